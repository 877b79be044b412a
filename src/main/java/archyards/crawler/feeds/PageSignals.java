/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

/**
 * Signals scraped from an article page.
 *
 * @param imageUrl
 *            og:image or twitter:image, null when absent
 * @param bodyText
 *            plain text of the first paragraphs of the article body, null when none found
 * @param commentCount
 *            digits of the source's comment counter, null when unknown
 * @param socialShares
 *            sum of share/reaction data attributes, null when none found
 */
public record PageSignals(String imageUrl, String bodyText, Integer commentCount, Integer socialShares) {

    private static final PageSignals EMPTY = new PageSignals(null, null, null, null);

    public static PageSignals empty() {
        return EMPTY;
    }
}
