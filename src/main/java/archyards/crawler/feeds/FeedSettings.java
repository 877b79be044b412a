/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.time.Duration;

/**
 * HTTP and parsing settings shared by all RSS feed sources.
 *
 * @param entriesPerSource
 *            feed entries considered per source (the first N in feed order)
 * @param requestTimeout
 *            time box for each HTTP request (feed document and article pages)
 * @param scrapePages
 *            whether article pages are fetched for image, description and engagement signals
 * @param pageDelay
 *            politeness delay before each article page request
 * @param userAgent
 *            User-Agent header sent to sources
 */
public record FeedSettings(int entriesPerSource, Duration requestTimeout, boolean scrapePages, Duration pageDelay,
        String userAgent) {

    public FeedSettings {
        entriesPerSource = Math.max(1, entriesPerSource);
        pageDelay = pageDelay == null ? Duration.ZERO : pageDelay;
    }
}
