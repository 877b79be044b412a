/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.time.Instant;
import java.util.List;

/**
 * Feed entry fields as found in the RSS/Atom document, before normalization.
 *
 * @param url
 *            entry link
 * @param title
 *            entry title, may be null
 * @param summaryHtml
 *            description or content, may contain HTML
 * @param publishedAt
 *            published or updated date, null when the feed carries neither
 * @param feedImageUrl
 *            Media RSS image or image enclosure, null when absent
 * @param tags
 *            category terms in feed order
 */
public record RawFeedEntry(String url, String title, String summaryHtml, Instant publishedAt,
        String feedImageUrl, List<String> tags) {

    public RawFeedEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
