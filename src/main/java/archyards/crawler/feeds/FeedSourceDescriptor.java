/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Static configuration of one feed source, loaded from the source catalog.
 *
 * @param name
 *            display name, e.g. "Dezeen"
 * @param rssUrl
 *            RSS/Atom document URL
 * @param baseUrl
 *            site root
 * @param category
 *            category assigned to every candidate from this source
 * @param logo
 *            favicon/logo URL carried onto articles
 * @param popularitySelector
 *            CSS selector of the comment counter on article pages, null when the site has none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FeedSourceDescriptor(String name, @JsonProperty("rss") String rssUrl,
        @JsonProperty("base_url") String baseUrl, String category, String logo,
        @JsonProperty("popularity_selector") String popularitySelector) {
}
