/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

/**
 * Optional, conjunctive filters over the published collection. Null or blank values do not filter.
 *
 * @param category
 *            exact category match
 * @param badge
 *            {@code aggregated} or {@code paid}; any other value is ignored
 * @param source
 *            case-insensitive source name match
 * @param today
 *            only articles promoted on the current date of the reference zone
 */
public record ArticleFilter(String category, String badge, String source, boolean today) {

    public static ArticleFilter none() {
        return new ArticleFilter(null, null, null, false);
    }
}
