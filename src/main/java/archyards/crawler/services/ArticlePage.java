/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import java.util.List;

import archyards.crawler.data.models.Article;

/**
 * One page of filtered published articles.
 *
 * @param total
 *            matches after filtering, before pagination
 * @param limit
 *            effective page size
 * @param offset
 *            effective offset
 * @param articles
 *            the page, in stored order
 */
public record ArticlePage(int total, int limit, int offset, List<Article> articles) {

    public ArticlePage {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }
}
