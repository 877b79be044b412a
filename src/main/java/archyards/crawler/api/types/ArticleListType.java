/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import archyards.crawler.services.ArticlePage;

/**
 * Paginated article listing.
 *
 * @param total
 *            matches after filtering, before pagination
 * @param limit
 *            effective page size
 * @param offset
 *            effective offset
 * @param articles
 *            the requested page
 */
@Schema(
        description = "Filtered, paginated published articles")
public record ArticleListType(int total, int limit, int offset, List<ArticleType> articles) {

    public static ArticleListType fromPage(ArticlePage page) {
        return new ArticleListType(page.total(), page.limit(), page.offset(), ArticleType.fromArticles(page.articles()));
    }
}
