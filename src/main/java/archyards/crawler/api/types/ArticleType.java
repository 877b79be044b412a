/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import archyards.crawler.data.models.Article;

/**
 * API type representing a published article for JSON responses.
 *
 * <p>
 * Converts from the stored {@link Article}; field names match the collection file layout so presentation layers can
 * read either.
 */
@Schema(
        description = "Published article with original and rewritten text")
public record ArticleType(@Schema(
        description = "Stable article id (12 hex characters)",
        example = "3f2a9c0d11be",
        required = true) String id,

        @Schema(
                description = "Feed source name",
                example = "Dezeen",
                required = true) @JsonProperty("source_name") String sourceName,

        @JsonProperty("source_logo") String sourceLogo,

        @Schema(
                description = "Original article URL",
                required = true) String url,

        @JsonProperty("image_url") String imageUrl,

        @JsonProperty("original_title") String originalTitle,

        @JsonProperty("original_description") String originalDescription,

        @Schema(
                description = "Title in the Archyards voice") @JsonProperty("rewritten_title") String rewrittenTitle,

        @Schema(
                description = "Description in the Archyards voice, at most five sentences") @JsonProperty("rewritten_description") String rewrittenDescription,

        @Schema(
                description = "Source publication time") @JsonProperty("published_at") Instant publishedAt,

        @Schema(
                description = "Time the pipeline published the article") @JsonProperty("published_at_archyards") Instant publishedAtArchyards,

        @Schema(
                description = "Category from the source catalog",
                example = "architecture") String category,

        List<String> tags,

        @JsonProperty("age_hours") double ageHours,

        @JsonProperty("comment_count") int commentCount,

        @JsonProperty("social_shares") int socialShares,

        @JsonProperty("popularity_score") double popularityScore,

        @Schema(
                description = "Provenance badge",
                enumeration = {"aggregated", "paid"}) String badge,

        @Schema(
                description = "Lifecycle status",
                example = "published") String status) {

    public static ArticleType fromArticle(Article article) {
        return new ArticleType(article.id(), article.sourceName(), article.sourceLogo(), article.url(),
                article.imageUrl(), article.originalTitle(), article.originalDescription(), article.rewrittenTitle(),
                article.rewrittenDescription(), article.publishedAt(), article.publishedAtArchyards(),
                article.category(), article.tags(), article.ageHours(), article.commentCount(), article.socialShares(),
                article.popularityScore(), article.badge().value(), article.status().value());
    }

    public static List<ArticleType> fromArticles(List<Article> articles) {
        return articles.stream().map(ArticleType::fromArticle).toList();
    }
}
