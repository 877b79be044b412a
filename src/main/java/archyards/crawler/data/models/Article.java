/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted, pipeline-tracked article.
 *
 * <p>
 * Records are immutable; every lifecycle step produces a copy through one of the {@code with*} methods. The
 * {@code id}/{@code url} binding of the originating {@link Candidate} is carried through every copy and never rewritten.
 *
 * <p>
 * <b>JSON layout</b> (one element of a collection file):
 *
 * <pre>
 * {
 *   "id": "3f2a9c0d11be",
 *   "source_name": "Dezeen",
 *   "url": "https://www.dezeen.com/...",
 *   "original_title": "...",
 *   "rewritten_title": "...",
 *   "published_at": "2025-06-01T08:00:00Z",
 *   "published_at_archyards": "2025-06-01T07:02:11Z",
 *   "popularity_score": 87.4,
 *   "badge": "aggregated",
 *   "status": "published"
 * }
 * </pre>
 *
 * @see ArticleStatus
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Article(String id, @JsonProperty("source_name") String sourceName,
        @JsonProperty("source_logo") String sourceLogo, String url, @JsonProperty("image_url") String imageUrl,
        @JsonProperty("original_title") String originalTitle,
        @JsonProperty("original_description") String originalDescription,
        @JsonProperty("published_at") Instant publishedAt, String category, List<String> tags,
        @JsonProperty("age_hours") double ageHours, @JsonProperty("comment_count") int commentCount,
        @JsonProperty("social_shares") int socialShares, @JsonProperty("rewritten_title") String rewrittenTitle,
        @JsonProperty("rewritten_description") String rewrittenDescription,
        @JsonProperty("published_at_archyards") Instant publishedAtArchyards,
        @JsonProperty("popularity_score") double popularityScore, Badge badge, ArticleStatus status) {

    public Article {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        tags = tags == null ? List.of() : List.copyOf(tags);
        badge = badge == null ? Badge.AGGREGATED : badge;
        status = status == null ? ArticleStatus.RAW : status;
    }

    /**
     * Creates a {@code raw} article from a ranked candidate.
     *
     * @param scored
     *            candidate selected by the ranker
     * @return new article in {@link ArticleStatus#RAW}
     */
    public static Article fromScored(ScoredCandidate scored) {
        Candidate c = scored.candidate();
        return new Article(c.id(), c.sourceName(), c.sourceLogo(), c.url(), c.imageUrl(), c.originalTitle(),
                c.originalDescription(), c.publishedAt(), c.category(), c.tags(), c.ageHours(), c.commentCount(),
                c.socialShares(), null, null, null, scored.popularityScore(), Badge.AGGREGATED, ArticleStatus.RAW);
    }

    /**
     * Returns a copy carrying the rewritten text in {@link ArticleStatus#REWRITTEN}.
     */
    public Article withRewrite(String title, String description) {
        return new Article(id, sourceName, sourceLogo, url, imageUrl, originalTitle, originalDescription, publishedAt,
                category, tags, ageHours, commentCount, socialShares, title, description, publishedAtArchyards,
                popularityScore, badge, ArticleStatus.REWRITTEN);
    }

    public Article withStatus(ArticleStatus newStatus) {
        return new Article(id, sourceName, sourceLogo, url, imageUrl, originalTitle, originalDescription, publishedAt,
                category, tags, ageHours, commentCount, socialShares, rewrittenTitle, rewrittenDescription,
                publishedAtArchyards, popularityScore, badge, newStatus);
    }

    /**
     * Returns the promoted copy: status {@code published}, stamped with the promotion time.
     *
     * @param promotedAt
     *            promotion timestamp
     */
    public Article publishedAt(Instant promotedAt) {
        return new Article(id, sourceName, sourceLogo, url, imageUrl, originalTitle, originalDescription, publishedAt,
                category, tags, ageHours, commentCount, socialShares, rewrittenTitle, rewrittenDescription, promotedAt,
                popularityScore, badge, ArticleStatus.PUBLISHED);
    }

    /**
     * Title to show to readers: the rewritten one when present.
     */
    public String displayTitle() {
        return rewrittenTitle != null && !rewrittenTitle.isBlank() ? rewrittenTitle : originalTitle;
    }
}
