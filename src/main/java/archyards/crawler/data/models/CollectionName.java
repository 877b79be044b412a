/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import java.util.EnumSet;
import java.util.Set;

/**
 * The three article collections, each a mapping from article id to {@link Article}.
 *
 * <p>
 * Invariant after every completed run: ids in {@link #PUBLISHED} ⊆ ids in {@link #REWRITTEN} ⊆ ids in {@link #RAW}.
 */
public enum CollectionName {

    RAW("raw_articles.json", EnumSet.of(ArticleStatus.RAW, ArticleStatus.REWRITE_FAILED)),

    REWRITTEN("rewritten_articles.json", EnumSet.of(ArticleStatus.REWRITTEN)),

    PUBLISHED("published_articles.json", EnumSet.of(ArticleStatus.PUBLISHED));

    private final String fileName;
    private final Set<ArticleStatus> acceptedStatuses;

    CollectionName(String fileName, Set<ArticleStatus> acceptedStatuses) {
        this.fileName = fileName;
        this.acceptedStatuses = acceptedStatuses;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Statuses a record may carry while stored in this collection.
     */
    public Set<ArticleStatus> acceptedStatuses() {
        return acceptedStatuses;
    }
}
