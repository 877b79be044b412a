/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a pipeline-tracked {@link Article}.
 *
 * <p>
 * <b>Transitions:</b>
 *
 * <pre>
 * RAW ──► REWRITTEN ──► PUBLISHED
 *   └──► REWRITE_FAILED   (terminal for the run, eligible again on a later run)
 * </pre>
 */
public enum ArticleStatus {

    RAW("raw"), REWRITTEN("rewritten"), PUBLISHED("published"), REWRITE_FAILED("rewrite_failed");

    private final String value;

    ArticleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ArticleStatus fromValue(String value) {
        for (ArticleStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown article status: " + value);
    }

    /**
     * Whether an article may move from this status to {@code target}.
     *
     * @param target
     *            the requested status
     * @return true if the transition is part of the lifecycle
     */
    public boolean canTransitionTo(ArticleStatus target) {
        return switch (this) {
            case RAW, REWRITE_FAILED -> target == REWRITTEN || target == REWRITE_FAILED || target == RAW;
            case REWRITTEN -> target == PUBLISHED || target == REWRITTEN;
            case PUBLISHED -> target == PUBLISHED;
        };
    }
}
