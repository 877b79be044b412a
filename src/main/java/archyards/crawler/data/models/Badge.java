/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance badge shown next to a published article. Pipeline output is always {@link #AGGREGATED}; {@link #PAID}
 * marks placements added outside the pipeline.
 */
public enum Badge {

    AGGREGATED("aggregated"), PAID("paid");

    private final String value;

    Badge(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Badge fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown badge: " + value));
    }

    /**
     * Lenient lookup used by the query surface, where an unknown badge is a no-op filter rather than an error.
     *
     * @param value
     *            raw badge text, may be null
     * @return the badge, or empty if the text matches none
     */
    public static Optional<Badge> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Badge badge : values()) {
            if (badge.value.equalsIgnoreCase(trimmed)) {
                return Optional.of(badge);
            }
        }
        return Optional.empty();
    }
}
