/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;

/**
 * A normalized, not-yet-selected feed entry.
 *
 * <p>
 * The {@code id} is derived from {@code source_name + url} via {@link #idFor(String, String)}, so re-fetching the same
 * URL from the same source always yields the same id.
 *
 * @param id
 *            stable hash of source name and URL
 * @param sourceName
 *            display name of the feed source
 * @param sourceLogo
 *            source favicon/logo URL, may be null
 * @param url
 *            canonical article URL
 * @param imageUrl
 *            lead image URL, null when absent
 * @param originalTitle
 *            title as published by the source
 * @param originalDescription
 *            plain-text description as published by the source
 * @param publishedAt
 *            source publication timestamp
 * @param category
 *            category mapped from the source configuration
 * @param tags
 *            entry categories, de-duplicated, at most eight
 * @param ageHours
 *            hours between {@code publishedAt} and fetch time, never negative
 * @param commentCount
 *            comment count, 0 when unknown
 * @param socialShares
 *            share/reaction signals, 0 when unknown
 */
public record Candidate(String id, String sourceName, String sourceLogo, String url, String imageUrl,
        String originalTitle, String originalDescription, Instant publishedAt, String category, List<String> tags,
        double ageHours, int commentCount, int socialShares) {

    private static final int ID_LENGTH = 12;

    public Candidate {
        tags = tags == null ? List.of() : List.copyOf(tags);
        ageHours = Math.max(0.0, ageHours);
        commentCount = Math.max(0, commentCount);
        socialShares = Math.max(0, socialShares);
    }

    /**
     * Computes the stable article id: the first 12 hex characters of MD5({@code sourceName + ":" + url}).
     *
     * @param sourceName
     *            feed source name
     * @param url
     *            article URL
     * @return 12-character lowercase hex id
     */
    public static String idFor(String sourceName, String url) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest((sourceName + ":" + url).getBytes(StandardCharsets.UTF_8));
            String hex = String.format("%032x", new BigInteger(1, digest));
            return hex.substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
