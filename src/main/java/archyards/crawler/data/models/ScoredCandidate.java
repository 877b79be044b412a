/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

/**
 * A {@link Candidate} with its popularity score for the current run. Recomputed every run, never persisted on its own.
 *
 * @param candidate
 *            the scored candidate
 * @param popularityScore
 *            freshness + engagement + jitter
 * @param jitterComponent
 *            the tie-breaking jitter included in {@code popularityScore}
 */
public record ScoredCandidate(Candidate candidate, double popularityScore, double jitterComponent) {

    public String id() {
        return candidate.id();
    }

    public String sourceName() {
        return candidate.sourceName();
    }
}
