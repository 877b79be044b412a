/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import archyards.crawler.config.PipelineConfig;
import archyards.crawler.data.models.Candidate;
import archyards.crawler.data.models.ScoredCandidate;

/**
 * Scores candidates by popularity and selects a bounded, source-diverse subset for a run.
 *
 * <p>
 * <b>Score:</b> {@code freshness(age_hours) + 2 * comment_count + 0.5 * social_shares + jitter}
 * <ul>
 * <li>freshness: linear decay from 100 at age 0 to 0 at the configured horizon</li>
 * <li>jitter: uniform in {@code [0, maxJitter]}, only there to break near-ties</li>
 * </ul>
 *
 * <p>
 * <b>Selection:</b> candidates sorted by score descending (ties by id ascending) are taken greedily, skipping any
 * candidate whose source already holds {@code perSourceCap} selected slots, until {@code articlesPerRun} are selected
 * or the pool runs out. A short pool is not an error.
 *
 * <p>
 * With {@code archyards.pipeline.jitter-seed} set, every call draws the same jitter stream, so identical input yields
 * an identical selection.
 */
@ApplicationScoped
public class RankingService {

    private static final Logger LOG = Logger.getLogger(RankingService.class);

    static final double MAX_FRESHNESS = 100.0;
    static final double COMMENT_WEIGHT = 2.0;
    static final double SHARE_WEIGHT = 0.5;

    private static final Comparator<ScoredCandidate> BY_SCORE = Comparator
            .comparingDouble(ScoredCandidate::popularityScore).reversed().thenComparing(ScoredCandidate::id);

    private final PipelineConfig config;

    @Inject
    public RankingService(PipelineConfig config) {
        this.config = config;
    }

    /**
     * Ranks and selects with the configured jitter source.
     *
     * @param pool
     *            merged candidates from all sources
     * @return selection in rank order
     */
    public List<ScoredCandidate> select(List<Candidate> pool) {
        Random random = config.jitterSeed() != null ? new Random(config.jitterSeed()) : new Random();
        return select(pool, random);
    }

    /**
     * Ranks and selects with an explicit jitter source.
     *
     * @param pool
     *            merged candidates from all sources
     * @param random
     *            jitter source
     * @return at most {@code articlesPerRun} candidates, at most {@code perSourceCap} per source, in rank order
     */
    public List<ScoredCandidate> select(List<Candidate> pool, Random random) {
        Map<String, Candidate> distinct = new LinkedHashMap<>();
        for (Candidate candidate : pool) {
            distinct.putIfAbsent(candidate.id(), candidate);
        }

        List<ScoredCandidate> ranked = new ArrayList<>(distinct.size());
        for (Candidate candidate : distinct.values()) {
            ranked.add(score(candidate, random));
        }
        ranked.sort(BY_SCORE);

        List<ScoredCandidate> selected = new ArrayList<>();
        Map<String, Integer> perSource = new HashMap<>();
        for (ScoredCandidate scored : ranked) {
            if (selected.size() >= config.articlesPerRun()) {
                break;
            }
            int taken = perSource.getOrDefault(scored.sourceName(), 0);
            if (taken >= config.perSourceCap()) {
                continue;
            }
            perSource.put(scored.sourceName(), taken + 1);
            selected.add(scored);
        }

        LOG.debugf("Ranked %d distinct candidates, selected %d", ranked.size(), selected.size());
        return selected;
    }

    /**
     * Computes the popularity score of one candidate.
     */
    public ScoredCandidate score(Candidate candidate, Random random) {
        double jitter = config.maxJitter() > 0 ? random.nextDouble() * config.maxJitter() : 0.0;
        double score = freshness(candidate.ageHours()) + COMMENT_WEIGHT * candidate.commentCount()
                + SHARE_WEIGHT * candidate.socialShares() + jitter;
        return new ScoredCandidate(candidate, round(score), jitter);
    }

    /**
     * Freshness points for an age: 100 at age 0, decaying linearly to 0 at the horizon, never negative.
     */
    public double freshness(double ageHours) {
        double age = Math.max(0.0, ageHours);
        return Math.max(0.0, MAX_FRESHNESS * (1.0 - age / config.freshnessHorizonHours()));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
