/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Immutable run parameters handed to the orchestrator and its collaborators at construction.
 *
 * <p>
 * Produced once from {@code application.yaml} by {@link PipelineConfigProducer}; tests build their own instances with
 * {@link #builder()} so several independently configured pipelines can coexist.
 *
 * @param articlesPerRun
 *            target selection size N
 * @param minArticles
 *            selection size below which a run logs a warning (the run still continues)
 * @param perSourceCap
 *            diversity cap K, maximum selected articles per source
 * @param freshnessHorizonHours
 *            age at which the freshness component reaches 0 (linear decay from 100 points)
 * @param maxJitter
 *            upper bound of the uniform tie-breaking jitter
 * @param jitterSeed
 *            fixed jitter seed for reproducible selection, null for a fresh seed every run
 * @param fetchParallelism
 *            concurrent source fetches
 * @param fetchTimeout
 *            time box for one source fetch
 * @param maxDescriptionSentences
 *            hard limit on sentences in a rewritten description
 * @param rewriteParallelism
 *            concurrent rewrite calls
 * @param maxInputChars
 *            original description characters passed to the text-generation call
 * @param zone
 *            zone of the query service's "today"
 */
public record PipelineConfig(int articlesPerRun, int minArticles, int perSourceCap, double freshnessHorizonHours,
        double maxJitter, Long jitterSeed, int fetchParallelism, Duration fetchTimeout,
        int maxDescriptionSentences, int rewriteParallelism, int maxInputChars, ZoneId zone) {

    public PipelineConfig {
        if (articlesPerRun < 0) {
            throw new IllegalArgumentException("articlesPerRun must be >= 0");
        }
        if (perSourceCap < 1) {
            throw new IllegalArgumentException("perSourceCap must be >= 1");
        }
        if (freshnessHorizonHours <= 0) {
            throw new IllegalArgumentException("freshnessHorizonHours must be > 0");
        }
        if (maxJitter < 0) {
            throw new IllegalArgumentException("maxJitter must be >= 0");
        }
        fetchParallelism = Math.max(1, fetchParallelism);
        rewriteParallelism = Math.max(1, rewriteParallelism);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated with the production defaults.
     */
    public static final class Builder {

        private int articlesPerRun = 5;
        private int minArticles = 3;
        private int perSourceCap = 2;
        private double freshnessHorizonHours = 100.0;
        private double maxJitter = 5.0;
        private Long jitterSeed;
        private int fetchParallelism = 4;
        private Duration fetchTimeout = Duration.ofSeconds(45);
        private int maxDescriptionSentences = 5;
        private int rewriteParallelism = 2;
        private int maxInputChars = 800;
        private ZoneId zone = ZoneOffset.UTC;

        private Builder() {
        }

        public Builder articlesPerRun(int articlesPerRun) {
            this.articlesPerRun = articlesPerRun;
            return this;
        }

        public Builder minArticles(int minArticles) {
            this.minArticles = minArticles;
            return this;
        }

        public Builder perSourceCap(int perSourceCap) {
            this.perSourceCap = perSourceCap;
            return this;
        }

        public Builder freshnessHorizonHours(double freshnessHorizonHours) {
            this.freshnessHorizonHours = freshnessHorizonHours;
            return this;
        }

        public Builder maxJitter(double maxJitter) {
            this.maxJitter = maxJitter;
            return this;
        }

        public Builder jitterSeed(Long jitterSeed) {
            this.jitterSeed = jitterSeed;
            return this;
        }

        public Builder fetchParallelism(int fetchParallelism) {
            this.fetchParallelism = fetchParallelism;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder maxDescriptionSentences(int maxDescriptionSentences) {
            this.maxDescriptionSentences = maxDescriptionSentences;
            return this;
        }

        public Builder rewriteParallelism(int rewriteParallelism) {
            this.rewriteParallelism = rewriteParallelism;
            return this;
        }

        public Builder maxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(articlesPerRun, minArticles, perSourceCap, freshnessHorizonHours, maxJitter,
                    jitterSeed, fetchParallelism, fetchTimeout, maxDescriptionSentences, rewriteParallelism, maxInputChars,
                    zone);
        }
    }
}
