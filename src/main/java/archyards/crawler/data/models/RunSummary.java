/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run, recorded by the orchestrator at the {@link RunState#DONE} boundary.
 *
 * @param runId
 *            run identifier
 * @param trigger
 *            scheduled or on-demand
 * @param startedAt
 *            run start
 * @param finishedAt
 *            run end
 * @param duration
 *            wall-clock duration
 * @param fetchedPerSource
 *            candidates fetched per source name, in source order (0 for failed sources)
 * @param failedSources
 *            sources that raised {@code SourceUnavailable}
 * @param selected
 *            articles selected by the ranker
 * @param rewritten
 *            articles rewritten by the text-generation call in this run
 * @param reused
 *            selected articles whose rewrite from an earlier interrupted run was reused
 * @param rewriteFailed
 *            articles marked {@code rewrite_failed}
 * @param publishedIds
 *            ids promoted to {@code published}, in publish order
 * @param aborted
 *            true when the store became unavailable and the run stopped
 * @param abortReason
 *            store failure message when aborted
 */
public record RunSummary(String runId, RunTrigger trigger, Instant startedAt, Instant finishedAt, Duration duration,
        Map<String, Integer> fetchedPerSource, List<String> failedSources, int selected, int rewritten, int reused,
        int rewriteFailed, List<String> publishedIds, boolean aborted, String abortReason) {

    public RunSummary {
        fetchedPerSource = fetchedPerSource == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fetchedPerSource));
        failedSources = failedSources == null ? List.of() : List.copyOf(failedSources);
        publishedIds = publishedIds == null ? List.of() : List.copyOf(publishedIds);
    }

    public int fetched() {
        return fetchedPerSource.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int published() {
        return publishedIds.size();
    }

    /**
     * Failure tally: unavailable sources plus failed rewrites.
     */
    public int failed() {
        return failedSources.size() + rewriteFailed;
    }

    public static Builder builder(String runId, RunTrigger trigger, Instant startedAt) {
        return new Builder(runId, trigger, startedAt);
    }

    /**
     * Mutable accumulator filled in while a run progresses.
     */
    public static final class Builder {

        private final String runId;
        private final RunTrigger trigger;
        private final Instant startedAt;
        private final Map<String, Integer> fetchedPerSource = new LinkedHashMap<>();
        private final List<String> failedSources = new ArrayList<>();
        private final List<String> publishedIds = new ArrayList<>();
        private int selected;
        private int rewritten;
        private int reused;
        private int rewriteFailed;
        private boolean aborted;
        private String abortReason;

        private Builder(String runId, RunTrigger trigger, Instant startedAt) {
            this.runId = runId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }

        public Builder fetched(String sourceName, int count) {
            fetchedPerSource.put(sourceName, count);
            return this;
        }

        public Builder sourceFailed(String sourceName) {
            fetchedPerSource.put(sourceName, 0);
            failedSources.add(sourceName);
            return this;
        }

        public Builder selected(int count) {
            this.selected = count;
            return this;
        }

        public Builder rewritten(int count) {
            this.rewritten = count;
            return this;
        }

        public Builder reused(int count) {
            this.reused = count;
            return this;
        }

        public Builder rewriteFailed(int count) {
            this.rewriteFailed = count;
            return this;
        }

        public Builder published(List<String> ids) {
            publishedIds.clear();
            publishedIds.addAll(ids);
            return this;
        }

        public Builder aborted(String reason) {
            this.aborted = true;
            this.abortReason = reason;
            return this;
        }

        public RunSummary build(Instant finishedAt) {
            return new RunSummary(runId, trigger, startedAt, finishedAt, Duration.between(startedAt, finishedAt),
                    fetchedPerSource, failedSources, selected, rewritten, reused, rewriteFailed, publishedIds, aborted,
                    abortReason);
        }
    }
}
