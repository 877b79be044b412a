/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import archyards.crawler.data.models.RunSummary;

/**
 * API type for a pipeline run summary.
 */
@Schema(
        description = "Outcome of one pipeline run")
public record RunSummaryType(@JsonProperty("run_id") String runId,
        @Schema(
                enumeration = {"scheduled", "on_demand"}) String trigger,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("fetched_per_source") Map<String, Integer> fetchedPerSource,
        @JsonProperty("failed_sources") List<String> failedSources, int fetched, int selected, int rewritten,
        int reused, @JsonProperty("rewrite_failed") int rewriteFailed, int failed, int published,
        @JsonProperty("published_ids") List<String> publishedIds, boolean aborted,
        @JsonProperty("abort_reason") String abortReason) {

    public static RunSummaryType fromSummary(RunSummary summary) {
        return new RunSummaryType(summary.runId(), summary.trigger().value(), summary.startedAt(),
                summary.finishedAt(), summary.duration().toMillis(), summary.fetchedPerSource(),
                summary.failedSources(), summary.fetched(), summary.selected(), summary.rewritten(), summary.reused(),
                summary.rewriteFailed(), summary.failed(), summary.published(), summary.publishedIds(),
                summary.aborted(), summary.abortReason());
    }
}
