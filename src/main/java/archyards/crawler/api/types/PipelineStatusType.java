/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Current pipeline state.
 *
 * @param state
 *            run state ({@code idle} before the first run)
 * @param running
 *            whether a run is active
 * @param activeRunId
 *            id of the active run, null when idle
 * @param lastRunId
 *            id of the last completed run, null before the first run
 */
@Schema(
        description = "Pipeline state")
public record PipelineStatusType(@Schema(
        enumeration = {"idle", "fetching", "ranking", "rewriting", "publishing", "done"}) String state,
        boolean running, @JsonProperty("active_run_id") String activeRunId,
        @JsonProperty("last_run_id") String lastRunId) {
}
