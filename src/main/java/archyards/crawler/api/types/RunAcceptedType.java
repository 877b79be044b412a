/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Response to an accepted on-demand run.
 */
@Schema(
        description = "On-demand run accepted")
public record RunAcceptedType(@JsonProperty("run_id") String runId, String status) {
}
