/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.rest;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import archyards.crawler.services.ArticleQueryService;

@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @Inject
    ArticleQueryService queryService;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Published collection size and last publish time")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Application is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class)))})
    public HealthResponse health() {
        ArticleQueryService.CollectionHealth health = queryService.health();
        return new HealthResponse("ok", health.totalArticles(), health.lastUpdated());
    }

    public record HealthResponse(String status, @JsonProperty("total_articles") int totalArticles,
            @JsonProperty("last_updated") Instant lastUpdated) {
    }
}
