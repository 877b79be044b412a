/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.rest.admin;

import java.util.Locale;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import archyards.crawler.api.types.PipelineStatusType;
import archyards.crawler.api.types.RunAcceptedType;
import archyards.crawler.api.types.RunSummaryType;
import archyards.crawler.data.models.RunSummary;
import archyards.crawler.data.models.RunTrigger;
import archyards.crawler.exceptions.RunInProgressException;
import archyards.crawler.services.PipelineOrchestrator;

/**
 * Admin endpoints for the content pipeline.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /admin/api/pipeline/runs} - start an on-demand run (202, or 409 while a run is active)</li>
 * <li>{@code GET /admin/api/pipeline/runs/latest} - summary of the last completed run</li>
 * <li>{@code GET /admin/api/pipeline/status} - current state</li>
 * </ul>
 */
@Path("/admin/api/pipeline")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Pipeline Admin",
        description = "Pipeline run control")
public class PipelineAdminResource {

    private static final Logger LOG = Logger.getLogger(PipelineAdminResource.class);

    @Inject
    PipelineOrchestrator orchestrator;

    @POST
    @Path("/runs")
    @Operation(
            summary = "Start an on-demand run",
            description = "Runs the pipeline in the background; shares the single-run guard with the daily schedule")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Run started"),
                    @APIResponse(
                            responseCode = "409",
                            description = "A run is already in progress")})
    public Response startRun() {
        try {
            PipelineOrchestrator.StartedRun run = orchestrator.triggerAsync(RunTrigger.ON_DEMAND);
            LOG.infof("On-demand pipeline run %s accepted", run.runId());
            return Response.accepted(new RunAcceptedType(run.runId(), "started")).build();
        } catch (RunInProgressException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(new ErrorResponse("Run " + e.getActiveRunId() + " is already in progress")).build();
        }
    }

    @GET
    @Path("/runs/latest")
    @Operation(
            summary = "Last run summary")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Summary of the last completed run"),
                    @APIResponse(
                            responseCode = "404",
                            description = "No run has completed yet")})
    public Response latestRun() {
        return orchestrator.lastSummary().map(summary -> Response.ok(RunSummaryType.fromSummary(summary)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("No pipeline run has completed yet")).build());
    }

    @GET
    @Path("/status")
    @Operation(
            summary = "Pipeline state")
    public Response status() {
        String lastRunId = orchestrator.lastSummary().map(RunSummary::runId).orElse(null);
        PipelineStatusType status = new PipelineStatusType(orchestrator.state().name().toLowerCase(Locale.ROOT),
                orchestrator.isRunning(), orchestrator.activeRunId().orElse(null), lastRunId);
        return Response.ok(status).build();
    }

    /**
     * Error response DTO.
     */
    public record ErrorResponse(String error) {
    }
}
