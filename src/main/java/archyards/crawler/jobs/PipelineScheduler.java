/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.jobs;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import archyards.crawler.data.models.RunSummary;
import archyards.crawler.data.models.RunTrigger;
import archyards.crawler.exceptions.RunInProgressException;
import archyards.crawler.services.PipelineOrchestrator;

/**
 * Fires the daily pipeline run.
 *
 * <p>
 * Runs on the {@code archyards.schedule.cron} expression (default {@code 0 0 7 * * ?}, 07:00 daily) evaluated in
 * {@code archyards.schedule.zone}. A due run goes through the same single-run guard as the on-demand trigger; if a run
 * is already active the firing is logged and dropped.
 *
 * <p>
 * Disabled with {@code archyards.schedule.enabled=false}.
 */
@ApplicationScoped
public class PipelineScheduler {

    private static final Logger LOG = Logger.getLogger(PipelineScheduler.class);

    static final String IDENTITY = "archyards-daily-pipeline";

    private final PipelineOrchestrator orchestrator;
    private final boolean enabled;

    @Inject
    public PipelineScheduler(PipelineOrchestrator orchestrator,
            @ConfigProperty(
                    name = "archyards.schedule.enabled",
                    defaultValue = "true") boolean enabled,
            @ConfigProperty(
                    name = "archyards.schedule.cron",
                    defaultValue = "0 0 7 * * ?") String cron,
            @ConfigProperty(
                    name = "archyards.schedule.zone",
                    defaultValue = "UTC") String zone) {
        this.orchestrator = orchestrator;
        this.enabled = enabled;
        if (enabled) {
            LOG.infof("Daily pipeline run scheduled with cron '%s' in %s", cron, zone);
        } else {
            LOG.info("Daily pipeline schedule disabled");
        }
    }

    @Scheduled(
            identity = IDENTITY,
            cron = "${archyards.schedule.cron:0 0 7 * * ?}",
            timeZone = "${archyards.schedule.zone:UTC}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void runDaily() {
        if (!enabled) {
            return;
        }

        LOG.info("Daily pipeline run due");
        try {
            RunSummary summary = orchestrator.trigger(RunTrigger.SCHEDULED);
            LOG.infof("Scheduled run %s finished", summary.runId());
        } catch (RunInProgressException e) {
            LOG.warnf("Scheduled run skipped: run %s is in progress", e.getActiveRunId());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduled pipeline run failed: %s", e.getMessage());
        }
    }
}
