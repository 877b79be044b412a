/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.jobs;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.quarkus.scheduler.Scheduled;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import archyards.crawler.TestFixtures;
import archyards.crawler.data.models.RunSummary;
import archyards.crawler.data.models.RunTrigger;
import archyards.crawler.exceptions.RunInProgressException;
import archyards.crawler.services.PipelineOrchestrator;

/**
 * Unit tests for {@link PipelineScheduler}.
 */
class PipelineSchedulerTest {

    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        when(orchestrator.trigger(RunTrigger.SCHEDULED)).thenReturn(
                RunSummary.builder("run-1", RunTrigger.SCHEDULED, TestFixtures.NOW).build(TestFixtures.NOW));
    }

    private PipelineScheduler scheduler(boolean enabled) {
        return new PipelineScheduler(orchestrator, enabled, "0 0 7 * * ?", "UTC");
    }

    @Test
    void testRunDaily_triggersScheduledRun() {
        scheduler(true).runDaily();

        verify(orchestrator, times(1)).trigger(RunTrigger.SCHEDULED);
    }

    @Test
    void testRunDaily_disabled_neverTriggers() {
        scheduler(false).runDaily();

        verify(orchestrator, never()).trigger(RunTrigger.SCHEDULED);
    }

    @Test
    void testRunDaily_runInProgress_isDropped() {
        when(orchestrator.trigger(RunTrigger.SCHEDULED)).thenThrow(new RunInProgressException("run-0"));

        assertDoesNotThrow(() -> scheduler(true).runDaily());
    }

    @Test
    void testRunDaily_failure_isLoggedNotThrown() {
        when(orchestrator.trigger(RunTrigger.SCHEDULED)).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> scheduler(true).runDaily());
    }

    @Test
    void testRunDaily_isCronScheduledInConfiguredZone() throws Exception {
        Scheduled scheduled = PipelineScheduler.class.getDeclaredMethod("runDaily").getAnnotation(Scheduled.class);

        assertNotNull(scheduled);
        assertEquals("${archyards.schedule.cron:0 0 7 * * ?}", scheduled.cron());
        assertEquals("${archyards.schedule.zone:UTC}", scheduled.timeZone());
        assertEquals("", scheduled.every());
        assertEquals(Scheduled.ConcurrentExecution.SKIP, scheduled.concurrentExecution());
    }
}
