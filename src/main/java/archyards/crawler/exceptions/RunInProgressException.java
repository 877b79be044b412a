/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.exceptions;

/**
 * Exception thrown when a run is triggered while another run is active. The trigger is rejected, never queued, and no
 * state changes.
 */
public class RunInProgressException extends RuntimeException {

    private final String activeRunId;

    public RunInProgressException(String activeRunId) {
        super("Pipeline run already in progress: " + activeRunId);
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
