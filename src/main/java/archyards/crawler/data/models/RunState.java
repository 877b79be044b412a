/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

/**
 * Orchestrator state machine: {@code IDLE → FETCHING → RANKING → REWRITING → PUBLISHING → DONE}. Partial failures and
 * store aborts both end in {@code DONE}; the outcome lives in the {@link RunSummary}.
 */
public enum RunState {
    IDLE, FETCHING, RANKING, REWRITING, PUBLISHING, DONE
}
