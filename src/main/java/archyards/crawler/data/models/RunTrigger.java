/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.data.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What started a pipeline run.
 */
public enum RunTrigger {

    SCHEDULED("scheduled"), ON_DEMAND("on_demand");

    private final String value;

    RunTrigger(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
