/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import archyards.crawler.config.AiConfig.AiConfigurationException;

/**
 * Unit tests for {@link AiConfig} startup validation. No Quarkus context is needed.
 */
class AiConfigTest {

    private static AiConfig config(Optional<String> apiKey) {
        AiConfig config = new AiConfig();
        config.apiKey = apiKey;
        config.modelName = "claude-sonnet-4-20250514";
        config.timeoutSeconds = 60;
        return config;
    }

    @Test
    void testValidationSucceedsWithApiKey() {
        assertDoesNotThrow(() -> config(Optional.of("sk-ant-test-12345678")).validateConfiguration());
    }

    @Test
    void testValidationFailsWithoutApiKey() {
        assertThrows(AiConfigurationException.class, () -> config(Optional.empty()).validateConfiguration());
        assertThrows(AiConfigurationException.class, () -> config(null).validateConfiguration());
    }

    @Test
    void testValidationFailsWithBlankApiKey() {
        assertThrows(AiConfigurationException.class, () -> config(Optional.of("")).validateConfiguration());
        assertThrows(AiConfigurationException.class, () -> config(Optional.of("   ")).validateConfiguration());
    }
}
