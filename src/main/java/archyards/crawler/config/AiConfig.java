/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Configuration class for the LangChain4j text-generation capability backed by Anthropic Claude.
 *
 * <p>
 * Performs startup validation of the API key and produces the {@link ChatModel} used by the rewrite service.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code ai.anthropic.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code ai.model.name} - model name (default: claude-sonnet-4-20250514)</li>
 * <li>{@code ai.model.temperature} - sampling temperature (default: 0.7)</li>
 * <li>{@code ai.model.max-tokens} - max output tokens (default: 600)</li>
 * <li>{@code ai.model.timeout-seconds} - per-call time box (default: 60)</li>
 * </ul>
 *
 * <p>
 * The client itself never retries ({@code maxRetries(0)}); the fault tolerance policy on
 * {@link archyards.crawler.services.RewriteClient} retries transient failures and rejected output alike.
 *
 * @see archyards.crawler.services.RewriteClient
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "ai.anthropic.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.model.name",
            defaultValue = "claude-sonnet-4-20250514")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.7")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "600")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    /**
     * Fails application start with a descriptive message when the API key is missing or blank.
     *
     * @throws AiConfigurationException
     *             if the Anthropic API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.isEmpty() || apiKey.get().isBlank()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "The rewrite step requires a valid Anthropic API key. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j configured with model %s (timeout=%ds)", modelName, timeoutSeconds);
    }

    /**
     * Produces the chat model used for editorial rewrites.
     *
     * @return configured Anthropic chat model
     */
    @Produces
    @ApplicationScoped
    public ChatModel rewriteChatModel() {
        LOG.infof("Creating ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds", modelName, temperature,
                maxTokens, timeoutSeconds);

        return AnthropicChatModel.builder().apiKey(apiKey.orElseThrow()).modelName(modelName)
                .temperature(temperature).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(0).logRequests(false).logResponses(false).build();
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }
    }
}
