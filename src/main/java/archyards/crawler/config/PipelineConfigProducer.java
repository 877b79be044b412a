/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.config;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import archyards.crawler.feeds.FeedSettings;

/**
 * Builds the immutable pipeline configuration values from {@code application.yaml}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code archyards.pipeline.*} - selection size, diversity cap, scoring, fetch fan-out</li>
 * <li>{@code archyards.rewrite.*} - sentence limit, prompt input size, rewrite fan-out</li>
 * <li>{@code archyards.feeds.*} - per-source entry limit, HTTP timeout, article page scraping</li>
 * <li>{@code archyards.schedule.zone} - reference zone of the daily trigger and of "today" queries</li>
 * </ul>
 *
 * <p>
 * Everything downstream receives these values through injection, never by reading configuration on its own.
 */
@ApplicationScoped
public class PipelineConfigProducer {

    private static final Logger LOG = Logger.getLogger(PipelineConfigProducer.class);

    @ConfigProperty(
            name = "archyards.pipeline.articles-per-run",
            defaultValue = "5")
    int articlesPerRun;

    @ConfigProperty(
            name = "archyards.pipeline.min-articles",
            defaultValue = "3")
    int minArticles;

    @ConfigProperty(
            name = "archyards.pipeline.per-source-cap",
            defaultValue = "2")
    int perSourceCap;

    @ConfigProperty(
            name = "archyards.pipeline.freshness-horizon-hours",
            defaultValue = "100")
    double freshnessHorizonHours;

    @ConfigProperty(
            name = "archyards.pipeline.max-jitter",
            defaultValue = "5.0")
    double maxJitter;

    @ConfigProperty(
            name = "archyards.pipeline.jitter-seed")
    Optional<Long> jitterSeed;

    @ConfigProperty(
            name = "archyards.pipeline.fetch-parallelism",
            defaultValue = "4")
    int fetchParallelism;

    @ConfigProperty(
            name = "archyards.pipeline.fetch-timeout",
            defaultValue = "45s")
    Duration fetchTimeout;

    @ConfigProperty(
            name = "archyards.rewrite.max-description-sentences",
            defaultValue = "5")
    int maxDescriptionSentences;

    @ConfigProperty(
            name = "archyards.rewrite.parallelism",
            defaultValue = "2")
    int rewriteParallelism;

    @ConfigProperty(
            name = "archyards.rewrite.max-input-chars",
            defaultValue = "800")
    int maxInputChars;

    @ConfigProperty(
            name = "archyards.schedule.zone",
            defaultValue = "UTC")
    String zone;

    @ConfigProperty(
            name = "archyards.feeds.entries-per-source",
            defaultValue = "20")
    int entriesPerSource;

    @ConfigProperty(
            name = "archyards.feeds.request-timeout",
            defaultValue = "10s")
    Duration requestTimeout;

    @ConfigProperty(
            name = "archyards.feeds.scrape-pages",
            defaultValue = "true")
    boolean scrapePages;

    @ConfigProperty(
            name = "archyards.feeds.page-delay",
            defaultValue = "750ms")
    Duration pageDelay;

    @ConfigProperty(
            name = "archyards.feeds.user-agent",
            defaultValue = "Mozilla/5.0 (compatible; ArchyardsBot/1.0; +https://archyards.com/bot)")
    String userAgent;

    @Produces
    @Singleton
    public PipelineConfig pipelineConfig() {
        PipelineConfig config = PipelineConfig.builder().articlesPerRun(articlesPerRun).minArticles(minArticles)
                .perSourceCap(perSourceCap).freshnessHorizonHours(freshnessHorizonHours).maxJitter(maxJitter)
                .jitterSeed(jitterSeed.orElse(null)).fetchParallelism(fetchParallelism).fetchTimeout(fetchTimeout)
                .maxDescriptionSentences(maxDescriptionSentences).rewriteParallelism(rewriteParallelism)
                .maxInputChars(maxInputChars).zone(ZoneId.of(zone.trim())).build();

        LOG.infof("Pipeline configured: N=%d, K=%d, horizon=%.0fh, sentences<=%d, zone=%s", config.articlesPerRun(),
                config.perSourceCap(), config.freshnessHorizonHours(), config.maxDescriptionSentences(),
                config.zone());
        return config;
    }

    @Produces
    @Singleton
    public FeedSettings feedSettings() {
        return new FeedSettings(entriesPerSource, requestTimeout, scrapePages, pageDelay, userAgent);
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
