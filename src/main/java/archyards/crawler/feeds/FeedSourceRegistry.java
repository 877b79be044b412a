/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Holds the feed sources a pipeline run fetches from.
 *
 * <p>
 * The catalog ({@code archyards.feeds.catalog}) is a JSON array of {@link FeedSourceDescriptor}. The value is tried as
 * a file path first and then as a classpath resource, so deployments can override the bundled
 * {@code feed-sources.json} without rebuilding.
 *
 * <p>
 * All sources share one {@link HttpClient} (5 second connect timeout, redirects followed).
 */
@ApplicationScoped
public class FeedSourceRegistry {

    private static final Logger LOG = Logger.getLogger(FeedSourceRegistry.class);

    private static final TypeReference<List<FeedSourceDescriptor>> CATALOG_TYPE = new TypeReference<>() {
    };

    private final List<FeedSource> sources;

    @Inject
    public FeedSourceRegistry(ObjectMapper objectMapper, FeedSettings settings, ArticlePageScraper scraper,
            Clock clock, @ConfigProperty(
                    name = "archyards.feeds.catalog",
                    defaultValue = "feed-sources.json") String catalog) {
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL).build();

        List<FeedSource> built = new ArrayList<>();
        for (FeedSourceDescriptor descriptor : loadCatalog(objectMapper, catalog)) {
            built.add(new RssFeedSource(descriptor, settings, httpClient, scraper, clock));
        }
        this.sources = List.copyOf(built);
        LOG.infof("Loaded %d feed sources from %s", sources.size(), catalog);
    }

    public FeedSourceRegistry(List<FeedSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public List<FeedSource> sources() {
        return sources;
    }

    /**
     * Reads and validates a source catalog. Entries without a name or RSS URL are skipped with a warning.
     *
     * @param objectMapper
     *            JSON mapper
     * @param location
     *            file path or classpath resource name
     * @return descriptors in catalog order
     * @throws IllegalStateException
     *             if the catalog cannot be found or parsed
     */
    public static List<FeedSourceDescriptor> loadCatalog(ObjectMapper objectMapper, String location) {
        List<FeedSourceDescriptor> descriptors;
        try (InputStream in = open(location)) {
            descriptors = objectMapper.readValue(in, CATALOG_TYPE);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read feed catalog " + location + ": " + e.getMessage(), e);
        }

        List<FeedSourceDescriptor> valid = new ArrayList<>();
        for (FeedSourceDescriptor descriptor : descriptors) {
            if (descriptor.name() == null || descriptor.name().isBlank() || descriptor.rssUrl() == null
                    || descriptor.rssUrl().isBlank()) {
                LOG.warnf("Skipping feed catalog entry without name or rss url: %s", descriptor);
                continue;
            }
            valid.add(descriptor);
        }
        return valid;
    }

    private static InputStream open(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return Files.newInputStream(path);
        }
        InputStream resource = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (resource == null) {
            throw new IllegalStateException("Feed catalog not found: " + location);
        }
        return resource;
    }
}
