/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.store;

import java.nio.file.Path;
import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Produces the {@link CollectionStore} from {@code archyards.store.*} configuration.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code archyards.store.directory} - collection directory (default: storage)</li>
 * <li>{@code archyards.store.published-retention} - published articles kept (default: 150)</li>
 * <li>{@code archyards.store.archive} - archive the published collection before each run (default: true)</li>
 * </ul>
 */
@ApplicationScoped
public class StoreProducer {

    private static final Logger LOG = Logger.getLogger(StoreProducer.class);

    @ConfigProperty(
            name = "archyards.store.directory",
            defaultValue = "storage")
    String directory;

    @ConfigProperty(
            name = "archyards.store.published-retention",
            defaultValue = "150")
    int publishedRetention;

    @ConfigProperty(
            name = "archyards.store.archive",
            defaultValue = "true")
    boolean archive;

    @Produces
    @Singleton
    public CollectionStore collectionStore(ObjectMapper objectMapper, Clock clock) {
        Path path = Path.of(directory).toAbsolutePath();
        LOG.infof("Collection store at %s (retention=%d, archive=%s)", path, publishedRetention, archive);
        return new JsonFileCollectionStore(path, publishedRetention, archive, objectMapper, clock);
    }
}
