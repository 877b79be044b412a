/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jboss.logging.Logger;

import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.ArticleStatus;
import archyards.crawler.data.models.CollectionName;
import archyards.crawler.exceptions.StoreUnavailableException;

/**
 * {@link CollectionStore} keeping each collection as a JSON array file in one directory.
 *
 * <p>
 * <b>Layout:</b>
 *
 * <pre>
 * storage/
 *   raw_articles.json
 *   rewritten_articles.json
 *   published_articles.json
 *   archive/published_2025-06-01.json
 * </pre>
 *
 * <p>
 * <b>Retention:</b> promotion trims {@code published} to {@code publishedRetention} articles, newest batch first, and
 * removes the trimmed ids from {@code rewritten} and {@code raw} as well.
 *
 * <p>
 * <b>Atomic visibility:</b> a write serializes to a temporary file in the same directory and renames it over the
 * collection file with {@link StandardCopyOption#ATOMIC_MOVE}. Writers are serialized by a lock; readers are not.
 */
public class JsonFileCollectionStore implements CollectionStore {

    private static final Logger LOG = Logger.getLogger(JsonFileCollectionStore.class);

    private static final TypeReference<List<Article>> ARTICLE_LIST = new TypeReference<>() {
    };

    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Path directory;
    private final int publishedRetention;
    private final boolean archiveEnabled;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileCollectionStore(Path directory, int publishedRetention, boolean archiveEnabled,
            ObjectMapper objectMapper, Clock clock) {
        if (publishedRetention < 1) {
            throw new IllegalArgumentException("publishedRetention must be >= 1");
        }
        this.directory = directory;
        this.publishedRetention = publishedRetention;
        this.archiveEnabled = archiveEnabled;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public List<Article> read(CollectionName collection) {
        Path file = pathOf(collection);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<Article> articles = objectMapper.readValue(file.toFile(), ARTICLE_LIST);
            return articles == null ? List.of() : List.copyOf(articles);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Collection " + file.getFileName() + " is not valid JSON", e);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to read " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Article> find(CollectionName collection, String id) {
        return read(collection).stream().filter(a -> a.id().equals(id)).findFirst();
    }

    @Override
    public void merge(CollectionName collection, List<Article> articles) {
        if (collection == CollectionName.PUBLISHED) {
            throw new IllegalArgumentException("Articles enter the published collection only through promotion");
        }
        if (articles == null || articles.isEmpty()) {
            return;
        }
        for (Article article : articles) {
            if (!collection.acceptedStatuses().contains(article.status())) {
                throw new IllegalArgumentException(String.format("Article %s with status %s cannot be stored in %s",
                        article.id(), article.status(), collection));
            }
        }

        writeLock.lock();
        try {
            if (collection == CollectionName.REWRITTEN) {
                Set<String> rawIds = idsOf(read(CollectionName.RAW));
                for (Article article : articles) {
                    if (!rawIds.contains(article.id())) {
                        throw new IllegalArgumentException(
                                "Rewritten article " + article.id() + " has no raw counterpart");
                    }
                }
            }

            Map<String, Article> byId = new LinkedHashMap<>();
            for (Article existing : read(collection)) {
                byId.put(existing.id(), existing);
            }
            for (Article article : articles) {
                byId.put(article.id(), article);
            }
            write(collection, new ArrayList<>(byId.values()));
            LOG.debugf("Merged %d articles into %s (%d total)", Integer.valueOf(articles.size()), collection, Integer.valueOf(byId.size()));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Article> promoteAll(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        writeLock.lock();
        try {
            Map<String, Article> rewritten = new LinkedHashMap<>();
            for (Article article : read(CollectionName.REWRITTEN)) {
                rewritten.put(article.id(), article);
            }

            Instant promotedAt = clock.instant();
            List<Article> promoted = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) {
                Article source = rewritten.get(id);
                if (source == null || !source.status().canTransitionTo(ArticleStatus.PUBLISHED)) {
                    throw new IllegalArgumentException("Article " + id + " is not a rewritten article");
                }
                promoted.add(source.publishedAt(promotedAt));
            }

            Set<String> promotedIds = idsOf(promoted);
            List<Article> published = new ArrayList<>(promoted);
            for (Article existing : read(CollectionName.PUBLISHED)) {
                if (!promotedIds.contains(existing.id())) {
                    published.add(existing);
                }
            }
            Set<String> expired = Set.of();
            if (published.size() > publishedRetention) {
                LOG.infof("Dropping %d published articles beyond retention of %d",
                        published.size() - publishedRetention, publishedRetention);
                expired = idsOf(published.subList(publishedRetention, published.size()));
                published = new ArrayList<>(published.subList(0, publishedRetention));
            }

            write(CollectionName.PUBLISHED, published);
            if (!expired.isEmpty()) {
                prune(CollectionName.REWRITTEN, expired);
                prune(CollectionName.RAW, expired);
            }
            LOG.infof("Promoted %d articles to published (%d total)", promoted.size(), published.size());
            return List.copyOf(promoted);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Path> archivePublished(LocalDate day) {
        if (!archiveEnabled) {
            return Optional.empty();
        }
        Path published = pathOf(CollectionName.PUBLISHED);
        if (!Files.exists(published)) {
            return Optional.empty();
        }

        Path archive = directory.resolve("archive").resolve("published_" + ARCHIVE_DATE.format(day) + ".json");
        writeLock.lock();
        try {
            Files.createDirectories(archive.getParent());
            Path tmp = Files.createTempFile(archive.getParent(), archive.getFileName().toString(), ".tmp");
            try {
                Files.copy(published, tmp, StandardCopyOption.REPLACE_EXISTING);
                moveIntoPlace(tmp, archive);
            } finally {
                Files.deleteIfExists(tmp);
            }
            LOG.infof("Archived published collection to %s", archive);
            return Optional.of(archive);
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to archive published collection: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes articles that left published retention. Rewritten is pruned before raw so each intermediate state keeps
     * the subset chain.
     */
    private void prune(CollectionName collection, Set<String> ids) {
        List<Article> current = read(collection);
        List<Article> kept = new ArrayList<>();
        for (Article article : current) {
            if (!ids.contains(article.id())) {
                kept.add(article);
            }
        }
        if (kept.size() != current.size()) {
            write(collection, kept);
            LOG.debugf("Pruned %d expired articles from %s", current.size() - kept.size(), collection);
        }
    }

    private void write(CollectionName collection, List<Article> articles) {
        Path target = pathOf(collection);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, collection.fileName(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), articles);
                moveIntoPlace(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Unable to write " + target + ": " + e.getMessage(), e);
        }
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warnf("Atomic move not supported for %s, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path pathOf(CollectionName collection) {
        return directory.resolve(collection.fileName());
    }

    private static Set<String> idsOf(List<Article> articles) {
        Set<String> ids = new LinkedHashSet<>();
        for (Article article : articles) {
            ids.add(article.id());
        }
        return ids;
    }
}
