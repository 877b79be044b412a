/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import archyards.crawler.config.PipelineConfig;
import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.Badge;
import archyards.crawler.data.models.CollectionName;
import archyards.crawler.exceptions.StoreUnavailableException;
import archyards.crawler.store.CollectionStore;

/**
 * Read-only views over the published collection.
 *
 * <p>
 * <b>Query Rules:</b>
 * <ul>
 * <li>Filters are conjunctive; a missing or unrecognized value does not filter</li>
 * <li>{@code limit} defaults to 20, values above 100 are clamped to 100, zero, negative or non-numeric values use the
 * default</li>
 * <li>{@code offset} defaults to 0, negative or non-numeric values use the default</li>
 * <li>Order is the stored order of the published collection, never re-sorted</li>
 * <li>An absent or unreadable published collection is empty</li>
 * </ul>
 */
@ApplicationScoped
public class ArticleQueryService {

    private static final Logger LOG = Logger.getLogger(ArticleQueryService.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final CollectionStore store;
    private final PipelineConfig config;
    private final Clock clock;

    @Inject
    public ArticleQueryService(CollectionStore store, PipelineConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Filters and paginates the published collection.
     *
     * @param filter
     *            filters to apply
     * @param limit
     *            raw page size parameter, may be null or malformed
     * @param offset
     *            raw offset parameter, may be null or malformed
     * @return total after filtering and the requested page
     */
    public ArticlePage list(ArticleFilter filter, String limit, String offset) {
        return list(filter, parseInt(limit), parseInt(offset));
    }

    public ArticlePage list(ArticleFilter filter, Integer limit, Integer offset) {
        int effectiveLimit = resolveLimit(limit);
        int effectiveOffset = resolveOffset(offset);

        List<Article> matches = filter(published(), filter == null ? ArticleFilter.none() : filter);
        int from = Math.min(effectiveOffset, matches.size());
        int to = Math.min(from + effectiveLimit, matches.size());

        return new ArticlePage(matches.size(), effectiveLimit, effectiveOffset, matches.subList(from, to));
    }

    public Optional<Article> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return published().stream().filter(a -> a.id().equals(id)).findFirst();
    }

    /**
     * Articles promoted on the current date of the reference zone.
     */
    public List<Article> today() {
        return filter(published(), new ArticleFilter(null, null, null, true));
    }

    /**
     * Published article count per source, most common first. Equal counts keep first-appearance order.
     */
    public Map<String, Long> sourceCounts() {
        Map<String, Long> counts = published().stream()
                .filter(a -> a.sourceName() != null)
                .collect(Collectors.groupingBy(Article::sourceName, LinkedHashMap::new, Collectors.counting()));

        return counts.entrySet().stream().sorted(Map.Entry.<String, Long> comparingByValue().reversed())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Size of the published collection and the promotion time of its newest article.
     */
    public CollectionHealth health() {
        List<Article> published = published();
        Instant lastUpdated = published.isEmpty() ? null : published.get(0).publishedAtArchyards();
        return new CollectionHealth(published.size(), lastUpdated);
    }

    static int resolveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    static int resolveOffset(Integer offset) {
        if (offset == null || offset < 0) {
            return 0;
        }
        return offset;
    }

    private List<Article> filter(List<Article> articles, ArticleFilter filter) {
        Optional<Badge> badge = Badge.parse(filter.badge());
        if (filter.badge() != null && !filter.badge().isBlank() && badge.isEmpty()) {
            LOG.debugf("Ignoring unknown badge filter: %s", filter.badge());
        }
        LocalDate today = filter.today() ? LocalDate.now(clock.withZone(config.zone())) : null;

        List<Article> result = new ArrayList<>();
        for (Article article : articles) {
            if (isSet(filter.category()) && !filter.category().equals(article.category())) {
                continue;
            }
            if (badge.isPresent() && badge.get() != article.badge()) {
                continue;
            }
            if (isSet(filter.source()) && !filter.source().trim().equalsIgnoreCase(article.sourceName())) {
                continue;
            }
            if (today != null && (article.publishedAtArchyards() == null
                    || !LocalDate.ofInstant(article.publishedAtArchyards(), config.zone()).equals(today))) {
                continue;
            }
            result.add(article);
        }
        return result;
    }

    private List<Article> published() {
        try {
            return store.read(CollectionName.PUBLISHED);
        } catch (StoreUnavailableException e) {
            LOG.warnf("Published collection unavailable, serving empty result: %s", e.getMessage());
            return List.of();
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric pagination value: %s", value);
            return null;
        }
    }

    /**
     * @param totalArticles
     *            published article count
     * @param lastUpdated
     *            promotion time of the first stored article, null when empty
     */
    public record CollectionHealth(int totalArticles, Instant lastUpdated) {
    }
}
