/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import static archyards.crawler.TestFixtures.published;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import archyards.crawler.TestFixtures;
import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.Badge;
import archyards.crawler.data.models.CollectionName;
import archyards.crawler.exceptions.StoreUnavailableException;
import archyards.crawler.store.CollectionStore;

/**
 * Unit tests for {@link ArticleQueryService} filtering, pagination and aggregates.
 */
public class ArticleQueryServiceTest {

    private static final Instant TODAY = TestFixtures.NOW;
    private static final Instant YESTERDAY = TestFixtures.NOW.minus(Duration.ofDays(1));

    @Mock
    CollectionStore store;

    private AutoCloseable mocks;
    private ArticleQueryService service;

    @BeforeEach
    public void setup() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new ArticleQueryService(store, TestFixtures.config().build(),
                Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC));
    }

    @AfterEach
    public void teardown() throws Exception {
        mocks.close();
    }

    private void givenPublished(List<Article> articles) {
        when(store.read(CollectionName.PUBLISHED)).thenReturn(articles);
    }

    private static List<Article> numbered(int count) {
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            articles.add(published("id" + i, "Dezeen", "architecture", Badge.AGGREGATED, TODAY));
        }
        return articles;
    }

    @Test
    public void testList_badgeFilter_totalCountsMatchesOnly() {
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            articles.add(published("id" + i, "Dezeen", "architecture", i < 3 ? Badge.PAID : Badge.AGGREGATED, TODAY));
        }
        givenPublished(articles);

        ArticlePage page = service.list(new ArticleFilter(null, "paid", null, false), 5, 0);

        assertEquals(3, page.total());
        assertEquals(3, page.articles().size());
        assertTrue(page.articles().stream().allMatch(a -> a.badge() == Badge.PAID));
    }

    @Test
    public void testList_limitAboveMaximum_isClamped() {
        givenPublished(numbered(150));

        ArticlePage page = service.list(ArticleFilter.none(), 500, 0);

        assertEquals(100, page.limit());
        assertEquals(100, page.articles().size());
        assertEquals(150, page.total());
    }

    @Test
    public void testList_nonPositiveOrMalformedLimit_usesDefault() {
        givenPublished(numbered(30));

        assertEquals(20, service.list(ArticleFilter.none(), 0, 0).limit());
        assertEquals(20, service.list(ArticleFilter.none(), -5, 0).limit());
        assertEquals(20, service.list(ArticleFilter.none(), "abc", "0").limit());
        assertEquals(20, service.list(ArticleFilter.none(), (String) null, null).articles().size());
    }

    @Test
    public void testList_malformedOrNegativeOffset_startsAtZero() {
        givenPublished(numbered(3));

        assertEquals(0, service.list(ArticleFilter.none(), "2", "-4").offset());
        assertEquals("id0", service.list(ArticleFilter.none(), "2", "x").articles().get(0).id());
    }

    @Test
    public void testList_offsetPastEnd_isEmptyPageWithTotal() {
        givenPublished(numbered(3));

        ArticlePage page = service.list(ArticleFilter.none(), 10, 50);

        assertEquals(3, page.total());
        assertTrue(page.articles().isEmpty());
    }

    @Test
    public void testList_pagesReconstructFilteredSetInOrder() {
        List<Article> articles = numbered(7);
        givenPublished(articles);

        List<String> collected = new ArrayList<>();
        for (int offset = 0; offset < 7; offset += 3) {
            service.list(ArticleFilter.none(), 3, offset).articles().forEach(a -> collected.add(a.id()));
        }

        assertEquals(articles.stream().map(Article::id).toList(), collected);
    }

    @Test
    public void testList_filtersAreConjunctive() {
        givenPublished(List.of(published("a", "Dezeen", "architecture", Badge.AGGREGATED, TODAY),
                published("b", "Dezeen", "interiors", Badge.AGGREGATED, TODAY),
                published("c", "ArchDaily", "architecture", Badge.AGGREGATED, TODAY),
                published("d", "Dezeen", "architecture", Badge.PAID, TODAY)));

        ArticlePage page = service.list(new ArticleFilter("architecture", "aggregated", " dezeen ", false), 20, 0);

        assertEquals(List.of("a"), page.articles().stream().map(Article::id).toList());
    }

    @Test
    public void testList_unknownBadge_doesNotFilter() {
        givenPublished(numbered(4));

        assertEquals(4, service.list(new ArticleFilter(null, "sponsored", null, false), 20, 0).total());
    }

    @Test
    public void testList_todayFilter_usesReferenceZoneDate() {
        givenPublished(List.of(published("new", "Dezeen", "architecture", Badge.AGGREGATED, TODAY),
                published("old", "Dezeen", "architecture", Badge.AGGREGATED, YESTERDAY)));

        assertEquals(List.of("new"), service.today().stream().map(Article::id).toList());
        assertEquals(1, service.list(new ArticleFilter(null, null, null, true), 20, 0).total());
    }

    @Test
    public void testToday_otherZone_shiftsCalendarDay() {
        // 07:00Z on June 1st is still May 31st in Honolulu
        service = new ArticleQueryService(store, TestFixtures.config().zone(ZoneId.of("Pacific/Honolulu")).build(),
                Clock.fixed(TestFixtures.NOW, ZoneOffset.UTC));
        givenPublished(List.of(published("late", "Dezeen", "architecture", Badge.AGGREGATED,
                Instant.parse("2025-05-31T12:00:00Z")), published("new", "Dezeen", "architecture", Badge.AGGREGATED,
                        TODAY)));

        assertEquals(List.of("late", "new"), service.today().stream().map(Article::id).toList());
    }

    @Test
    public void testFindById_returnsPublishedArticleOrEmpty() {
        givenPublished(numbered(3));

        assertEquals("id1", service.findById("id1").orElseThrow().id());
        assertTrue(service.findById("missing").isEmpty());
        assertTrue(service.findById(null).isEmpty());
    }

    @Test
    public void testSourceCounts_mostCommonFirst() {
        givenPublished(List.of(published("a", "ArchDaily", "architecture", Badge.AGGREGATED, TODAY),
                published("b", "Dezeen", "architecture", Badge.AGGREGATED, TODAY),
                published("c", "Dezeen", "architecture", Badge.AGGREGATED, TODAY)));

        Map<String, Long> counts = service.sourceCounts();

        assertEquals(List.of("Dezeen", "ArchDaily"), List.copyOf(counts.keySet()));
        assertEquals(2L, counts.get("Dezeen"));
    }

    @Test
    public void testHealth_reportsSizeAndNewestPromotion() {
        givenPublished(List.of(published("a", "Dezeen", "architecture", Badge.AGGREGATED, TODAY),
                published("b", "Dezeen", "architecture", Badge.AGGREGATED, YESTERDAY)));

        ArticleQueryService.CollectionHealth health = service.health();

        assertEquals(2, health.totalArticles());
        assertEquals(TODAY, health.lastUpdated());
    }

    @Test
    public void testQueries_unavailableStore_serveEmptyResults() {
        when(store.read(CollectionName.PUBLISHED)).thenThrow(new StoreUnavailableException("not valid JSON"));

        assertEquals(0, service.list(ArticleFilter.none(), 20, 0).total());
        assertTrue(service.today().isEmpty());
        assertEquals(0, service.health().totalArticles());
        assertNull(service.health().lastUpdated());
    }

    @Test
    public void testResolveLimitAndOffset() {
        assertEquals(20, ArticleQueryService.resolveLimit(null));
        assertEquals(1, ArticleQueryService.resolveLimit(1));
        assertEquals(100, ArticleQueryService.resolveLimit(101));
        assertEquals(0, ArticleQueryService.resolveOffset(null));
        assertEquals(7, ArticleQueryService.resolveOffset(7));
    }
}
