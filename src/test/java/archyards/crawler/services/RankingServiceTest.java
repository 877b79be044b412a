/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import static archyards.crawler.TestFixtures.candidate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import archyards.crawler.TestFixtures;
import archyards.crawler.data.models.Candidate;
import archyards.crawler.data.models.ScoredCandidate;

/**
 * Unit tests for {@link RankingService} scoring and diversity-capped selection.
 */
public class RankingServiceTest {

    private RankingService service(int n, int k) {
        return new RankingService(TestFixtures.config().articlesPerRun(n).perSourceCap(k).build());
    }

    @Test
    public void testSelect_twoSources_capsEachAtTwoInScoreOrder() {
        List<Candidate> pool = List.of(candidate("A", "a80", 80), candidate("A", "a60", 60), candidate("A", "a40", 40),
                candidate("B", "b90", 90), candidate("B", "b70", 70), candidate("B", "b50", 50));

        List<ScoredCandidate> selected = service(4, 2).select(pool);

        List<String> order = selected.stream().map(s -> s.candidate().originalTitle()).toList();
        assertEquals(List.of("Title b90", "Title a80", "Title b70", "Title a60"), order);
        assertEquals(90.0, selected.get(0).popularityScore(), 0.001);
    }

    @Test
    public void testSelect_neverExceedsTargetOrCap() {
        Random random = new Random(7);
        List<Candidate> pool = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            String source = "S" + (i % 4);
            pool.add(candidate(source, "item" + i, 2 * random.nextInt(50)));
        }

        for (int n = 0; n <= 8; n++) {
            for (int k = 1; k <= 3; k++) {
                List<ScoredCandidate> selected = service(n, k).select(pool, new Random(n * 31L + k));

                assertTrue(selected.size() <= n, "selection larger than N");
                Map<String, Integer> perSource = new HashMap<>();
                for (ScoredCandidate scored : selected) {
                    perSource.merge(scored.sourceName(), 1, Integer::sum);
                }
                int cap = k;
                assertTrue(perSource.values().stream().allMatch(count -> count <= cap), "source exceeded cap");

                Set<String> inputIds = pool.stream().map(Candidate::id).collect(Collectors.toSet());
                assertTrue(selected.stream().allMatch(s -> inputIds.contains(s.id())), "selection not a subset");
            }
        }
    }

    @Test
    public void testSelect_smallPool_returnsAllEligible() {
        List<Candidate> pool = List.of(candidate("A", "one", 10), candidate("B", "two", 20));

        List<ScoredCandidate> selected = service(5, 2).select(pool);

        assertEquals(2, selected.size());
        assertEquals("Title two", selected.get(0).candidate().originalTitle());
    }

    @Test
    public void testSelect_emptyPool_returnsEmpty() {
        assertTrue(service(5, 2).select(List.of()).isEmpty());
    }

    @Test
    public void testSelect_duplicateIds_selectedOnce() {
        Candidate first = candidate("A", "same", 40);
        List<ScoredCandidate> selected = service(5, 2).select(List.of(first, first, first));

        assertEquals(1, selected.size());
    }

    @Test
    public void testSelect_equalScores_tieBrokenById() {
        Candidate x = candidate("A", "x", 50);
        Candidate y = candidate("B", "y", 50);
        Candidate z = candidate("C", "z", 50);

        List<String> expected = List.of(x, y, z).stream().map(Candidate::id).sorted().toList();
        List<String> actual = service(3, 2).select(List.of(z, y, x)).stream().map(ScoredCandidate::id).toList();

        assertEquals(expected, actual);
    }

    @Test
    public void testSelect_fixedSeed_isReproducible() {
        RankingService seeded = new RankingService(
                TestFixtures.config().maxJitter(5.0).jitterSeed(42L).articlesPerRun(5).perSourceCap(2).build());
        List<Candidate> pool = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            pool.add(candidate("S" + (i % 5), "n" + i, 40));
        }

        List<String> first = seeded.select(pool).stream().map(ScoredCandidate::id).toList();
        List<String> second = seeded.select(pool).stream().map(ScoredCandidate::id).toList();

        assertEquals(first, second);
    }

    @Test
    public void testScore_jitterWithinBounds() {
        RankingService jittered = new RankingService(TestFixtures.config().maxJitter(5.0).build());
        Random random = new Random(1);
        Candidate c = candidate("A", "j", 20);

        for (int i = 0; i < 200; i++) {
            ScoredCandidate scored = jittered.score(c, random);
            assertTrue(scored.jitterComponent() >= 0.0 && scored.jitterComponent() <= 5.0);
            assertTrue(scored.popularityScore() >= 20.0 && scored.popularityScore() <= 25.01);
        }
    }

    @Test
    public void testFreshness_decaysLinearlyAndIsCapped() {
        RankingService ranking = service(5, 2);

        assertEquals(100.0, ranking.freshness(0.0), 0.001);
        assertEquals(100.0, ranking.freshness(-3.0), 0.001, "negative ages count as fresh");
        assertEquals(50.0, ranking.freshness(50.0), 0.001);
        assertEquals(0.0, ranking.freshness(100.0), 0.001);
        assertEquals(0.0, ranking.freshness(500.0), 0.001);
        assertTrue(ranking.freshness(10.0) > ranking.freshness(20.0));
    }

    @Test
    public void testScore_weightsCommentsAndShares() {
        Candidate c = new Candidate("abc", "A", null, "https://a.example/x", null, "t", "d", TestFixtures.NOW,
                "design", List.of(), 200.0, 3, 10);

        assertEquals(11.0, service(5, 2).score(c, new Random()).popularityScore(), 0.001);
    }
}
