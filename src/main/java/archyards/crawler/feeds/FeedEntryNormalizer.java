/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import archyards.crawler.data.models.Candidate;

/**
 * Turns a raw feed entry plus optional page signals into a {@link Candidate}.
 *
 * <p>
 * Pure function of its inputs: no I/O, no clock. The fetch time is passed in so that ages are reproducible.
 */
public final class FeedEntryNormalizer {

    static final int SHORT_DESCRIPTION_CHARS = 100;
    static final int MAX_DESCRIPTION_CHARS = 1500;
    static final int MAX_TAGS = 8;

    private FeedEntryNormalizer() {
    }

    /**
     * @param source
     *            source the entry came from
     * @param entry
     *            raw entry (must carry a URL)
     * @param page
     *            signals scraped from the article page, {@link PageSignals#empty()} when not scraped
     * @param fetchedAt
     *            fetch time, used for age and as the fallback publication time
     * @return normalized candidate
     */
    public static Candidate normalize(FeedSourceDescriptor source, RawFeedEntry entry, PageSignals page,
            Instant fetchedAt) {
        PageSignals signals = page == null ? PageSignals.empty() : page;

        String description = ArticlePageScraper.plainText(entry.summaryHtml());
        if (description.length() < SHORT_DESCRIPTION_CHARS && signals.bodyText() != null
                && !signals.bodyText().isBlank()) {
            description = signals.bodyText().trim();
        }
        description = truncate(description, MAX_DESCRIPTION_CHARS);

        String image = entry.feedImageUrl();
        if (image == null || image.isBlank()) {
            image = signals.imageUrl();
        }
        if (image == null || image.isBlank()) {
            image = ArticlePageScraper.firstImage(entry.summaryHtml());
        }

        Instant publishedAt = entry.publishedAt() != null ? entry.publishedAt() : fetchedAt;
        double ageHours = Duration.between(publishedAt, fetchedAt).toMillis() / 3_600_000.0;

        String title = entry.title() == null ? "" : ArticlePageScraper.plainText(entry.title());

        return new Candidate(Candidate.idFor(source.name(), entry.url()), source.name(), source.logo(), entry.url(),
                image, title, description, publishedAt, source.category(), distinctTags(entry.tags()), ageHours,
                signals.commentCount() == null ? 0 : signals.commentCount(),
                signals.socialShares() == null ? 0 : signals.socialShares());
    }

    private static List<String> distinctTags(List<String> tags) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                distinct.add(tag.trim());
            }
            if (distinct.size() == MAX_TAGS) {
                break;
            }
        }
        return new ArrayList<>(distinct);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
