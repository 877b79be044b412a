/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import com.rometools.modules.mediarss.MediaEntryModule;
import com.rometools.modules.mediarss.MediaModule;
import com.rometools.modules.mediarss.types.MediaContent;
import com.rometools.modules.mediarss.types.MediaGroup;
import com.rometools.modules.mediarss.types.Thumbnail;
import com.rometools.modules.mediarss.types.UrlReference;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;

import org.jboss.logging.Logger;

import archyards.crawler.data.models.Candidate;
import archyards.crawler.exceptions.SourceUnavailableException;

/**
 * {@link FeedSource} backed by an RSS/Atom document.
 *
 * <p>
 * <b>Fetch Flow:</b>
 * <ol>
 * <li>GET the feed URL with the configured request timeout</li>
 * <li>Parse with Rome {@link SyndFeedInput}</li>
 * <li>Take the first {@code entriesPerSource} entries, skipping entries without a link</li>
 * <li>Pick the feed image: Media RSS content, then Media RSS thumbnail, then an image enclosure</li>
 * <li>Optionally scrape each article page, pausing {@code pageDelay} between requests</li>
 * <li>Normalize through {@link FeedEntryNormalizer}</li>
 * </ol>
 *
 * <p>
 * Transport failures, non-200 responses and unparsable documents raise {@link SourceUnavailableException}. A broken
 * individual entry is logged and skipped.
 */
public class RssFeedSource implements FeedSource {

    private static final Logger LOG = Logger.getLogger(RssFeedSource.class);

    private final FeedSourceDescriptor descriptor;
    private final FeedSettings settings;
    private final HttpClient httpClient;
    private final ArticlePageScraper scraper;
    private final Clock clock;

    public RssFeedSource(FeedSourceDescriptor descriptor, FeedSettings settings, HttpClient httpClient,
            ArticlePageScraper scraper, Clock clock) {
        this.descriptor = descriptor;
        this.settings = settings;
        this.httpClient = httpClient;
        this.scraper = scraper;
        this.clock = clock;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    public FeedSourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public List<Candidate> fetch() {
        SyndFeed feed = download();
        Instant fetchedAt = clock.instant();

        List<SyndEntry> entries = feed.getEntries();
        LOG.debugf("Parsed %d entries from %s", entries.size(), descriptor.name());

        List<Candidate> candidates = new ArrayList<>();
        int considered = 0;
        for (SyndEntry entry : entries) {
            if (considered >= settings.entriesPerSource()) {
                break;
            }
            considered++;

            try {
                RawFeedEntry raw = toRawEntry(entry);
                if (raw == null) {
                    LOG.debugf("Skipping entry without link from %s", descriptor.name());
                    continue;
                }

                PageSignals page = PageSignals.empty();
                if (settings.scrapePages()) {
                    if (!candidates.isEmpty()) {
                        pause();
                    }
                    page = scraper.fetch(raw.url(), descriptor.popularitySelector(), settings);
                }

                candidates.add(FeedEntryNormalizer.normalize(descriptor, raw, page, fetchedAt));
            } catch (SourceUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to process entry from %s: %s", descriptor.name(), e.getMessage());
            }
        }

        LOG.infof("Fetched %d candidates from %s", candidates.size(), descriptor.name());
        return candidates;
    }

    private SyndFeed download() {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(descriptor.rssUrl()))
                .timeout(settings.requestTimeout()).header("User-Agent", settings.userAgent()).GET().build();

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new SourceUnavailableException(descriptor.name(), "Feed request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(descriptor.name(), "Feed request interrupted", e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() != 200) {
                throw new SourceUnavailableException(descriptor.name(),
                        String.format("HTTP %d: %s", response.statusCode(), descriptor.rssUrl()));
            }
            return new SyndFeedInput().build(new XmlReader(body));
        } catch (FeedException | IllegalArgumentException e) {
            throw new SourceUnavailableException(descriptor.name(), "Unparsable feed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SourceUnavailableException(descriptor.name(), "Feed read failed: " + e.getMessage(), e);
        }
    }

    private RawFeedEntry toRawEntry(SyndEntry entry) {
        String link = entry.getLink();
        if (link == null || link.isBlank()) {
            return null;
        }

        List<String> tags = new ArrayList<>();
        for (SyndCategory category : entry.getCategories()) {
            if (category.getName() != null) {
                tags.add(category.getName());
            }
        }

        return new RawFeedEntry(link.trim(), entry.getTitle(), extractSummary(entry), extractPublishedAt(entry),
                extractFeedImage(entry), tags);
    }

    private String extractSummary(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return entry.getDescription().getValue();
        }
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null && !content.getValue().isBlank()) {
                return content.getValue();
            }
        }
        return null;
    }

    private Instant extractPublishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private String extractFeedImage(SyndEntry entry) {
        String media = extractMediaImage(entry);
        return media != null ? media : extractEnclosureImage(entry);
    }

    private String extractMediaImage(SyndEntry entry) {
        if (!(entry.getModule(MediaModule.URI) instanceof MediaEntryModule media)) {
            return null;
        }

        List<MediaContent> contents = new ArrayList<>(List.of(media.getMediaContents()));
        for (MediaGroup group : media.getMediaGroups()) {
            contents.addAll(List.of(group.getContents()));
        }
        for (MediaContent content : contents) {
            if (!isImage(content) || !(content.getReference() instanceof UrlReference reference)) {
                continue;
            }
            String url = httpUrl(String.valueOf(reference.getUrl()));
            if (url != null) {
                return url;
            }
        }

        if (media.getMetadata() != null) {
            for (Thumbnail thumbnail : media.getMetadata().getThumbnail()) {
                String url = httpUrl(String.valueOf(thumbnail.getUrl()));
                if (url != null) {
                    return url;
                }
            }
        }
        return null;
    }

    private static boolean isImage(MediaContent content) {
        if (content.getMedium() != null) {
            return "image".equalsIgnoreCase(content.getMedium());
        }
        return content.getType() == null || content.getType().startsWith("image");
    }

    private static String httpUrl(String url) {
        return url != null && url.startsWith("http") ? url : null;
    }

    private String extractEnclosureImage(SyndEntry entry) {
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String type = enclosure.getType();
            if (enclosure.getUrl() != null && (type == null || type.startsWith("image"))) {
                return enclosure.getUrl();
            }
        }
        return null;
    }

    private void pause() {
        Duration delay = settings.pageDelay();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(descriptor.name(), "Interrupted between article pages", e);
        }
    }
}
