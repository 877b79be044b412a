/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Fetches an article page and extracts the signals the RSS entry lacks.
 *
 * <p>
 * <b>Extraction Strategy:</b>
 * <ol>
 * <li>Lead image: {@code og:image}, then {@code twitter:image}</li>
 * <li>Body text: the first five paragraphs of {@code article}, {@code .entry-content}, {@code .article-body}, or any
 * {@code p}, whichever matches first</li>
 * <li>Comment count: digits of the element matched by the source's popularity selector</li>
 * <li>Share signals: sum of the first {@code data-shares}, {@code data-reactions} and {@code data-likes}
 * attributes</li>
 * </ol>
 *
 * <p>
 * Page failures degrade to {@link PageSignals#empty()}; they never fail the feed entry.
 */
@ApplicationScoped
public class ArticlePageScraper {

    private static final Logger LOG = Logger.getLogger(ArticlePageScraper.class);

    private static final int MAX_BODY_SIZE = 2 * 1024 * 1024;
    private static final int MAX_PARAGRAPHS = 5;

    private static final List<String> BODY_SELECTORS = List.of("article p", ".entry-content p", ".article-body p",
            "p");
    private static final List<String> SHARE_ATTRIBUTES = List.of("data-shares", "data-reactions", "data-likes");

    /**
     * Fetches and parses an article page.
     *
     * @param url
     *            article URL (http/https only)
     * @param popularitySelector
     *            comment counter selector, may be null
     * @param settings
     *            timeout and user agent
     * @return extracted signals, or {@link PageSignals#empty()} when the page cannot be fetched
     */
    public PageSignals fetch(String url, String popularitySelector, FeedSettings settings) {
        if (!isHttpUrl(url)) {
            return PageSignals.empty();
        }

        try {
            Document doc = Jsoup.connect(url).userAgent(settings.userAgent()).header("Accept-Language", "en-US,en;q=0.9")
                    .timeout((int) settings.requestTimeout().toMillis()).maxBodySize(MAX_BODY_SIZE)
                    .followRedirects(true).get();
            return extract(doc, popularitySelector);
        } catch (IOException e) {
            LOG.warnf("Failed to fetch article page %s: %s", url, e.getMessage());
            return PageSignals.empty();
        }
    }

    /**
     * Extracts signals from an already parsed page.
     *
     * @param doc
     *            parsed page
     * @param popularitySelector
     *            comment counter selector, may be null
     * @return extracted signals
     */
    public PageSignals extract(Document doc, String popularitySelector) {
        String image = metaContent(doc, "meta[property=og:image]");
        if (image == null) {
            image = metaContent(doc, "meta[name=twitter:image]");
        }

        String bodyText = null;
        for (String selector : BODY_SELECTORS) {
            Elements paragraphs = doc.select(selector);
            if (!paragraphs.isEmpty()) {
                bodyText = paragraphs.stream().limit(MAX_PARAGRAPHS).map(Element::text).filter(t -> !t.isBlank())
                        .collect(Collectors.joining(" "));
                break;
            }
        }

        Integer comments = null;
        if (popularitySelector != null && !popularitySelector.isBlank()) {
            Element counter = doc.selectFirst(popularitySelector);
            if (counter != null) {
                comments = digitsOf(counter.text());
            }
        }

        Integer shares = null;
        for (String attribute : SHARE_ATTRIBUTES) {
            Element element = doc.selectFirst("[" + attribute + "]");
            if (element != null) {
                Integer value = digitsOf(element.attr(attribute));
                if (value != null) {
                    shares = (shares == null ? 0 : shares) + value;
                }
            }
        }

        return new PageSignals(image, bodyText == null || bodyText.isBlank() ? null : bodyText, comments, shares);
    }

    /**
     * Converts an HTML fragment to whitespace-normalized plain text.
     *
     * @param html
     *            fragment, may be null
     * @return plain text, empty string for null input
     */
    public static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().trim();
    }

    /**
     * Returns the {@code src} of the first absolute image in an HTML fragment.
     *
     * @param html
     *            fragment, may be null
     * @return image URL, or null
     */
    public static String firstImage(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        Element img = Jsoup.parse(html).selectFirst("img[src]");
        if (img != null && img.attr("src").startsWith("http")) {
            return img.attr("src");
        }
        return null;
    }

    static Integer digitsOf(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.chars().filter(Character::isDigit)
                .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append).toString();
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring oversized counter value: %s", text);
            return null;
        }
    }

    private String metaContent(Document doc, String cssQuery) {
        Element element = doc.selectFirst(cssQuery);
        if (element != null && !element.attr("content").isBlank()) {
            return element.attr("content");
        }
        return null;
    }

    private boolean isHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            String scheme = URI.create(url).getScheme();
            return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Skipping page fetch for malformed URL %s", url);
            return false;
        }
    }
}
