/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ArticlePageScraper} signal extraction on parsed pages.
 */
public class ArticlePageScraperTest {

    private ArticlePageScraper scraper;
    private Document page;

    @BeforeEach
    public void setup() throws IOException {
        scraper = new ArticlePageScraper();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("wiremock/pages/article-page.html")) {
            page = Jsoup.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "https://dezeen.example/");
        }
    }

    @Test
    public void testExtract_readsAllSignals() {
        PageSignals signals = scraper.extract(page, ".comment-count");

        assertEquals("https://images.example/ceramic-og.jpg", signals.imageUrl());
        assertEquals("The pavilion is clad in 4,000 hand-glazed tiles. Its roof folds down to form a shaded bench.",
                signals.bodyText());
        assertEquals(42, signals.commentCount());
        assertEquals(1230, signals.socialShares());
    }

    @Test
    public void testExtract_withoutSelector_hasNoCommentCount() {
        assertNull(scraper.extract(page, null).commentCount());
        assertNull(scraper.extract(page, ".no-such-counter").commentCount());
    }

    @Test
    public void testExtract_twitterImageFallback() {
        Document doc = Jsoup.parse("<html><head><meta name=\"twitter:image\" content=\"https://img.example/t.jpg\">"
                + "</head><body><div class=\"entry-content\"><p>Only text.</p></div></body></html>");

        PageSignals signals = scraper.extract(doc, null);

        assertEquals("https://img.example/t.jpg", signals.imageUrl());
        assertEquals("Only text.", signals.bodyText());
        assertNull(signals.socialShares());
    }

    @Test
    public void testExtract_keepsAtMostFiveParagraphs() {
        StringBuilder html = new StringBuilder("<article>");
        for (int i = 1; i <= 7; i++) {
            html.append("<p>P").append(i).append(".</p>");
        }
        html.append("</article>");

        PageSignals signals = scraper.extract(Jsoup.parse(html.toString()), null);

        assertEquals("P1. P2. P3. P4. P5.", signals.bodyText());
    }

    @Test
    public void testExtract_emptyPage_hasNoSignals() {
        PageSignals signals = scraper.extract(Jsoup.parse("<html><body></body></html>"), ".comment-count");

        assertNull(signals.imageUrl());
        assertNull(signals.bodyText());
        assertNull(signals.commentCount());
        assertNull(signals.socialShares());
    }

    @Test
    public void testFetch_nonHttpUrl_returnsEmptySignals() {
        FeedSettings settings = new FeedSettings(10, Duration.ofSeconds(1), true, Duration.ZERO, "ArchyardsBot/1.0");

        assertSame(PageSignals.empty(), scraper.fetch("ftp://files.example/a", null, settings));
        assertSame(PageSignals.empty(), scraper.fetch(null, null, settings));
        assertSame(PageSignals.empty(), scraper.fetch("not a url", null, settings));
    }

    @Test
    public void testDigitsOf() {
        assertEquals(1200, ArticlePageScraper.digitsOf("1,200 shares"));
        assertNull(ArticlePageScraper.digitsOf("none"));
        assertNull(ArticlePageScraper.digitsOf("99999999999"));
    }

    @Test
    public void testPlainTextAndFirstImage() {
        assertEquals("Bold move", ArticlePageScraper.plainText("<p><b>Bold</b> move</p>"));
        assertEquals("", ArticlePageScraper.plainText(null));
        assertEquals("https://img.example/a.jpg",
                ArticlePageScraper.firstImage("<p>x</p><img src=\"https://img.example/a.jpg\">"));
        assertNull(ArticlePageScraper.firstImage("<img src=\"/relative.jpg\">"));
    }
}
