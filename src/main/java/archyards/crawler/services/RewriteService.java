/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import dev.langchain4j.exception.NonRetriableException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import archyards.crawler.api.types.RewriteResultType;
import archyards.crawler.config.PipelineConfig;
import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.ArticleStatus;

/**
 * Rewrites an article's title and description in the Archyards editorial voice.
 *
 * <p>
 * Builds the prompt from the voice guide, the source name, the original title and the first {@code maxInputChars}
 * characters of the original description, then hands it to {@link RewriteClient}, which owns validation, retry and
 * backoff.
 *
 * <p>
 * The service never throws for model failures: it returns the article in {@code rewritten} or {@code rewrite_failed}
 * status. The id and URL of the input are always carried into the result.
 */
@ApplicationScoped
public class RewriteService {

    private static final Logger LOG = Logger.getLogger(RewriteService.class);

    static final String VOICE_GUIDE = """
            You are the senior editor of Archyards, an architecture and design magazine with editorial weight, \
            cultural insight and technical depth.

            Rewrite article titles and opening descriptions from other publications in the Archyards voice:
            - Confident, intelligent, slightly provocative
            - Never hyperbolic or clickbait
            - Short, punchy titles that spark curiosity
            - Descriptions open with a strong editorial observation, not a summary
            - Architectural precision mixed with cultural commentary
            - Present tense, no passive voice
            - At most %d sentences in the description

            Rules:
            - Do not copy the original wording; rewrite fully
            - Preserve every fact exactly: names, places, dates, buildings
            - Never introduce a fact that is absent from the original
            - Return ONLY valid JSON, no markdown, no explanation
            """;

    private static final String REWRITE_PROMPT = """
            %s
            Rewrite the following article for Archyards.

            SOURCE: %s
            ORIGINAL TITLE: %s
            ORIGINAL DESCRIPTION: %s

            Respond with a JSON object with exactly these two keys:
            {
              "rewritten_title": "Your rewritten title",
              "rewritten_description": "Your rewritten description, one sentence per line."
            }
            """;

    private final RewriteClient client;
    private final PipelineConfig config;

    @Inject
    public RewriteService(RewriteClient client, PipelineConfig config) {
        this.client = client;
        this.config = config;
    }

    /**
     * Rewrites one article.
     *
     * @param article
     *            article in {@code raw} (or {@code rewrite_failed}) status
     * @return the article in {@code rewritten} status with the new text, or in {@code rewrite_failed} status
     */
    public Article rewrite(Article article) {
        LOG.infof("Rewriting %s: %s", article.id(), abbreviate(article.originalTitle(), 60));

        try {
            RewriteResultType result = client.attempt(article.id(), buildPrompt(article));
            LOG.infof("Rewrote %s: %s", article.id(), result.rewrittenTitle());
            return article.withRewrite(result.rewrittenTitle().trim(), result.rewrittenDescription().trim());
        } catch (NonRetriableException e) {
            LOG.errorf(e, "Rewrite of %s failed permanently", article.id());
        } catch (RuntimeException e) {
            LOG.errorf("Rewrite of %s failed after retries: %s", article.id(), e.getMessage());
        }
        return article.withStatus(ArticleStatus.REWRITE_FAILED);
    }

    String buildPrompt(Article article) {
        String description = article.originalDescription() == null ? "" : article.originalDescription();
        if (description.length() > config.maxInputChars()) {
            description = description.substring(0, config.maxInputChars());
        }
        return String.format(REWRITE_PROMPT, String.format(VOICE_GUIDE, config.maxDescriptionSentences()),
                article.sourceName() == null ? "" : article.sourceName(),
                article.originalTitle() == null ? "" : article.originalTitle(), description);
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
