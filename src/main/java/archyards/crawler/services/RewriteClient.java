/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.faulttolerance.api.ExponentialBackoff;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import archyards.crawler.api.types.RewriteResultType;
import archyards.crawler.config.PipelineConfig;
import archyards.crawler.exceptions.RewriteFailedException;

/**
 * One guarded text-generation call per article rewrite.
 *
 * <p>
 * <b>Attempt:</b> call the chat model, strip markdown code fences, parse {@link RewriteResultType}, then reject blank
 * output and descriptions longer than {@code maxDescriptionSentences} sentences with {@link RewriteFailedException}.
 *
 * <p>
 * <b>Retry Policy (SmallRye Fault Tolerance):</b> every failure of {@link #attempt(String, String)} is retried, with
 * exponential backoff, except {@link NonRetriableException} (bad credentials, invalid request). The bound and the
 * first delay come from {@code archyards.rewrite.max-retries} and {@code archyards.rewrite.backoff-millis} through the
 * {@code archyards.crawler.services.RewriteClient/attempt/Retry/*} keys in {@code application.yaml}.
 *
 * <p>
 * Metrics: {@code archyards.rewrite.attempts.total} tagged {@code result={success|invalid|error|fatal}}, one increment
 * per attempt.
 */
@ApplicationScoped
public class RewriteClient {

    private static final Logger LOG = Logger.getLogger(RewriteClient.class);

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+[\"'”’)]*(?=\\s|$)");

    private static final Set<String> ABBREVIATIONS = Set.of("mr", "mrs", "ms", "dr", "prof", "st", "sr", "jr", "mt",
            "ft", "vs", "inc", "ltd", "corp", "dept", "approx", "sq");

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final PipelineConfig config;
    private final MeterRegistry meterRegistry;

    @Inject
    public RewriteClient(ChatModel chatModel, ObjectMapper objectMapper, PipelineConfig config,
            MeterRegistry meterRegistry) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs one rewrite attempt.
     *
     * @param articleId
     *            id of the article being rewritten, for logs and errors
     * @param prompt
     *            complete prompt
     * @return validated rewrite
     * @throws RewriteFailedException
     *             if the response is unusable
     * @throws NonRetriableException
     *             if the model rejects the request permanently
     */
    @Retry(
            maxRetries = 2,
            delay = 2000,
            jitter = 0,
            maxDuration = 300000,
            abortOn = NonRetriableException.class)
    @ExponentialBackoff
    @Timeout(60000)
    public RewriteResultType attempt(String articleId, String prompt) {
        try {
            RewriteResultType result = parse(articleId, chatModel.chat(prompt));
            count("success");
            return result;
        } catch (RewriteFailedException e) {
            count("invalid");
            LOG.warnf("Rewrite attempt for %s rejected: %s", articleId, e.getMessage());
            throw e;
        } catch (NonRetriableException e) {
            count("fatal");
            throw e;
        } catch (RuntimeException e) {
            count("error");
            LOG.warnf("Rewrite attempt for %s failed: %s", articleId, e.getMessage());
            throw e;
        }
    }

    RewriteResultType parse(String articleId, String response) {
        if (response == null || response.isBlank()) {
            throw new RewriteFailedException(articleId, "Empty response");
        }

        RewriteResultType result;
        try {
            result = objectMapper.readValue(stripCodeFences(response), RewriteResultType.class);
        } catch (JsonProcessingException e) {
            throw new RewriteFailedException(articleId, "Response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        if (result == null || result.rewrittenTitle() == null || result.rewrittenTitle().isBlank()) {
            throw new RewriteFailedException(articleId, "Missing rewritten_title");
        }
        if (result.rewrittenDescription() == null || result.rewrittenDescription().isBlank()) {
            throw new RewriteFailedException(articleId, "Missing rewritten_description");
        }
        int sentences = countSentences(result.rewrittenDescription());
        if (sentences > config.maxDescriptionSentences()) {
            throw new RewriteFailedException(articleId, String.format("Description has %d sentences, limit is %d",
                    sentences, config.maxDescriptionSentences()));
        }
        return result;
    }

    /**
     * Counts sentences. Lines are counted separately; inside a line a sentence ends at terminal punctuation followed by
     * whitespace, unless the punctuation closes an abbreviation or an initial ({@code Dr.}, {@code U.S.}) or the next
     * word starts in lower case.
     */
    public static int countSentences(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int count = 0;
        for (String line : text.trim().split("\\R+")) {
            if (!line.isBlank()) {
                count += countSentencesInLine(line.trim());
            }
        }
        return count;
    }

    private static int countSentencesInLine(String line) {
        int count = 0;
        int start = 0;
        Matcher end = SENTENCE_END.matcher(line);
        while (end.find()) {
            if (end.group().startsWith(".") && isAbbreviation(line, end.start())) {
                continue;
            }
            if (continuesInLowerCase(line, end.end())) {
                continue;
            }
            if (!line.substring(start, end.end()).isBlank()) {
                count++;
            }
            start = end.end();
        }
        if (!line.substring(start).isBlank()) {
            count++;
        }
        return count;
    }

    private static boolean isAbbreviation(String line, int periodIndex) {
        int wordStart = line.lastIndexOf(' ', periodIndex - 1) + 1;
        String word = line.substring(wordStart, periodIndex).replaceAll("^[\"'“‘(]+", "");
        if (word.isEmpty()) {
            return false;
        }
        if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
            return true;
        }
        if (word.contains(".") && word.matches("(\\p{L}{1,2}\\.)+\\p{L}{1,2}")) {
            return true;
        }
        return ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
    }

    private static boolean continuesInLowerCase(String line, int from) {
        for (int i = from; i < line.length(); i++) {
            char c = line.charAt(i);
            if (!Character.isWhitespace(c)) {
                return Character.isLowerCase(c);
            }
        }
        return false;
    }

    /**
     * Removes a surrounding markdown code fence (with or without a {@code json} tag).
     */
    static String stripCodeFences(String response) {
        String json = response.trim();
        if (json.startsWith("```")) {
            json = json.substring(3);
            if (json.startsWith("json")) {
                json = json.substring(4);
            }
            int closing = json.lastIndexOf("```");
            if (closing >= 0) {
                json = json.substring(0, closing);
            }
        }
        return json.trim();
    }

    private void count(String result) {
        Counter.builder("archyards.rewrite.attempts.total").tag("result", result).register(meterRegistry).increment();
    }
}
