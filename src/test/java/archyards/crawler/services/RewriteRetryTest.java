/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;

import jakarta.inject.Inject;

import org.junit.jupiter.api.Test;

import archyards.crawler.TestFixtures;
import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.ArticleStatus;

/**
 * Integration tests for the fault tolerance policy around {@link RewriteClient#attempt(String, String)}: two retries
 * after the first attempt with a short backoff in the test profile, no retry for non-retriable failures.
 */
@QuarkusTest
class RewriteRetryTest {

    @Inject
    RewriteService rewriteService;

    @InjectMock
    ChatModel chatModel;

    @Test
    void testRewrite_transientFailureThenSuccess_retries() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("rate limited"))
                .thenReturn(RewriteServiceTest.VALID);

        Article result = rewriteService.rewrite(TestFixtures.article("r1", ArticleStatus.RAW));

        assertEquals(ArticleStatus.REWRITTEN, result.status());
        verify(chatModel, times(2)).chat(anyString());
    }

    @Test
    void testRewrite_invalidJsonThenValid_retries() {
        when(chatModel.chat(anyString())).thenReturn("Here is your rewrite!").thenReturn(RewriteServiceTest.VALID);

        Article result = rewriteService.rewrite(TestFixtures.article("r2", ArticleStatus.RAW));

        assertEquals(ArticleStatus.REWRITTEN, result.status());
        verify(chatModel, times(2)).chat(anyString());
    }

    @Test
    void testRewrite_sevenSentencesEveryTime_failsAfterTwoRetries() {
        when(chatModel.chat(anyString())).thenReturn(RewriteServiceTest.SEVEN_SENTENCES);

        Article result = rewriteService.rewrite(TestFixtures.article("r3", ArticleStatus.RAW));

        assertEquals(ArticleStatus.REWRITE_FAILED, result.status());
        verify(chatModel, times(3)).chat(anyString());
    }

    @Test
    void testRewrite_nonRetriableFailure_failsWithoutRetry() {
        when(chatModel.chat(anyString())).thenThrow(new NonRetriableException("invalid x-api-key"));

        Article result = rewriteService.rewrite(TestFixtures.article("r4", ArticleStatus.RAW));

        assertEquals(ArticleStatus.REWRITE_FAILED, result.status());
        verify(chatModel, times(1)).chat(anyString());
    }
}
