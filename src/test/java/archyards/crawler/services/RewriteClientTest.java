/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.langchain4j.model.chat.ChatModel;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import archyards.crawler.TestFixtures;
import archyards.crawler.api.types.RewriteResultType;
import archyards.crawler.exceptions.RewriteFailedException;

/**
 * Unit tests for {@link RewriteClient} response validation and sentence counting.
 */
public class RewriteClientTest {

    @Mock
    ChatModel chatModel;

    private RewriteClient client;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        client = new RewriteClient(chatModel, TestFixtures.objectMapper(), TestFixtures.config().build(),
                new SimpleMeterRegistry());
    }

    @Test
    public void testParse_validResponse() {
        RewriteResultType result = client.parse("a1", RewriteServiceTest.VALID);

        assertEquals("Concrete Finds Its Voice", result.rewrittenTitle());
    }

    @Test
    public void testParse_blankTitle_isRejected() {
        RewriteFailedException e = assertThrows(RewriteFailedException.class,
                () -> client.parse("a2", "{\"rewritten_title\": \" \", \"rewritten_description\": \"Fine.\"}"));

        assertEquals("a2", e.getArticleId());
    }

    @Test
    public void testParse_notJson_isRejected() {
        assertThrows(RewriteFailedException.class, () -> client.parse("a3", "Here is your rewrite!"));
    }

    @Test
    public void testParse_tooManySentences_isRejected() {
        RewriteFailedException e = assertThrows(RewriteFailedException.class,
                () -> client.parse("a4", RewriteServiceTest.SEVEN_SENTENCES));

        assertTrue(e.getMessage().contains("7 sentences"));
    }

    @Test
    public void testParse_abbreviationsDoNotPushFiveSentencesOverLimit() {
        String response = """
                {"rewritten_title": "Ando in Ohio", "rewritten_description": "Dr. Ando lands in the Midwest. \
                The U.S. firm behind the museum hired him in 2023. St. Louis watches closely. \
                The concrete is poured on site. Mr. Ando visits every month."}
                """;

        RewriteResultType result = client.parse("a5", response);

        assertEquals("Ando in Ohio", result.rewrittenTitle());
    }

    @Test
    public void testCountSentences() {
        assertEquals(0, RewriteClient.countSentences(" "));
        assertEquals(1, RewriteClient.countSentences("No terminal punctuation"));
        assertEquals(3, RewriteClient.countSentences("One. Two? Three!"));
        assertEquals(2, RewriteClient.countSentences("First line\nSecond line"));
        assertEquals(7, RewriteClient.countSentences("One. Two. Three. Four. Five. Six. Seven."));
        assertEquals(2, RewriteClient.countSentences("It opens today. \"Nothing here is decorative.\""));
    }

    @Test
    public void testCountSentences_abbreviationsAndInitials() {
        assertEquals(1, RewriteClient.countSentences("Dr. Ando designed it."));
        assertEquals(1, RewriteClient.countSentences("The U.S. firm won the commission."));
        assertEquals(1, RewriteClient.countSentences("Designed by I. M. Pei in 1978."));
        assertEquals(2, RewriteClient.countSentences("The tower rises 3.5 metres a week. It tops out in May."));
        assertEquals(1, RewriteClient.countSentences("Why? because the site floods."));
    }

    @Test
    public void testStripCodeFences() {
        assertEquals("{}", RewriteClient.stripCodeFences("```json\n{}\n```"));
        assertEquals("{}", RewriteClient.stripCodeFences("```\n{}\n```"));
        assertEquals("{}", RewriteClient.stripCodeFences("  {}  "));
    }
}
