package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsightExtractorTest {

    private final InsightExtractor extractor = new InsightExtractor();

    @Test
    void shouldExtractMarkedSentencesOfModerateLength() {
        List<String> insights = extractor.extract("I found a SQL injection in the login form. Short key. "
                + "The weather is nice today and nothing else happened!\nThis is an important constraint on caching");

        assertEquals(List.of("I found a SQL injection in the login form",
                "This is an important constraint on caching"), insights);
    }

    @Test
    void shouldIgnoreBlankText() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("   ").isEmpty());
    }

    @Test
    void shouldDigestDroppedMessages() {
        List<Message> dropped = List.of(
                Message.builder().role(Message.ROLE_USER).content("Start").build(),
                Message.builder().role(Message.ROLE_ASSISTANT).content("Nothing notable here yet")
                        .toolCalls(List.of(Message.ToolCall.builder().id("1").name("list-directory").build()))
                        .build());

        List<String> summary = extractor.summarizeDropped(dropped);

        assertEquals(List.of("Earlier conversation (2 messages) called tools: list-directory"), summary);
    }

    @Test
    void shouldReportWhenDroppedMessagesMadeNoToolCalls() {
        List<String> summary = extractor.summarizeDropped(List.of(
                Message.builder().role(Message.ROLE_USER).content("Start").build()));

        assertEquals(List.of("Earlier conversation (1 messages) made no tool calls"), summary);
    }
}
