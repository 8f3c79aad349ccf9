package com.hybridchat.ai.chat;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.hybridchat.ai.memory.ContextEntry;
import com.hybridchat.ai.memory.HybridConversationMemory;
import com.hybridchat.ai.memory.InMemoryMemoryStore;
import com.hybridchat.ai.memory.MemoryConfiguration;
import com.hybridchat.ai.memory.Summarizer;
import com.hybridchat.ai.memory.Turn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.publisher.Flux;

public class ChatServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final InMemoryMemoryStore store = new InMemoryMemoryStore(
            MemoryConfiguration.of(3, 2), new NumberingSummarizer(), registry);
    private final ChatService chatService = new ChatService(chatClient, store, registry);

    @Test
    void recordsTurnAfterAnswer() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).call().content())
                .thenReturn("Nice to meet you, Sam!");

        ChatReply reply = chatService.chat("c1", "My name is Sam");

        assertEquals("Nice to meet you, Sam!", reply.answer());
        assertEquals(1, reply.memory().retainedTurns().size());
        assertEquals(List.of(
                ContextEntry.user("My name is Sam"),
                ContextEntry.assistant("Nice to meet you, Sam!")
        ), store.get("c1").orElseThrow().getContext());
        assertEquals(1, registry.get("chat.answer.duration").timer().count());
    }

    @Test
    void fourthTurnFoldsOldestTurnsIntoSummary() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).call().content())
                .thenReturn("ok");

        for (int i = 1; i <= 4; i++) {
            chatService.chat(null, "question " + i);
        }

        HybridConversationMemory memory = store.get("default").orElseThrow();
        assertEquals("summary of 1-2", memory.snapshot().summary());
        assertEquals(2, memory.snapshot().retainedTurns().size());
    }

    @Test
    void nullAnswerIsRecordedAsEmpty() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).call().content())
                .thenReturn(null);

        ChatReply reply = chatService.chat("c1", "hello?");

        assertEquals("", reply.answer());
        assertEquals("", reply.memory().retainedTurns().get(0).assistantText());
    }

    @Test
    void blankQueryIsRejectedBeforeCallingModel() {
        assertThrows(IllegalArgumentException.class, () -> chatService.chat("c1", "  "));
        assertThrows(IllegalArgumentException.class, () -> chatService.chatStream("c1", null));
        assertTrue(store.get("c1").isEmpty());
    }

    @Test
    void streamRecordsConcatenatedAnswerOnCompletion() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).stream().content())
                .thenReturn(Flux.just("Hel", "lo", " there"));

        List<String> chunks = chatService.chatStream(null, "hi").collectList().block();

        assertEquals(List.of("Hel", "lo", " there"), chunks);
        assertEquals(List.of(
                ContextEntry.user("hi"),
                ContextEntry.assistant("Hello there")
        ), store.get("default").orElseThrow().getContext());
    }

    @Test
    void streamCompletionLogsWithRequestAndConversationIds() {
        Map<String, String> seen = new ConcurrentHashMap<>();
        Summarizer capturing = new NumberingSummarizer() {
            @Override
            public String summarize(String priorSummary, List<Turn> evictedTurns) {
                seen.put("thread", Thread.currentThread().getName());
                seen.put("requestId", String.valueOf(MDC.get("requestId")));
                seen.put("conversationId", String.valueOf(MDC.get("conversationId")));
                return super.summarize(priorSummary, evictedTurns);
            }
        };
        InMemoryMemoryStore smallStore =
                new InMemoryMemoryStore(MemoryConfiguration.of(1, 1), capturing, registry);
        smallStore.getOrCreate("c3").recordTurn("first", "reply");
        ChatService service = new ChatService(chatClient, smallStore, registry);
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).stream().content())
                .thenReturn(Flux.just("ok"));

        MDC.put("requestId", "req-42");
        try {
            service.chatStream("c3", "second").collectList().block();
        } finally {
            MDC.clear();
        }

        assertNotEquals(Thread.currentThread().getName(), seen.get("thread"));
        assertEquals("req-42", seen.get("requestId"));
        assertEquals("c3", seen.get("conversationId"));
        assertEquals("summary of 1-1", smallStore.get("c3").orElseThrow().snapshot().summary());
    }

    @Test
    void logContextIsRestoredAfterwards() {
        MDC.put("requestId", "outer");
        try {
            ChatService.withLogContext("inner", "c9", () -> {
                assertEquals("inner", MDC.get("requestId"));
                assertEquals("c9", MDC.get("conversationId"));
            });

            assertEquals("outer", MDC.get("requestId"));
            assertNull(MDC.get("conversationId"));
        } finally {
            MDC.clear();
        }
    }

    @Test
    void failedStreamDoesNotRecordTurn() {
        when(chatClient.prompt().system(anyString()).messages(anyList()).user(anyString()).stream().content())
                .thenReturn(Flux.concat(Flux.just("partial"), Flux.error(new IllegalStateException("dropped"))));

        assertThrows(IllegalStateException.class,
                () -> chatService.chatStream("c2", "hi").collectList().block());
        assertTrue(store.get("c2").orElseThrow().getContext().isEmpty());
    }

    @Test
    void contextEntriesMapToPromptMessages() {
        List<Message> messages = ChatService.toMessages(List.of(
                ContextEntry.summary("Sam likes Java."),
                ContextEntry.user("What do I like?"),
                ContextEntry.assistant("Java.")
        ));

        assertEquals(3, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("Context from previous conversation: Sam likes Java.", messages.get(0).getText());
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertEquals("What do I like?", messages.get(1).getText());
        assertInstanceOf(AssistantMessage.class, messages.get(2));
        assertEquals("Java.", messages.get(2).getText());
    }

    static class NumberingSummarizer implements Summarizer {
        @Override
        public String summarize(String priorSummary, List<Turn> evictedTurns) {
            return "summary of " + evictedTurns.get(0).sequence() + "-"
                    + evictedTurns.get(evictedTurns.size() - 1).sequence();
        }

        @Override
        public String condense(String summary) {
            return summary;
        }
    }
}
