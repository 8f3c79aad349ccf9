package com.hybridchat.ai.chat;

import com.hybridchat.ai.memory.ContextEntry;
import com.hybridchat.ai.memory.HybridConversationMemory;
import com.hybridchat.ai.memory.MemoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    static final String SYSTEM_PROMPT = """
            You are a friendly educational assistant that remembers conversation history.
            You can recall details about the user from both recent messages and summarized older conversations.
            Always try to reference previous context when relevant.
            """;

    static final String SUMMARY_CONTEXT_PREFIX = "Context from previous conversation: ";

    private final ChatClient answerChatClient;
    private final MemoryStore memoryStore;
    private final Timer answerTimer;

    public ChatService(
            @Qualifier("answerChatClient") ChatClient answerChatClient,
            MemoryStore memoryStore,
            MeterRegistry meterRegistry
    ) {
        this.answerChatClient = answerChatClient;
        this.memoryStore = memoryStore;
        this.answerTimer = Timer.builder("chat.answer.duration")
                .description("Answer LLM call duration")
                .register(meterRegistry);
    }

    /**
     * Answers {@code query} with the conversation's memory as context, then records the exchange.
     */
    public ChatReply chat(String conversationId, String query) {
        requireQuery(query);
        String key = MemoryStore.resolveConversationId(conversationId);
        MDC.put("conversationId", key);

        HybridConversationMemory memory = memoryStore.getOrCreate(key);
        List<Message> history = toMessages(memory.getContext());

        long startNanos = System.nanoTime();
        String answer = answerChatClient.prompt()
                .system(SYSTEM_PROMPT)
                .messages(history)
                .user(query)
                .call()
                .content();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        answerTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.info("LLM answer call completed durationMs={} historyMessages={}", durationMs, history.size());

        if (answer == null) {
            answer = "";
        }
        memory.recordTurn(query, answer);
        return new ChatReply(answer, memory.snapshot());
    }

    /**
     * Streams the answer chunks. The turn is recorded once the stream completes, on a worker
     * thread because recording may block on the summarizer.
     */
    public Flux<String> chatStream(String conversationId, String query) {
        requireQuery(query);
        String key = MemoryStore.resolveConversationId(conversationId);
        MDC.put("conversationId", key);
        String requestId = MDC.get("requestId");
        HybridConversationMemory memory = memoryStore.getOrCreate(key);

        return Flux.defer(() -> {
            List<Message> history = toMessages(memory.getContext());
            StringBuilder answer = new StringBuilder();
            long startNanos = System.nanoTime();

            return answerChatClient.prompt()
                    .system(SYSTEM_PROMPT)
                    .messages(history)
                    .user(query)
                    .stream()
                    .content()
                    .doOnNext(answer::append)
                    .concatWith(Mono.<String>fromRunnable(() -> withLogContext(requestId, key, () -> {
                        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
                        answerTimer.record(durationMs, TimeUnit.MILLISECONDS);
                        log.info("LLM answer stream completed conversationId={} durationMs={}", key, durationMs);
                        memory.recordTurn(query, answer.toString());
                    })).subscribeOn(Schedulers.boundedElastic()))
                    .doOnError(e -> withLogContext(requestId, key, () ->
                            log.warn("LLM answer stream failed conversationId={}, turn not recorded", key, e)));
        });
    }

    static List<Message> toMessages(List<ContextEntry> entries) {
        List<Message> messages = new ArrayList<>(entries.size());
        for (ContextEntry entry : entries) {
            switch (entry.role()) {
                case SUMMARY -> messages.add(new SystemMessage(SUMMARY_CONTEXT_PREFIX + entry.text()));
                case USER -> messages.add(new UserMessage(entry.text()));
                case ASSISTANT -> messages.add(new AssistantMessage(entry.text()));
                default -> throw new IllegalStateException("Unknown context role " + entry.role());
            }
        }
        return messages;
    }

    /**
     * Runs {@code action} with the request's ids in the MDC of whatever thread the stream
     * callback lands on, restoring that thread's previous values afterwards.
     */
    static void withLogContext(String requestId, String conversationId, Runnable action) {
        String previousRequestId = MDC.get("requestId");
        String previousConversationId = MDC.get("conversationId");
        putOrRemove("requestId", requestId);
        putOrRemove("conversationId", conversationId);
        try {
            action.run();
        } finally {
            putOrRemove("requestId", previousRequestId);
            putOrRemove("conversationId", previousConversationId);
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
    }
}
