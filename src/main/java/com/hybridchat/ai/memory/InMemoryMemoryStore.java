package com.hybridchat.ai.memory;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryMemoryStore implements MemoryStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryStore.class);

  private final ConcurrentMap<String, HybridConversationMemory> store = new ConcurrentHashMap<>();
  private final MemoryConfiguration config;
  private final Summarizer summarizer;
  private final MeterRegistry meterRegistry;

  public InMemoryMemoryStore(
      MemoryConfiguration config,
      Summarizer summarizer,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.summarizer = summarizer;
    this.meterRegistry = meterRegistry;
    Gauge.builder("memory.conversations", store, ConcurrentMap::size)
        .description("Conversations with an allocated memory")
        .register(meterRegistry);
  }

  @Override
  public Optional<HybridConversationMemory> get(String conversationId) {
    return Optional.ofNullable(store.get(MemoryStore.resolveConversationId(conversationId)));
  }

  @Override
  public HybridConversationMemory getOrCreate(String conversationId) {
    String key = MemoryStore.resolveConversationId(conversationId);
    return store.computeIfAbsent(key, id -> {
      log.info("Allocating conversation memory conversationId={} maxPairs={} evictionBatchSize={}",
          id, config.maxPairs(), config.evictionBatchSize());
      return new HybridConversationMemory(config, summarizer, meterRegistry);
    });
  }

  @Override
  public void remove(String conversationId) {
    String key = MemoryStore.resolveConversationId(conversationId);
    if (store.remove(key) != null) {
      log.info("Released conversation memory conversationId={}", key);
    }
  }
}
