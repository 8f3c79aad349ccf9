package com.hybridchat.ai.memory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded buffer of recent turns backed by a rolling summary.
 *
 * <p>When recording a turn pushes the buffer past {@code maxPairs}, the oldest
 * {@code evictionBatchSize} turns are removed and handed to the {@link Summarizer}; the
 * returned fragment is appended to the rolling summary. A failing summarizer is replaced by a
 * fallback fragment built from the evicted text, so {@link #recordTurn} always completes with
 * the buffer back under capacity.
 *
 * <p>All operations run under one lock, the summarizer call included.
 */
public class HybridConversationMemory {

  private static final Logger log = LoggerFactory.getLogger(HybridConversationMemory.class);

  private final MemoryConfiguration config;
  private final Summarizer summarizer;
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Turn> retainedTurns = new ArrayDeque<>();
  private final Counter evictionCounter;
  private final Counter fallbackCounter;
  private final Counter condenseCounter;
  private final Timer summarizerTimer;

  private String summary = "";
  private long nextSequence = 1;

  public HybridConversationMemory(
      MemoryConfiguration config,
      Summarizer summarizer,
      MeterRegistry meterRegistry) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
    this.evictionCounter = Counter.builder("memory.evictions")
        .description("Eviction events folded into the rolling summary")
        .register(meterRegistry);
    this.fallbackCounter = Counter.builder("memory.summarizer.fallbacks")
        .description("Evictions summarized by the fallback fragment")
        .register(meterRegistry);
    this.condenseCounter = Counter.builder("memory.summary.condensations")
        .description("Rolling summary condensations")
        .register(meterRegistry);
    this.summarizerTimer = Timer.builder("memory.summarizer.duration")
        .description("Summarizer call duration")
        .register(meterRegistry);
  }

  public void recordTurn(String userText, String assistantText) {
    Objects.requireNonNull(userText, "userText must not be null");
    Objects.requireNonNull(assistantText, "assistantText must not be null");

    lock.lock();
    try {
      retainedTurns.addLast(new Turn(userText, assistantText, nextSequence++));

      boolean evicted = false;
      while (retainedTurns.size() > config.maxPairs()) {
        evictOldest();
        evicted = true;
      }
      if (evicted && config.condenseEnabled() && summary.length() > config.summaryCondenseThreshold()) {
        condenseSummary();
      }
    } finally {
      lock.unlock();
    }
  }

  public List<ContextEntry> getContext() {
    lock.lock();
    try {
      List<ContextEntry> entries = new ArrayList<>(retainedTurns.size() * 2 + 1);
      if (!summary.isEmpty()) {
        entries.add(ContextEntry.summary(summary));
      }
      for (Turn turn : retainedTurns) {
        entries.add(ContextEntry.user(turn.userText()));
        entries.add(ContextEntry.assistant(turn.assistantText()));
      }
      return List.copyOf(entries);
    } finally {
      lock.unlock();
    }
  }

  public void clear() {
    lock.lock();
    try {
      retainedTurns.clear();
      summary = "";
    } finally {
      lock.unlock();
    }
  }

  public MemorySnapshot snapshot() {
    lock.lock();
    try {
      return new MemorySnapshot(summary, List.copyOf(retainedTurns), config.maxPairs());
    } finally {
      lock.unlock();
    }
  }

  private void evictOldest() {
    List<Turn> evicted = new ArrayList<>(config.evictionBatchSize());
    while (evicted.size() < config.evictionBatchSize() && !retainedTurns.isEmpty()) {
      evicted.add(retainedTurns.removeFirst());
    }
    evictionCounter.increment();

    String fragment = summarizeOrFallback(List.copyOf(evicted));
    summary = summary.isEmpty() ? fragment : summary + config.separator() + fragment;

    log.debug("Evicted turns sequences={}..{} retained={} summaryLength={}",
        evicted.get(0).sequence(),
        evicted.get(evicted.size() - 1).sequence(),
        retainedTurns.size(),
        summary.length());
  }

  private String summarizeOrFallback(List<Turn> evicted) {
    long startNanos = System.nanoTime();
    try {
      String fragment = summarizer.summarize(summary, evicted);
      if (fragment == null || fragment.isBlank()) {
        throw new SummarizerException("Summarizer returned an empty fragment");
      }
      return fragment;
    } catch (RuntimeException e) {
      fallbackCounter.increment();
      log.warn("Summarizer failed, using fallback fragment evictedTurns={} reason={}",
          evicted.size(), e.getMessage(), e);
      return Transcripts.fallbackFragment(evicted, config.fallbackLength());
    } finally {
      summarizerTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }
  }

  private void condenseSummary() {
    int before = summary.length();
    try {
      String condensed = summarizer.condense(summary);
      if (condensed == null || condensed.isBlank()) {
        log.warn("Summary condensation returned nothing, keeping summaryLength={}", before);
        return;
      }
      summary = condensed;
      condenseCounter.increment();
      log.info("Condensed rolling summary lengthBefore={} lengthAfter={}", before, summary.length());
    } catch (RuntimeException e) {
      log.warn("Summary condensation failed, keeping summaryLength={} reason={}",
          before, e.getMessage(), e);
    }
  }
}
