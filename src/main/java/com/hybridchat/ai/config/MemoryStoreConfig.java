package com.hybridchat.ai.config;

import com.hybridchat.ai.memory.ChatClientSummarizer;
import com.hybridchat.ai.memory.InMemoryMemoryStore;
import com.hybridchat.ai.memory.MemoryConfiguration;
import com.hybridchat.ai.memory.MemoryStore;
import com.hybridchat.ai.memory.Summarizer;
import com.hybridchat.ai.memory.TimeLimitedSummarizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryStoreConfig {

  @Bean
  public MemoryConfiguration memoryConfiguration(MemoryProperties properties) {
    return properties.toConfiguration();
  }

  // close() is inferred as the destroy method and stops the worker threads.
  @Bean
  public Summarizer summarizer(
      @Qualifier("summarizerChatClient") ChatClient summarizerChatClient,
      MemoryProperties properties) {
    return new TimeLimitedSummarizer(
        new ChatClientSummarizer(summarizerChatClient),
        summarizerExecutor(properties.summarizerThreads()),
        properties.summarizerTimeout());
  }

  @Bean
  public MemoryStore memoryStore(
      MemoryConfiguration memoryConfiguration,
      Summarizer summarizer,
      MeterRegistry meterRegistry) {
    return new InMemoryMemoryStore(memoryConfiguration, summarizer, meterRegistry);
  }

  private static ExecutorService summarizerExecutor(int threads) {
    AtomicInteger sequence = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("memory-summarizer-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
    return Executors.newFixedThreadPool(Math.max(1, threads), factory);
  }
}
