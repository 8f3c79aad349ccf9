package com.hybridchat.ai.config;

import com.hybridchat.ai.memory.MemoryConfiguration;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Hybrid memory settings, bound from {@code app.memory.*}.
 *
 * @param maxPairs turns kept verbatim before eviction starts
 * @param evictionBatchSize oldest turns folded into the summary per eviction
 * @param separator text between accumulated summary fragments
 * @param fallbackLength transcript characters kept when the summarizer fails
 * @param summaryCondenseThreshold summary length that triggers condensation, 0 keeps it append-only
 * @param summarizerTimeout how long one summarizer call may run, and separately how long it may
 *     wait for a free worker, before the fallback is used
 * @param summarizerThreads worker threads shared by every conversation's summarizer calls
 */
@ConfigurationProperties(prefix = "app.memory")
public record MemoryProperties(
    @DefaultValue("3") int maxPairs,
    @DefaultValue("2") int evictionBatchSize,
    @DefaultValue("\n\n") String separator,
    @DefaultValue("200") int fallbackLength,
    @DefaultValue("0") int summaryCondenseThreshold,
    @DefaultValue("PT30S") Duration summarizerTimeout,
    @DefaultValue("2") int summarizerThreads
) {

  public MemoryConfiguration toConfiguration() {
    return new MemoryConfiguration(
        maxPairs, evictionBatchSize, separator, fallbackLength, summaryCondenseThreshold);
  }
}
