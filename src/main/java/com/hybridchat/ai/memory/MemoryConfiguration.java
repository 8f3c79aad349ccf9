package com.hybridchat.ai.memory;

/**
 * Immutable settings of a {@link HybridConversationMemory}. Validated on construction so a
 * bad configuration fails at startup rather than on the first eviction.
 *
 * @param maxPairs number of turns kept verbatim
 * @param evictionBatchSize number of oldest turns folded into the summary per eviction
 * @param separator text placed between accumulated summary fragments
 * @param fallbackLength maximum transcript characters kept in a fallback fragment
 * @param summaryCondenseThreshold summary length that triggers condensation, {@code 0} disables it
 */
public record MemoryConfiguration(
    int maxPairs,
    int evictionBatchSize,
    String separator,
    int fallbackLength,
    int summaryCondenseThreshold
) {

  public static final String DEFAULT_SEPARATOR = "\n\n";
  public static final int DEFAULT_FALLBACK_LENGTH = 200;

  public MemoryConfiguration {
    if (maxPairs <= 0) {
      throw new IllegalArgumentException(
          "Invalid memory configuration: maxPairs must be positive, was " + maxPairs);
    }
    if (evictionBatchSize < 1 || evictionBatchSize > maxPairs) {
      throw new IllegalArgumentException(
          "Invalid memory configuration: evictionBatchSize must be within [1, " + maxPairs
              + "], was " + evictionBatchSize);
    }
    if (separator == null) {
      throw new IllegalArgumentException("Invalid memory configuration: separator is required");
    }
    if (fallbackLength <= 0) {
      throw new IllegalArgumentException(
          "Invalid memory configuration: fallbackLength must be positive, was " + fallbackLength);
    }
    if (summaryCondenseThreshold < 0) {
      throw new IllegalArgumentException(
          "Invalid memory configuration: summaryCondenseThreshold must not be negative, was "
              + summaryCondenseThreshold);
    }
  }

  public static MemoryConfiguration of(int maxPairs, int evictionBatchSize) {
    return new MemoryConfiguration(
        maxPairs, evictionBatchSize, DEFAULT_SEPARATOR, DEFAULT_FALLBACK_LENGTH, 0);
  }

  public boolean condenseEnabled() {
    return summaryCondenseThreshold > 0;
  }
}
