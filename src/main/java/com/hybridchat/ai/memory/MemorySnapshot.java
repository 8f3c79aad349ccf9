package com.hybridchat.ai.memory;

import java.util.List;

public record MemorySnapshot(
    String summary,
    List<Turn> retainedTurns,
    int maxPairs
) {

  public MemorySnapshot {
    retainedTurns = List.copyOf(retainedTurns);
  }

  public boolean hasSummary() {
    return !summary.isEmpty();
  }
}
