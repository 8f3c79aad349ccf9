package com.hybridchat.ai.memory;

import java.util.List;

/**
 * Condenses evicted turns into prose. Implementations may block and may fail with
 * {@link SummarizerException}; callers treat any runtime failure the same way.
 */
public interface Summarizer {

  /**
   * @param priorSummary the rolling summary before this eviction, empty if none yet
   * @param evictedTurns turns being removed from the buffer, oldest first
   * @return a summary fragment for the evicted turns
   */
  String summarize(String priorSummary, List<Turn> evictedTurns);

  /**
   * Produces a shorter replacement for an overgrown rolling summary.
   */
  String condense(String summary);
}
