package com.hybridchat.ai.memory;

import java.util.List;

/**
 * Plain-text renderings of turns shared by the summarizer prompt and the fallback path.
 */
public final class Transcripts {

  static final String FALLBACK_PREFIX = "Previous conversation included discussion about: ";

  private Transcripts() {}

  public static String render(List<Turn> turns) {
    StringBuilder out = new StringBuilder();
    for (Turn turn : turns) {
      out.append("User: ").append(turn.userText()).append('\n')
          .append("Assistant: ").append(turn.assistantText()).append("\n\n");
    }
    return out.toString();
  }

  /**
   * Deterministic stand-in for a summary when the summarizer is unavailable. The result is
   * never empty and never longer than {@code maxTranscriptChars} transcript characters plus the fixed decoration.
   */
  public static String fallbackFragment(List<Turn> turns, int maxTranscriptChars) {
    String transcript = render(turns);
    if (transcript.length() > maxTranscriptChars) {
      int end = maxTranscriptChars;
      // keep surrogate pairs whole
      if (end > 0 && Character.isHighSurrogate(transcript.charAt(end - 1))) {
        end--;
      }
      transcript = transcript.substring(0, end);
    }
    return FALLBACK_PREFIX + transcript + "...";
  }
}
