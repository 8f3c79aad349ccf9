package com.hybridchat.ai.memory;

import java.util.Objects;

/**
 * One user/assistant exchange. {@code sequence} is assigned by the owning memory when the
 * turn is recorded.
 */
public record Turn(
    String userText,
    String assistantText,
    long sequence
) {

  public Turn {
    Objects.requireNonNull(userText, "userText must not be null");
    Objects.requireNonNull(assistantText, "assistantText must not be null");
  }
}
