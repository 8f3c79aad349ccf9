package com.hybridchat.ai.memory;

import java.util.Objects;

/**
 * Role-tagged entry handed to prompt assembly.
 */
public record ContextEntry(Role role, String text) {

  public enum Role {
    /** Rolling summary of evicted turns, used as background context. */
    SUMMARY,
    USER,
    ASSISTANT
  }

  public ContextEntry {
    Objects.requireNonNull(role, "role must not be null");
    Objects.requireNonNull(text, "text must not be null");
  }

  public static ContextEntry summary(String text) {
    return new ContextEntry(Role.SUMMARY, text);
  }

  public static ContextEntry user(String text) {
    return new ContextEntry(Role.USER, text);
  }

  public static ContextEntry assistant(String text) {
    return new ContextEntry(Role.ASSISTANT, text);
  }
}
