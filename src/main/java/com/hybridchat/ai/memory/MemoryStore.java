package com.hybridchat.ai.memory;

import java.util.Optional;

/**
 * Conversation id to memory lookup. Each conversation owns its own
 * {@link HybridConversationMemory} and therefore its own lock.
 */
public interface MemoryStore {

  /** Key used when a caller does not name a conversation. */
  String DEFAULT_CONVERSATION_ID = "default";

  Optional<HybridConversationMemory> get(String conversationId);

  HybridConversationMemory getOrCreate(String conversationId);

  /** Releases the conversation's memory. Unknown ids are ignored. */
  void remove(String conversationId);

  static String resolveConversationId(String conversationId) {
    if (conversationId == null || conversationId.isBlank()) {
      return DEFAULT_CONVERSATION_ID;
    }
    return conversationId.trim();
  }
}
