package com.hybridchat.ai.api;

import com.hybridchat.ai.memory.ContextEntry;
import com.hybridchat.ai.memory.HybridConversationMemory;
import com.hybridchat.ai.memory.MemoryConfiguration;
import com.hybridchat.ai.memory.MemorySnapshot;
import com.hybridchat.ai.memory.MemoryStore;
import com.hybridchat.ai.model.MemoryStats;
import com.hybridchat.ai.model.RawMemory;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

/**
 * Read-only views of a conversation's memory plus the clear operation. Conversations that
 * were never written read as empty.
 */
@RestController
@RequestMapping("/memory")
public class MemoryController {

  private static final Logger log = LoggerFactory.getLogger(MemoryController.class);

  private final MemoryStore memoryStore;
  private final MemoryConfiguration memoryConfiguration;

  public MemoryController(MemoryStore memoryStore, MemoryConfiguration memoryConfiguration) {
    this.memoryStore = memoryStore;
    this.memoryConfiguration = memoryConfiguration;
  }

  @GetMapping("/stats")
  public MemoryStats stats(@RequestParam(required = false) String conversationId) {
    return MemoryStats.from(snapshot(conversationId));
  }

  @GetMapping("/raw")
  public RawMemory raw(@RequestParam(required = false) String conversationId) {
    return RawMemory.from(snapshot(conversationId));
  }

  @GetMapping("/context")
  public List<ContextEntry> context(@RequestParam(required = false) String conversationId) {
    return memoryStore.get(conversationId)
        .map(HybridConversationMemory::getContext)
        .orElse(List.of());
  }

  @PostMapping("/clear")
  public Map<String, String> clear(@RequestParam(required = false) String conversationId) {
    memoryStore.get(conversationId).ifPresent(HybridConversationMemory::clear);
    memoryStore.remove(conversationId);
    log.info("Memory cleared conversationId={}", MemoryStore.resolveConversationId(conversationId));
    return Map.of("message", "Memory cleared successfully");
  }

  private MemorySnapshot snapshot(String conversationId) {
    return memoryStore.get(conversationId)
        .map(HybridConversationMemory::snapshot)
        .orElseGet(() -> new MemorySnapshot("", List.of(), memoryConfiguration.maxPairs()));
  }
}
