package com.hybridchat.ai.api;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.hybridchat.ai.memory.HybridConversationMemory;
import com.hybridchat.ai.memory.InMemoryMemoryStore;
import com.hybridchat.ai.memory.MemoryConfiguration;
import com.hybridchat.ai.memory.Summarizer;
import com.hybridchat.ai.memory.SummarizerException;
import com.hybridchat.ai.memory.Turn;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

public class MemoryControllerTest {

  private final MemoryConfiguration config = MemoryConfiguration.of(3, 2);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final InMemoryMemoryStore store =
      new InMemoryMemoryStore(config, new FirstCallFailsSummarizer(), registry);
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    mvc = MockMvcBuilders.standaloneSetup(new MemoryController(store, config))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
  }

  @Test
  void statsOfUnknownConversationAreEmpty() throws Exception {
    mvc.perform(get("/memory/stats").param("conversationId", "nobody"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentSummary").value("No summary yet"))
        .andExpect(jsonPath("$.recentMessagesCount").value(0))
        .andExpect(jsonPath("$.memoryStructure").value("0 recent message pairs"));
  }

  @Test
  void statsReflectSummaryAndRecentTurns() throws Exception {
    HybridConversationMemory memory = store.getOrCreate(null);
    for (int i = 1; i <= 6; i++) {
      memory.recordTurn("u" + i, "a" + i);
    }

    mvc.perform(get("/memory/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.recentMessagesCount").value(4))
        .andExpect(jsonPath("$.memoryStructure").value("Summary + 2 recent message pairs"))
        .andExpect(jsonPath("$.currentSummary").value(
            "Previous conversation included discussion about: "
                + "User: u1\nAssistant: a1\n\nUser: u2\nAssistant: a2\n\n..."
                + "\n\nsummary of turn 3"));
  }

  @Test
  void contextListsSummaryThenTurns() throws Exception {
    HybridConversationMemory memory = store.getOrCreate("c1");
    for (int i = 1; i <= 4; i++) {
      memory.recordTurn("u" + i, "a" + i);
    }

    mvc.perform(get("/memory/context").param("conversationId", "c1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(5))
        .andExpect(jsonPath("$[0].role").value("SUMMARY"))
        .andExpect(jsonPath("$[1].role").value("USER"))
        .andExpect(jsonPath("$[1].text").value("u3"))
        .andExpect(jsonPath("$[4].role").value("ASSISTANT"))
        .andExpect(jsonPath("$[4].text").value("a4"));
  }

  @Test
  void rawShowsTurnsWithSequence() throws Exception {
    store.getOrCreate("c1").recordTurn("hello", "hi");

    mvc.perform(get("/memory/raw").param("conversationId", "c1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary").value(""))
        .andExpect(jsonPath("$.recentMessages[0].userText").value("hello"))
        .andExpect(jsonPath("$.recentMessages[0].assistantText").value("hi"))
        .andExpect(jsonPath("$.recentMessages[0].sequence").value(1))
        .andExpect(jsonPath("$.maxMessagePairs").value(3))
        .andExpect(jsonPath("$.memoryApproach").value("Custom implementation without token counting"));
  }

  @Test
  void clearEmptiesOnlyTheNamedConversation() throws Exception {
    store.getOrCreate("c1").recordTurn("hello", "hi");
    store.getOrCreate("c2").recordTurn("hey", "yo");

    mvc.perform(post("/memory/clear").param("conversationId", "c1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Memory cleared successfully"));
    mvc.perform(post("/memory/clear").param("conversationId", "c1"))
        .andExpect(status().isOk());

    assertTrue(store.get("c1").isEmpty());
    assertEquals(2, store.get("c2").orElseThrow().getContext().size());
  }

  @Test
  void clearReleasesConversationMemory() throws Exception {
    for (int i = 0; i < 500; i++) {
      store.getOrCreate("conversation-" + i).recordTurn("hello", "hi");
    }
    assertEquals(500.0, registry.get("memory.conversations").gauge().value());

    for (int i = 0; i < 500; i++) {
      mvc.perform(post("/memory/clear").param("conversationId", "conversation-" + i))
          .andExpect(status().isOk());
    }

    assertEquals(0.0, registry.get("memory.conversations").gauge().value());
    mvc.perform(get("/memory/stats").param("conversationId", "conversation-7"))
        .andExpect(jsonPath("$.recentMessagesCount").value(0));
  }

  @Test
  void clearOfUnknownConversationSucceeds() throws Exception {
    mvc.perform(post("/memory/clear").param("conversationId", "ghost"))
        .andExpect(status().isOk());
    assertTrue(store.get("ghost").isEmpty());
  }

  static class FirstCallFailsSummarizer implements Summarizer {
    private int calls;

    @Override
    public String summarize(String priorSummary, List<Turn> evictedTurns) {
      if (calls++ == 0) {
        throw new SummarizerException("timeout");
      }
      return "summary of turn " + evictedTurns.get(0).sequence();
    }

    @Override
    public String condense(String summary) {
      return summary;
    }
  }
}
