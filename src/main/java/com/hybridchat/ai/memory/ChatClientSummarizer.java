package com.hybridchat.ai.memory;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Summarizer backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientSummarizer implements Summarizer {

  private static final Logger log = LoggerFactory.getLogger(ChatClientSummarizer.class);

  static final String FRAGMENT_PREFIX = "Previous conversation summary: ";

  private static final String SUMMARY_PROMPT = """
      Please provide a concise summary of this conversation:

      %s
      Summary:""";

  private static final String PRIOR_SUMMARY_BLOCK = """
      Earlier parts of the conversation were already summarized as follows. Use this only as
      background and do not repeat it:
      %s

      """;

  private static final String CONDENSE_PROMPT = """
      The following notes summarize an ongoing conversation. Rewrite them as one shorter
      summary that keeps every fact, name, preference and decision the user mentioned:

      %s

      Condensed summary:""";

  private final ChatClient chatClient;

  public ChatClientSummarizer(ChatClient chatClient) {
    this.chatClient = chatClient;
  }

  @Override
  public String summarize(String priorSummary, List<Turn> evictedTurns) {
    String prompt = SUMMARY_PROMPT.formatted(Transcripts.render(evictedTurns));
    if (priorSummary != null && !priorSummary.isBlank()) {
      prompt = PRIOR_SUMMARY_BLOCK.formatted(priorSummary) + prompt;
    }
    return FRAGMENT_PREFIX + call(prompt, "summarize");
  }

  @Override
  public String condense(String summary) {
    return call(CONDENSE_PROMPT.formatted(summary), "condense");
  }

  private String call(String prompt, String operation) {
    long startNanos = System.nanoTime();
    String content;
    try {
      content = chatClient.prompt()
          .user(prompt)
          .call()
          .content();
    } catch (RuntimeException e) {
      throw new SummarizerException("Summarizer " + operation + " call failed", e);
    }
    long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
    log.info("LLM summarizer call completed operation={} durationMs={}", operation, durationMs);

    if (content == null || content.isBlank()) {
      throw new SummarizerException("Summarizer " + operation + " returned an empty response");
    }
    return content.trim();
  }
}
