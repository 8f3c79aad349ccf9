package com.hybridchat.ai.model;

import com.hybridchat.ai.memory.MemorySnapshot;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Memory view returned with every chat reply. Message texts are shortened for display.
 */
public record MemoryDetails(
        String summary,
        int recentMessagePairs,
        List<RecentMessage> recentMessages,
        boolean hasSummary,
        int maxMessagePairs
) {

    static final String NO_SUMMARY = "No summary yet";
    static final int PREVIEW_LENGTH = 100;

    public record RecentMessage(String user, String ai) {}

    public static MemoryDetails from(MemorySnapshot snapshot) {
        List<RecentMessage> recent = snapshot.retainedTurns().stream()
                .map(turn -> new RecentMessage(preview(turn.userText()), preview(turn.assistantText())))
                .collect(Collectors.toList());
        return new MemoryDetails(
                snapshot.hasSummary() ? snapshot.summary() : NO_SUMMARY,
                snapshot.retainedTurns().size(),
                recent,
                snapshot.hasSummary(),
                snapshot.maxPairs()
        );
    }

    static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
