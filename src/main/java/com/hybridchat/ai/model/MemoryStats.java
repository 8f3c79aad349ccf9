package com.hybridchat.ai.model;

import com.hybridchat.ai.memory.MemorySnapshot;

public record MemoryStats(
        String currentSummary,
        int recentMessagesCount,
        String memoryStructure
) {

    public static MemoryStats from(MemorySnapshot snapshot) {
        int pairs = snapshot.retainedTurns().size();
        String structure = (snapshot.hasSummary() ? "Summary + " : "") + pairs + " recent message pairs";
        return new MemoryStats(
                snapshot.hasSummary() ? snapshot.summary() : MemoryDetails.NO_SUMMARY,
                pairs * 2,
                structure
        );
    }
}
