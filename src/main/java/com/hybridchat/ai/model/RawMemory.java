package com.hybridchat.ai.model;

import com.hybridchat.ai.memory.MemorySnapshot;
import com.hybridchat.ai.memory.Turn;
import java.util.List;

public record RawMemory(
        String summary,
        List<Turn> recentMessages,
        int maxMessagePairs,
        String memoryApproach
) {

    static final String APPROACH = "Custom implementation without token counting";

    public static RawMemory from(MemorySnapshot snapshot) {
        return new RawMemory(snapshot.summary(), snapshot.retainedTurns(), snapshot.maxPairs(), APPROACH);
    }
}
