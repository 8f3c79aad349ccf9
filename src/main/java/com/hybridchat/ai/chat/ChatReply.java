package com.hybridchat.ai.chat;

import com.hybridchat.ai.memory.MemorySnapshot;

public record ChatReply(
        String answer,
        MemorySnapshot memory
) {}
