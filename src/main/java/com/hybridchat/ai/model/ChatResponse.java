package com.hybridchat.ai.model;

public record ChatResponse(
        String response,
        MemoryDetails memoryDetails
) {}
