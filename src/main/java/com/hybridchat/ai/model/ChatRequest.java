package com.hybridchat.ai.model;

public record ChatRequest(
        String query,
        String conversationId
) {}
