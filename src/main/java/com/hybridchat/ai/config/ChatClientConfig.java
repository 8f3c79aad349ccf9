package com.hybridchat.ai.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    @Bean(name = "answerChatClient")
    public ChatClient answerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.answer:llama3.2:3b}") String answerModel,
            @Value("${app.models.answer-temperature:0.5}") double temperature) {
        return ChatClient.builder(chatModel)
                .defaultOptions(OllamaChatOptions.builder()
                        .model(answerModel)
                        .temperature(temperature)
                        .build())
                .build();
    }

    // Summaries favour determinism.
    @Bean(name = "summarizerChatClient")
    public ChatClient summarizerChatClient(
            OllamaChatModel chatModel,
            @Value("${app.models.summarizer:llama3.2:3b}") String summarizerModel) {
        return ChatClient.builder(chatModel)
                .defaultOptions(OllamaChatOptions.builder()
                        .model(summarizerModel)
                        .temperature(0.2)
                        .build())
                .build();
    }
}
