package com.example.audit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatClient and JSON configuration.
 * <p>
 * The chat model is chosen with {@code spring.ai.model.chat} (openai or anthropic);
 * only the selected provider is auto-configured, so a single {@link ChatModel} is available.
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient used by every analysis strategy.
     */
    @Bean("analysisChatClient")
    public ChatClient analysisChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

    /**
     * Shared ObjectMapper for JSON serialization (report timestamps as ISO strings).
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
