package com.di.qualityguard.ai.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

/**
 * Builds the {@link ChatClient} used for report insights from whatever {@link ChatModel} the
 * Spring AI provider starter on the classpath auto-configures.
 *
 * <p>Only active when {@code qualityguard.ai.enabled=true}; a missing chat model then fails
 * startup instead of silently disabling insights.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "qualityguard.ai.enabled", havingValue = "true")
public class AiInsightsConfig {

    private final AiInsightsProperties aiProperties;

    /** System prompt; swap the file to change tone without touching code. */
    @Value("classpath:prompts/insights-system.st")
    private Resource systemPromptResource;

    @Bean
    public ChatClient insightsChatClient(ChatModel chatModel) {
        AiInsightsProperties.ChatConfig chat = aiProperties.getChat();
        log.info("[AI-CONFIG] Initialising insights ChatClient -> model={}, temperature={}",
                StringUtils.hasText(chat.getModel()) ? chat.getModel() : "provider default", chat.getTemperature());

        ChatOptions.Builder options = ChatOptions.builder().temperature(chat.getTemperature());
        if (StringUtils.hasText(chat.getModel())) {
            options.model(chat.getModel());
        }
        return ChatClient.builder(chatModel)
                .defaultSystem(systemPromptResource)
                .defaultOptions(options.build())
                .build();
    }
}
