package com.di.qualityguard.ai.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Strongly-typed binding for {@code qualityguard.ai.*}.
 *
 * <p>Insights need a Spring AI chat model on the classpath (any {@code spring-ai-starter-model-*}).
 * Without one, or with {@code enabled: false}, every report carries a {@code disabled} status.
 *
 * <pre>
 * qualityguard:
 *   ai:
 *     enabled: false
 *     chat:
 *       model:       gpt-4o-mini
 *       temperature: 0.2
 *     payload:
 *       max-columns:         50
 *       max-findings:        50
 *       max-recommendations: 20
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "qualityguard.ai")
public class AiInsightsProperties {

    /** Master switch; off unless a chat model has been configured. */
    private boolean enabled = false;

    @NestedConfigurationProperty
    private ChatConfig chat = new ChatConfig();

    @NestedConfigurationProperty
    private PayloadConfig payload = new PayloadConfig();

    // ------------------------------------------------------------------ //

    @Data
    public static class ChatConfig {
        /** Model requested from the provider and echoed as {@code modelUsed}; blank keeps the provider default. */
        private String model = "";
        @DecimalMin("0.0") @DecimalMax("2.0")
        private double temperature = 0.2;
    }

    /** Caps on what of the report is sent to the model. */
    @Data
    public static class PayloadConfig {
        @Min(1)
        private int maxColumns = 50;
        @Min(0)
        private int maxFindings = 50;
        @Min(0)
        private int maxRecommendations = 20;
    }
}
