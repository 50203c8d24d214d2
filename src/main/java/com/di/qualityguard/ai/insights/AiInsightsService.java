package com.di.qualityguard.ai.insights;

import com.di.qualityguard.ai.config.AiInsightsProperties;
import com.di.qualityguard.report.Report;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the configured chat model for business-level commentary on a finished report.
 *
 * <p>Never fails the analysis: when insights are switched off or no {@link ChatClient} exists
 * the result is {@code disabled}, and any model or parsing failure becomes {@code error}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiInsightsService {

    private final AiInsightsProperties aiProperties;
    private final ObjectProvider<ChatClient> chatClientProvider;
    private final ObjectMapper objectMapper;

    public AiInsights generate(Report report) {
        if (!aiProperties.isEnabled()) {
            return AiInsights.disabled("AI insights are turned off (qualityguard.ai.enabled=false)");
        }
        ChatClient chatClient = chatClientProvider.getIfUnique();
        if (chatClient == null) {
            return AiInsights.disabled("No chat model is configured");
        }

        long start = System.currentTimeMillis();
        try {
            String userMessage = objectMapper.writeValueAsString(
                    InsightsPayload.of(report, aiProperties.getPayload()));
            String content = chatClient.prompt()
                    .user(userMessage)
                    .call()
                    .content();
            AiInsights insights = parse(content);
            log.info("[AI-INSIGHTS] Generated insights in {}ms (status={})",
                    System.currentTimeMillis() - start, insights.getStatus().wireName());
            return insights;
        } catch (Exception ex) {
            log.error("[AI-INSIGHTS] Insight generation failed after {}ms: {}",
                    System.currentTimeMillis() - start, ex.getMessage());
            return AiInsights.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private AiInsights parse(String content) {
        if (!StringUtils.hasText(content)) {
            return AiInsights.error("Model returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            log.warn("[AI-INSIGHTS] Model response is not JSON: {}", e.getOriginalMessage());
            return AiInsights.error("Model response is not valid JSON");
        }
        if (!root.isObject()) {
            return AiInsights.error("Model response is not a JSON object");
        }
        JsonNode semanticTypes = root.get("semantic_types");
        return AiInsights.builder()
                .status(AiInsightsStatus.OK)
                .modelUsed(StringUtils.hasText(aiProperties.getChat().getModel())
                        ? aiProperties.getChat().getModel() : null)
                .summaryBullets(lines(root.get("summary_bullets")))
                .cleaningRecipe(lines(root.get("cleaning_recipe")))
                .semanticTypes(semanticTypes == null || semanticTypes.isNull() ? null : semanticTypes)
                .driftNarrative(text(root.get("drift_narrative")))
                .anomalyExplanation(text(root.get("anomaly_explanation")))
                .build();
    }

    /** Models sometimes wrap JSON in a markdown fence despite the instructions. */
    private static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }

    private static List<String> lines(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> lines = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> lines.add(item.isTextual() ? item.asText() : item.toString()));
        } else if (node.isTextual()) {
            node.asText().lines().filter(StringUtils::hasText).forEach(lines::add);
        } else {
            lines.add(node.toString());
        }
        return List.copyOf(lines);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }
}
