package com.di.qualityguard.ai.insights;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Model-written commentary on a report. Only {@code status} is always present; {@code reason}
 * explains a {@code disabled} or {@code error} status.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "reason", "modelUsed", "summaryBullets", "cleaningRecipe", "semanticTypes",
        "driftNarrative", "anomalyExplanation"})
public class AiInsights {
    AiInsightsStatus status;
    String reason;
    String modelUsed;
    List<String> summaryBullets;
    List<String> cleaningRecipe;
    /** Free-form as returned by the model, usually column name to semantic type. */
    JsonNode semanticTypes;
    String driftNarrative;
    String anomalyExplanation;

    public static AiInsights disabled(String reason) {
        return AiInsights.builder().status(AiInsightsStatus.DISABLED).reason(reason).build();
    }

    public static AiInsights error(String reason) {
        return AiInsights.builder().status(AiInsightsStatus.ERROR).reason(reason).build();
    }
}
