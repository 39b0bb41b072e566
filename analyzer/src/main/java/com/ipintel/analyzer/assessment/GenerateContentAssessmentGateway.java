package com.ipintel.analyzer.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.gateway.AssessmentException;
import com.ipintel.gateway.HttpAssessmentGateway;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assessment through the Gemini {@code generateContent} API.
 *
 * <p>{@code apiUrl} may contain a {@code {model}} placeholder.  This backend asks for the
 * risk-score line unless {@code includeRiskScore} is set to {@code false}.</p>
 */
public class GenerateContentAssessmentGateway extends HttpAssessmentGateway {

    @Override
    protected boolean defaultIncludeRiskScore() {
        return true;
    }

    @Override
    protected URI endpoint() {
        return URI.create(apiUrl.replace("{model}", model));
    }

    @Override
    protected Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", temperature);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of(
                "role", "user",
                "parts", List.of(Map.of("text", prompt)))));
        body.put("generationConfig", generationConfig);
        return body;
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        request.header("x-goog-api-key", apiKey);
    }

    @Override
    protected String extractText(JsonNode body) throws AssessmentException {
        JsonNode candidate = body.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            String reason = body.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new AssessmentException("generateContent from '" + name + "' returned no answer: " + reason);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new AssessmentException("generateContent from '" + name + "' has no text parts");
        }
        return text.toString();
    }
}
