package com.ipintel.analyzer.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.gateway.AssessmentException;
import com.ipintel.gateway.HttpAssessmentGateway;

import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assessment through the Anthropic Messages API (non-streamed).
 *
 * <p>The answer is the concatenation of every {@code text} block in {@code content}.</p>
 */
public class MessagesAssessmentGateway extends HttpAssessmentGateway {

    static final String API_VERSION = "2023-06-01";

    static final String SYSTEM_PROMPT = "You are a cybersecurity expert analysing IP addresses and "
            + "their observed traffic. Judge trustworthiness from the organisation and its services, "
            + "describe the primary purpose of the address, list potential security concerns and "
            + "give a short recommendation.";

    @Override
    protected Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("system", SYSTEM_PROMPT);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return body;
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        request.header("x-api-key", apiKey);
        request.header("anthropic-version", API_VERSION);
    }

    @Override
    protected String extractText(JsonNode body) throws AssessmentException {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                text.append(block.get("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new AssessmentException("Messages response from '" + name + "' has no text content");
        }
        return text.toString();
    }
}
