package com.ipintel.analyzer.assessment;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.config.GatewayConfig;
import com.ipintel.gateway.AssessmentBuffer;
import com.ipintel.gateway.AssessmentException;
import com.ipintel.gateway.HttpAssessmentGateway;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Assessment through an OpenAI-compatible chat-completions endpoint with
 * {@code "stream": true} (Together AI and similar hosts).
 *
 * <p>The response is a Server-Sent Events stream of {@code data: {...}} chunks, each carrying
 * a piece of text in {@code choices[0].delta.content}, terminated by {@code data: [DONE]}.
 * Chunks are collected in an {@link AssessmentBuffer}; a stream that ends or breaks before
 * {@code [DONE]} fails the assessment rather than returning a truncated answer.</p>
 *
 * <p>Extra properties: {@code topP} (optional).</p>
 */
@Slf4j
public class StreamingChatAssessmentGateway extends HttpAssessmentGateway {

    static final String DATA_PREFIX = "data:";
    static final String DONE = "[DONE]";

    private Double topP;

    @Override
    public void init(GatewayConfig config) {
        super.init(config);
        String value = config.getProperty("topP");
        this.topP = value == null || value.isBlank() ? null : config.getDoubleProperty("topP", 1.0);
    }

    @Override
    protected Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        if (topP != null) {
            body.put("top_p", topP);
        }
        body.put("stream", true);
        return body;
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        request.header("Authorization", "Bearer " + apiKey);
        request.header("Accept", "text/event-stream");
    }

    @Override
    protected String exchange(HttpRequest request)
            throws IOException, InterruptedException, AssessmentException {
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());

        AssessmentBuffer buffer = new AssessmentBuffer();
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                checkStatus(response.statusCode(), lines.collect(Collectors.joining("\n")));
            }

            Iterator<String> it = lines.iterator();
            while (it.hasNext() && !buffer.isComplete()) {
                consume(it.next(), buffer);
            }
        } catch (UncheckedIOException e) {
            throw new AssessmentException("Assessment stream from '" + name + "' broke after "
                    + buffer.chunkCount() + " chunks", e.getCause());
        }
        return buffer.text();
    }

    void consume(String rawLine, AssessmentBuffer buffer) throws AssessmentException {
        String line = rawLine.strip();
        // blank lines separate events; ':' lines are SSE comments/keep-alives
        if (line.isEmpty() || line.startsWith(":") || !line.startsWith(DATA_PREFIX)) {
            return;
        }
        String data = line.substring(DATA_PREFIX.length()).strip();
        if (DONE.equals(data)) {
            buffer.complete();
            return;
        }

        JsonNode chunk;
        try {
            chunk = objectMapper.readTree(data);
        } catch (IOException e) {
            throw new AssessmentException("Unparseable stream chunk from '" + name + "'", e);
        }
        if (chunk.has("error")) {
            throw new AssessmentException("Assessment stream from '" + name + "' reported an error: "
                    + chunk.path("error").path("message").asText(chunk.path("error").toString()));
        }

        JsonNode content = chunk.path("choices").path(0).path("delta").path("content");
        if (content.isTextual()) {
            buffer.append(content.asText());
        } else {
            log.trace("Stream chunk without delta content from '{}'", name);
        }
    }

    @Override
    protected String extractText(JsonNode body) throws AssessmentException {
        // only reached for non-streamed bodies
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new AssessmentException("Chat response from '" + name + "' has no message content");
        }
        return content.asText();
    }
}
