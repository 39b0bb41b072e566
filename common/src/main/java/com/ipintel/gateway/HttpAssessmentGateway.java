package com.ipintel.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipintel.config.GatewayConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * An assessment gateway that POSTs a JSON request to a text-generation API.
 *
 * <p>Subclasses shape the request with {@link #buildRequestBody} and {@link #decorate}, and
 * read the answer with {@link #extractText}.  Streaming backends override
 * {@link #exchange} to consume the body incrementally.</p>
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code apiUrl} – the HTTP endpoint</li>
 *   <li>{@code apiKey} – usually supplied through {@code credentials}</li>
 *   <li>{@code model}, {@code maxTokens} (default 300), {@code temperature} (default 0)</li>
 *   <li>{@code timeoutMs} – request timeout in milliseconds (default: 60000)</li>
 *   <li>{@code includeRiskScore} – ask for the optional risk-score line</li>
 * </ul>
 */
@Slf4j
public abstract class HttpAssessmentGateway implements AssessmentGateway {

    protected String name;
    protected String apiUrl;
    protected String apiKey;
    protected String model;
    protected int maxTokens;
    protected double temperature;
    protected int timeoutMs;
    protected boolean includeRiskScore;
    protected HttpClient httpClient;
    protected ObjectMapper objectMapper;

    @Override
    public void init(GatewayConfig config) {
        this.name = config.getName();
        this.apiUrl = config.requireProperty("apiUrl");
        this.apiKey = config.requireProperty("apiKey");
        this.model = config.requireProperty("model");
        this.maxTokens = config.getIntProperty("maxTokens", 300);
        this.temperature = config.getDoubleProperty("temperature", 0.0);
        this.timeoutMs = config.getIntProperty("timeoutMs", 60_000);
        this.includeRiskScore = config.getBooleanProperty("includeRiskScore", defaultIncludeRiskScore());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.min(timeoutMs, 10_000)))
                .build();
        this.objectMapper = new ObjectMapper();
        log.info("Initialised assessment gateway '{}' → {} (model: {}, riskScore: {})",
                name, apiUrl, model, includeRiskScore);
    }

    @Override
    public String assess(EnrichmentContext context) throws AssessmentException {
        String address = context.getRecord().getAddress();
        HttpRequest request;
        try {
            byte[] body = objectMapper.writeValueAsBytes(buildRequestBody(context.prompt()));
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(endpoint())
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofMillis(timeoutMs))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body));
            decorate(builder);
            request = builder.build();
        } catch (IOException e) {
            throw new AssessmentException("Failed to build assessment request for " + address, e);
        }

        try {
            String text = exchange(request);
            log.debug("Assessment '{}' for {} returned {} chars", name, address, text.length());
            return text;
        } catch (IOException e) {
            throw new AssessmentException("Assessment request failed for " + address + ": "
                    + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssessmentException("Assessment interrupted for " + address, e);
        }
    }

    @Override
    public boolean includesRiskScore() {
        return includeRiskScore;
    }

    /** Default for {@code includeRiskScore} when the property is absent. */
    protected boolean defaultIncludeRiskScore() {
        return false;
    }

    protected URI endpoint() {
        return URI.create(apiUrl);
    }

    /** The JSON request body for one prompt. */
    protected abstract Map<String, Object> buildRequestBody(String prompt);

    /** Adds authentication and API-version headers. */
    protected abstract void decorate(HttpRequest.Builder request);

    /**
     * Sends the request and returns the complete response text.  The default reads the
     * whole body as one JSON document.
     */
    protected String exchange(HttpRequest request)
            throws IOException, InterruptedException, AssessmentException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        checkStatus(response.statusCode(), response.body());
        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new AssessmentException("Unparseable assessment response from " + name, e);
        }
        return extractText(body);
    }

    /**
     * Reads the generated text out of a complete (non-streamed) JSON response.
     */
    protected abstract String extractText(JsonNode body) throws AssessmentException;

    protected void checkStatus(int status, String body) throws AssessmentException {
        if (status < 200 || status >= 300) {
            throw new AssessmentException("Assessment API '" + name + "' failed: status=" + status
                    + (body == null || body.isBlank() ? "" : " body=" + abbreviate(body)));
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    @Override
    public void close() {
        log.info("Closed assessment gateway '{}'", name);
    }
}
