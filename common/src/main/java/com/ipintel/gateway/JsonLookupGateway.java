package com.ipintel.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ipintel.config.GatewayConfig;
import com.ipintel.model.LookupResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * A lookup gateway that issues one HTTP GET per address and reads a JSON body.
 *
 * <h3>Mapping</h3>
 * <p>Subclasses implement {@link #mapFromResponse} to pick the organisation, country and
 * ISP out of their service's JSON shape, and may override {@link #decorate} to add
 * authentication headers.</p>
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code urlTemplate} – endpoint with an {@code {address}} placeholder</li>
 *   <li>{@code timeoutMs} – connect and request timeout in milliseconds (default: 5000)</li>
 * </ul>
 */
@Slf4j
public abstract class JsonLookupGateway implements LookupGateway {

    public static final String ADDRESS_PLACEHOLDER = "{address}";

    private String name;
    private String urlTemplate;
    private int timeoutMs;
    private HttpClient httpClient;
    private ObjectMapper objectMapper;

    @Override
    public void init(GatewayConfig config) {
        this.name = config.getName();
        this.urlTemplate = config.requireProperty("urlTemplate");
        this.timeoutMs = config.getIntProperty("timeoutMs", 5_000);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.objectMapper = new ObjectMapper();
        log.info("Initialised lookup gateway '{}' → {}", name, urlTemplate);
    }

    @Override
    public LookupResult lookup(String address) throws LookupException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolveUri(address))
                .header("Accept", "application/json")
                .timeout(Duration.ofMillis(timeoutMs))
                .GET();
        decorate(builder);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LookupException("Lookup request failed for " + address + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LookupException("Lookup interrupted for " + address, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LookupException("Lookup failed for " + address
                    + " status=" + response.statusCode());
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new LookupException("Unparseable lookup response for " + address, e);
        }
        if (body == null || !body.isObject()) {
            throw new LookupException("Lookup response for " + address + " is not a JSON object");
        }

        LookupResult result = mapFromResponse(address, body);
        log.debug("Lookup '{}' for {} → {}", name, address, result);
        return result;
    }

    /**
     * Interprets the service's JSON body.
     *
     * @throws LookupException when the body reports a failure
     */
    protected abstract LookupResult mapFromResponse(String address, JsonNode body) throws LookupException;

    /**
     * Adds service-specific headers (authentication etc.) to each request.
     */
    protected void decorate(HttpRequest.Builder request) {
        // no headers by default
    }

    URI resolveUri(String address) {
        String encoded = URLEncoder.encode(address, StandardCharsets.UTF_8);
        return URI.create(urlTemplate.replace(ADDRESS_PLACEHOLDER, encoded));
    }

    /**
     * Returns the text of {@code field} or {@code null} when it is missing, null or blank.
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    @Override
    public void close() {
        log.info("Closed lookup gateway '{}'", name);
    }
}
