package com.ipintel.analyzer.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.config.GatewayConfig;
import com.ipintel.gateway.JsonLookupGateway;
import com.ipintel.model.LookupResult;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Lookup against the Censys hosts API, authenticated with HTTP basic auth.
 *
 * <p>Maps {@code autonomous_system.name} to the organisation, {@code location.country} to
 * the country and every {@code services[].port} to the port list.  Censys has no ISP
 * field, so it stays absent.</p>
 *
 * <p>Extra properties: {@code apiId}, {@code apiSecret} (normally via {@code credentials}).</p>
 */
public class CensysLookupGateway extends JsonLookupGateway {

    private String authorization;

    @Override
    public void init(GatewayConfig config) {
        String apiId = config.requireProperty("apiId");
        String apiSecret = config.requireProperty("apiSecret");
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((apiId + ":" + apiSecret).getBytes(StandardCharsets.UTF_8));
        super.init(config);
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        request.header("Authorization", authorization);
    }

    @Override
    protected LookupResult mapFromResponse(String address, JsonNode body) {
        JsonNode host = body.has("result") ? body.get("result") : body;

        LookupResult.LookupResultBuilder result = LookupResult.builder()
                .organization(text(host.path("autonomous_system"), "name"))
                .country(text(host.path("location"), "country"));

        for (JsonNode service : host.path("services")) {
            if (service.path("port").canConvertToInt()) {
                result.port(service.path("port").asInt());
            }
        }
        return result.build();
    }
}
