package com.ipintel.analyzer.lookup;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.gateway.JsonLookupGateway;
import com.ipintel.gateway.LookupException;
import com.ipintel.model.LookupResult;

/**
 * Lookup against ip-api.com ({@code http://ip-api.com/json/{address}}).
 *
 * <h3>Response (example)</h3>
 * <pre>{@code
 * {
 *   "status":  "success",
 *   "country": "United States",
 *   "isp":     "Google LLC",
 *   "org":     "Google Public DNS"
 * }
 * }</pre>
 *
 * <p>{@code "status": "fail"} (private or reserved ranges, bad queries) is reported as a
 * {@link LookupException}.  Some mirrors spell the organisation key {@code organization};
 * both are accepted.</p>
 */
public class IpApiLookupGateway extends JsonLookupGateway {

    @Override
    protected LookupResult mapFromResponse(String address, JsonNode body) throws LookupException {
        if ("fail".equalsIgnoreCase(body.path("status").asText())) {
            throw new LookupException("ip-api lookup failed for " + address + ": "
                    + body.path("message").asText("no message"));
        }

        String organization = text(body, "org");
        if (organization == null) {
            organization = text(body, "organization");
        }
        return LookupResult.builder()
                .organization(organization)
                .country(text(body, "country"))
                .isp(text(body, "isp"))
                .build();
    }
}
