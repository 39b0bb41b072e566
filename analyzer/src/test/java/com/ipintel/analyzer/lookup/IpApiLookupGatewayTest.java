package com.ipintel.analyzer.lookup;

import com.ipintel.analyzer.StubHttpServer;
import com.ipintel.config.GatewayConfig;
import com.ipintel.gateway.LookupException;
import com.ipintel.model.LookupResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IpApiLookupGatewayTest {

    private StubHttpServer server;
    private IpApiLookupGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubHttpServer();
        GatewayConfig config = new GatewayConfig();
        config.setName("ip-api");
        config.getProperties().put("urlTemplate", server.url("/json/{address}"));
        gateway = new IpApiLookupGateway();
        gateway.init(config);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
        server.close();
    }

    @Test
    void lookup_shouldMapSuccessResponse() throws Exception {
        server.respondJson("{\"status\":\"success\",\"country\":\"United States\","
                + "\"isp\":\"Google LLC\",\"org\":\"Google Public DNS\",\"query\":\"8.8.8.8\"}");

        LookupResult result = gateway.lookup("8.8.8.8");

        assertThat(server.lastRequest().path).isEqualTo("/json/8.8.8.8");
        assertThat(server.lastRequest().method).isEqualTo("GET");
        assertThat(result.getOrganization()).isEqualTo("Google Public DNS");
        assertThat(result.getCountry()).isEqualTo("United States");
        assertThat(result.getIsp()).isEqualTo("Google LLC");
        assertThat(result.getPorts()).isEmpty();
    }

    @Test
    void lookup_shouldFallBackToOrganizationKey() throws Exception {
        server.respondJson("{\"status\":\"success\",\"organization\":\"ExampleOrg\",\"org\":\"\"}");

        assertThat(gateway.lookup("1.2.3.4").getOrganization()).isEqualTo("ExampleOrg");
    }

    @Test
    void lookup_shouldLeaveUnknownFieldsAbsent() throws Exception {
        server.respondJson("{\"status\":\"success\",\"country\":\"NL\"}");

        LookupResult result = gateway.lookup("1.2.3.4");

        assertThat(result.organization()).isEmpty();
        assertThat(result.isp()).isEmpty();
        assertThat(result.toRow()).containsEntry("organization", "").containsEntry("country", "NL");
    }

    @Test
    void lookup_shouldFail_onFailStatus() {
        server.respondJson("{\"status\":\"fail\",\"message\":\"private range\",\"query\":\"10.0.0.5\"}");

        assertThatThrownBy(() -> gateway.lookup("10.0.0.5"))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("private range");
    }

    @Test
    void lookup_shouldFail_onRateLimitStatus() {
        server.respond(429, "text/plain", "slow down");

        assertThatThrownBy(() -> gateway.lookup("8.8.8.8"))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("429");
    }
}
