package com.ipintel.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.ipintel.config.GatewayConfig;
import com.ipintel.model.LookupResult;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLookupGatewayTest {

    private HttpServer server;
    private final AtomicReference<String> requestedPath = new AtomicReference<>();
    private final AtomicReference<String> authHeader = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{}";

    /** Minimal subclass: reads flat country/org/isp keys. */
    static class FlatLookupGateway extends JsonLookupGateway {
        @Override
        protected LookupResult mapFromResponse(String address, JsonNode body) {
            return LookupResult.builder()
                    .country(text(body, "country"))
                    .organization(text(body, "org"))
                    .isp(text(body, "isp"))
                    .build();
        }

        @Override
        protected void decorate(java.net.http.HttpRequest.Builder request) {
            request.header("Authorization", "Token test");
        }
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/json", exchange -> {
            requestedPath.set(exchange.getRequestURI().getPath());
            authHeader.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private FlatLookupGateway gateway() {
        GatewayConfig config = new GatewayConfig();
        config.setName("flat");
        config.getProperties().put("urlTemplate",
                "http://127.0.0.1:" + server.getAddress().getPort() + "/json/{address}");
        config.getProperties().put("timeoutMs", "2000");
        FlatLookupGateway gateway = new FlatLookupGateway();
        gateway.init(config);
        return gateway;
    }

    @Test
    void lookup_shouldSubstituteAddressAndMapBody() throws Exception {
        body = "{\"country\":\"US\",\"org\":\"ExampleOrg\",\"isp\":\"  \"}";

        LookupResult result = gateway().lookup("8.8.4.4");

        assertThat(requestedPath.get()).isEqualTo("/json/8.8.4.4");
        assertThat(authHeader.get()).isEqualTo("Token test");
        assertThat(result.getCountry()).isEqualTo("US");
        assertThat(result.getOrganization()).isEqualTo("ExampleOrg");
        assertThat(result.isp()).isEmpty();
    }

    @Test
    void lookup_shouldFail_onNonSuccessStatus() {
        status = 503;
        body = "{\"message\":\"busy\"}";

        assertThatThrownBy(() -> gateway().lookup("8.8.4.4"))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("status=503");
    }

    @Test
    void lookup_shouldFail_onUnparseableBody() {
        body = "<html>oops</html>";

        assertThatThrownBy(() -> gateway().lookup("8.8.4.4"))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("Unparseable");
    }

    @Test
    void lookup_shouldFail_whenBodyIsNotAnObject() {
        body = "[1,2,3]";

        assertThatThrownBy(() -> gateway().lookup("8.8.4.4"))
                .isInstanceOf(LookupException.class)
                .hasMessageContaining("not a JSON object");
    }
}
