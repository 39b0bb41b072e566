package com.ipintel.config;

import com.ipintel.enrichment.EnrichmentPool;
import com.ipintel.enrichment.RecordEnricher;
import com.ipintel.gateway.AssessmentGateway;
import com.ipintel.gateway.EnrichmentContext;
import com.ipintel.gateway.LookupGateway;
import com.ipintel.io.AnalysisResultWriter;
import com.ipintel.io.NetworkSummaryReader;
import com.ipintel.model.LookupResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class IpIntelAutoConfigurationTest {

    public static class FixedLookupGateway implements LookupGateway {
        @Override
        public LookupResult lookup(String address) {
            return LookupResult.builder().country("US").build();
        }
    }

    public static class EchoAssessmentGateway implements AssessmentGateway {
        private GatewayConfig config;

        @Override
        public void init(GatewayConfig config) {
            this.config = config;
        }

        @Override
        public String assess(EnrichmentContext context) {
            return "Trustworthiness: fine";
        }

        String apiKey() {
            return config.getProperty("apiKey");
        }
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(IpIntelAutoConfiguration.class)
            .withPropertyValues(
                    "ipintel.pool.concurrency=2",
                    "ipintel.pool.pacing-ms=0",
                    "ipintel.lookup.name=fixed",
                    "ipintel.lookup.class-name=" + FixedLookupGateway.class.getName(),
                    "ipintel.assessment.name=echo",
                    "ipintel.assessment.class-name=" + EchoAssessmentGateway.class.getName());

    @Test
    void shouldWireEnrichmentBeans(@TempDir Path dir) throws IOException {
        Path envFile = dir.resolve("test.env");
        Files.writeString(envFile, "IPINTEL_TEST_ECHO_KEY=echo-secret\n");

        runner.withPropertyValues(
                        "ipintel.io.env-file=" + envFile,
                        "ipintel.io.input-dir=" + dir.resolve("in"),
                        "ipintel.io.output-dir=" + dir.resolve("out"),
                        "ipintel.assessment.credentials[apiKey]=IPINTEL_TEST_ECHO_KEY")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(RecordEnricher.class);
                    assertThat(context).hasSingleBean(EnrichmentPool.class);
                    assertThat(context).hasSingleBean(NetworkSummaryReader.class);
                    assertThat(context).hasSingleBean(AnalysisResultWriter.class);
                    assertThat(context.getBean(IpIntelConfig.class).getConcurrency()).isEqualTo(2);
                    assertThat(context.getBean(LookupGateway.class)).isInstanceOf(FixedLookupGateway.class);

                    EchoAssessmentGateway assessment =
                            (EchoAssessmentGateway) context.getBean(AssessmentGateway.class);
                    assertThat(assessment.apiKey()).isEqualTo("echo-secret");
                });
    }

    @Test
    void shouldStart_whenEnvFileIsBlank() {
        runner.withPropertyValues("ipintel.io.env-file=")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(CredentialResolver.class);
                });
    }

    @Test
    void shouldFailStartup_whenCredentialMissing(@TempDir Path dir) {
        runner.withPropertyValues(
                        "ipintel.io.env-file=" + dir.resolve("absent.env"),
                        "ipintel.assessment.credentials[apiKey]=IPINTEL_TEST_MISSING_KEY_XYZ")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(ConfigurationException.class)
                            .hasMessageContaining("IPINTEL_TEST_MISSING_KEY_XYZ");
                });
    }

    @Test
    void shouldFailStartup_whenPoolSettingsInvalid() {
        runner.withPropertyValues("ipintel.pool.concurrency=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("pool.concurrency");
                });
    }
}
