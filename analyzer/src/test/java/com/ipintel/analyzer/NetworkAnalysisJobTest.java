package com.ipintel.analyzer;

import com.ipintel.config.ConfigurationException;
import com.ipintel.gateway.AssessmentException;
import com.ipintel.gateway.AssessmentGateway;
import com.ipintel.gateway.EnrichmentContext;
import com.ipintel.gateway.LookupGateway;
import com.ipintel.model.LookupResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkAnalysisJobTest {

    private static final String HEADER =
            "Path,Total Events,Connects,Disconnects,Sends,Receives,Send Bytes,Receive Bytes\n";

    public static class StubLookupGateway implements LookupGateway {
        @Override
        public LookupResult lookup(String address) {
            return LookupResult.builder().organization("ExampleOrg").country("US").build();
        }
    }

    public static class StubAssessmentGateway implements AssessmentGateway {
        @Override
        public String assess(EnrichmentContext context) throws AssessmentException {
            if (context.getRecord().getAddress().startsWith("8.8.")) {
                throw new AssessmentException("upstream timeout, retry later");
            }
            return "Trustworthiness: 90\n"
                    + "Primary Purpose: Internal service\n"
                    + "Security Concerns: NO\n"
                    + "Recommendation: No action required";
        }
    }

    @TempDir
    Path dir;

    private Path inputDir;
    private Path outputDir;
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(dir.resolve("input"));
        outputDir = dir.resolve("output");
        Files.writeString(inputDir.resolve("a_summary.csv"), HEADER
                + "10.0.0.5:443,12,3,3,4,2,1024,2048\n"
                + "localhost:8080,1,1,1,1,1,1,1\n"
                + "8.8.8.8:53,2,0,0,1,1,60,120\n");
        Files.writeString(inputDir.resolve("b_summary.csv"), HEADER
                + "192.168.1.20,5,1,1,2,1,300,400\n");
    }

    private Path writeConfig(String inputFileLine, String credentialLines) throws IOException {
        Path config = dir.resolve("config.yaml");
        Files.writeString(config, "ipintel:\n"
                + "  pool:\n"
                + "    concurrency: 3\n"
                + "    pacingMs: 0\n"
                + "  io:\n"
                + "    inputDir: \"" + inputDir + "\"\n"
                + "    outputDir: \"" + outputDir + "\"\n"
                + "    envFile: \"" + dir.resolve("test.env") + "\"\n"
                + inputFileLine
                + "  lookup:\n"
                + "    name: stub-lookup\n"
                + "    className: " + StubLookupGateway.class.getName() + "\n"
                + "  assessment:\n"
                + "    name: stub-assessment\n"
                + "    className: " + StubAssessmentGateway.class.getName() + "\n"
                + credentialLines);
        return config;
    }

    private NetworkAnalysisJob job(String stdin) {
        return new NetworkAnalysisJob(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_shouldEnrichConfiguredFileAndWriteResults() throws IOException {
        Path config = writeConfig("    inputFile: a_summary.csv\n", "");

        Optional<Path> output = job("").run(new String[]{config.toString()});

        assertThat(output).isPresent();
        assertThat(output.get().getParent()).isEqualTo(outputDir);
        assertThat(output.get().getFileName().toString()).startsWith("ip_analysis_").endsWith(".csv");

        List<String> lines = Files.readAllLines(output.get());
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).startsWith("address,connects,country,disconnects,error,");
        assertThat(lines).anySatisfy(line -> assertThat(line)
                .startsWith("10.0.0.5,3,US,3,,")
                .contains("No action required"));
        assertThat(lines).anySatisfy(line -> assertThat(line)
                .startsWith("8.8.8.8,")
                .contains("Failed to perform AI analysis: upstream timeout - retry later"));
    }

    @Test
    void run_shouldPreferCommandLineInputFile() throws IOException {
        Path config = writeConfig("    inputFile: a_summary.csv\n", "");

        Optional<Path> output = job("").run(new String[]{config.toString(), "b_summary.csv"});

        assertThat(Files.readAllLines(output.orElseThrow()))
                .hasSize(2)
                .last().asString().startsWith("192.168.1.20,");
    }

    @Test
    void run_shouldPromptForInputFile_whenNoneConfigured() throws IOException {
        Path config = writeConfig("", "");

        Optional<Path> output = job("2\n").run(new String[]{config.toString()});

        String prompt = console.toString(StandardCharsets.UTF_8);
        assertThat(prompt).contains("1. a_summary.csv").contains("2. b_summary.csv");
        assertThat(Files.readAllLines(output.orElseThrow())).hasSize(2);
    }

    @Test
    void run_shouldRejectOutOfRangeSelection() throws IOException {
        Path config = writeConfig("", "");

        assertThatThrownBy(() -> job("7\n").run(new String[]{config.toString()}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void run_shouldReturnEmpty_whenInputDirectoryHasNoFiles() throws IOException {
        Files.delete(inputDir.resolve("a_summary.csv"));
        Files.delete(inputDir.resolve("b_summary.csv"));
        Path config = writeConfig("", "");

        Optional<Path> output = job("").run(new String[]{config.toString()});

        assertThat(output).isEmpty();
        assertThat(console.toString(StandardCharsets.UTF_8)).contains("No input CSV files found");
        assertThat(outputDir).doesNotExist();
    }

    @Test
    void run_shouldResolveCredentialsFromEnvFile() throws IOException {
        Files.writeString(dir.resolve("test.env"), "IPINTEL_JOB_TEST_KEY=abc\n");
        Path config = writeConfig("    inputFile: b_summary.csv\n",
                "    credentials:\n      apiKey: IPINTEL_JOB_TEST_KEY\n");

        assertThat(job("").run(new String[]{config.toString()})).isPresent();
    }

    @Test
    void run_shouldFailBeforeReadingInput_whenCredentialMissing() throws IOException {
        Path config = writeConfig("    inputFile: missing.csv\n",
                "    credentials:\n      apiKey: IPINTEL_JOB_TEST_ABSENT\n      apiSecret: IPINTEL_JOB_TEST_ALSO_ABSENT\n");

        assertThatThrownBy(() -> job("").run(new String[]{config.toString()}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("IPINTEL_JOB_TEST_ABSENT")
                .hasMessageContaining("IPINTEL_JOB_TEST_ALSO_ABSENT");
    }

    @Test
    void run_shouldFail_onMalformedInput() throws IOException {
        Files.writeString(inputDir.resolve("bad.csv"), "Path,Total Events\n1.2.3.4,1\n");
        Path config = writeConfig("    inputFile: bad.csv\n", "");

        assertThatThrownBy(() -> job("").run(new String[]{config.toString()}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("missing required columns");
    }
}
