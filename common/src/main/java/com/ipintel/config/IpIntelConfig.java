package com.ipintel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Top-level enrichment configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code ipintel.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers read the same shape
 * from a standalone YAML document whose root key is {@code ipintel}.</p>
 */
@Data
@ConfigurationProperties(prefix = "ipintel")
public class IpIntelConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PoolSection pool = new PoolSection();
    private IoSection io = new IoSection();
    private GatewayConfig lookup = new GatewayConfig();
    private GatewayConfig assessment = new GatewayConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static IpIntelConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), Document.class).getIpintel();
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static IpIntelConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = IpIntelConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, Document.class).getIpintel();
        }
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public int getConcurrency() {
        return pool.getConcurrency();
    }

    public Duration getPacing() {
        return Duration.ofMillis(pool.getPacingMs());
    }

    /**
     * Rejects settings the pool cannot run with.
     *
     * @throws ConfigurationException on the first invalid setting
     */
    public void validate() {
        if (pool.getConcurrency() < 1) {
            throw new ConfigurationException("pool.concurrency must be at least 1, was "
                    + pool.getConcurrency());
        }
        if (pool.getPacingMs() < 0) {
            throw new ConfigurationException("pool.pacingMs must not be negative, was "
                    + pool.getPacingMs());
        }
        if (pool.getRetryRounds() < 0) {
            throw new ConfigurationException("pool.retryRounds must not be negative, was "
                    + pool.getRetryRounds());
        }
        lookup.validate("lookup");
        assessment.validate("assessment");
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class PoolSection {
        /** Max in-flight enrichments; driven by external rate limits, not CPU count. */
        private int concurrency = 5;
        /** Delay a worker slot waits after each completion before taking the next record. */
        private long pacingMs = 1_000;
        /** Extra rounds that re-run only the failed rows. */
        private int retryRounds = 0;
    }

    @Data
    public static class IoSection {
        private String inputDir = "data/input";
        private String outputDir = "data/output";
        /** Input file name inside {@code inputDir}; chosen interactively when unset. */
        private String inputFile;
        /** Optional dotenv-style file consulted before the process environment. */
        private String envFile = ".env";

        /** The credentials file, or {@code null} when none is configured. */
        public Path resolveEnvFile() {
            return envFile == null || envFile.isBlank() ? null : Path.of(envFile.strip());
        }
    }

    /** YAML root wrapper so standalone files use the same {@code ipintel:} prefix as Spring. */
    @Data
    static class Document {
        private IpIntelConfig ipintel = new IpIntelConfig();
    }
}
