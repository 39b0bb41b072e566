package com.ipintel.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Resolves gateway credentials from a dotenv-style file and the process environment.
 *
 * <p>Variables already set in the process environment win over the env file.  Every missing
 * variable across all gateways is collected and reported in a single
 * {@link ConfigurationException}, so a misconfigured run fails once with the full list.</p>
 */
@Slf4j
public class CredentialResolver {

    private static final String EXPORT_PREFIX = "export ";

    private final Map<String, String> variables;

    public CredentialResolver(Map<String, String> variables) {
        this.variables = Collections.unmodifiableMap(new HashMap<>(variables));
    }

    /**
     * Builds a resolver from {@code envFile} (when set and present) and {@code System.getenv()}.
     * Variables already set in the process environment are not overridden by the file.
     */
    public static CredentialResolver fromEnvironment(Path envFile) {
        return fromEnvironment(envFile, System.getenv());
    }

    static CredentialResolver fromEnvironment(Path envFile, Map<String, String> environment) {
        Map<String, String> merged = new HashMap<>();
        if (envFile == null) {
            log.info("No credentials file configured, using environment variables only");
        } else if (Files.isRegularFile(envFile)) {
            merged.putAll(readEnvFile(envFile));
            log.info("Loaded credentials file {}", envFile);
        } else {
            log.warn("{} not found. Falling back to environment variables.", envFile);
        }
        merged.putAll(environment);
        return new CredentialResolver(merged);
    }

    /**
     * Copies each configured credential into its gateway's properties.
     *
     * @throws ConfigurationException listing every missing variable
     */
    public void resolve(GatewayConfig... gateways) {
        TreeSet<String> missing = new TreeSet<>();
        for (GatewayConfig gateway : gateways) {
            gateway.getCredentials().forEach((property, variable) -> {
                String value = variables.get(variable);
                if (value == null || value.isBlank()) {
                    missing.add(variable);
                } else {
                    gateway.getProperties().put(property, value.trim());
                }
            });
        }
        if (!missing.isEmpty()) {
            log.error("Missing required environment variables: {}", String.join(", ", missing));
            throw new ConfigurationException(
                    "Missing required environment variables: " + String.join(", ", missing));
        }
    }

    /**
     * Reads dotenv lines: {@code [export] KEY=VALUE}, split on the first {@code =}.  Blank lines
     * and {@code #} comments are skipped.  Quoted values are unquoted and otherwise kept
     * literally (no escape processing); unquoted values end at a {@code " #"} comment.
     */
    static Map<String, String> readEnvFile(Path envFile) {
        List<String> lines;
        try {
            lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read credentials file " + envFile, e);
        }
        Map<String, String> values = new HashMap<>();
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith(EXPORT_PREFIX)) {
                line = line.substring(EXPORT_PREFIX.length()).stripLeading();
            }
            int equals = line.indexOf('=');
            String key = equals < 0 ? "" : line.substring(0, equals).strip();
            if (key.isEmpty()) {
                log.warn("Ignoring malformed line {} of {}", lineNumber, envFile);
                continue;
            }
            values.put(key, value(line.substring(equals + 1).strip()));
        }
        return values;
    }

    private static String value(String raw) {
        if (raw.length() >= 2
                && (raw.startsWith("\"") && raw.endsWith("\"")
                || raw.startsWith("'") && raw.endsWith("'"))) {
            return raw.substring(1, raw.length() - 1);
        }
        int comment = raw.indexOf(" #");
        return comment < 0 ? raw : raw.substring(0, comment).stripTrailing();
    }
}
