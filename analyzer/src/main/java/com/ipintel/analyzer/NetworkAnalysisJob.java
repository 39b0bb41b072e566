package com.ipintel.analyzer;

import com.ipintel.EnrichmentJobBase;
import com.ipintel.config.ConfigurationException;
import com.ipintel.config.IpIntelConfig;
import com.ipintel.io.NetworkSummaryReader;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the network summary analysis.
 *
 * <p>Usage:
 * <pre>
 *   java -jar ipintel-analyzer.jar [config-path] [input-file]
 * </pre>
 *
 * <p>If no config path is supplied, the classpath resource {@code analyzer-config.yaml} is
 * used.  Without an input file argument or {@code io.inputFile}, the CSV files in the input
 * directory are listed and one is chosen interactively.</p>
 */
@Slf4j
public class NetworkAnalysisJob extends EnrichmentJobBase {

    private static final String DEFAULT_CONFIG = "analyzer-config.yaml";

    private final InputStream in;
    private final PrintStream out;

    public NetworkAnalysisJob() {
        this(System.in, System.out);
    }

    NetworkAnalysisJob(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName(IpIntelConfig config) {
        return "IP Intel network analysis [concurrency=" + config.getConcurrency() + "]";
    }

    @Override
    protected Optional<String> selectInputFile(String[] args,
                                               IpIntelConfig config,
                                               NetworkSummaryReader reader) throws IOException {
        if (args.length > 1 && !args[1].isBlank()) {
            return Optional.of(args[1]);
        }
        String configured = config.getIo().getInputFile();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured);
        }

        List<String> files = reader.listInputFiles();
        if (files.isEmpty()) {
            out.println("No input CSV files found in " + config.getIo().getInputDir());
            return Optional.empty();
        }

        out.println("Available input files:");
        for (int i = 0; i < files.size(); i++) {
            out.println((i + 1) + ". " + files.get(i));
        }
        out.print("Select the number of the file to process: ");
        out.flush();

        BufferedReader console = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String answer = console.readLine();
        int selection;
        try {
            selection = Integer.parseInt(answer == null ? "" : answer.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a file number: " + answer, e);
        }
        if (selection < 1 || selection > files.size()) {
            throw new IllegalArgumentException("File number out of range: " + selection);
        }
        return Optional.of(files.get(selection - 1));
    }

    public static void main(String[] args) {
        try {
            new NetworkAnalysisJob().run(args)
                    .ifPresent(output -> System.out.println("\nAnalysis complete! Results saved to: " + output));
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(1);
        } catch (IOException | RuntimeException e) {
            log.error("Error during analysis: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
