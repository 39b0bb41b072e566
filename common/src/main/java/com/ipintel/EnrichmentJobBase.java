package com.ipintel;

import com.ipintel.config.CredentialResolver;
import com.ipintel.config.IpIntelConfig;
import com.ipintel.enrichment.EnrichmentPool;
import com.ipintel.enrichment.FailedRecordRetrier;
import com.ipintel.enrichment.RecordEnricher;
import com.ipintel.gateway.AssessmentGateway;
import com.ipintel.gateway.GatewayFactory;
import com.ipintel.gateway.LookupGateway;
import com.ipintel.io.AnalysisResultWriter;
import com.ipintel.io.NetworkSummaryReader;
import com.ipintel.model.EnrichedRecord;
import com.ipintel.model.NetworkRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Abstract base for enrichment jobs.
 *
 * <p>Subclasses provide the default config resource, a display name and the way the input
 * file is chosen.  Everything else is driven by the YAML configuration.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class NetworkAnalysisJob extends EnrichmentJobBase {
 *       protected String getDefaultConfigResource() { return "analyzer-config.yaml"; }
 *       protected String getJobName(IpIntelConfig c) { return "Network analysis"; }
 *       protected Optional&lt;String&gt; selectInputFile(...) { ... }
 *       public static void main(String[] args) throws Exception { new NetworkAnalysisJob().run(args); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class EnrichmentJobBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    protected abstract String getJobName(IpIntelConfig config);

    /**
     * Chooses the input file name inside the input directory.
     *
     * @return empty when there is nothing to process
     */
    protected abstract Optional<String> selectInputFile(String[] args,
                                                        IpIntelConfig config,
                                                        NetworkSummaryReader reader) throws IOException;

    /**
     * Runs the enrichment end-to-end.
     *
     * @param args optional first argument: path to a YAML config file
     * @return the written output file, or empty when no input was selected
     */
    public Optional<Path> run(String[] args) throws IOException {
        // ── Load configuration ───────────────────────────────────────────
        IpIntelConfig config;
        if (args.length > 0 && !args[0].isBlank()) {
            log.info("Loading configuration from file: {}", args[0]);
            config = IpIntelConfig.load(args[0]);
        } else {
            String resource = getDefaultConfigResource();
            log.info("Loading configuration from classpath: {}", resource);
            config = IpIntelConfig.loadFromClasspath(resource);
        }
        config.validate();
        createCredentialResolver(config).resolve(config.getLookup(), config.getAssessment());

        log.info("Starting {}", getJobName(config));

        NetworkSummaryReader reader = new NetworkSummaryReader(Path.of(config.getIo().getInputDir()));
        Optional<String> inputFile = selectInputFile(args, config, reader);
        if (inputFile.isEmpty()) {
            log.warn("No input file selected, nothing to do");
            return Optional.empty();
        }
        List<NetworkRecord> records = reader.read(inputFile.get());
        log.info("Processing {} IP addresses", records.size());

        // ── Build gateways and run the pool ──────────────────────────────
        LookupGateway lookup = GatewayFactory.createLookup(config.getLookup());
        AssessmentGateway assessment = null;
        List<EnrichedRecord> results;
        try {
            assessment = GatewayFactory.createAssessment(config.getAssessment());
            EnrichmentPool pool = createPool(RecordEnricher.forGateways(lookup, assessment), config);
            results = new FailedRecordRetrier(pool, config.getPool().getRetryRounds()).run(records);
        } finally {
            lookup.close();
            if (assessment != null) {
                assessment.close();
            }
        }

        Path output = new AnalysisResultWriter(Path.of(config.getIo().getOutputDir())).write(results);
        log.info("Analysis complete. Results written to {}", output);
        return Optional.of(output);
    }

    protected CredentialResolver createCredentialResolver(IpIntelConfig config) {
        return CredentialResolver.fromEnvironment(config.getIo().resolveEnvFile());
    }

    protected EnrichmentPool createPool(RecordEnricher enricher, IpIntelConfig config) {
        return new EnrichmentPool(enricher, config.getConcurrency(), config.getPacing());
    }
}
