package com.ipintel.config;

import com.ipintel.enrichment.EnrichmentPool;
import com.ipintel.enrichment.RecordEnricher;
import com.ipintel.gateway.AssessmentGateway;
import com.ipintel.gateway.GatewayFactory;
import com.ipintel.gateway.LookupGateway;
import com.ipintel.io.AnalysisResultWriter;
import com.ipintel.io.NetworkSummaryReader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration that wires the enrichment beans from {@code ipintel.*} properties.
 *
 * <p>Credentials are resolved when the {@link CredentialResolver} bean is created, before
 * any gateway exists, so a missing variable fails context startup.</p>
 */
@Configuration
@EnableConfigurationProperties(IpIntelConfig.class)
public class IpIntelAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CredentialResolver credentialResolver(IpIntelConfig config) {
        config.validate();
        CredentialResolver resolver = CredentialResolver.fromEnvironment(config.getIo().resolveEnvFile());
        resolver.resolve(config.getLookup(), config.getAssessment());
        return resolver;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public LookupGateway lookupGateway(IpIntelConfig config, CredentialResolver credentialResolver) {
        return GatewayFactory.createLookup(config.getLookup());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public AssessmentGateway assessmentGateway(IpIntelConfig config, CredentialResolver credentialResolver) {
        return GatewayFactory.createAssessment(config.getAssessment());
    }

    @Bean
    public RecordEnricher recordEnricher(LookupGateway lookupGateway, AssessmentGateway assessmentGateway) {
        return RecordEnricher.forGateways(lookupGateway, assessmentGateway);
    }

    @Bean
    public EnrichmentPool enrichmentPool(RecordEnricher recordEnricher, IpIntelConfig config) {
        return new EnrichmentPool(recordEnricher, config.getConcurrency(), config.getPacing());
    }

    @Bean
    public NetworkSummaryReader networkSummaryReader(IpIntelConfig config) {
        return new NetworkSummaryReader(Path.of(config.getIo().getInputDir()));
    }

    @Bean
    public AnalysisResultWriter analysisResultWriter(IpIntelConfig config) {
        return new AnalysisResultWriter(Path.of(config.getIo().getOutputDir()));
    }
}
