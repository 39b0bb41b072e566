package com.ipintel.gateway;

import com.ipintel.config.GatewayConfig;

/**
 * Contract for natural-language assessment services.
 *
 * <p>The returned text is whatever the service produced; the format the prompt asks for is
 * a request, not a guarantee.  Streamed implementations must drain the whole stream (see
 * {@link AssessmentBuffer}) before returning.</p>
 */
public interface AssessmentGateway {

    default void init(GatewayConfig config) {
        // no-op by default
    }

    /**
     * Requests an assessment for one record.
     *
     * @param context the record, its lookup data and the instruction template
     * @return the complete raw response text
     * @throws AssessmentException when no complete response could be obtained
     */
    String assess(EnrichmentContext context) throws AssessmentException;

    /**
     * Whether this backend is asked for the optional risk-score line.
     */
    default boolean includesRiskScore() {
        return false;
    }

    default void close() {
        // no-op by default
    }
}
