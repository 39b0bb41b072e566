package com.ipintel.enrichment;

import com.ipintel.gateway.AssessmentException;
import com.ipintel.gateway.AssessmentGateway;
import com.ipintel.gateway.EnrichmentContext;
import com.ipintel.gateway.LookupException;
import com.ipintel.gateway.LookupGateway;
import com.ipintel.gateway.PromptTemplate;
import com.ipintel.model.AssessedRecord;
import com.ipintel.model.EnrichedRecord;
import com.ipintel.model.FailedRecord;
import com.ipintel.model.LookupResult;
import com.ipintel.model.NetworkRecord;
import com.ipintel.model.StructuredAssessment;
import com.ipintel.parser.ResponseParser;
import lombok.extern.slf4j.Slf4j;

/**
 * Enriches one record: lookup, then assessment, then parse and merge.
 *
 * <h3>Failure handling</h3>
 * <p>A lookup failure degrades to {@link LookupResult#empty()} and the record continues.
 * An assessment failure turns the whole record into a {@link FailedRecord} carrying the
 * original counters.  {@link #enrich} never throws, so one bad record cannot take down the
 * pool or other in-flight records.</p>
 */
@Slf4j
public class RecordEnricher {

    /** Replaces commas in error messages; the output is comma-delimited. */
    static final String COMMA_REPLACEMENT = " -";

    private final LookupGateway lookupGateway;
    private final AssessmentGateway assessmentGateway;
    private final PromptTemplate template;
    private final ResponseParser parser;

    public RecordEnricher(LookupGateway lookupGateway,
                          AssessmentGateway assessmentGateway,
                          PromptTemplate template,
                          ResponseParser parser) {
        this.lookupGateway = lookupGateway;
        this.assessmentGateway = assessmentGateway;
        this.template = template;
        this.parser = parser;
    }

    /**
     * Wires a template and parser that agree with the gateway on the risk-score extension.
     */
    public static RecordEnricher forGateways(LookupGateway lookupGateway,
                                             AssessmentGateway assessmentGateway) {
        boolean riskScore = assessmentGateway.includesRiskScore();
        return new RecordEnricher(lookupGateway, assessmentGateway,
                new PromptTemplate(riskScore), new ResponseParser(riskScore));
    }

    public EnrichedRecord enrich(NetworkRecord record) {
        String address = record.getAddress();
        LookupResult lookup = lookup(record);

        String text;
        try {
            text = assessmentGateway.assess(new EnrichmentContext(record, lookup, template));
        } catch (AssessmentException e) {
            return fail(record, "Failed to perform AI analysis: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected assessment error for row={} address={}", record.getRowNumber(), address, e);
            return fail(record, "Failed to perform AI analysis: " + describe(e));
        }

        StructuredAssessment assessment = parser.parse(text);
        if (assessment.isBlank()) {
            log.warn("Assessment for {} contained no recognised fields", address);
        }
        log.debug("Enrichment success: row={} address={}", record.getRowNumber(), address);
        return new AssessedRecord(record, lookup, assessment);
    }

    private LookupResult lookup(NetworkRecord record) {
        try {
            return lookupGateway.lookup(record.getAddress());
        } catch (LookupException e) {
            log.warn("Lookup failed for {}, continuing without lookup data: {}",
                    record.getAddress(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected lookup error for {}, continuing without lookup data",
                    record.getAddress(), e);
        }
        return LookupResult.empty();
    }

    private FailedRecord fail(NetworkRecord record, String message) {
        log.error("Enrichment failed for row={} address={}: {}",
                record.getRowNumber(), record.getAddress(), message);
        return failed(record, message);
    }

    /**
     * Builds the error row for {@code record}, sanitising the message for CSV output.
     */
    public static FailedRecord failed(NetworkRecord record, String message) {
        return new FailedRecord(record, sanitise(message));
    }

    static String sanitise(String message) {
        if (message == null || message.isBlank()) {
            return "unknown error";
        }
        return message.replace(",", COMMA_REPLACEMENT);
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
