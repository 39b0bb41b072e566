package com.ipintel.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-shape result of parsing a free-text assessment.
 *
 * <p>The four base fields are never {@code null}; a field the parser could not find is
 * {@code ""}.  {@code riskScore} is a backend-specific extension and is {@code null} when the
 * parser was not asked to look for it.</p>
 */
@Value
@Builder
public class StructuredAssessment {

    @Builder.Default
    String trustworthiness = "";
    @Builder.Default
    String primaryPurpose = "";
    @Builder.Default
    String securityConcerns = "";
    @Builder.Default
    String recommendation = "";
    String riskScore;

    public boolean hasRiskScore() {
        return riskScore != null;
    }

    /** {@code true} when no field carries any text. */
    public boolean isBlank() {
        return trustworthiness.isEmpty()
                && primaryPurpose.isEmpty()
                && securityConcerns.isEmpty()
                && recommendation.isEmpty()
                && (riskScore == null || riskScore.isEmpty());
    }

    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(AssessmentField.TRUSTWORTHINESS.getKey(), trustworthiness);
        row.put(AssessmentField.PRIMARY_PURPOSE.getKey(), primaryPurpose);
        row.put(AssessmentField.SECURITY_CONCERNS.getKey(), securityConcerns);
        row.put(AssessmentField.RECOMMENDATION.getKey(), recommendation);
        if (riskScore != null) {
            row.put(AssessmentField.RISK_SCORE.getKey(), riskScore);
        }
        return row;
    }
}
