package com.ipintel.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Labelled fields of a structured assessment, in label-matching priority order.
 */
@Getter
@RequiredArgsConstructor
public enum AssessmentField {

    TRUSTWORTHINESS("trustworthiness", "trustworthiness"),
    PRIMARY_PURPOSE("primary purpose", "primary_purpose"),
    SECURITY_CONCERNS("security concerns", "security_concerns"),
    RECOMMENDATION("recommendation", "recommendation"),

    /** Optional extension, only requested from some assessment backends. */
    RISK_SCORE("risk score", "risk_score");

    /** Lower-case label searched for inside a response line. */
    private final String label;

    /** Output column name. */
    private final String key;
}
