package com.ipintel.parser;

import com.ipintel.model.AssessmentField;
import com.ipintel.model.StructuredAssessment;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Line-oriented, case-insensitive, best-effort extraction of a {@link StructuredAssessment}
 * from free text.
 *
 * <p>A line starts a field when its lower-cased form contains the field's label and the
 * line contains a colon.  Labels are tried in {@link AssessmentField} declaration order, so
 * the earliest label wins when a line mentions two.  The field value is the text after the
 * first colon; following unlabelled, non-empty lines are appended with a single space until
 * another label appears.  A label seen again overwrites the earlier value.</p>
 *
 * <p>Never fails: text without any recognised label yields an all-empty assessment.
 * Instances are stateless and thread-safe.</p>
 */
@Slf4j
public class ResponseParser {

    private static final List<AssessmentField> BASE_FIELDS = List.of(
            AssessmentField.TRUSTWORTHINESS,
            AssessmentField.PRIMARY_PURPOSE,
            AssessmentField.SECURITY_CONCERNS,
            AssessmentField.RECOMMENDATION);

    private final Set<AssessmentField> fields;

    /**
     * @param includeRiskScore also extract the optional {@code risk score} field
     */
    public ResponseParser(boolean includeRiskScore) {
        this.fields = EnumSet.copyOf(BASE_FIELDS);
        if (includeRiskScore) {
            fields.add(AssessmentField.RISK_SCORE);
        }
    }

    public ResponseParser() {
        this(false);
    }

    public StructuredAssessment parse(String text) {
        Map<AssessmentField, StringBuilder> values = new EnumMap<>(AssessmentField.class);
        for (AssessmentField field : fields) {
            values.put(field, new StringBuilder());
        }
        if (text == null || text.isEmpty()) {
            return toAssessment(values);
        }

        AssessmentField current = null;
        for (String rawLine : text.split("\n", -1)) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            AssessmentField labelled = matchLabel(line);
            if (labelled != null) {
                current = labelled;
                StringBuilder value = values.get(labelled);
                value.setLength(0);
                value.append(line.substring(line.indexOf(':') + 1).strip());
            } else if (current != null) {
                values.get(current).append(' ').append(line);
            }
        }

        StructuredAssessment assessment = toAssessment(values);
        if (assessment.isBlank()) {
            log.debug("No labelled fields found in {} chars of assessment text", text.length());
        }
        return assessment;
    }

    private AssessmentField matchLabel(String line) {
        if (line.indexOf(':') < 0) {
            return null;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        // EnumSet iterates in declaration order, which is the label priority order
        for (AssessmentField field : fields) {
            if (lower.contains(field.getLabel())) {
                return field;
            }
        }
        return null;
    }

    private StructuredAssessment toAssessment(Map<AssessmentField, StringBuilder> values) {
        StructuredAssessment.StructuredAssessmentBuilder builder = StructuredAssessment.builder()
                .trustworthiness(values.get(AssessmentField.TRUSTWORTHINESS).toString())
                .primaryPurpose(values.get(AssessmentField.PRIMARY_PURPOSE).toString())
                .securityConcerns(values.get(AssessmentField.SECURITY_CONCERNS).toString())
                .recommendation(values.get(AssessmentField.RECOMMENDATION).toString());
        StringBuilder riskScore = values.get(AssessmentField.RISK_SCORE);
        if (riskScore != null) {
            builder.riskScore(riskScore.toString());
        }
        return builder.build();
    }
}
