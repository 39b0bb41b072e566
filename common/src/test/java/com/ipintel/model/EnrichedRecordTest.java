package com.ipintel.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichedRecordTest {

    private static final NetworkRecord SOURCE = NetworkRecord.builder()
            .rowNumber(7).address("10.0.0.5")
            .totalEvents(12).connects(3).disconnects(3).sends(4).receives(2)
            .sendBytes(1024).receiveBytes(2048)
            .build();

    @Test
    void assessedRow_shouldCarryCountersLookupAndAssessment_withoutError() {
        AssessedRecord assessed = new AssessedRecord(SOURCE, LookupResult.empty(),
                StructuredAssessment.builder().trustworthiness("Trusted").build());

        Map<String, String> row = assessed.toRow();

        assertThat(assessed.isFailed()).isFalse();
        assertThat(row).doesNotContainKey(FailedRecord.ERROR_KEY)
                .doesNotContainKey(AssessmentField.RISK_SCORE.getKey())
                .containsEntry("address", "10.0.0.5")
                .containsEntry("receive_bytes", "2048")
                .containsEntry("organization", "")
                .containsEntry("ports", "")
                .containsEntry("trustworthiness", "Trusted")
                .containsEntry("recommendation", "");
        assertThat(row).hasSize(16);
    }

    @Test
    void assessedRow_shouldIncludeRiskScore_whenPresent() {
        AssessedRecord assessed = new AssessedRecord(SOURCE, LookupResult.empty(),
                StructuredAssessment.builder().riskScore("3").build());

        assertThat(assessed.toRow()).containsEntry("risk_score", "3").hasSize(17);
    }

    @Test
    void failedRow_shouldCarryCountersAndErrorOnly() {
        FailedRecord failed = new FailedRecord(SOURCE, "Failed to perform AI analysis: timeout");

        Map<String, String> row = failed.toRow();

        assertThat(failed.isFailed()).isTrue();
        assertThat(row).containsOnlyKeys("address", "total_events", "connects", "disconnects",
                "sends", "receives", "send_bytes", "receive_bytes", "error");
        assertThat(row.get("error")).isEqualTo("Failed to perform AI analysis: timeout");
    }

    @Test
    void rowNumberIsNotAColumn() {
        assertThat(SOURCE.toRow()).doesNotContainKey("row_number").doesNotContainValue("7");
    }

    @Test
    void lookupResult_shouldReportEmptiness() {
        assertThat(LookupResult.empty().isEmpty()).isTrue();
        assertThat(LookupResult.builder().country("US").build().isEmpty()).isFalse();
        assertThat(LookupResult.builder().port(80).build().toRow()).containsEntry("ports", "80");
    }

    @Test
    void structuredAssessment_blankness() {
        assertThat(StructuredAssessment.builder().build().isBlank()).isTrue();
        assertThat(StructuredAssessment.builder().riskScore("").build().isBlank()).isTrue();
        assertThat(StructuredAssessment.builder().recommendation("Block").build().isBlank()).isFalse();
    }

    @Test
    void records_shouldRejectNullParts() {
        assertThatThrownBy(() -> new FailedRecord(SOURCE, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new AssessedRecord(SOURCE, null, StructuredAssessment.builder().build()))
                .isInstanceOf(NullPointerException.class);
    }
}
