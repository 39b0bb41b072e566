package com.ipintel.model;

import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Successful enrichment: counters + lookup data + parsed assessment.  Never has an
 * {@code error} column.
 */
@Value
public class AssessedRecord implements EnrichedRecord {

    @NonNull NetworkRecord source;
    @NonNull LookupResult lookup;
    @NonNull StructuredAssessment assessment;

    @Override
    public boolean isFailed() {
        return false;
    }

    @Override
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>(source.toRow());
        row.putAll(lookup.toRow());
        row.putAll(assessment.toRow());
        return row;
    }
}
