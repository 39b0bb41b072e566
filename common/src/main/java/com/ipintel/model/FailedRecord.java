package com.ipintel.model;

import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enrichment that could not be completed.  Keeps the original counters intact and
 * carries the failure reason in the {@code error} column.
 */
@Value
public class FailedRecord implements EnrichedRecord {

    public static final String ERROR_KEY = "error";

    @NonNull NetworkRecord source;
    @NonNull String error;

    @Override
    public boolean isFailed() {
        return true;
    }

    @Override
    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>(source.toRow());
        row.put(ERROR_KEY, error);
        return row;
    }
}
