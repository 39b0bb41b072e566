package com.ipintel.model;

import java.util.Map;

/**
 * Outcome of enriching one {@link NetworkRecord}: either an {@link AssessedRecord} or a
 * {@link FailedRecord}.  Exactly one is produced per input row.
 */
public interface EnrichedRecord {

    NetworkRecord getSource();

    boolean isFailed();

    /** Flat column view used for serialisation. */
    Map<String, String> toRow();
}
