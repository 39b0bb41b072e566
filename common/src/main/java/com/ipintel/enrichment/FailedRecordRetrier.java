package com.ipintel.enrichment;

import com.ipintel.model.EnrichedRecord;
import com.ipintel.model.NetworkRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outer retry loop around {@link EnrichmentPool}: after the first pass, re-runs the pool on
 * the failed rows only, up to {@code retryRounds} more times.
 *
 * <p>A retried row's new result replaces the previous one (matched by row number), so the
 * output still has exactly one result per input row.</p>
 */
@Slf4j
public class FailedRecordRetrier {

    private final EnrichmentPool pool;
    private final int retryRounds;

    public FailedRecordRetrier(EnrichmentPool pool, int retryRounds) {
        this.pool = pool;
        this.retryRounds = Math.max(0, retryRounds);
    }

    public List<EnrichedRecord> run(List<NetworkRecord> records) {
        Map<Integer, EnrichedRecord> byRow = new LinkedHashMap<>();
        for (EnrichedRecord result : pool.run(records)) {
            byRow.put(result.getSource().getRowNumber(), result);
        }

        for (int round = 1; round <= retryRounds; round++) {
            List<NetworkRecord> failed = byRow.values().stream()
                    .filter(EnrichedRecord::isFailed)
                    .map(EnrichedRecord::getSource)
                    .collect(Collectors.toList());
            if (failed.isEmpty()) {
                break;
            }
            log.info("Retry round {}/{}: re-running {} failed records", round, retryRounds, failed.size());
            for (EnrichedRecord result : pool.run(failed)) {
                byRow.put(result.getSource().getRowNumber(), result);
            }
        }
        return new ArrayList<>(byRow.values());
    }
}
