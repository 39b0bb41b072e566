package com.ipintel.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives a notification after every completed record.  Always called from the pool's
 * coordinating thread, one completion at a time.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int completed, int total);

    static ProgressListener logging() {
        Logger log = LoggerFactory.getLogger(ProgressListener.class);
        return (completed, total) -> log.info("Progress: {}/{} records enriched", completed, total);
    }
}
