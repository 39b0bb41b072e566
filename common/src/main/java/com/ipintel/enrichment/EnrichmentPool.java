package com.ipintel.enrichment;

import com.ipintel.model.EnrichedRecord;
import com.ipintel.model.NetworkRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link RecordEnricher} over a batch of records with bounded concurrency and pacing.
 *
 * <p>Provides two guarantees:
 * <ol>
 *   <li><b>Bounded in-flight work</b>: a fixed pool of {@code concurrency} workers, so at
 *       most that many records are being enriched at once.  Remaining records wait in the
 *       pool's queue and are picked up as slots free.</li>
 *   <li><b>One result per record</b>: every worker hands its result to a single completion
 *       queue that only the calling thread drains, so accumulation needs no further
 *       locking.  A task that throws is converted into a failed record instead of being
 *       lost.</li>
 * </ol>
 *
 * <p>After each completion the worker slot waits the pacing delay before it takes the next
 * record, throttling the aggregate request rate to roughly {@code concurrency / pacing}.
 * Nothing is retried here; re-running failed rows is the caller's concern.</p>
 *
 * <p>Output order is completion order, not input order.</p>
 */
@Slf4j
public class EnrichmentPool {

    private static final long SHUTDOWN_TIMEOUT_MINUTES = 5;
    private static final long INTERRUPT_GRACE_SECONDS = 30;

    private final RecordEnricher enricher;
    private final int concurrency;
    private final Duration pacing;
    private final Pacer pacer;
    private final ProgressListener progressListener;

    public EnrichmentPool(RecordEnricher enricher, int concurrency, Duration pacing) {
        this(enricher, concurrency, pacing, Pacer.sleeping(), ProgressListener.logging());
    }

    public EnrichmentPool(RecordEnricher enricher,
                          int concurrency,
                          Duration pacing,
                          Pacer pacer,
                          ProgressListener progressListener) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        if (pacing == null || pacing.isNegative()) {
            throw new IllegalArgumentException("pacing must not be negative, was " + pacing);
        }
        this.enricher = enricher;
        this.concurrency = concurrency;
        this.pacing = pacing;
        this.pacer = pacer;
        this.progressListener = progressListener;
    }

    /**
     * Enriches every record and returns exactly one result per input, in completion order.
     * Returns only after all workers have finished.
     *
     * @throws EnrichmentInterruptedException if the calling thread is interrupted while waiting
     */
    public List<EnrichedRecord> run(List<NetworkRecord> records) {
        int total = records.size();
        List<EnrichedRecord> results = new ArrayList<>(total);
        if (total == 0) {
            return results;
        }

        int workers = Math.min(concurrency, total);
        log.info("Enriching {} records: concurrency={} pacing={}ms", total, workers, pacing.toMillis());

        BlockingQueue<EnrichedRecord> completions = new LinkedBlockingQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            for (NetworkRecord record : records) {
                executor.execute(() -> process(record, completions));
            }
            executor.shutdown();

            while (results.size() < total) {
                EnrichedRecord result = completions.take();
                results.add(result);
                log.info("Completed analysis for row={} address={}{}",
                        result.getSource().getRowNumber(), result.getSource().getAddress(),
                        result.isFailed() ? " (failed)" : "");
                progressListener.onProgress(results.size(), total);
            }

            awaitWorkers(executor);
        } catch (InterruptedException e) {
            stopWorkers(executor);
            Thread.currentThread().interrupt();
            throw new EnrichmentInterruptedException(
                    "Enrichment interrupted after " + results.size() + "/" + total + " records", e);
        } finally {
            // a failing progress listener must not leave workers behind
            if (!executor.isTerminated()) {
                executor.shutdownNow();
            }
        }

        long failed = results.stream().filter(EnrichedRecord::isFailed).count();
        log.info("Enrichment finished: {} records, {} failed", total, failed);
        return results;
    }

    private void process(NetworkRecord record, BlockingQueue<EnrichedRecord> completions) {
        EnrichedRecord result;
        Error fatal = null;
        try {
            result = enricher.enrich(record);
        } catch (RuntimeException | Error e) {
            log.error("Enricher threw for row={} address={}", record.getRowNumber(), record.getAddress(), e);
            result = RecordEnricher.failed(record, "Unexpected enrichment error: " + RecordEnricher.describe(e));
            if (e instanceof VirtualMachineError) {
                fatal = (Error) e;
            }
        }
        // the coordinator waits for exactly one result per record
        completions.add(result);
        if (fatal != null) {
            throw fatal;
        }

        try {
            pacer.pause(pacing);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted during pacing delay");
        }
    }

    private void awaitWorkers(ExecutorService executor) throws InterruptedException {
        // every result is in; remaining workers are only finishing their pacing delay
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
            log.warn("Enrichment workers still running after {} minutes, forcing shutdown",
                    SHUTDOWN_TIMEOUT_MINUTES);
            executor.shutdownNow();
        }
    }

    // called with the interrupt flag cleared, so the bounded wait is not cut short
    private void stopWorkers(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(INTERRUPT_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Enrichment workers did not stop within {} seconds of interruption",
                        INTERRUPT_GRACE_SECONDS);
            }
        } catch (InterruptedException again) {
            log.warn("Interrupted again while waiting for enrichment workers to stop");
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ipintel-enrichment-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
