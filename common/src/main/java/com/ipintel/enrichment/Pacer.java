package com.ipintel.enrichment;

import java.time.Duration;

/**
 * Waits out the pacing delay between completions.  Injectable so tests can record the
 * pauses instead of sleeping.
 */
@FunctionalInterface
public interface Pacer {

    void pause(Duration delay) throws InterruptedException;

    /** Real pacer backed by {@link Thread#sleep(long)}. */
    static Pacer sleeping() {
        return delay -> {
            if (!delay.isZero() && !delay.isNegative()) {
                Thread.sleep(delay.toMillis());
            }
        };
    }
}
