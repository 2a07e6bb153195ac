package com.phillippitts.scantomack.service.orchestration;

import java.time.Duration;

/**
 * Pause between retry attempts. Separate from the dispatcher so tests can record delays
 * instead of sleeping.
 */
@FunctionalInterface
public interface Backoff {

    void pause(Duration delay) throws InterruptedException;

    /**
     * Exponential delay before the attempt that follows {@code failedAttempt}: {@code base·2^failedAttempt},
     * so 2s, 4s, 8s for a one second base.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     */
    static Duration delayAfter(int failedAttempt, Duration base) {
        int shift = Math.min(Math.max(failedAttempt, 0), 20);
        return base.multipliedBy(1L << shift);
    }
}
