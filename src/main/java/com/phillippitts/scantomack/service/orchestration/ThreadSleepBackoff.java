package com.phillippitts.scantomack.service.orchestration;

import java.time.Duration;

/**
 * Production backoff: blocks the dispatching thread.
 */
public final class ThreadSleepBackoff implements Backoff {

    @Override
    public void pause(Duration delay) throws InterruptedException {
        if (!delay.isNegative() && !delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
