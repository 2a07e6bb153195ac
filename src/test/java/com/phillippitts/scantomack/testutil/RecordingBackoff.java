package com.phillippitts.scantomack.testutil;

import com.phillippitts.scantomack.service.orchestration.Backoff;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Backoff that records requested delays instead of sleeping.
 */
public class RecordingBackoff implements Backoff {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void pause(Duration delay) {
        delays.add(delay);
    }

    public List<Duration> delays() {
        return List.copyOf(delays);
    }
}
