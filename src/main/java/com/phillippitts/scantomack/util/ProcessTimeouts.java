package com.phillippitts.scantomack.util;

import java.time.Duration;

/**
 * Standard timeout values for bridge process and worker thread management.
 *
 * @see com.phillippitts.scantomack.service.ocr.bridge.ProcessBridge
 * @see com.phillippitts.scantomack.service.ocr.tesseract.NativeWorkerPool
 */
public final class ProcessTimeouts {

    /**
     * Grace period after {@link Process#destroy()} before escalating to a forcible kill.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Deadline for {@link Process#destroyForcibly()} to take effect.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Best-effort join of stdout/stderr reader threads after a bridge is terminated.
     * They are daemon threads, so a reader stuck on a dead pipe never blocks JVM exit.
     */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Time native workers get to finish their current job on pool shutdown.
     */
    public static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Default probe timeout for bridged engines at registry start.
     */
    public static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
