package com.phillippitts.scantomack.service.ocr.tesseract;

import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import com.phillippitts.scantomack.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Supplier;

/**
 * Fixed set of dedicated worker threads running native recognition.
 *
 * <p>Native handles are not thread-safe, so every worker owns its own {@link NativeRecognizer}
 * created on start-up. All workers draw from one shared unbounded job queue; whichever worker
 * is free takes the next job.
 *
 * <p>Jobs always run to completion once a worker picked them up. A caller that stops waiting
 * only abandons its future; cancelling the future before a worker takes the job skips it.
 *
 * <p>Thread Safety: {@link #submit} may be called from any thread.
 */
public final class NativeWorkerPool implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(NativeWorkerPool.class);

    /** Hard ceiling on native workers regardless of configuration. */
    public static final int MAX_WORKERS = 4;

    static final String THREAD_PREFIX = "ocr-native-";

    private static final NativeJob POISON = new NativeJob(null, null, null);

    private final BlockingQueue<NativeJob> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workers;
    private volatile boolean closed = false;

    private NativeWorkerPool(int size, Supplier<NativeRecognizer> recognizerFactory) {
        List<Thread> threads = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            NativeRecognizer recognizer = recognizerFactory.get();
            Thread t = new Thread(() -> runWorker(recognizer), THREAD_PREFIX + i);
            t.setDaemon(true);
            threads.add(t);
        }
        this.workers = Collections.unmodifiableList(threads);
    }

    /**
     * Creates and starts {@code min(requested, 4)} workers (at least one).
     *
     * @param requested         configured concurrency
     * @param recognizerFactory called once per worker
     */
    public static NativeWorkerPool start(int requested, Supplier<NativeRecognizer> recognizerFactory) {
        Objects.requireNonNull(recognizerFactory, "recognizerFactory");
        int size = Math.max(1, Math.min(requested, MAX_WORKERS));
        NativeWorkerPool pool = new NativeWorkerPool(size, recognizerFactory);
        pool.workers.forEach(Thread::start);
        LOG.info("Native worker pool started: workers={}", size);
        return pool;
    }

    /**
     * Queues a recognition job.
     *
     * @return future completed by the worker; already failed with
     *         {@link EngineUnavailableException} if the pool is closed
     */
    public CompletableFuture<RawRecognition> submit(DocumentImage document, String language) {
        NativeJob job = NativeJob.of(Objects.requireNonNull(document, "document"), language);
        if (closed) {
            job.result().completeExceptionally(
                    new EngineUnavailableException("native worker pool is closed", EngineId.TESSERACT));
            return job.result();
        }
        queue.add(job);
        return job.result();
    }

    public int size() {
        return workers.size();
    }

    public int queueDepth() {
        return queue.size();
    }

    public boolean isRunning() {
        if (closed) {
            return false;
        }
        for (Thread t : workers) {
            if (t.isAlive()) {
                return true;
            }
        }
        return false;
    }

    private void runWorker(NativeRecognizer recognizer) {
        String name = Thread.currentThread().getName();
        LOG.debug("Native worker {} started", name);
        while (true) {
            NativeJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (job == POISON) {
                break;
            }
            if (job.result().isDone()) {
                // Caller cancelled before we got to it
                continue;
            }
            if (closed) {
                job.result().completeExceptionally(
                        new EngineUnavailableException("native worker pool closed", EngineId.TESSERACT));
                continue;
            }
            try {
                RawRecognition raw = recognizer.recognize(job.document().decode(), job.language());
                job.result().complete(raw);
            } catch (Throwable t) {
                job.result().completeExceptionally(t);
            }
        }
        LOG.debug("Native worker {} stopped", name);
    }

    /**
     * Stops all workers after their current job and fails everything still queued. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (int i = 0; i < workers.size(); i++) {
            queue.add(POISON);
        }
        for (Thread t : workers) {
            try {
                t.join(ProcessTimeouts.WORKER_SHUTDOWN_TIMEOUT.toMillis());
                if (t.isAlive()) {
                    LOG.warn("Native worker {} did not stop within {}ms; abandoning it",
                            t.getName(), ProcessTimeouts.WORKER_SHUTDOWN_TIMEOUT.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        failPending();
        LOG.info("Native worker pool closed");
    }

    private void failPending() {
        List<NativeJob> pending = new ArrayList<>();
        queue.drainTo(pending);
        int failed = 0;
        for (NativeJob job : pending) {
            if (job != POISON) {
                job.result().completeExceptionally(
                        new EngineUnavailableException("native worker pool closed", EngineId.TESSERACT));
                failed++;
            }
        }
        if (failed > 0) {
            LOG.warn("Failed {} pending native jobs on shutdown", failed);
        }
    }
}
