package com.phillippitts.scantomack.service.ocr.bridge;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.RecognizedWord;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import com.phillippitts.scantomack.util.LogSanitizer;
import com.phillippitts.scantomack.util.ProcessTimeouts;
import com.phillippitts.scantomack.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-lived child process speaking newline-delimited JSON over stdin/stdout.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Serialize requests: exactly one is outstanding at a time (fair {@link ReentrantLock});
 *       time spent queueing on the lock counts against the caller's timeout</li>
 *   <li>Frame responses: a reader thread accumulates stdout lines until the buffer parses as one
 *       JSON object, then hands it to the waiting caller</li>
 *   <li>Drain stderr into a bounded tail for error context</li>
 *   <li>Taint and terminate on a response timeout, since a late response would be attributed to
 *       the next request</li>
 * </ul>
 *
 * <p>A tainted or dead bridge refuses further requests; the owning engine replaces or evicts it.
 */
public final class ProcessBridge implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProcessBridge.class);

    static final int STDERR_TAIL_CHARS = 4096;
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    // Marks end of stdout; compared by identity
    private static final JSONObject EOF = new JSONObject();

    private final EngineId engine;
    private final Process process;
    private final int maxFrameChars;
    private final ReentrantLock requestLock = new ReentrantLock(true);
    private final BlockingQueue<JSONObject> responses = new LinkedBlockingQueue<>();
    private final AtomicBoolean tainted = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final Writer stdin;
    private final StderrCollector stderr;
    private final Thread readerThread;
    private final Thread stderrThread;

    ProcessBridge(EngineId engine, Process process, int maxFrameChars) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.process = Objects.requireNonNull(process, "process");
        this.maxFrameChars = maxFrameChars;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stderr = new StderrCollector(process.getErrorStream(), engine.wireName() + "-bridge-err",
                STDERR_TAIL_CHARS);
        this.stderrThread = stderr.start();
        this.readerThread = new Thread(this::readFrames, engine.wireName() + "-bridge-out");
        this.readerThread.setDaemon(true);
        this.readerThread.start();
    }

    /**
     * Spawns the bridge process and starts its reader threads.
     *
     * @throws IOException if the process cannot be started
     */
    public static ProcessBridge start(EngineId engine,
                                      ProcessFactory factory,
                                      List<String> command,
                                      Path workingDir,
                                      int maxFrameChars) throws IOException {
        LOG.info("Starting {} bridge: {}", engine, String.join(" ", command));
        Process process = factory.start(command, workingDir);
        return new ProcessBridge(engine, process, maxFrameChars);
    }

    /**
     * Sends a test frame and reports whether the bridge answered {@code success:true} in time.
     * Never throws.
     */
    public boolean probe(Duration timeout) {
        try {
            JSONObject response = exchange(BridgeMessages.testRequest(), TimeUtils.deadlineAfter(timeout));
            return Boolean.TRUE.equals(response.opt("success"));
        } catch (RuntimeException e) {
            LOG.warn("{} bridge probe failed: {}", engine, e.getMessage());
            return false;
        }
    }

    /**
     * Runs one recognition.
     *
     * @param image    encoded image bytes, sent base64-encoded
     * @param language engine-native language code
     * @param timeout  total budget including time waiting for the bridge lock
     * @return recognized words
     * @throws com.phillippitts.scantomack.exception.EngineTimeoutException no response in time (bridge is tainted)
     * @throws com.phillippitts.scantomack.exception.EngineReportedFailureException engine answered {@code success:false}
     * @throws com.phillippitts.scantomack.exception.BridgeProtocolException bad frame shape or dead process
     */
    public List<RecognizedWord> invoke(byte[] image, String language, Duration timeout) {
        Objects.requireNonNull(image, "image");
        long start = System.nanoTime();
        JSONObject response = exchange(BridgeMessages.processRequest(image, language),
                TimeUtils.deadlineAfter(timeout));
        if (!BridgeMessages.isSuccess(response, engine)) {
            String error = BridgeMessages.errorText(response);
            throw RecognitionExceptionBuilder.create("Engine reported failure: " + LogSanitizer.truncate(error, 200))
                    .engine(engine)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .buildReportedFailure(error);
        }
        List<RecognizedWord> words = BridgeMessages.parseWords(response, engine);
        LOG.debug("{} bridge returned {} words in {}ms", engine, words.size(), TimeUtils.elapsedMillis(start));
        return words;
    }

    private JSONObject exchange(String request, long deadlineNanos) {
        boolean locked;
        try {
            locked = requestLock.tryLock(Math.max(0, TimeUtils.remainingNanos(deadlineNanos)), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RecognitionExceptionBuilder.create("Interrupted waiting for bridge")
                    .engine(engine)
                    .cause(e)
                    .buildTimeout();
        }
        if (!locked) {
            // Never reached the process; the bridge itself is fine
            throw RecognitionExceptionBuilder.create("Timed out waiting for bridge to become free")
                    .engine(engine)
                    .metadata("queued", requestLock.getQueueLength())
                    .buildTimeout();
        }
        try {
            ensureUsable();
            responses.clear();
            send(request);
            JSONObject response = awaitResponse(deadlineNanos);
            if (response == EOF) {
                throw deadProcessError("Bridge process closed stdout", null);
            }
            return response;
        } finally {
            requestLock.unlock();
        }
    }

    private void ensureUsable() {
        if (tainted.get()) {
            throw RecognitionExceptionBuilder.create("Bridge is tainted by an earlier timeout")
                    .engine(engine)
                    .buildProtocolError();
        }
        if (terminated.get() || !process.isAlive()) {
            throw deadProcessError("Bridge process is not running", null);
        }
    }

    private void send(String frame) {
        try {
            stdin.write(frame);
            stdin.write('\n');
            stdin.flush();
        } catch (IOException e) {
            throw deadProcessError("Failed to write to bridge stdin", e);
        }
    }

    private JSONObject awaitResponse(long deadlineNanos) {
        JSONObject response;
        try {
            response = responses.poll(Math.max(0, TimeUtils.remainingNanos(deadlineNanos)), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response = null;
        }
        if (response == null) {
            tainted.set(true);
            String stderrTail = stderrSnippet();
            LOG.warn("{} bridge did not answer in time; tainting and terminating", engine);
            terminate();
            throw RecognitionExceptionBuilder.create("No response from bridge")
                    .engine(engine)
                    .metadata("stderr", stderrTail)
                    .buildTimeout();
        }
        return response;
    }

    private RuntimeException deadProcessError(String message, Throwable cause) {
        RecognitionExceptionBuilder builder = RecognitionExceptionBuilder.create(message)
                .engine(engine)
                .metadata("stderr", stderrSnippet());
        if (!process.isAlive()) {
            try {
                builder.exitCode(process.exitValue());
            } catch (IllegalThreadStateException e) {
                LOG.debug("{} bridge exit code not yet available", engine);
            }
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.buildProtocolError();
    }

    private void readFrames() {
        StringBuilder buffer = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() && buffer.isEmpty()) {
                    continue;
                }
                if (buffer.isEmpty() && !line.stripLeading().startsWith("{")) {
                    // Not the start of a frame: library chatter on stdout
                    LOG.debug("{} bridge stdout noise: {}", engine, LogSanitizer.truncate(line, 200));
                    continue;
                }
                buffer.append(line).append('\n');
                JSONObject frame = tryParse(buffer.toString());
                if (frame != null) {
                    buffer.setLength(0);
                    responses.offer(frame);
                } else if (buffer.length() > maxFrameChars) {
                    LOG.error("{} bridge frame exceeded {} chars without parsing; discarding", engine, maxFrameChars);
                    buffer.setLength(0);
                }
            }
        } catch (IOException e) {
            LOG.debug("{} bridge reader stopped: {}", engine, e.toString());
        } finally {
            responses.offer(EOF);
        }
    }

    private static JSONObject tryParse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.charAt(0) != '{') {
            return null;
        }
        try {
            return new JSONObject(trimmed);
        } catch (JSONException e) {
            return null;
        }
    }

    public boolean isAlive() {
        return !terminated.get() && process.isAlive();
    }

    public boolean isTainted() {
        return tainted.get();
    }

    public String stderrSnippet() {
        return LogSanitizer.truncate(stderr.snippet(), ERROR_SNIPPET_MAX_CHARS);
    }

    /**
     * Stops the process: {@code destroy()}, a 500ms grace period, then {@code destroyForcibly()}.
     * Idempotent.
     */
    public void terminate() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        try {
            stdin.close();
        } catch (IOException e) {
            LOG.debug("Closing {} bridge stdin: {}", engine, e.toString());
        }
        destroyProcess(process);
        joinQuietly(readerThread, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(stderrThread, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        LOG.info("{} bridge terminated", engine);
    }

    @Override
    public void close() {
        terminate();
    }

    private void destroyProcess(Process p) {
        try {
            p.destroy();
            boolean exited = p.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && p.isAlive()) {
                p.destroyForcibly();
                p.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (p.isAlive()) {
                    LOG.warn("{} bridge process still alive after destroyForcibly", engine);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying {} bridge process", engine);
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
