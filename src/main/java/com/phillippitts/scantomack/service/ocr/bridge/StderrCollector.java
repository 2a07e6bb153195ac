package com.phillippitts.scantomack.service.ocr.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains a bridge's stderr so the child never blocks on a full pipe, keeping only the most
 * recent {@code maxChars} for error messages.
 *
 * <p>Python engines print model download progress and warnings here; each line is logged at
 * DEBUG.
 */
final class StderrCollector implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StderrCollector.class);

    private final InputStream inputStream;
    private final String name;
    private final int maxChars;

    // @GuardedBy("this")
    private final StringBuilder tail = new StringBuilder();

    StderrCollector(InputStream inputStream, String name, int maxChars) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxChars = maxChars;
    }

    Thread start() {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                LOG.debug("[{}] {}", name, line);
                append(line);
            }
        } catch (IOException e) {
            LOG.debug("Stderr collector '{}' stopped: {}", name, e.toString());
        }
    }

    private synchronized void append(String line) {
        if (!tail.isEmpty()) {
            tail.append('\n');
        }
        tail.append(line);
        int overflow = tail.length() - maxChars;
        if (overflow > 0) {
            tail.delete(0, overflow);
        }
    }

    synchronized String snippet() {
        return tail.toString();
    }
}
