package com.phillippitts.scantomack.service.orchestration.event;

import com.phillippitts.scantomack.domain.ProcessingEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Delivers one request's events to its sink on the event executor, strictly in emission order.
 *
 * <p>Each delivery is chained onto the previous one, so a slow sink delays only its own request's
 * later events, never the pipeline. Sink failures and
 * rejected deliveries are logged at WARN and do not break the chain.
 */
public final class SerialEventChannel implements ProcessingEventChannel {

    private static final Logger LOG = LogManager.getLogger(SerialEventChannel.class);

    private final String correlationId;
    private final ProcessingEventSink sink;
    private final Executor executor;

    // @GuardedBy("this")
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public SerialEventChannel(String correlationId, ProcessingEventSink sink, Executor executor) {
        this.correlationId = correlationId;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void emit(ProcessingEvent.Type type, Map<String, Object> payload) {
        ProcessingEvent event = ProcessingEvent.of(type, correlationId, payload);
        synchronized (this) {
            // deliver() never throws, so an exceptional stage means the executor rejected it
            tail = tail.thenRunAsync(() -> deliver(event), executor)
                    .exceptionally(t -> {
                        LOG.warn("Dropped {} event for {}: {}", type, correlationId, t.toString());
                        return null;
                    });
        }
    }

    private void deliver(ProcessingEvent event) {
        try {
            sink.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event sink failed on {} for {}: {}", event.type(), correlationId, e.toString());
        }
    }

    /**
     * Completes when every event emitted so far has been delivered.
     */
    public synchronized CompletableFuture<Void> drained() {
        return tail;
    }
}
