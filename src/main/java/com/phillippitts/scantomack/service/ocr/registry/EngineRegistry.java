package com.phillippitts.scantomack.service.ocr.registry;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.EngineFailureEvent;
import com.phillippitts.scantomack.service.ocr.RecognitionEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifecycle of every configured recognition engine and answers which ones may be used.
 *
 * <p>{@link #initialize()} starts and probes each engine; engines that fail either step are
 * logged, closed and left out. The registry itself never fails start-up: a service with zero
 * engines still boots and reports UNHEALTHY.
 *
 * <p>Thread Safety: the available-engine map is replaced wholesale in {@link #initialize()} and
 * {@link #dispose()} only. Runtime eviction after a bridge failure goes through a concurrent set,
 * so readers never lock.
 */
public class EngineRegistry {

    private static final Logger LOG = LogManager.getLogger(EngineRegistry.class);

    private final Map<EngineId, RecognitionEngine> configured;
    private final Duration probeTimeout;

    private volatile Map<EngineId, RecognitionEngine> available = Map.of();
    private final Set<EngineId> evicted = ConcurrentHashMap.newKeySet();

    private boolean initialized = false;
    private boolean disposed = false;

    public EngineRegistry(List<RecognitionEngine> engines, Duration probeTimeout) {
        Objects.requireNonNull(engines, "engines");
        Map<EngineId, RecognitionEngine> map = new EnumMap<>(EngineId.class);
        for (RecognitionEngine engine : engines) {
            if (!engine.id().isDispatchable()) {
                throw new IllegalArgumentException("Engine id is not dispatchable: " + engine.id());
            }
            if (map.putIfAbsent(engine.id(), engine) != null) {
                throw new IllegalArgumentException("Duplicate engine: " + engine.id());
            }
        }
        this.configured = Collections.unmodifiableMap(map);
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
    }

    /**
     * Starts and probes every configured engine. Idempotent; never throws.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        LOG.info("Initializing OCR engines: {}", configured.keySet());
        Map<EngineId, RecognitionEngine> ready = new EnumMap<>(EngineId.class);
        for (RecognitionEngine engine : configured.values()) {
            EngineId id = engine.id();
            try {
                engine.initialize();
                if (engine.probe(probeTimeout)) {
                    ready.put(id, engine);
                    LOG.info("Engine {} available", id);
                } else {
                    LOG.warn("Engine {} failed its probe within {}ms; disabling it", id, probeTimeout.toMillis());
                    closeQuietly(engine);
                }
            } catch (RuntimeException e) {
                LOG.warn("Engine {} failed to initialize: {}", id, e.getMessage());
                closeQuietly(engine);
            }
        }
        this.available = Collections.unmodifiableMap(ready);
        evicted.clear();
        initialized = true;
        disposed = false;
        if (ready.isEmpty()) {
            LOG.warn("No OCR engines available; every request will fail until an engine is configured");
        } else {
            LOG.info("OCR engines ready: {}", ready.keySet());
        }
    }

    /**
     * @return engines that passed start-up and are still healthy
     */
    public Set<EngineId> availableEngines() {
        Set<EngineId> ids = EnumSet.noneOf(EngineId.class);
        for (Map.Entry<EngineId, RecognitionEngine> e : available.entrySet()) {
            if (!evicted.contains(e.getKey()) && e.getValue().isHealthy()) {
                ids.add(e.getKey());
            }
        }
        return ids;
    }

    public boolean isAvailable(EngineId id) {
        return availableEngines().contains(id);
    }

    /**
     * @throws EngineUnavailableException if the engine is not available
     */
    public EngineCapabilities capabilitiesOf(EngineId id) {
        return engine(id).capabilities();
    }

    /**
     * @throws EngineUnavailableException if the engine was never configured, failed start-up, or was evicted
     */
    public RecognitionEngine engine(EngineId id) {
        Objects.requireNonNull(id, "id");
        RecognitionEngine engine = available.get(id);
        if (engine == null || evicted.contains(id) || !engine.isHealthy()) {
            throw new EngineUnavailableException("engine is not available", id);
        }
        return engine;
    }

    public EngineHealthReport health() {
        Map<EngineId, Boolean> status = new EnumMap<>(EngineId.class);
        Set<EngineId> up = availableEngines();
        int workers = 0;
        int processes = 0;
        for (RecognitionEngine engine : configured.values()) {
            boolean ok = up.contains(engine.id());
            status.put(engine.id(), ok);
            if (ok) {
                workers += engine.workerCount();
                processes += engine.processCount();
            }
        }
        return new EngineHealthReport(
                up.isEmpty() ? EngineHealthReport.Status.UNHEALTHY : EngineHealthReport.Status.HEALTHY,
                status, workers, processes);
    }

    /**
     * Removes an engine that reported a fatal failure (bridge timeout or process death).
     */
    @EventListener
    public void onEngineFailure(EngineFailureEvent event) {
        RecognitionEngine engine = available.get(event.engine());
        if (engine == null || engine.isHealthy()) {
            return;
        }
        if (evicted.add(event.engine())) {
            LOG.warn("Evicted engine {} after failure: {}", event.engine(), event.message());
        }
    }

    /**
     * Closes every configured engine. Failures are logged and collected; the rest still close.
     * Idempotent and safe after a partial {@link #initialize()}.
     */
    public synchronized void dispose() {
        if (disposed) {
            return;
        }
        List<String> failures = new ArrayList<>();
        for (RecognitionEngine engine : configured.values()) {
            try {
                engine.close();
            } catch (RuntimeException e) {
                failures.add(engine.id() + ": " + e.getMessage());
                LOG.warn("Failed to close engine {}: {}", engine.id(), e.toString());
            }
        }
        this.available = Map.of();
        evicted.clear();
        disposed = true;
        initialized = false;
        if (failures.isEmpty()) {
            LOG.info("OCR engines disposed");
        } else {
            LOG.warn("OCR engines disposed with {} failure(s): {}", failures.size(), failures);
        }
    }

    private static void closeQuietly(RecognitionEngine engine) {
        try {
            engine.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing failed engine {}: {}", engine.id(), e.toString());
        }
    }
}
