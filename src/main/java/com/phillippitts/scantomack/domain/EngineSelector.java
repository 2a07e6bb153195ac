package com.phillippitts.scantomack.domain;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Which engines a request runs on.
 */
public sealed interface EngineSelector permits EngineSelector.Single, EngineSelector.Explicit, EngineSelector.Ensemble {

    /** Stable form used in request keys. */
    String key();

    /**
     * One engine, retried and then substituted by fallbacks on failure.
     */
    record Single(EngineId engine) implements EngineSelector {
        public Single {
            Objects.requireNonNull(engine, "engine");
            if (!engine.isDispatchable()) {
                throw new IllegalArgumentException("Engine " + engine + " is not a dispatch target");
            }
        }

        @Override
        public String key() {
            return engine.wireName();
        }
    }

    /**
     * Listed engines run in parallel and combined.
     */
    record Explicit(List<EngineId> engines) implements EngineSelector {
        public Explicit {
            if (engines == null || engines.isEmpty()) {
                throw new IllegalArgumentException("Explicit engine list must not be empty");
            }
            for (EngineId id : engines) {
                if (id == null || !id.isDispatchable()) {
                    throw new IllegalArgumentException("Engine " + id + " is not a dispatch target");
                }
            }
            engines = engines.stream().distinct().toList();
        }

        @Override
        public String key() {
            return engines.stream().map(EngineId::wireName).sorted().collect(Collectors.joining("+"));
        }
    }

    /**
     * All currently available engines run in parallel and combined.
     */
    record Ensemble() implements EngineSelector {
        @Override
        public String key() {
            return EngineId.ENSEMBLE.wireName();
        }
    }

    static EngineSelector single(EngineId engine) {
        return engine == EngineId.ENSEMBLE ? new Ensemble() : new Single(engine);
    }

    static EngineSelector explicit(List<EngineId> engines) {
        return new Explicit(engines);
    }

    static EngineSelector ensemble() {
        return new Ensemble();
    }
}
