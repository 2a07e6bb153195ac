package com.phillippitts.scantomack.service.orchestration.event;

import com.phillippitts.scantomack.domain.ProcessingEvent;

import java.util.Map;

/**
 * Per-request outlet for lifecycle events. Emission is fire-and-forget and never throws.
 */
public interface ProcessingEventChannel {

    ProcessingEventChannel NOOP = (type, payload) -> { };

    void emit(ProcessingEvent.Type type, Map<String, Object> payload);

    default void emit(ProcessingEvent.Type type) {
        emit(type, Map.of());
    }
}
