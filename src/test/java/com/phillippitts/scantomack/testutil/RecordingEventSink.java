package com.phillippitts.scantomack.testutil;

import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventChannel;
import com.phillippitts.scantomack.service.orchestration.event.ProcessingEventSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects processing events. Usable both as a caller sink and, synchronously, as a channel.
 */
public class RecordingEventSink implements ProcessingEventSink, ProcessingEventChannel {

    private final List<ProcessingEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(ProcessingEvent event) {
        events.add(event);
    }

    @Override
    public void emit(ProcessingEvent.Type type, Map<String, Object> payload) {
        events.add(ProcessingEvent.of(type, null, payload));
    }

    public List<ProcessingEvent> events() {
        return List.copyOf(events);
    }

    public List<ProcessingEvent.Type> types() {
        return events.stream().map(ProcessingEvent::type).toList();
    }

    public List<ProcessingEvent> ofType(ProcessingEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }
}
