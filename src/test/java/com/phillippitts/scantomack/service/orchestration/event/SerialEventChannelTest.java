package com.phillippitts.scantomack.service.orchestration.event;

import com.phillippitts.scantomack.domain.ProcessingEvent;
import com.phillippitts.scantomack.testutil.RecordingEventSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SerialEventChannelTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void deliversInEmissionOrderOnMultiThreadedExecutor() throws Exception {
        RecordingEventSink sink = new RecordingEventSink();
        SerialEventChannel channel = new SerialEventChannel("cid-7", sink, executor);

        for (int i = 0; i < 200; i++) {
            channel.emit(ProcessingEvent.Type.WARNING, Map.of("seq", i));
        }
        channel.drained().get(5, TimeUnit.SECONDS);

        List<Object> sequence = new ArrayList<>();
        sink.events().forEach(e -> sequence.add(e.payload().get("seq")));
        assertThat(sequence).containsExactlyElementsOf(IntStream.range(0, 200).boxed().toList());
        assertThat(sink.events()).allMatch(e -> "cid-7".equals(e.correlationId()));
    }

    @Test
    void failingSinkDoesNotBreakTheChain() throws Exception {
        RecordingEventSink recorded = new RecordingEventSink();
        AtomicBoolean first = new AtomicBoolean(true);
        SerialEventChannel channel = new SerialEventChannel("cid", event -> {
            if (first.getAndSet(false)) {
                throw new IllegalStateException("client went away");
            }
            recorded.onEvent(event);
        }, executor);

        channel.emit(ProcessingEvent.Type.STARTED);
        channel.emit(ProcessingEvent.Type.COMPLETED);
        channel.drained().get(5, TimeUnit.SECONDS);

        assertThat(recorded.types()).containsExactly(ProcessingEvent.Type.COMPLETED);
    }

    @Test
    void rejectedDeliveryDropsOnlyThatEvent() {
        RecordingEventSink sink = new RecordingEventSink();
        AtomicBoolean reject = new AtomicBoolean(true);
        SerialEventChannel channel = new SerialEventChannel("cid", sink, task -> {
            if (reject.getAndSet(false)) {
                throw new RejectedExecutionException("queue full");
            }
            task.run();
        });

        channel.emit(ProcessingEvent.Type.STARTED);
        channel.emit(ProcessingEvent.Type.COMPLETED);

        await().atMost(Duration.ofSeconds(2)).until(() -> channel.drained().isDone());
        assertThat(channel.drained().isCompletedExceptionally()).isFalse();
        assertThat(sink.types()).containsExactly(ProcessingEvent.Type.COMPLETED);
    }
}
