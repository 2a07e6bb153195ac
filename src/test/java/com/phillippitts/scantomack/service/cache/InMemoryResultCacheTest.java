package com.phillippitts.scantomack.service.cache;

import com.phillippitts.scantomack.domain.CompleteResult;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.phillippitts.scantomack.testutil.TestResults.completeResult;
import static com.phillippitts.scantomack.testutil.TestResults.engineResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResultCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final CompleteResult result = completeResult(engineResult(EngineId.TESSERACT, "cached text", 0.9));

    @Test
    void returnsStoredResultBeforeExpiry() {
        InMemoryResultCache cache = new InMemoryResultCache(10, Duration.ofMinutes(5), clock);
        cache.store("doc:opts", result);

        clock.advance(Duration.ofMinutes(4));

        assertThat(cache.lookup("doc:opts")).containsSame(result);
    }

    @Test
    void expiresEntriesAtTtl() {
        InMemoryResultCache cache = new InMemoryResultCache(10, Duration.ofMinutes(5), clock);
        cache.store("doc:opts", result);

        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.lookup("doc:opts")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsLeastRecentlyUsedBeyondCapacity() {
        InMemoryResultCache cache = new InMemoryResultCache(2, Duration.ofHours(1), clock);
        cache.store("a", result);
        cache.store("b", result);
        cache.lookup("a");

        cache.store("c", result);

        assertThat(cache.lookup("b")).isEmpty();
        assertThat(cache.lookup("a")).isPresent();
        assertThat(cache.lookup("c")).isPresent();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void missingKeyIsEmpty() {
        InMemoryResultCache cache = new InMemoryResultCache(2, Duration.ofHours(1), clock);

        assertThat(cache.lookup("nope")).isEmpty();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new InMemoryResultCache(0, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryResultCache(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void noOpCacheNeverReturnsAnything() {
        NoOpResultCache cache = new NoOpResultCache();
        cache.store("k", result);

        assertThat(cache.lookup("k")).isEmpty();
    }
}
