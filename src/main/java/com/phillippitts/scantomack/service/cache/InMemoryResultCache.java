package com.phillippitts.scantomack.service.cache;

import com.phillippitts.scantomack.domain.CompleteResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory LRU cache with a fixed time-to-live per entry.
 *
 * <p>Entries expire lazily on lookup. Contents are lost on restart.
 *
 * <p>Thread Safety: all access is synchronized on this instance.
 */
public class InMemoryResultCache implements ResultCache {

    private static final Logger LOG = LogManager.getLogger(InMemoryResultCache.class);

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<String, Entry> entries;

    public InMemoryResultCache(int maxEntries, Duration ttl) {
        this(maxEntries, ttl, Clock.systemUTC());
    }

    public InMemoryResultCache(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > InMemoryResultCache.this.maxEntries;
            }
        };
    }

    @Override
    public synchronized Optional<CompleteResult> lookup(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            LOG.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.result());
    }

    @Override
    public synchronized void store(String key, CompleteResult result) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        entries.put(key, new Entry(result, clock.instant().plus(ttl)));
    }

    public synchronized int size() {
        return entries.size();
    }

    private record Entry(CompleteResult result, Instant expiresAt) {
    }
}
