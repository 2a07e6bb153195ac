package com.phillippitts.scantomack.service.cache;

import com.phillippitts.scantomack.domain.CompleteResult;

import java.util.Optional;

/**
 * Cache used when caching is disabled: never hits, stores nothing.
 */
public final class NoOpResultCache implements ResultCache {

    @Override
    public Optional<CompleteResult> lookup(String key) {
        return Optional.empty();
    }

    @Override
    public void store(String key, CompleteResult result) {
        // nothing to store
    }
}
