package com.phillippitts.scantomack.service.cache;

import com.phillippitts.scantomack.domain.CompleteResult;

import java.util.Optional;

/**
 * Stores complete results by request key (document identity plus normalized options).
 *
 * <p>Implementations may throw; the orchestrator logs and ignores cache failures.
 */
public interface ResultCache {

    Optional<CompleteResult> lookup(String key);

    void store(String key, CompleteResult result);
}
