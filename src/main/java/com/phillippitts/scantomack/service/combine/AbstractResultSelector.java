package com.phillippitts.scantomack.service.combine;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;

import java.util.EnumMap;
import java.util.Map;

/**
 * Template for selectors: rejects empty input, short-circuits a single result and hands
 * subclasses an {@link EnumMap} so iteration order is always engine declaration order.
 */
public abstract class AbstractResultSelector implements ResultSelector {

    @Override
    public final EngineResult select(Map<EngineId, EngineResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("results must not be empty");
        }
        if (results.size() == 1) {
            return results.values().iterator().next();
        }
        return doSelect(new EnumMap<>(results));
    }

    /**
     * @param results at least two results in engine order
     */
    protected abstract EngineResult doSelect(EnumMap<EngineId, EngineResult> results);

    /**
     * Highest confidence; earliest engine wins ties.
     */
    protected static EngineResult mostConfident(Map<EngineId, EngineResult> results) {
        EngineResult best = null;
        for (EngineResult r : results.values()) {
            if (best == null || r.confidence() > best.confidence()) {
                best = r;
            }
        }
        return best;
    }
}
