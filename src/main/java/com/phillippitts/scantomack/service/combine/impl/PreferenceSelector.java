package com.phillippitts.scantomack.service.combine.impl;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.service.combine.AbstractResultSelector;

import java.util.EnumMap;
import java.util.List;

/**
 * Always prefers engines in a fixed order, regardless of confidence.
 *
 * <p>Useful when one engine is known to be better on the document kind at hand. If none of the
 * preferred engines produced a result, falls back to the most confident one.
 */
public final class PreferenceSelector extends AbstractResultSelector {

    private final List<EngineId> order;

    /**
     * @param order preferred engines, most preferred first
     * @throws IllegalArgumentException if order is empty
     */
    public PreferenceSelector(List<EngineId> order) {
        if (order == null || order.isEmpty()) {
            throw new IllegalArgumentException("preference order must not be empty");
        }
        this.order = List.copyOf(order);
    }

    @Override
    protected EngineResult doSelect(EnumMap<EngineId, EngineResult> results) {
        for (EngineId id : order) {
            EngineResult r = results.get(id);
            if (r != null) {
                return r;
            }
        }
        return mostConfident(results);
    }

    @Override
    public CombinationMethod method() {
        return CombinationMethod.PREFERENCE;
    }
}
