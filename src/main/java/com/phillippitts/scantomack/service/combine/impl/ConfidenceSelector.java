package com.phillippitts.scantomack.service.combine.impl;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.service.combine.AbstractResultSelector;

import java.util.EnumMap;

/**
 * Selects the result with the highest overall confidence.
 *
 * <p>Tie-breaking: the engine declared first in {@link EngineId} wins, so Tesseract beats the
 * bridged engines on equal scores.
 */
public final class ConfidenceSelector extends AbstractResultSelector {

    @Override
    protected EngineResult doSelect(EnumMap<EngineId, EngineResult> results) {
        return mostConfident(results);
    }

    @Override
    public CombinationMethod method() {
        return CombinationMethod.CONFIDENCE_WEIGHTED;
    }
}
