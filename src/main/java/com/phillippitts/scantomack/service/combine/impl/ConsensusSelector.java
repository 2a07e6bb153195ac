package com.phillippitts.scantomack.service.combine.impl;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.service.combine.AbstractResultSelector;
import com.phillippitts.scantomack.service.combine.TextSimilarity;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Selects the medoid: the result whose text has the highest mean similarity to all the others.
 *
 * <p>With three engines this is majority voting on whole texts: when two engines agree, one of
 * them is chosen even if the outlier is more confident. Ties go to higher confidence, then to
 * engine order.
 */
public final class ConsensusSelector extends AbstractResultSelector {

    @Override
    protected EngineResult doSelect(EnumMap<EngineId, EngineResult> results) {
        List<EngineResult> list = new ArrayList<>(results.values());
        EngineResult best = null;
        double bestScore = -1.0;
        for (int i = 0; i < list.size(); i++) {
            double sum = 0.0;
            for (int j = 0; j < list.size(); j++) {
                if (i != j) {
                    sum += TextSimilarity.similarity(list.get(i).text(), list.get(j).text());
                }
            }
            double score = sum / (list.size() - 1);
            EngineResult candidate = list.get(i);
            if (best == null || score > bestScore
                    || (score == bestScore && candidate.confidence() > best.confidence())) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    @Override
    public CombinationMethod method() {
        return CombinationMethod.CONSENSUS;
    }
}
