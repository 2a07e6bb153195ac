package com.phillippitts.scantomack.service.combine;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;

import java.util.Map;

/**
 * Strategy that picks the base result of an ensemble run.
 *
 * <p><b>Available Strategies:</b>
 * <ul>
 *   <li>{@link com.phillippitts.scantomack.service.combine.impl.ConfidenceSelector} -
 *       highest overall confidence</li>
 *   <li>{@link com.phillippitts.scantomack.service.combine.impl.PreferenceSelector} -
 *       first engine of a configured order</li>
 *   <li>{@link com.phillippitts.scantomack.service.combine.impl.ConsensusSelector} -
 *       the result closest to all others</li>
 * </ul>
 *
 * <p>Implementations are stateless and thread-safe.
 */
public interface ResultSelector {

    /**
     * @param results non-empty successful results, iterated in {@link EngineId} order
     * @return one of the given results
     */
    EngineResult select(Map<EngineId, EngineResult> results);

    CombinationMethod method();
}
