package com.phillippitts.scantomack.service.combine;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.EnsembleResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges the successful results of an ensemble run into one {@link EnsembleResult}.
 *
 * <p>The configured {@link ResultSelector} picks the base result, whose pages, text and
 * confidence are re-tagged as {@link EngineId#ENSEMBLE}. The agreement score is the mean
 * pairwise {@link TextSimilarity} of all engine texts. The combined duration is the slowest
 * engine's, since engines run in parallel.
 */
public class ResultCombiner {

    private static final Logger LOG = LogManager.getLogger(ResultCombiner.class);

    static final String POSTPROCESSING_STEP = "ensemble_combination";

    private final ResultSelector selector;

    public ResultCombiner(ResultSelector selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    /**
     * @param results successful results keyed by engine (at least one)
     * @throws IllegalArgumentException if results is empty
     */
    public EnsembleResult combine(Map<EngineId, EngineResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("Cannot combine zero engine results");
        }
        Map<EngineId, EngineResult> ordered = new EnumMap<>(results);
        EngineResult base = selector.select(ordered);

        List<String> texts = new ArrayList<>(ordered.size());
        long slowest = 0;
        for (EngineResult r : ordered.values()) {
            texts.add(r.text());
            slowest = Math.max(slowest, r.durationMs());
        }
        double agreement = Math.max(0.0, Math.min(1.0, TextSimilarity.agreement(texts)));

        EngineResult combined = new EngineResult(EngineId.ENSEMBLE, base.pages(), base.text(), base.confidence(),
                slowest, base.language(), base.qualityMetrics(),
                base.metadata().withPostprocessing(POSTPROCESSING_STEP), base.errors(), base.warnings());

        LOG.debug("Combined {} results via {}: base={}, agreement={}",
                ordered.size(), selector.method(), base.engine(), String.format("%.3f", agreement));
        return new EnsembleResult(combined, ordered, selector.method(), agreement);
    }

    public ResultSelector selector() {
        return selector;
    }
}
