package com.phillippitts.scantomack.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combination of several engines' results.
 *
 * @param combined          base result re-tagged as {@link EngineId#ENSEMBLE}
 * @param engineResults     successful per-engine results the combination was derived from
 * @param combinationMethod method used to pick the base
 * @param agreementScore    mean pairwise text similarity in [0,1]
 */
public record EnsembleResult(
        EngineResult combined,
        Map<EngineId, EngineResult> engineResults,
        CombinationMethod combinationMethod,
        double agreementScore
) implements RecognitionResult {

    public EnsembleResult {
        Objects.requireNonNull(combined, "combined");
        Objects.requireNonNull(combinationMethod, "combinationMethod");
        if (combined.engine() != EngineId.ENSEMBLE) {
            throw new IllegalArgumentException("Combined result must be tagged ensemble, got: " + combined.engine());
        }
        if (engineResults == null || engineResults.isEmpty()) {
            throw new IllegalArgumentException("Ensemble requires at least one engine result");
        }
        if (agreementScore < 0.0 || agreementScore > 1.0) {
            throw new IllegalArgumentException("Agreement score must be between 0.0 and 1.0, got: " + agreementScore);
        }
        engineResults = Collections.unmodifiableMap(new EnumMap<>(engineResults));
    }

    @Override
    public EngineId engine() {
        return EngineId.ENSEMBLE;
    }

    @Override
    public List<RecognizedPage> pages() {
        return combined.pages();
    }

    @Override
    public String text() {
        return combined.text();
    }

    @Override
    public double confidence() {
        return combined.confidence();
    }

    @Override
    public long durationMs() {
        return combined.durationMs();
    }

    @Override
    public String language() {
        return combined.language();
    }

    @Override
    public QualityMetrics qualityMetrics() {
        return combined.qualityMetrics();
    }

    @Override
    public ResultMetadata metadata() {
        return combined.metadata();
    }

    @Override
    public List<String> errors() {
        return combined.errors();
    }

    @Override
    public List<String> warnings() {
        return combined.warnings();
    }
}
