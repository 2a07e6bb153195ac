package com.phillippitts.scantomack.domain;

import java.util.List;

/**
 * Outcome of recognition: either a single engine's result or an ensemble combination.
 */
public sealed interface RecognitionResult permits EngineResult, EnsembleResult {

    EngineId engine();

    List<RecognizedPage> pages();

    String text();

    double confidence();

    long durationMs();

    String language();

    QualityMetrics qualityMetrics();

    ResultMetadata metadata();

    List<String> errors();

    List<String> warnings();
}
