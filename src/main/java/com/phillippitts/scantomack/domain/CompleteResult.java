package com.phillippitts.scantomack.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything a caller gets back for one processed document.
 *
 * <p>Only validation errors and total engine failure abort a request; every other problem is
 * reported through {@link #errors()} and {@link #warnings()} next to a degraded result.
 *
 * @param recognition               engine or ensemble result
 * @param postProcessedText         corrected text, or the raw text when post-processing was skipped or failed
 * @param textCorrections           edits applied by post-processing
 * @param semanticConfidence        post-processor confidence, or null when unavailable
 * @param overallQuality            weighted quality score in [0,1]
 * @param processingRecommendations human-readable hints for low-quality components
 * @param totalProcessingTimeMs     end-to-end wall-clock time
 * @param timings                   per-stage durations
 * @param metadata                  request provenance
 * @param errors                    non-fatal stage errors
 * @param warnings                  stage warnings
 */
public record CompleteResult(
        RecognitionResult recognition,
        String postProcessedText,
        List<TextCorrection> textCorrections,
        Double semanticConfidence,
        double overallQuality,
        List<String> processingRecommendations,
        long totalProcessingTimeMs,
        StageTimings timings,
        Metadata metadata,
        List<StageError> errors,
        List<StageWarning> warnings
) {

    public CompleteResult {
        Objects.requireNonNull(recognition, "recognition");
        Objects.requireNonNull(postProcessedText, "postProcessedText");
        Objects.requireNonNull(timings, "timings");
        Objects.requireNonNull(metadata, "metadata");
        textCorrections = textCorrections == null ? List.of() : List.copyOf(textCorrections);
        processingRecommendations = processingRecommendations == null
                ? List.of() : List.copyOf(processingRecommendations);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public CompleteResult withWarning(StageWarning warning) {
        List<StageWarning> all = new ArrayList<>(warnings);
        all.add(warning);
        return new CompleteResult(recognition, postProcessedText, textCorrections, semanticConfidence,
                overallQuality, processingRecommendations, totalProcessingTimeMs, timings, metadata, errors, all);
    }

    public enum Stage { PREPROCESSING, OCR, POSTPROCESSING, QUALITY_ASSESSMENT, CACHE }

    public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

    public enum Impact { LOW, MEDIUM, HIGH }

    public record StageTimings(long preprocessingMs, long ocrMs, long postprocessingMs, long qualityAssessmentMs) {
    }

    public record Metadata(String correlationId, String processingId, Instant timestamp, String version,
                           EngineId engineUsed) {
    }

    public record StageError(Stage stage, String error, Severity severity, String recoveryAction) {
    }

    public record StageWarning(Stage stage, String message, Impact impact) {
    }
}
