package com.phillippitts.scantomack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one engine invocation.
 *
 * <p>{@code text} is always the page texts joined by newlines and {@code confidence} is always the
 * mean of the page confidences; use {@link #of} to have both derived from the pages.
 *
 * @param engine         engine that produced (or, for ensembles, tags) the result
 * @param pages          layout tree per page
 * @param text           flattened text
 * @param confidence     overall confidence in [0,1]
 * @param durationMs     wall-clock duration of the invocation
 * @param language       language code the engine was asked for
 * @param qualityMetrics quality profile of this output
 * @param metadata       provenance
 * @param errors         non-fatal errors reported alongside the result
 * @param warnings       warnings reported alongside the result
 */
public record EngineResult(
        EngineId engine,
        List<RecognizedPage> pages,
        String text,
        double confidence,
        long durationMs,
        String language,
        QualityMetrics qualityMetrics,
        ResultMetadata metadata,
        List<String> errors,
        List<String> warnings
) implements RecognitionResult {

    public EngineResult {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(qualityMetrics, "qualityMetrics");
        Objects.requireNonNull(metadata, "metadata");
        pages = List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!text.equals(flatten(pages))) {
            throw new IllegalArgumentException("Result text must equal the concatenated page texts");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    /**
     * Builds a result whose text and confidence are derived from its pages.
     */
    public static EngineResult of(EngineId engine,
                                  List<RecognizedPage> pages,
                                  long durationMs,
                                  String language,
                                  QualityMetrics qualityMetrics,
                                  ResultMetadata metadata) {
        double confidence = pages.stream().mapToDouble(RecognizedPage::confidence).average().orElse(0.0);
        return new EngineResult(engine, pages, flatten(pages), confidence, durationMs, language,
                qualityMetrics, metadata, List.of(), List.of());
    }

    /**
     * Same content re-tagged with another engine id and metadata.
     */
    public EngineResult retag(EngineId newEngine, ResultMetadata newMetadata) {
        return new EngineResult(newEngine, pages, text, confidence, durationMs, language,
                qualityMetrics, newMetadata, errors, warnings);
    }

    private static String flatten(List<RecognizedPage> pages) {
        StringBuilder sb = new StringBuilder();
        for (RecognizedPage page : pages) {
            if (sb.length() > 0 && !page.text().isEmpty()) {
                sb.append('\n');
            }
            sb.append(page.text());
        }
        return sb.toString();
    }
}
