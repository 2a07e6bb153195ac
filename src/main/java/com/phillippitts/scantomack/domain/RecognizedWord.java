package com.phillippitts.scantomack.domain;

import java.util.Objects;

/**
 * Single word as reported by an engine.
 *
 * @param text           recognized text (may be empty, never null)
 * @param confidence     confidence in [0,1]
 * @param bbox           word bounds in source-image pixels
 * @param lineIndex      informational line index assigned during layout, or null
 * @param paragraphIndex informational paragraph index assigned during layout, or null
 * @param blockIndex     engine-reported block index, or null
 */
public record RecognizedWord(
        String text,
        double confidence,
        BoundingBox bbox,
        Integer lineIndex,
        Integer paragraphIndex,
        Integer blockIndex
) {

    public RecognizedWord {
        Objects.requireNonNull(text, "Word text must not be null");
        Objects.requireNonNull(bbox, "Word bounding box must not be null");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static RecognizedWord of(String text, double confidence, BoundingBox bbox) {
        return new RecognizedWord(text, confidence, bbox, null, null, null);
    }

    /**
     * Copy with layout indices filled in.
     */
    public RecognizedWord withLayout(int line, int paragraph) {
        return new RecognizedWord(text, confidence, bbox, line, paragraph, blockIndex);
    }
}
