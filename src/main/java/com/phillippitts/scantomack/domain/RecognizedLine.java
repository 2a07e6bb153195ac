package com.phillippitts.scantomack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Words sharing a text row, ordered left to right.
 *
 * @param confidence mean of the words' confidences
 */
public record RecognizedLine(
        String text,
        double confidence,
        BoundingBox bbox,
        List<RecognizedWord> words
) {
    public RecognizedLine {
        Objects.requireNonNull(text, "Line text must not be null");
        Objects.requireNonNull(bbox, "Line bounding box must not be null");
        words = List.copyOf(words);
    }
}
