package com.phillippitts.scantomack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Vertically adjacent lines.
 *
 * @param confidence mean of the lines' confidences
 */
public record RecognizedParagraph(
        String text,
        double confidence,
        BoundingBox bbox,
        List<RecognizedLine> lines
) {
    public RecognizedParagraph {
        Objects.requireNonNull(text, "Paragraph text must not be null");
        Objects.requireNonNull(bbox, "Paragraph bounding box must not be null");
        lines = List.copyOf(lines);
    }
}
