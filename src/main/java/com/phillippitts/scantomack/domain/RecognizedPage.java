package com.phillippitts.scantomack.domain;

import java.util.List;
import java.util.Objects;

/**
 * Root of the layout tree produced for one page of a document.
 *
 * @param pageNumber 1-based page number
 * @param text       paragraph texts joined by newlines
 * @param confidence mean of the paragraphs' confidences
 * @param bbox       union of paragraph bounds
 * @param paragraphs paragraphs in reading order
 */
public record RecognizedPage(
        int pageNumber,
        String text,
        double confidence,
        BoundingBox bbox,
        List<RecognizedParagraph> paragraphs
) {
    public RecognizedPage {
        Objects.requireNonNull(text, "Page text must not be null");
        Objects.requireNonNull(bbox, "Page bounding box must not be null");
        paragraphs = List.copyOf(paragraphs);
    }

    /** Lines of all paragraphs in reading order. */
    public List<RecognizedLine> lines() {
        return paragraphs.stream().flatMap(p -> p.lines().stream()).toList();
    }

    /** Words of all lines in reading order. */
    public List<RecognizedWord> words() {
        return lines().stream().flatMap(l -> l.words().stream()).toList();
    }
}
