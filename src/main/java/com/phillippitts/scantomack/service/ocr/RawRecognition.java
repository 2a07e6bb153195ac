package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.domain.RecognizedWord;

import java.util.List;

/**
 * Unstructured engine output: a flat word list before layout grouping.
 *
 * @param words         recognized words in engine order
 * @param engineVersion engine-reported version, or null
 */
public record RawRecognition(List<RecognizedWord> words, String engineVersion) {
    public RawRecognition {
        words = words == null ? List.of() : List.copyOf(words);
    }
}
