package com.phillippitts.scantomack.service.preprocess;

import com.phillippitts.scantomack.domain.DocumentImage;

import java.util.List;
import java.util.Objects;

/**
 * @param document     image to recognize
 * @param appliedSteps steps that were applied, in order
 */
public record PreprocessedDocument(DocumentImage document, List<String> appliedSteps) {
    public PreprocessedDocument {
        Objects.requireNonNull(document, "document");
        appliedSteps = appliedSteps == null ? List.of() : List.copyOf(appliedSteps);
    }

    public static PreprocessedDocument unchanged(DocumentImage document) {
        return new PreprocessedDocument(document, List.of());
    }
}
