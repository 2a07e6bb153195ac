package com.phillippitts.scantomack.service.postprocess;

import com.phillippitts.scantomack.domain.TextCorrection;

import java.util.List;
import java.util.Objects;

/**
 * @param correctedText      text after all corrections
 * @param corrections        applied edits, in application order
 * @param semanticConfidence share of recognizable words in [0,1], or null if not computed
 */
public record PostProcessingResult(String correctedText, List<TextCorrection> corrections, Double semanticConfidence) {
    public PostProcessingResult {
        Objects.requireNonNull(correctedText, "correctedText");
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
    }
}
