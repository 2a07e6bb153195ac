package com.phillippitts.scantomack.service.preprocess;

import com.phillippitts.scantomack.domain.DocumentImage;

import java.util.List;

/**
 * Hook for image clean-up before recognition (deskew, binarize, denoise...).
 *
 * <p>Implementations return the steps they actually applied so results can record them.
 * Failures are thrown; the orchestrator downgrades them to a warning and recognizes the
 * original image.
 */
@FunctionalInterface
public interface DocumentPreprocessor {

    /**
     * @param document       original image
     * @param requestedSteps step names from the request options (may be empty)
     */
    PreprocessedDocument preprocess(DocumentImage document, List<String> requestedSteps);
}
