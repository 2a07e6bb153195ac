package com.phillippitts.scantomack.service.preprocess;

import com.phillippitts.scantomack.domain.DocumentImage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Default preprocessor: recognizes the image exactly as uploaded.
 */
public final class PassThroughPreprocessor implements DocumentPreprocessor {

    private static final Logger LOG = LogManager.getLogger(PassThroughPreprocessor.class);

    @Override
    public PreprocessedDocument preprocess(DocumentImage document, List<String> requestedSteps) {
        if (requestedSteps != null && !requestedSteps.isEmpty()) {
            LOG.debug("No image filters installed; ignoring requested steps {}", requestedSteps);
        }
        return PreprocessedDocument.unchanged(document);
    }
}
