package com.phillippitts.scantomack.service.postprocess;

import com.phillippitts.scantomack.domain.ProcessingOptions;

/**
 * Corrects recognized text and scores how much of it reads as real language.
 *
 * <p>Failures are thrown; the orchestrator keeps the raw text and records a warning.
 */
@FunctionalInterface
public interface TextPostProcessor {

    PostProcessingResult process(String text, ProcessingOptions options);
}
