package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.ProcessingOptions;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.exception.RecognitionException;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import com.phillippitts.scantomack.service.ocr.EngineResultAssembler;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import com.phillippitts.scantomack.service.ocr.RecognitionEngine;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.preprocess.PreprocessedDocument;
import com.phillippitts.scantomack.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * One engine call: resolve the engine, recognize, assemble the structured result, record metrics.
 *
 * <p>Unexpected runtime failures from an engine are wrapped into a {@link RecognitionException}
 * so callers only deal with the recognition hierarchy plus
 * {@link InvalidDocumentException}.
 */
public class EngineInvoker {

    private static final Logger LOG = LogManager.getLogger(EngineInvoker.class);

    private final EngineRegistry registry;
    private final EngineResultAssembler assembler;
    private final ProcessingMetricsPublisher metrics;

    public EngineInvoker(EngineRegistry registry, EngineResultAssembler assembler, ProcessingMetricsPublisher metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.metrics = metrics == null ? ProcessingMetricsPublisher.NOOP : metrics;
    }

    /**
     * @throws RecognitionException on any engine failure (EngineUnavailableException when not available)
     * @throws InvalidDocumentException if the engine cannot decode the image
     */
    public EngineResult invoke(EngineId id, PreprocessedDocument document, ProcessingOptions options) {
        long start = System.nanoTime();
        try {
            RecognitionEngine engine = registry.engine(id);
            RawRecognition raw = engine.recognize(document.document(), options.language(), options.timeout());
            long elapsedNanos = System.nanoTime() - start;
            EngineResult result = assembler.assemble(id, raw, document.document(), options.language(),
                    TimeUtils.nanosToMillis(elapsedNanos), options.correlationId(), document.appliedSteps());
            metrics.recordSuccess(id, elapsedNanos);
            LOG.debug("{} recognized {} chars in {}ms (confidence={})", id, result.text().length(),
                    result.durationMs(), String.format("%.3f", result.confidence()));
            return result;
        } catch (RecognitionException e) {
            metrics.recordFailure(id, e);
            throw e;
        } catch (InvalidDocumentException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("{} failed unexpectedly", id, e);
            RecognitionException wrapped = RecognitionExceptionBuilder.create("Unexpected engine failure")
                    .engine(id)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
            metrics.recordFailure(id, wrapped);
            throw wrapped;
        }
    }
}
