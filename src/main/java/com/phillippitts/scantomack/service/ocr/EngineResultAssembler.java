package com.phillippitts.scantomack.service.ocr;

import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.QualityMetrics;
import com.phillippitts.scantomack.domain.RecognizedPage;
import com.phillippitts.scantomack.domain.ResultMetadata;
import com.phillippitts.scantomack.service.ocr.layout.PageLayoutBuilder;
import com.phillippitts.scantomack.service.quality.QualityMetricsCalculator;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw word list into a fully structured {@link EngineResult}: layout tree, quality
 * metrics and provenance metadata.
 *
 * <p>All engines report a single page today; multi-page documents are not split.
 */
public final class EngineResultAssembler {

    private final QualityMetricsCalculator calculator;
    private final Clock clock;

    public EngineResultAssembler(QualityMetricsCalculator calculator) {
        this(calculator, Clock.systemUTC());
    }

    public EngineResultAssembler(QualityMetricsCalculator calculator, Clock clock) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public EngineResult assemble(EngineId engine,
                                 RawRecognition raw,
                                 DocumentImage document,
                                 String language,
                                 long durationMs,
                                 String correlationId,
                                 List<String> preprocessingSteps) {
        RecognizedPage page = PageLayoutBuilder.buildPage(1, raw.words());
        List<RecognizedPage> pages = List.of(page);
        QualityMetrics metrics = calculator.calculate(pages, document.width(), document.height());
        ResultMetadata metadata = new ResultMetadata(correlationId, clock.instant(),
                preprocessingSteps, List.of(), raw.engineVersion());
        return EngineResult.of(engine, pages, durationMs, language, metrics, metadata);
    }
}
