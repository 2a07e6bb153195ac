package com.phillippitts.scantomack.service.ocr.bridge;

import com.phillippitts.scantomack.config.properties.BridgeProperties;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.LanguageCodes;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Set;

/**
 * PaddleOCR behind a Python bridge, with angle classification for rotated text.
 */
public class PaddleOcrEngine extends BridgedRecognitionEngine {

    static final String SCRIPT = "paddleocr_bridge.py";

    private static final EngineCapabilities CAPABILITIES = new EngineCapabilities(
            Set.of("en", "ch", "ta", "te", "ka", "ja", "ko"),
            Set.of("jpg", "jpeg", "png", "bmp", "tiff"),
            Set.of("text_detection", "angle_classification", "layout_analysis", "multilingual"),
            Set.of("complex_layouts", "rotated_text", "multilingual_documents"),
            1);

    public PaddleOcrEngine(BridgeProperties properties, ApplicationEventPublisher publisher) {
        this(properties, new DefaultProcessFactory(), publisher);
    }

    public PaddleOcrEngine(BridgeProperties properties, ProcessFactory processFactory,
                           ApplicationEventPublisher publisher) {
        super(properties, processFactory, publisher);
    }

    @Override
    public EngineId id() {
        return EngineId.PADDLEOCR;
    }

    @Override
    protected String scriptName() {
        return SCRIPT;
    }

    @Override
    protected BridgeProperties.EngineSettings settings(BridgeProperties properties) {
        return properties.getPaddleocr();
    }

    @Override
    protected String engineLanguage(String language) {
        return LanguageCodes.forPaddleOcr(language);
    }

    @Override
    public EngineCapabilities capabilities() {
        return CAPABILITIES;
    }
}
