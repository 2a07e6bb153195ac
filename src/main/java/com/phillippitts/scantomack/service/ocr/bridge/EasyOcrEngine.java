package com.phillippitts.scantomack.service.ocr.bridge;

import com.phillippitts.scantomack.config.properties.BridgeProperties;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.LanguageCodes;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Set;

/**
 * EasyOCR behind a Python bridge. Strong on receipts and forms.
 */
public class EasyOcrEngine extends BridgedRecognitionEngine {

    static final String SCRIPT = "easyocr_bridge.py";

    private static final EngineCapabilities CAPABILITIES = new EngineCapabilities(
            Set.of("en", "es", "fr", "de", "zh", "ja", "ko", "ar", "hi", "ru"),
            Set.of("jpg", "jpeg", "png", "bmp", "tiff"),
            Set.of("text_detection", "paragraph_detection", "confidence_scoring"),
            Set.of("receipts", "invoices", "forms"),
            1);

    public EasyOcrEngine(BridgeProperties properties, ApplicationEventPublisher publisher) {
        this(properties, new DefaultProcessFactory(), publisher);
    }

    public EasyOcrEngine(BridgeProperties properties, ProcessFactory processFactory,
                         ApplicationEventPublisher publisher) {
        super(properties, processFactory, publisher);
    }

    @Override
    public EngineId id() {
        return EngineId.EASYOCR;
    }

    @Override
    protected String scriptName() {
        return SCRIPT;
    }

    @Override
    protected BridgeProperties.EngineSettings settings(BridgeProperties properties) {
        return properties.getEasyocr();
    }

    @Override
    protected String engineLanguage(String language) {
        return LanguageCodes.forEasyOcr(language);
    }

    @Override
    public EngineCapabilities capabilities() {
        return CAPABILITIES;
    }
}
