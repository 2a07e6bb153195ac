package com.phillippitts.scantomack.config.ocr;

import com.phillippitts.scantomack.config.properties.BridgeProperties;
import com.phillippitts.scantomack.service.ocr.RecognitionEngine;
import com.phillippitts.scantomack.service.ocr.bridge.DefaultProcessFactory;
import com.phillippitts.scantomack.service.ocr.bridge.EasyOcrEngine;
import com.phillippitts.scantomack.service.ocr.bridge.PaddleOcrEngine;
import com.phillippitts.scantomack.service.ocr.bridge.ProcessFactory;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import com.phillippitts.scantomack.service.ocr.tesseract.TesseractEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Wires one bean per enabled engine plus the registry that owns their lifecycle.
 *
 * <p>Engines are only constructed here; the registry's {@code initialize} starts and probes them
 * once the context is up, and {@code dispose} closes them on shutdown.
 */
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ocr.tesseract", name = "enabled", havingValue = "true")
    public TesseractEngine tesseractEngine(TesseractConfig config, ApplicationEventPublisher publisher) {
        return new TesseractEngine(config, publisher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ocr.bridge.easyocr", name = "enabled", havingValue = "true")
    public EasyOcrEngine easyOcrEngine(BridgeProperties properties, ProcessFactory processFactory,
                                       ApplicationEventPublisher publisher) {
        return new EasyOcrEngine(properties, processFactory, publisher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ocr.bridge.paddleocr", name = "enabled", havingValue = "true")
    public PaddleOcrEngine paddleOcrEngine(BridgeProperties properties, ProcessFactory processFactory,
                                           ApplicationEventPublisher publisher) {
        return new PaddleOcrEngine(properties, processFactory, publisher);
    }

    /**
     * Registry over whichever engines are enabled; zero engines is a valid (UNHEALTHY) setup.
     */
    @Bean(initMethod = "initialize", destroyMethod = "dispose")
    public EngineRegistry engineRegistry(ObjectProvider<RecognitionEngine> engines, BridgeProperties properties) {
        List<RecognitionEngine> configured = engines.orderedStream().toList();
        return new EngineRegistry(configured, Duration.ofMillis(properties.getProbeTimeoutMs()));
    }
}
