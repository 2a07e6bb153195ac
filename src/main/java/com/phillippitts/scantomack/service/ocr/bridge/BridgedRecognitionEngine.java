package com.phillippitts.scantomack.service.ocr.bridge;

import com.phillippitts.scantomack.config.properties.BridgeProperties;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.RecognizedWord;
import com.phillippitts.scantomack.exception.BridgeProtocolException;
import com.phillippitts.scantomack.exception.EngineTimeoutException;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import com.phillippitts.scantomack.service.ocr.AbstractRecognitionEngine;
import com.phillippitts.scantomack.service.ocr.EngineEventPublisher;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for engines that run in a Python child process behind a {@link ProcessBridge}.
 *
 * <p>Subclasses name their bundled script and translate language codes; everything else
 * (spawning, probing, timeouts, eviction) lives here.
 *
 * <p>When a call times out the bridge taints itself and terminates. This engine then closes,
 * publishes an {@link com.phillippitts.scantomack.service.ocr.EngineFailureEvent} and reports
 * unhealthy, which removes it from the registry's available set.
 */
public abstract class BridgedRecognitionEngine extends AbstractRecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(BridgedRecognitionEngine.class);

    private final BridgeProperties properties;
    private final ProcessFactory processFactory;
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private ProcessBridge bridge;

    protected BridgedRecognitionEngine(BridgeProperties properties,
                                       ProcessFactory processFactory,
                                       ApplicationEventPublisher publisher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.publisher = publisher;
    }

    /**
     * File name of the bundled script under {@code classpath:bridges/}.
     */
    protected abstract String scriptName();

    protected abstract BridgeProperties.EngineSettings settings(BridgeProperties properties);

    /**
     * Maps a Tesseract-style language code to the engine's own code.
     */
    protected abstract String engineLanguage(String language);

    @Override
    protected void doInitialize() {
        String override = settings(properties).getScript();
        try {
            Path script = BridgeScripts.resolve(scriptName(), override);
            List<String> command = List.of(properties.getPython(), "-u", script.toString());
            this.bridge = ProcessBridge.start(id(), processFactory, command, script.getParent(),
                    properties.getMaxStdoutBytes());
        } catch (IOException e) {
            EngineEventPublisher.publishFailure(publisher, id(), "initialize failure", e,
                    Map.of("python", properties.getPython(), "script", String.valueOf(override)));
            throw RecognitionExceptionBuilder.create("Failed to start " + id() + " bridge")
                    .engine(id())
                    .cause(e)
                    .metadata("python", properties.getPython())
                    .build();
        }
    }

    @Override
    public boolean probe(Duration timeout) {
        ProcessBridge local = currentBridge();
        return local != null && local.probe(timeout);
    }

    @Override
    public RawRecognition recognize(DocumentImage document, String language, Duration timeout) {
        Objects.requireNonNull(document, "document");
        ensureInitialized();
        ProcessBridge local = currentBridge();
        if (local == null) {
            throw new EngineUnavailableException("bridge not running", id());
        }
        try {
            List<RecognizedWord> words = local.invoke(document.bytes(), engineLanguage(language), timeout);
            return new RawRecognition(words, id().wireName() + "-bridge");
        } catch (EngineTimeoutException e) {
            if (local.isTainted()) {
                retire("bridge timeout", e, document);
            }
            throw e;
        } catch (BridgeProtocolException e) {
            if (!local.isAlive()) {
                retire("bridge process died", e, document);
            }
            throw e;
        }
    }

    private void retire(String reason, RuntimeException cause, DocumentImage document) {
        LOG.warn("Retiring {} engine: {}", id(), reason);
        EngineEventPublisher.publishFailure(publisher, id(), reason, cause,
                Map.of("document", document.id(), "stderr", stderrSnippet()));
        close();
    }

    private ProcessBridge currentBridge() {
        synchronized (lock) {
            return bridge;
        }
    }

    private String stderrSnippet() {
        ProcessBridge local = currentBridge();
        return local == null ? "" : local.stderrSnippet();
    }

    @Override
    protected boolean isOperational() {
        return bridge != null && bridge.isAlive() && !bridge.isTainted();
    }

    @Override
    public int processCount() {
        ProcessBridge local = currentBridge();
        return local != null && local.isAlive() ? 1 : 0;
    }

    @Override
    protected void doClose() {
        if (bridge != null) {
            try {
                bridge.terminate();
            } finally {
                bridge = null;
            }
        }
        LOG.info("{} engine closed", id());
    }
}
