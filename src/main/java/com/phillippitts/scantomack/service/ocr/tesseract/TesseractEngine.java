package com.phillippitts.scantomack.service.ocr.tesseract;

import com.phillippitts.scantomack.config.ocr.TesseractConfig;
import com.phillippitts.scantomack.domain.DocumentImage;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.exception.EngineUnavailableException;
import com.phillippitts.scantomack.exception.InvalidDocumentException;
import com.phillippitts.scantomack.exception.RecognitionExceptionBuilder;
import com.phillippitts.scantomack.exception.TessdataNotFoundException;
import com.phillippitts.scantomack.service.ocr.AbstractRecognitionEngine;
import com.phillippitts.scantomack.service.ocr.EngineCapabilities;
import com.phillippitts.scantomack.service.ocr.EngineEventPublisher;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * In-process Tesseract engine backed by a {@link NativeWorkerPool}.
 *
 * <p>Each worker owns its own Tess4J handle. A call that times out stops waiting but leaves the
 * job running on its worker, so a slow page never corrupts a handle mid-recognition.
 *
 * <p>Thread-safe: any number of callers may submit concurrently; the pool queues them.
 */
public class TesseractEngine extends AbstractRecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(TesseractEngine.class);

    private static final Set<String> LANGUAGES = Set.of(
            "eng", "spa", "fra", "deu", "chi_sim", "chi_tra", "jpn", "kor", "ara", "hin", "rus");
    private static final Set<String> FORMATS = Set.of("jpg", "jpeg", "png", "bmp", "tiff", "pdf");
    private static final Set<String> FEATURES = Set.of(
            "text_detection", "layout_analysis", "confidence_scoring", "multiple_languages");
    private static final DocumentImage BLANK_PAGE = blankPage();

    private final TesseractConfig config;
    private final ApplicationEventPublisher publisher;
    private final Supplier<NativeRecognizer> recognizerFactory;

    // @GuardedBy("lock")
    private NativeWorkerPool pool;

    public TesseractEngine(TesseractConfig config, ApplicationEventPublisher publisher) {
        this(config, publisher, () -> new TesseractRecognizer(config));
    }

    /**
     * Test-friendly constructor with a custom recognizer per worker.
     */
    public TesseractEngine(TesseractConfig config,
                           ApplicationEventPublisher publisher,
                           Supplier<NativeRecognizer> recognizerFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
        this.recognizerFactory = Objects.requireNonNull(recognizerFactory, "recognizerFactory");
    }

    @Override
    public EngineId id() {
        return EngineId.TESSERACT;
    }

    /**
     * Verifies the tessdata directory and starts the worker pool.
     *
     * @throws TessdataNotFoundException if {@code ocr.tesseract.datapath} is not a directory
     */
    @Override
    protected void doInitialize() {
        LOG.info("Initializing Tesseract engine: datapath={}, language={}, psm={}, oem={}, workers={}",
                config.datapath(), config.language(), config.pageSegMode(), config.engineMode(), config.workers());
        if (!Files.isDirectory(Path.of(config.datapath()))) {
            EngineEventPublisher.publishFailure(publisher, id(), "tessdata missing", null,
                    Map.of("datapath", config.datapath()));
            throw new TessdataNotFoundException(config.datapath());
        }
        try {
            this.pool = NativeWorkerPool.start(config.workers(), recognizerFactory);
        } catch (RuntimeException e) {
            EngineEventPublisher.publishFailure(publisher, id(), "initialize failure", e,
                    Map.of("datapath", config.datapath()));
            throw RecognitionExceptionBuilder.create("Failed to initialize Tesseract")
                    .engine(id())
                    .cause(e)
                    .metadata("datapath", config.datapath())
                    .build();
        }
    }

    /**
     * Runs a blank page through the pool so a missing native library fails here rather than on
     * the first real document.
     */
    @Override
    public boolean probe(Duration timeout) {
        NativeWorkerPool localPool;
        synchronized (lock) {
            localPool = this.pool;
        }
        if (localPool == null || !localPool.isRunning()) {
            return false;
        }
        try {
            localPool.submit(BLANK_PAGE, config.language()).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            LOG.warn("Tesseract self-check did not finish within {}ms", timeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("Tesseract self-check failed: {}", cause.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (RuntimeException e) {
            LOG.warn("Tesseract self-check could not be submitted: {}", e.getMessage());
            return false;
        }
    }

    private static DocumentImage blankPage() {
        BufferedImage image = new BufferedImage(32, 32, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot encode self-check page", e);
        }
        return DocumentImage.of(out.toByteArray());
    }

    /**
     * Queues the document on the pool and waits up to {@code timeout}.
     *
     * @throws com.phillippitts.scantomack.exception.EngineTimeoutException if no worker finished in time
     * @throws InvalidDocumentException if the image cannot be decoded
     */
    @Override
    public RawRecognition recognize(DocumentImage document, String language, Duration timeout) {
        Objects.requireNonNull(document, "document");
        ensureInitialized();
        NativeWorkerPool localPool;
        synchronized (lock) {
            localPool = this.pool;
        }
        if (localPool == null) {
            throw new EngineUnavailableException("engine closed", id());
        }
        String lang = language == null || language.isBlank() ? config.language() : language;
        long start = System.nanoTime();
        CompletableFuture<RawRecognition> future = localPool.submit(document, lang);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            LOG.warn("Tesseract did not finish within {}ms for {}; abandoning wait", timeout.toMillis(), document.id());
            throw RecognitionExceptionBuilder.create("Tesseract recognition timed out")
                    .engine(id())
                    .durationMs(elapsed)
                    .metadata("queueDepth", localPool.queueDepth())
                    .buildTimeout();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof InvalidDocumentException ide) {
                throw ide;
            }
            if (cause instanceof EngineUnavailableException eue) {
                throw eue;
            }
            Exception wrapped = cause instanceof Exception ex ? ex : new RuntimeException(cause);
            throw handleRecognitionError(wrapped, publisher,
                    Map.of("document", document.id(), "language", lang));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RecognitionExceptionBuilder.create("Interrupted waiting for Tesseract")
                    .engine(id())
                    .cause(e)
                    .build();
        }
    }

    @Override
    public EngineCapabilities capabilities() {
        return new EngineCapabilities(LANGUAGES, FORMATS, FEATURES, Set.of(), workerCount());
    }

    @Override
    public int workerCount() {
        synchronized (lock) {
            return pool == null ? 0 : pool.size();
        }
    }

    @Override
    protected boolean isOperational() {
        return pool != null && pool.isRunning();
    }

    @Override
    protected void doClose() {
        if (pool != null) {
            try {
                pool.close();
            } finally {
                pool = null;
            }
        }
        LOG.info("Tesseract engine closed");
    }
}
