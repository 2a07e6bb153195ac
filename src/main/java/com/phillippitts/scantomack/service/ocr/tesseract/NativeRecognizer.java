package com.phillippitts.scantomack.service.ocr.tesseract;

import com.phillippitts.scantomack.service.ocr.RawRecognition;

import java.awt.image.BufferedImage;

/**
 * One native recognition handle. Not thread-safe: each pool worker owns exactly one.
 */
public interface NativeRecognizer {

    /**
     * @param image    decoded raster
     * @param language Tesseract language code, e.g. "eng" or "eng+deu"
     * @return recognized words with confidences normalized to [0,1]
     * @throws Exception on native failure
     */
    RawRecognition recognize(BufferedImage image, String language) throws Exception;
}
