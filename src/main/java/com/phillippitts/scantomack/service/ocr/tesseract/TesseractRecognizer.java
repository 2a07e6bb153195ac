package com.phillippitts.scantomack.service.ocr.tesseract;

import com.phillippitts.scantomack.config.ocr.TesseractConfig;
import com.phillippitts.scantomack.domain.BoundingBox;
import com.phillippitts.scantomack.domain.RecognizedWord;
import com.phillippitts.scantomack.service.ocr.RawRecognition;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Tess4J-backed recognizer. Owns one {@link Tesseract} handle, so it must stay confined to a
 * single worker thread.
 */
final class TesseractRecognizer implements NativeRecognizer {

    static final String ENGINE_VERSION = "tess4j-5";

    private final Tesseract tesseract;

    TesseractRecognizer(TesseractConfig config) {
        this.tesseract = new Tesseract();
        tesseract.setDatapath(config.datapath());
        tesseract.setLanguage(config.language());
        tesseract.setPageSegMode(config.pageSegMode());
        tesseract.setOcrEngineMode(config.engineMode());
        tesseract.setVariable("user_defined_dpi", "300");
    }

    @Override
    public RawRecognition recognize(BufferedImage image, String language) {
        tesseract.setLanguage(language);
        List<Word> words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        List<RecognizedWord> out = new ArrayList<>(words.size());
        for (Word w : words) {
            String text = w.getText() == null ? "" : w.getText().trim();
            if (text.isEmpty()) {
                continue;
            }
            Rectangle r = w.getBoundingBox();
            BoundingBox bbox = new BoundingBox(r.x, r.y, r.x + r.width, r.y + r.height);
            out.add(RecognizedWord.of(text, normalizeConfidence(w.getConfidence()), bbox));
        }
        return new RawRecognition(out, ENGINE_VERSION);
    }

    /**
     * Tesseract reports 0..100; negative values mean "no estimate".
     */
    static double normalizeConfidence(float raw) {
        if (raw <= 0f || Float.isNaN(raw)) {
            return 0.0;
        }
        return Math.min(1.0, raw / 100.0);
    }
}
