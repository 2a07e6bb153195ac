package com.phillippitts.scantomack.service.ocr;

import java.util.Locale;
import java.util.Map;

/**
 * Maps Tesseract-style language codes (ISO 639-2 plus script suffix) to the short codes the
 * Python engines expect. Unknown codes pass through unchanged.
 */
public final class LanguageCodes {

    private static final Map<String, String> EASYOCR = Map.ofEntries(
            Map.entry("eng", "en"), Map.entry("spa", "es"), Map.entry("fra", "fr"),
            Map.entry("deu", "de"), Map.entry("chi_sim", "ch_sim"), Map.entry("chi_tra", "ch_tra"),
            Map.entry("jpn", "ja"), Map.entry("kor", "ko"), Map.entry("ara", "ar"),
            Map.entry("hin", "hi"), Map.entry("rus", "ru"));

    private static final Map<String, String> PADDLEOCR = Map.ofEntries(
            Map.entry("eng", "en"), Map.entry("chi_sim", "ch"), Map.entry("chi_tra", "chinese_cht"),
            Map.entry("tam", "ta"), Map.entry("tel", "te"), Map.entry("kan", "ka"),
            Map.entry("jpn", "japan"), Map.entry("kor", "korean"));

    private LanguageCodes() {
    }

    public static String forEasyOcr(String language) {
        return EASYOCR.getOrDefault(normalize(language), normalize(language));
    }

    public static String forPaddleOcr(String language) {
        return PADDLEOCR.getOrDefault(normalize(language), normalize(language));
    }

    private static String normalize(String language) {
        return language == null ? "eng" : language.trim().toLowerCase(Locale.ROOT);
    }
}
