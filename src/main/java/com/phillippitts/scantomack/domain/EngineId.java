package com.phillippitts.scantomack.domain;

import java.util.Locale;

/**
 * Closed set of text-recognition engines known to the service.
 *
 * <p>{@link #ENSEMBLE} is synthetic: it tags combined results and is never a dispatch target.
 */
public enum EngineId {

    /** In-process Tesseract worker pool. */
    TESSERACT("tesseract"),

    /** EasyOCR behind a stdio process bridge. */
    EASYOCR("easyocr"),

    /** PaddleOCR behind a stdio process bridge. */
    PADDLEOCR("paddleocr"),

    /** Combined output of several engines. */
    ENSEMBLE("ensemble");

    private final String wireName;

    EngineId(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return lowercase name used in logs, metrics tags, and JSON payloads
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return true for engines that can actually be invoked
     */
    public boolean isDispatchable() {
        return this != ENSEMBLE;
    }

    /**
     * Resolves an engine from its wire name or constant name, case-insensitively.
     *
     * @param name engine name (e.g. "tesseract", "EASYOCR")
     * @return matching engine
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static EngineId fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Engine name must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EngineId id : values()) {
            if (id.wireName.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown engine: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
