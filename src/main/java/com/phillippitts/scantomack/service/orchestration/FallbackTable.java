package com.phillippitts.scantomack.service.orchestration;

import com.phillippitts.scantomack.domain.EngineId;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered substitutes to try when a single-engine request's primary engine fails.
 */
public final class FallbackTable {

    private static final Map<EngineId, List<EngineId>> FALLBACKS = new EnumMap<>(EngineId.class);

    static {
        FALLBACKS.put(EngineId.TESSERACT, List.of(EngineId.EASYOCR, EngineId.PADDLEOCR));
        FALLBACKS.put(EngineId.EASYOCR, List.of(EngineId.TESSERACT, EngineId.PADDLEOCR));
        FALLBACKS.put(EngineId.PADDLEOCR, List.of(EngineId.TESSERACT, EngineId.EASYOCR));
    }

    private FallbackTable() {
    }

    /**
     * @return fallbacks in try order; empty for non-dispatchable ids
     */
    public static List<EngineId> fallbacksFor(EngineId primary) {
        return FALLBACKS.getOrDefault(primary, List.of());
    }
}
