package com.phillippitts.scantomack.service.combine.impl;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.scantomack.testutil.TestResults.engineResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultSelectorsTest {

    private final EngineResult tess = engineResult(EngineId.TESSERACT, "Invoice 1001", 0.70);
    private final EngineResult easy = engineResult(EngineId.EASYOCR, "Invoice 1001", 0.85);
    private final EngineResult paddle = engineResult(EngineId.PADDLEOCR, "lnvo1ce IOOI", 0.95);

    private final Map<EngineId, EngineResult> all = Map.of(
            EngineId.TESSERACT, tess, EngineId.EASYOCR, easy, EngineId.PADDLEOCR, paddle);

    @Test
    void confidenceSelectorPicksHighestConfidence() {
        assertThat(new ConfidenceSelector().select(all)).isSameAs(paddle);
    }

    @Test
    void confidenceSelectorPrefersEarlierEngineOnTie() {
        EngineResult a = engineResult(EngineId.TESSERACT, "x", 0.8);
        EngineResult b = engineResult(EngineId.PADDLEOCR, "y", 0.8);

        assertThat(new ConfidenceSelector().select(Map.of(EngineId.PADDLEOCR, b, EngineId.TESSERACT, a)))
                .isSameAs(a);
    }

    @Test
    void preferenceSelectorFollowsConfiguredOrder() {
        PreferenceSelector selector = new PreferenceSelector(List.of(EngineId.EASYOCR, EngineId.TESSERACT));

        assertThat(selector.select(all)).isSameAs(easy);
    }

    @Test
    void preferenceSelectorFallsBackToConfidenceWhenNoPreferredEngineSucceeded() {
        PreferenceSelector selector = new PreferenceSelector(List.of(EngineId.EASYOCR));

        assertThat(selector.select(Map.of(EngineId.TESSERACT, tess, EngineId.PADDLEOCR, paddle)))
                .isSameAs(paddle);
    }

    @Test
    void preferenceSelectorRejectsEmptyOrder() {
        assertThatThrownBy(() -> new PreferenceSelector(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void consensusSelectorPicksTextClosestToTheOthers() {
        // Two engines agree; the confident outlier loses
        assertThat(new ConsensusSelector().select(all).text()).isEqualTo("Invoice 1001");
    }

    @Test
    void consensusSelectorBreaksTiesByConfidence() {
        assertThat(new ConsensusSelector().select(all)).isSameAs(easy);
    }

    @Test
    void singleResultIsReturnedAsIs() {
        assertThat(new ConsensusSelector().select(Map.of(EngineId.TESSERACT, tess))).isSameAs(tess);
    }
}
