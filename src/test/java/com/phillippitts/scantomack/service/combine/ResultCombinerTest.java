package com.phillippitts.scantomack.service.combine;

import com.phillippitts.scantomack.domain.CombinationMethod;
import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.domain.EngineResult;
import com.phillippitts.scantomack.domain.EnsembleResult;
import com.phillippitts.scantomack.service.combine.impl.ConfidenceSelector;
import com.phillippitts.scantomack.service.combine.impl.PreferenceSelector;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.scantomack.testutil.TestResults.engineResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultCombinerTest {

    @Test
    void combinedResultIsTaggedEnsembleAndCarriesBaseText() {
        ResultCombiner combiner = new ResultCombiner(new ConfidenceSelector());
        EngineResult tess = engineResult(EngineId.TESSERACT, "Total 12.50", 0.72, 40);
        EngineResult easy = engineResult(EngineId.EASYOCR, "Total 12.60", 0.91, 90);

        EnsembleResult result = combiner.combine(Map.of(EngineId.TESSERACT, tess, EngineId.EASYOCR, easy));

        assertThat(result.engine()).isEqualTo(EngineId.ENSEMBLE);
        assertThat(result.text()).isEqualTo("Total 12.60");
        assertThat(result.confidence()).isEqualTo(easy.confidence());
        assertThat(result.combinationMethod()).isEqualTo(CombinationMethod.CONFIDENCE_WEIGHTED);
        assertThat(result.engineResults()).containsOnlyKeys(EngineId.TESSERACT, EngineId.EASYOCR);
        assertThat(result.metadata().postprocessing()).contains(ResultCombiner.POSTPROCESSING_STEP);
    }

    @Test
    void durationIsSlowestEngine() {
        ResultCombiner combiner = new ResultCombiner(new ConfidenceSelector());

        EnsembleResult result = combiner.combine(Map.of(
                EngineId.TESSERACT, engineResult(EngineId.TESSERACT, "a", 0.5, 40),
                EngineId.PADDLEOCR, engineResult(EngineId.PADDLEOCR, "a", 0.5, 120)));

        assertThat(result.durationMs()).isEqualTo(120);
    }

    @Test
    void agreementIsOneForIdenticalTexts() {
        ResultCombiner combiner = new ResultCombiner(new ConfidenceSelector());

        EnsembleResult result = combiner.combine(Map.of(
                EngineId.TESSERACT, engineResult(EngineId.TESSERACT, "same text", 0.6),
                EngineId.EASYOCR, engineResult(EngineId.EASYOCR, "same text", 0.8)));

        assertThat(result.agreementScore()).isEqualTo(1.0);
    }

    @Test
    void singleSuccessCombinesWithFullAgreement() {
        ResultCombiner combiner = new ResultCombiner(new PreferenceSelector(List.of(EngineId.TESSERACT)));
        EngineResult only = engineResult(EngineId.PADDLEOCR, "lonely", 0.4);

        EnsembleResult result = combiner.combine(Map.of(EngineId.PADDLEOCR, only));

        assertThat(result.text()).isEqualTo("lonely");
        assertThat(result.agreementScore()).isEqualTo(1.0);
        assertThat(result.engineResults()).hasSize(1);
    }

    @Test
    void rejectsEmptyInput() {
        ResultCombiner combiner = new ResultCombiner(new ConfidenceSelector());

        assertThatThrownBy(() -> combiner.combine(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
