package com.phillippitts.scantomack.service.quality;

import com.phillippitts.scantomack.domain.QualityMetrics;
import com.phillippitts.scantomack.domain.RecognitionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Blends OCR, semantic, image and layout quality into one overall score.
 *
 * <p>Weights: OCR 0.5, semantic 0.25 (only when present), image 0.15, layout simplicity 0.1.
 * The result is clamped to [0,1], so NaN or out-of-range inputs cannot leak through.
 */
public class QualityAssessor {

    static final double OCR_WEIGHT = 0.5;
    static final double SEMANTIC_WEIGHT = 0.25;
    static final double IMAGE_WEIGHT = 0.15;
    static final double LAYOUT_WEIGHT = 0.1;

    static final double AGREEMENT_REVIEW_BELOW = 0.8;

    static final String IMPROVE_PREPROCESSING = "Consider image preprocessing to improve OCR quality";
    static final String ENABLE_POSTPROCESSING = "Enable post-processing for semantic analysis";
    static final String LOW_SEMANTIC = "Low semantic confidence detected - review text corrections";
    static final String IMPROVE_IMAGE = "Improve image quality for better OCR results";
    static final String COMPLEX_LAYOUT = "Complex document layout detected - consider structure-aware processing";
    static final String LOW_OVERALL = "Overall quality is low - consider using ensemble OCR approach";
    static final String HANDWRITING = "Handwriting detected - specialized handwriting OCR may improve results";
    static final String ENGINES_DISAGREE = "Engines disagree on recognized text - manual review recommended";

    /**
     * @param recognition        engine or ensemble result
     * @param semanticConfidence post-processor confidence, null when post-processing was skipped or failed
     * @param agreementScore     ensemble agreement, null for single-engine results
     */
    public QualityAssessment assess(RecognitionResult recognition, Double semanticConfidence, Double agreementScore) {
        Objects.requireNonNull(recognition, "recognition");
        QualityMetrics metrics = recognition.qualityMetrics();

        double ocr = unit(metrics.averageWordConfidence());
        double image = unit(metrics.imageQuality().score());
        double layout = unit(metrics.layoutComplexity());

        double score = OCR_WEIGHT * ocr + IMAGE_WEIGHT * image + LAYOUT_WEIGHT * (1.0 - layout);
        if (semanticConfidence != null) {
            score += SEMANTIC_WEIGHT * unit(semanticConfidence);
        }
        score = unit(score);

        List<String> recommendations = new ArrayList<>();
        if (ocr < 0.7) {
            recommendations.add(IMPROVE_PREPROCESSING);
        }
        if (semanticConfidence == null) {
            recommendations.add(ENABLE_POSTPROCESSING);
        } else if (unit(semanticConfidence) < 0.6) {
            recommendations.add(LOW_SEMANTIC);
        }
        if (image < 0.7) {
            recommendations.add(IMPROVE_IMAGE);
        }
        if (layout > 0.7) {
            recommendations.add(COMPLEX_LAYOUT);
        }
        if (score < 0.6) {
            recommendations.add(LOW_OVERALL);
        }
        if (metrics.hasHandwriting()) {
            recommendations.add(HANDWRITING);
        }
        if (agreementScore != null && agreementScore < AGREEMENT_REVIEW_BELOW) {
            recommendations.add(ENGINES_DISAGREE);
        }
        return new QualityAssessment(score, recommendations);
    }

    private static double unit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
