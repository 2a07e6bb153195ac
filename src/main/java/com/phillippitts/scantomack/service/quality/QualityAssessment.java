package com.phillippitts.scantomack.service.quality;

import java.util.List;

/**
 * @param overallScore    weighted score in [0,1]
 * @param recommendations hints for the components that pulled the score down
 */
public record QualityAssessment(double overallScore, List<String> recommendations) {
    public QualityAssessment {
        if (Double.isNaN(overallScore) || overallScore < 0.0 || overallScore > 1.0) {
            throw new IllegalArgumentException("overallScore must be in [0,1], got: " + overallScore);
        }
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
