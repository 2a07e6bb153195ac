package com.phillippitts.scantomack.domain;

import java.util.Objects;

/**
 * Structured quality profile of a single engine's output.
 *
 * @param averageWordConfidence      mean word confidence over all pages
 * @param averageLineConfidence      mean line confidence over all pages
 * @param averageParagraphConfidence mean paragraph confidence over all pages
 * @param textDensity                characters per pixel of source image area
 * @param regionCount                distinct 100px grid cells containing a word
 * @param layoutComplexity           margin and spacing variance, normalized to [0,1]
 * @param skewAngle                  median line angle in degrees, or null when too few lines
 * @param languageConfidence         blend of alphabetic ratio and common-word hits
 * @param suspiciousCharRatio        symbol characters over non-whitespace characters
 * @param whitespaceRatio            whitespace over all characters
 * @param digitRatio                 digits over all characters
 * @param uppercaseRatio             uppercase over alphabetic characters
 * @param hasTableStructure          repeated left margins or tabular text patterns
 * @param hasHandwriting             low, highly varying word confidence
 * @param imageQuality               bucket from source pixel count
 */
public record QualityMetrics(
        double averageWordConfidence,
        double averageLineConfidence,
        double averageParagraphConfidence,
        double textDensity,
        int regionCount,
        double layoutComplexity,
        Double skewAngle,
        double languageConfidence,
        double suspiciousCharRatio,
        double whitespaceRatio,
        double digitRatio,
        double uppercaseRatio,
        boolean hasTableStructure,
        boolean hasHandwriting,
        ImageQuality imageQuality
) {

    private static final QualityMetrics DEFAULTS = new QualityMetrics(
            0.5, 0.5, 0.5, 0.5, 0, 0.5, null, 0.5, 0.5, 0.5, 0.5, 0.5, false, false, ImageQuality.FAIR);

    public QualityMetrics {
        Objects.requireNonNull(imageQuality, "imageQuality");
    }

    /**
     * Neutral profile used when the calculation itself fails.
     */
    public static QualityMetrics defaults() {
        return DEFAULTS;
    }
}
