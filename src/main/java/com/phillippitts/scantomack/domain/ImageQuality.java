package com.phillippitts.scantomack.domain;

/**
 * Coarse image-quality bucket derived from pixel count.
 */
public enum ImageQuality {
    POOR(0.3),
    FAIR(0.6),
    GOOD(0.8),
    EXCELLENT(1.0);

    private static final long POOR_BELOW = 300L * 400L;
    private static final long FAIR_BELOW = 600L * 800L;
    private static final long GOOD_BELOW = 1200L * 1600L;

    private final double score;

    ImageQuality(double score) {
        this.score = score;
    }

    /** Score in [0,1] used by the overall quality blend. */
    public double score() {
        return score;
    }

    /**
     * Buckets an image by its pixel count. Unknown geometry (non-positive sides) is {@link #FAIR}.
     */
    public static ImageQuality fromDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            return FAIR;
        }
        long pixels = (long) width * height;
        if (pixels < POOR_BELOW) {
            return POOR;
        }
        if (pixels < FAIR_BELOW) {
            return FAIR;
        }
        if (pixels < GOOD_BELOW) {
            return GOOD;
        }
        return EXCELLENT;
    }
}
