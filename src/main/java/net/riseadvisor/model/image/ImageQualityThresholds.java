package net.riseadvisor.model.image;

/**
 * Immutable tuning values for one validation call. Every analyzer receives the
 * thresholds explicitly, so overrides requested by one caller never affect another.
 *
 * @param minResolution minimum length in pixels of the shorter image side
 * @param maxAspectRatio largest accepted ratio of the longer side to the shorter side
 * @param blurThreshold Laplacian variance at or above which an image counts as sharp
 * @param minBrightness mean intensity below which an image is too dark
 * @param maxBrightness mean intensity above which an image is too bright
 * @param minContrast intensity standard deviation below which contrast is too low
 * @param validityThreshold minimum aggregate score for a valid image
 * @param maxImageBytes largest accepted upload size in bytes
 * @param maxPixels largest accepted {@code width * height}, checked before the pixels are decoded
 */
public record ImageQualityThresholds(
        int minResolution,
        double maxAspectRatio,
        double blurThreshold,
        double minBrightness,
        double maxBrightness,
        double minContrast,
        double validityThreshold,
        long maxImageBytes,
        long maxPixels) {

    public static final int DEFAULT_MIN_RESOLUTION = 300;
    public static final double DEFAULT_MAX_ASPECT_RATIO = 3.0;
    public static final double DEFAULT_BLUR_THRESHOLD = 100.0;
    public static final double DEFAULT_MIN_BRIGHTNESS = 30.0;
    public static final double DEFAULT_MAX_BRIGHTNESS = 225.0;
    public static final double DEFAULT_MIN_CONTRAST = 20.0;
    public static final double DEFAULT_VALIDITY_THRESHOLD = 0.7;
    public static final long DEFAULT_MAX_IMAGE_BYTES = 5L * 1024 * 1024;
    public static final long DEFAULT_MAX_PIXELS = 24_000_000L;

    private static final ImageQualityThresholds DEFAULTS = new ImageQualityThresholds(
        DEFAULT_MIN_RESOLUTION,
        DEFAULT_MAX_ASPECT_RATIO,
        DEFAULT_BLUR_THRESHOLD,
        DEFAULT_MIN_BRIGHTNESS,
        DEFAULT_MAX_BRIGHTNESS,
        DEFAULT_MIN_CONTRAST,
        DEFAULT_VALIDITY_THRESHOLD,
        DEFAULT_MAX_IMAGE_BYTES,
        DEFAULT_MAX_PIXELS
    );

    public ImageQualityThresholds {
        require(minResolution > 0, "min_resolution must be positive");
        require(maxAspectRatio >= 1.0, "max_aspect_ratio must be at least 1.0");
        require(blurThreshold > 0.0, "blur_threshold must be positive");
        require(minBrightness >= 0.0 && maxBrightness <= 255.0,
            "brightness bounds must lie within [0, 255]");
        require(minBrightness < maxBrightness, "min_brightness must be below max_brightness");
        require(minContrast >= 0.0, "min_contrast must be non-negative");
        require(validityThreshold >= 0.0 && validityThreshold <= 1.0,
            "validity_threshold must lie within [0, 1]");
        require(maxImageBytes > 0, "max_image_bytes must be positive");
        require(maxPixels > 0, "max_pixels must be positive");
    }

    public static ImageQualityThresholds defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy with the non-null overrides applied.
     *
     * @throws IllegalArgumentException when the combined values are inconsistent
     */
    public ImageQualityThresholds withOverrides(Integer minResolution,
                                                Double blurThreshold,
                                                Double minBrightness,
                                                Double maxBrightness,
                                                Double minContrast,
                                                Double validityThreshold) {
        return new ImageQualityThresholds(
            minResolution != null ? minResolution : this.minResolution,
            maxAspectRatio,
            blurThreshold != null ? blurThreshold : this.blurThreshold,
            minBrightness != null ? minBrightness : this.minBrightness,
            maxBrightness != null ? maxBrightness : this.maxBrightness,
            minContrast != null ? minContrast : this.minContrast,
            validityThreshold != null ? validityThreshold : this.validityThreshold,
            maxImageBytes,
            maxPixels
        );
    }

    /** Midpoint of the accepted brightness band. */
    public double idealBrightness() {
        return (minBrightness + maxBrightness) / 2.0;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
