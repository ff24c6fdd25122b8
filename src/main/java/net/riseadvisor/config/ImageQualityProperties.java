package net.riseadvisor.config;

import jakarta.annotation.PostConstruct;
import net.riseadvisor.model.image.ImageQualityThresholds;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.unit.DataSize;

/**
 * Strongly typed defaults for the image quality gate. Request-level overrides are
 * applied on top of these values per call and never written back.
 */
@Component
@ConfigurationProperties(prefix = "image-quality")
public class ImageQualityProperties {

    /**
     * Minimum length in pixels of the shorter image side.
     */
    private int minResolution = ImageQualityThresholds.DEFAULT_MIN_RESOLUTION;

    /**
     * Largest accepted ratio between the longer and the shorter image side.
     */
    private double maxAspectRatio = ImageQualityThresholds.DEFAULT_MAX_ASPECT_RATIO;

    /**
     * Laplacian variance at or above which an image counts as sharp.
     */
    private double blurThreshold = ImageQualityThresholds.DEFAULT_BLUR_THRESHOLD;

    /**
     * Mean intensity below which an image is too dark.
     */
    private double minBrightness = ImageQualityThresholds.DEFAULT_MIN_BRIGHTNESS;

    /**
     * Mean intensity above which an image is overexposed.
     */
    private double maxBrightness = ImageQualityThresholds.DEFAULT_MAX_BRIGHTNESS;

    /**
     * Intensity standard deviation below which contrast is too low.
     */
    private double minContrast = ImageQualityThresholds.DEFAULT_MIN_CONTRAST;

    /**
     * Minimum aggregate score for an image to be sent for diagnosis.
     */
    private double validityThreshold = ImageQualityThresholds.DEFAULT_VALIDITY_THRESHOLD;

    /**
     * Largest accepted upload.
     */
    private DataSize maxImageSize = DataSize.ofBytes(ImageQualityThresholds.DEFAULT_MAX_IMAGE_BYTES);

    /**
     * Largest accepted pixel count (width times height). Compressed uploads can be tiny
     * on disk yet expand to gigabytes, so dimensions are checked before decoding.
     */
    private long maxPixels = ImageQualityThresholds.DEFAULT_MAX_PIXELS;

    @PostConstruct
    void validate() {
        Assert.isTrue(minResolution > 0, "image-quality.min-resolution must be positive");
        Assert.isTrue(maxAspectRatio >= 1.0, "image-quality.max-aspect-ratio must be at least 1.0");
        Assert.isTrue(blurThreshold > 0.0, "image-quality.blur-threshold must be positive");
        Assert.isTrue(minBrightness < maxBrightness,
                "image-quality.min-brightness must be below image-quality.max-brightness");
        Assert.isTrue(validityThreshold >= 0.0 && validityThreshold <= 1.0,
                "image-quality.validity-threshold must lie within [0, 1]");
        Assert.notNull(maxImageSize, "image-quality.max-image-size is required");
        Assert.isTrue(maxImageSize.toBytes() > 0, "image-quality.max-image-size must be positive");
        Assert.isTrue(maxPixels > 0, "image-quality.max-pixels must be positive");
    }

    /**
     * Snapshot of the configured values as an immutable thresholds record.
     */
    public ImageQualityThresholds toThresholds() {
        return new ImageQualityThresholds(
                minResolution,
                maxAspectRatio,
                blurThreshold,
                minBrightness,
                maxBrightness,
                minContrast,
                validityThreshold,
                maxImageSize.toBytes(),
                maxPixels
        );
    }

    public int getMinResolution() {
        return minResolution;
    }

    public void setMinResolution(int minResolution) {
        this.minResolution = minResolution;
    }

    public double getMaxAspectRatio() {
        return maxAspectRatio;
    }

    public void setMaxAspectRatio(double maxAspectRatio) {
        this.maxAspectRatio = maxAspectRatio;
    }

    public double getBlurThreshold() {
        return blurThreshold;
    }

    public void setBlurThreshold(double blurThreshold) {
        this.blurThreshold = blurThreshold;
    }

    public double getMinBrightness() {
        return minBrightness;
    }

    public void setMinBrightness(double minBrightness) {
        this.minBrightness = minBrightness;
    }

    public double getMaxBrightness() {
        return maxBrightness;
    }

    public void setMaxBrightness(double maxBrightness) {
        this.maxBrightness = maxBrightness;
    }

    public double getMinContrast() {
        return minContrast;
    }

    public void setMinContrast(double minContrast) {
        this.minContrast = minContrast;
    }

    public double getValidityThreshold() {
        return validityThreshold;
    }

    public void setValidityThreshold(double validityThreshold) {
        this.validityThreshold = validityThreshold;
    }

    public DataSize getMaxImageSize() {
        return maxImageSize;
    }

    public void setMaxImageSize(DataSize maxImageSize) {
        this.maxImageSize = maxImageSize;
    }

    public long getMaxPixels() {
        return maxPixels;
    }

    public void setMaxPixels(long maxPixels) {
        this.maxPixels = maxPixels;
    }
}
