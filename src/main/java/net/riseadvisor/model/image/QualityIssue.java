package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named quality defects reported by the analyzers, plus the tags used when the
 * upload could not be decoded at all. Numeric detail lives in {@link QualityMetrics}.
 */
public enum QualityIssue {

    LOW_RESOLUTION("low_resolution"),
    UNUSUAL_ASPECT_RATIO("unusual_aspect_ratio"),
    VERY_BLURRY("very_blurry"),
    SLIGHTLY_BLURRY("slightly_blurry"),
    TOO_DARK("too_dark"),
    TOO_BRIGHT("too_bright"),
    LOW_CONTRAST("low_contrast"),
    EMPTY_FILE("empty_file"),
    FILE_TOO_LARGE("file_too_large"),
    INVALID_IMAGE("invalid_image");

    private final String value;

    QualityIssue(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Issues that make a diagnosis categorically unreliable, whatever the numeric score.
     */
    public boolean isDisqualifying() {
        return this == LOW_RESOLUTION || this == VERY_BLURRY;
    }

    @Override
    public String toString() {
        return value;
    }
}
