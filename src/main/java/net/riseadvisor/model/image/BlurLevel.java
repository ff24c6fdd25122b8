package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonValue;

/** Focus classification derived from the Laplacian variance. */
public enum BlurLevel {
    SHARP("sharp"),
    SLIGHTLY_BLURRY("slightly_blurry"),
    VERY_BLURRY("very_blurry");

    private final String value;

    BlurLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
