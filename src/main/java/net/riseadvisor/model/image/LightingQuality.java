package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse lighting verdict reported alongside brightness and contrast. */
public enum LightingQuality {
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String value;

    LightingQuality(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
