package net.riseadvisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * JSON request for {@code POST /api/image-quality/validate}.
 *
 * @param imageData base64 image bytes; a {@code data:image/...;base64,} prefix is accepted
 * @param checkTypes checks to run; all checks when absent
 * @param minResolution optional override
 * @param blurThreshold optional override
 * @param minBrightness optional override
 * @param maxBrightness optional override
 * @param minContrast optional override
 * @param validityThreshold optional override
 */
public record ImageQualityRequest(
        @JsonProperty("image_data") String imageData,
        @JsonProperty("check_types") List<String> checkTypes,
        @JsonProperty("min_resolution") Integer minResolution,
        @JsonProperty("blur_threshold") Double blurThreshold,
        @JsonProperty("min_brightness") Double minBrightness,
        @JsonProperty("max_brightness") Double maxBrightness,
        @JsonProperty("min_contrast") Double minContrast,
        @JsonProperty("validity_threshold") Double validityThreshold) {

    public boolean hasThresholdOverrides() {
        return minResolution != null
            || blurThreshold != null
            || minBrightness != null
            || maxBrightness != null
            || minContrast != null
            || validityThreshold != null;
    }
}
