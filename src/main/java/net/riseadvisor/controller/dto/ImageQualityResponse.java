package net.riseadvisor.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.riseadvisor.model.image.RetryGuidance;
import net.riseadvisor.model.image.ValidationResult;

/**
 * Verdict plus retake guidance returned by the image quality endpoints.
 *
 * @param validation the quality verdict
 * @param retryGuidance retake instructions; {@code retry_needed} is false for valid images
 */
public record ImageQualityResponse(
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("retry_guidance") RetryGuidance retryGuidance) {
}
