package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Measurements gathered by the analyzers that ran for a validation call.
 * Values belonging to a check that was not requested stay {@code null} and are
 * omitted from the JSON payload.
 *
 * @param blurScore variance of the Laplacian response (blur check)
 * @param blurLevel focus classification (blur check)
 * @param resolution pixel dimensions (resolution check)
 * @param aspectRatio width divided by height (resolution check)
 * @param brightness mean channel intensity (lighting check)
 * @param contrast standard deviation of channel intensity (lighting check)
 * @param clippedFraction share of channel samples near pure black or white (lighting check)
 * @param lightingQuality coarse lighting verdict (lighting check)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityMetrics(
        @JsonProperty("blur_score") Double blurScore,
        @JsonProperty("blur_level") BlurLevel blurLevel,
        @JsonProperty("resolution") ImageResolution resolution,
        @JsonProperty("aspect_ratio") Double aspectRatio,
        @JsonProperty("brightness") Double brightness,
        @JsonProperty("contrast") Double contrast,
        @JsonProperty("clipped_fraction") Double clippedFraction,
        @JsonProperty("lighting_quality") LightingQuality lightingQuality) {

    private static final QualityMetrics EMPTY = new QualityMetrics(null, null, null, null, null, null, null, null);

    /** Metrics for a call that never reached the analyzers. */
    public static QualityMetrics empty() {
        return EMPTY;
    }
}
