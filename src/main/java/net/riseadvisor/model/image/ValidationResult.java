package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Verdict of the image quality gate for a single upload.
 *
 * @param valid whether the photograph may be sent for multimodal analysis
 * @param qualityScore aggregate score in [0, 1], rounded to two decimals
 * @param issues detected issues in detection order, without duplicates
 * @param metrics measurements from the checks that ran
 * @param summary one-line human-readable verdict
 */
public record ValidationResult(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("quality_score") double qualityScore,
        @JsonProperty("issues") List<QualityIssue> issues,
        @JsonProperty("metrics") QualityMetrics metrics,
        @JsonProperty("summary") String summary) {

    public ValidationResult {
        if (Double.isNaN(qualityScore) || qualityScore < 0.0 || qualityScore > 1.0) {
            throw new IllegalArgumentException("quality_score must be within [0, 1] but was " + qualityScore);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        metrics = metrics == null ? QualityMetrics.empty() : metrics;
    }

    public boolean hasIssue(QualityIssue issue) {
        return issues.contains(issue);
    }
}
