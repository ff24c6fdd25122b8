package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Retake instructions derived from a {@link ValidationResult}.
 *
 * @param retryNeeded whether the farmer should retake the photograph
 * @param message headline shown to the farmer
 * @param qualityScore score of the validation this guidance was built from
 * @param topIssues at most three issues, highest priority first
 * @param specificGuidance advice for each entry of {@code topIssues}, same order
 */
public record RetryGuidance(
        @JsonProperty("retry_needed") boolean retryNeeded,
        @JsonProperty("message") String message,
        @JsonProperty("quality_score") double qualityScore,
        @JsonProperty("top_issues") List<QualityIssue> topIssues,
        @JsonProperty("specific_guidance") List<IssueGuidance> specificGuidance) {

    public RetryGuidance {
        topIssues = List.copyOf(topIssues);
        specificGuidance = List.copyOf(specificGuidance);
    }
}
