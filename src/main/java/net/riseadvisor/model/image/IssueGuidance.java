package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Retake advice for one issue.
 *
 * @param issue the issue this advice addresses
 * @param title short heading shown to the farmer
 * @param icon emoji shown next to the heading
 * @param tips concrete retake tips, most useful first
 */
public record IssueGuidance(
        @JsonProperty("issue") QualityIssue issue,
        @JsonProperty("title") String title,
        @JsonProperty("icon") String icon,
        @JsonProperty("tips") List<String> tips) {

    public IssueGuidance {
        tips = List.copyOf(tips);
    }
}
