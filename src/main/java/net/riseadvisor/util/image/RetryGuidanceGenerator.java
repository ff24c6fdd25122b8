package net.riseadvisor.util.image;

import java.util.Comparator;
import java.util.List;
import net.riseadvisor.model.image.IssueGuidance;
import net.riseadvisor.model.image.QualityIssue;
import net.riseadvisor.model.image.RetryGuidance;
import net.riseadvisor.model.image.ValidationResult;

/**
 * Turns a {@link ValidationResult} into retake instructions.
 *
 * <p>Issues are ranked by priority tier (unreadable uploads, then disqualifying
 * issues, then exposure, then mild focus and framing problems, then contrast).
 * The sort is stable, so issues in the same tier keep their detection order. Only
 * the first {@value #MAX_TOP_ISSUES} issues are surfaced.</p>
 */
public final class RetryGuidanceGenerator {

    static final int MAX_TOP_ISSUES = 3;

    static final String PROCEED_MESSAGE = "Image quality is good. You can proceed with analysis.";

    private static final Comparator<QualityIssue> BY_PRIORITY =
        Comparator.comparingInt(RetryGuidanceGenerator::priorityTier);

    private RetryGuidanceGenerator() {
    }

    public static RetryGuidance generate(ValidationResult result) {
        if (result.valid()) {
            return new RetryGuidance(false, PROCEED_MESSAGE, result.qualityScore(), List.of(), List.of());
        }

        List<QualityIssue> topIssues = result.issues().stream()
            .distinct()
            .sorted(BY_PRIORITY)
            .limit(MAX_TOP_ISSUES)
            .toList();
        List<IssueGuidance> specificGuidance = topIssues.stream()
            .map(IssueGuidanceCatalog::guidanceFor)
            .toList();

        return new RetryGuidance(true, retakeMessage(topIssues.size()), result.qualityScore(),
            topIssues, specificGuidance);
    }

    /** Lower tiers are more urgent. */
    static int priorityTier(QualityIssue issue) {
        return switch (issue) {
            case EMPTY_FILE, FILE_TOO_LARGE, INVALID_IMAGE -> 0;
            case LOW_RESOLUTION, VERY_BLURRY -> 1;
            case TOO_DARK, TOO_BRIGHT -> 2;
            case SLIGHTLY_BLURRY, UNUSUAL_ASPECT_RATIO -> 3;
            case LOW_CONTRAST -> 4;
        };
    }

    private static String retakeMessage(int issueCount) {
        if (issueCount == 0) {
            return "Please retake the photo; its overall quality is too low for an accurate diagnosis";
        }
        return issueCount == 1
            ? "Please retake the photo to address 1 quality issue"
            : "Please retake the photo to address %d quality issues".formatted(issueCount);
    }
}
