package net.riseadvisor.util.image;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.ImageRejectionReason;
import net.riseadvisor.model.image.ImageResolution;
import net.riseadvisor.model.image.QualityIssue;
import net.riseadvisor.model.image.QualityMetrics;
import net.riseadvisor.model.image.ValidationResult;
import net.riseadvisor.util.image.BlurDetector.BlurAnalysis;
import net.riseadvisor.util.image.LightingAnalyzer.LightingAnalysis;
import net.riseadvisor.util.image.ResolutionAnalyzer.ResolutionAnalysis;

/**
 * Merges analyzer outputs into one {@link ValidationResult}.
 *
 * <p>The quality score is the mean of the clamped sub-scores of the checks that
 * actually ran; checks the caller did not request are left out of the mean rather
 * than counted as neutral. An image is valid when the score reaches the validity
 * threshold and no disqualifying issue ({@code low_resolution}, {@code very_blurry})
 * was detected.</p>
 */
public final class QualityAggregator {

    static final double EXCELLENT_SCORE = 0.9;
    static final double GOOD_SCORE = 0.8;

    private QualityAggregator() {
    }

    /**
     * Aggregates the outcomes of the requested checks. Pass {@code null} for a check
     * that was not requested.
     *
     * @param resolution resolution outcome, or null
     * @param blur blur outcome, or null
     * @param lighting lighting outcome, or null
     * @param thresholds tuning values for this call
     * @return the verdict
     * @throws IllegalArgumentException when no outcome is supplied
     */
    public static ValidationResult aggregate(ResolutionAnalysis resolution,
                                             BlurAnalysis blur,
                                             LightingAnalysis lighting,
                                             ImageQualityThresholds thresholds) {
        List<CheckOutcome> outcomes = new ArrayList<>(3);
        if (resolution != null) {
            outcomes.add(resolution);
        }
        if (blur != null) {
            outcomes.add(blur);
        }
        if (lighting != null) {
            outcomes.add(lighting);
        }
        if (outcomes.isEmpty()) {
            throw new IllegalArgumentException("At least one check outcome is required");
        }

        double subScoreTotal = 0.0;
        Set<QualityIssue> issues = new LinkedHashSet<>();
        for (CheckOutcome outcome : outcomes) {
            subScoreTotal += QualityScoreMath.clampUnit(outcome.subScore());
            issues.addAll(outcome.issues());
        }
        double qualityScore = QualityScoreMath.round2(
            QualityScoreMath.clampUnit(subScoreTotal / outcomes.size()));

        boolean disqualified = issues.stream().anyMatch(QualityIssue::isDisqualifying);
        boolean valid = !disqualified && qualityScore >= thresholds.validityThreshold();

        return new ValidationResult(
            valid,
            qualityScore,
            List.copyOf(issues),
            metrics(resolution, blur, lighting),
            summarize(valid, qualityScore, issues.size())
        );
    }

    /**
     * Verdict for an upload that never reached the analyzers.
     */
    public static ValidationResult rejected(ImageRejectionReason reason) {
        return new ValidationResult(
            false,
            0.0,
            List.of(reason.issue()),
            QualityMetrics.empty(),
            reason.description()
        );
    }

    static String summarize(boolean valid, double qualityScore, int issueCount) {
        if (valid) {
            if (qualityScore >= EXCELLENT_SCORE) {
                return "Excellent image quality - perfect for accurate diagnosis";
            }
            if (qualityScore >= GOOD_SCORE) {
                return "Good image quality - suitable for diagnosis";
            }
            return "Acceptable image quality - diagnosis may be less accurate";
        }
        if (issueCount == 0) {
            return "Poor image quality - not reliable enough for accurate diagnosis";
        }
        return issueCount == 1
            ? "Poor image quality - 1 issue should be addressed for accurate diagnosis"
            : "Poor image quality - %d issues should be addressed for accurate diagnosis".formatted(issueCount);
    }

    private static QualityMetrics metrics(ResolutionAnalysis resolution,
                                          BlurAnalysis blur,
                                          LightingAnalysis lighting) {
        return new QualityMetrics(
            blur == null ? null : QualityScoreMath.round2(blur.blurScore()),
            blur == null ? null : blur.level(),
            resolution == null ? null : new ImageResolution(resolution.width(), resolution.height()),
            resolution == null ? null : QualityScoreMath.round2(resolution.aspectRatio()),
            lighting == null ? null : QualityScoreMath.round2(lighting.brightness()),
            lighting == null ? null : QualityScoreMath.round2(lighting.contrast()),
            lighting == null ? null : QualityScoreMath.round2(lighting.clippedFraction()),
            lighting == null ? null : lighting.lightingQuality()
        );
    }
}
