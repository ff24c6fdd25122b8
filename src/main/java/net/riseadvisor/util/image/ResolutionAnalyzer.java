package net.riseadvisor.util.image;

import java.util.ArrayList;
import java.util.List;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.PixelGrid;
import net.riseadvisor.model.image.QualityIssue;

/**
 * Checks pixel dimensions and framing of a photograph.
 *
 * <p>The shorter side must reach {@link ImageQualityThresholds#minResolution()} and the
 * longer side may be at most {@link ImageQualityThresholds#maxAspectRatio()} times the
 * shorter one. Crops, leaves and soil samples photographed as thin strips lose the
 * context a diagnosis needs.</p>
 */
public final class ResolutionAnalyzer {

    private ResolutionAnalyzer() {
    }

    /**
     * Analyzes the grid's dimensions.
     *
     * @param grid decoded pixels
     * @param thresholds tuning values for this call
     * @return dimensions, aspect ratio, sub-score and issues
     */
    public static ResolutionAnalysis analyze(PixelGrid grid, ImageQualityThresholds thresholds) {
        int width = grid.width();
        int height = grid.height();
        int shortSide = Math.min(width, height);
        int longSide = Math.max(width, height);

        List<QualityIssue> issues = new ArrayList<>(2);
        if (shortSide == 0) {
            issues.add(QualityIssue.LOW_RESOLUTION);
            return new ResolutionAnalysis(width, height, 0.0, 0.0, issues);
        }

        if (shortSide < thresholds.minResolution()) {
            issues.add(QualityIssue.LOW_RESOLUTION);
        }
        if ((double) longSide / shortSide > thresholds.maxAspectRatio()) {
            issues.add(QualityIssue.UNUSUAL_ASPECT_RATIO);
        }

        double aspectRatio = (double) width / height;
        double subScore = (double) shortSide / thresholds.minResolution();
        return new ResolutionAnalysis(width, height, aspectRatio, subScore, issues);
    }

    /**
     * Output of {@link #analyze(PixelGrid, ImageQualityThresholds)}.
     *
     * @param width width in pixels
     * @param height height in pixels
     * @param aspectRatio width divided by height (0 for an empty grid)
     * @param subScore shorter side divided by the minimum resolution, unclamped
     * @param issues {@code low_resolution} and/or {@code unusual_aspect_ratio}
     */
    public record ResolutionAnalysis(int width, int height, double aspectRatio, double subScore,
                                     List<QualityIssue> issues) implements CheckOutcome {

        public ResolutionAnalysis {
            issues = List.copyOf(issues);
        }

        @Override
        public CheckType checkType() {
            return CheckType.RESOLUTION;
        }
    }
}
