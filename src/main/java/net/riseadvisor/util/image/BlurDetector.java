package net.riseadvisor.util.image;

import java.util.List;
import net.riseadvisor.model.image.BlurLevel;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.PixelGrid;
import net.riseadvisor.model.image.QualityIssue;

/**
 * Estimates focus quality with the variance of a Laplacian edge response.
 *
 * <p>For every interior pixel of the grayscale plane the response is
 * {@code 4*center - up - down - left - right}. Sharp photographs have strong local
 * intensity changes and therefore a widely spread response; defocus or camera shake
 * smooths edges and collapses the variance.</p>
 *
 * <ul>
 *   <li>{@code score >= threshold}: sharp</li>
 *   <li>{@code threshold/2 <= score < threshold}: {@code slightly_blurry}</li>
 *   <li>{@code score < threshold/2}: {@code very_blurry}</li>
 * </ul>
 */
public final class BlurDetector {

    private BlurDetector() {
    }

    /**
     * Scores the sharpness of the grid.
     *
     * @param grid decoded pixels
     * @param thresholds tuning values for this call
     * @return blur score, level, sub-score and at most one blur issue
     */
    public static BlurAnalysis analyze(PixelGrid grid, ImageQualityThresholds thresholds) {
        double blurScore = laplacianVariance(grid);
        double threshold = thresholds.blurThreshold();

        BlurLevel level;
        List<QualityIssue> issues;
        if (blurScore >= threshold) {
            level = BlurLevel.SHARP;
            issues = List.of();
        } else if (blurScore >= threshold / 2.0) {
            level = BlurLevel.SLIGHTLY_BLURRY;
            issues = List.of(QualityIssue.SLIGHTLY_BLURRY);
        } else {
            level = BlurLevel.VERY_BLURRY;
            issues = List.of(QualityIssue.VERY_BLURRY);
        }

        double subScore = Math.min(blurScore / threshold, 1.0);
        return new BlurAnalysis(blurScore, level, subScore, issues);
    }

    /**
     * Population variance of the Laplacian response over interior pixels.
     * Grids narrower or shorter than three pixels have no interior and score 0.
     */
    static double laplacianVariance(PixelGrid grid) {
        int width = grid.width();
        int height = grid.height();
        if (width < 3 || height < 3) {
            return 0.0;
        }

        int[] luma = grid.lumaPlane();
        long sum = 0;
        long sumOfSquares = 0;
        long count = 0;

        for (int y = 1; y < height - 1; y++) {
            int row = y * width;
            for (int x = 1; x < width - 1; x++) {
                int index = row + x;
                long response = 4L * luma[index]
                    - luma[index - width]
                    - luma[index + width]
                    - luma[index - 1]
                    - luma[index + 1];
                sum += response;
                sumOfSquares += response * response;
                count++;
            }
        }

        double mean = (double) sum / count;
        double variance = (double) sumOfSquares / count - mean * mean;
        return Math.max(variance, 0.0);
    }

    /**
     * Output of {@link #analyze(PixelGrid, ImageQualityThresholds)}.
     *
     * @param blurScore Laplacian variance, non-negative and unbounded
     * @param level focus classification
     * @param subScore {@code min(blurScore / threshold, 1)}
     * @param issues empty, {@code slightly_blurry} or {@code very_blurry}
     */
    public record BlurAnalysis(double blurScore, BlurLevel level, double subScore,
                               List<QualityIssue> issues) implements CheckOutcome {

        public BlurAnalysis {
            issues = List.copyOf(issues);
        }

        @Override
        public CheckType checkType() {
            return CheckType.BLUR;
        }
    }
}
