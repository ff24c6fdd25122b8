package net.riseadvisor.util.image;

import java.util.ArrayList;
import java.util.List;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.LightingQuality;
import net.riseadvisor.model.image.PixelGrid;
import net.riseadvisor.model.image.QualityIssue;

/**
 * Measures exposure of a photograph over every channel sample of every pixel.
 *
 * <ul>
 *   <li>brightness: mean intensity</li>
 *   <li>contrast: standard deviation of intensity</li>
 *   <li>clipped fraction: share of samples below {@value #SHADOW_CLIP} or above
 *       {@value #HIGHLIGHT_CLIP}, a proxy for harsh shadows and blown highlights</li>
 * </ul>
 *
 * <p>{@code low_contrast} is only reported when neither brightness issue fired; a
 * black or white frame is flat by construction and the exposure issue already covers it.</p>
 */
public final class LightingAnalyzer {

    /** Samples strictly below this value count as crushed shadows. */
    static final int SHADOW_CLIP = 10;

    /** Samples strictly above this value count as blown highlights. */
    static final int HIGHLIGHT_CLIP = 245;

    /** Clipped fraction below which lighting can be {@code good}. */
    static final double FAIR_CLIPPING = 0.05;

    /** Clipped fraction above which lighting without a single issue is {@code poor}. */
    static final double POOR_CLIPPING = 0.15;

    static final double BRIGHTNESS_WEIGHT = 0.5;
    static final double CONTRAST_WEIGHT = 0.3;
    static final double DISTRIBUTION_WEIGHT = 0.2;

    private LightingAnalyzer() {
    }

    /**
     * Analyzes exposure of the grid.
     *
     * @param grid decoded pixels
     * @param thresholds tuning values for this call
     * @return brightness, contrast, clipping, lighting quality, sub-score and issues
     */
    public static LightingAnalysis analyze(PixelGrid grid, ImageQualityThresholds thresholds) {
        long sum = 0;
        long sumOfSquares = 0;
        long clipped = 0;

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                int rgb = grid.rgb(x, y);
                for (int shift = 16; shift >= 0; shift -= 8) {
                    int sample = (rgb >> shift) & 0xFF;
                    sum += sample;
                    sumOfSquares += (long) sample * sample;
                    if (sample < SHADOW_CLIP || sample > HIGHLIGHT_CLIP) {
                        clipped++;
                    }
                }
            }
        }

        long samples = 3L * grid.pixelCount();
        double brightness = 0.0;
        double contrast = 0.0;
        double clippedFraction = 0.0;
        if (samples > 0) {
            brightness = (double) sum / samples;
            double variance = (double) sumOfSquares / samples - brightness * brightness;
            contrast = Math.sqrt(Math.max(variance, 0.0));
            clippedFraction = (double) clipped / samples;
        }

        List<QualityIssue> issues = new ArrayList<>(2);
        if (brightness < thresholds.minBrightness()) {
            issues.add(QualityIssue.TOO_DARK);
        } else if (brightness > thresholds.maxBrightness()) {
            issues.add(QualityIssue.TOO_BRIGHT);
        }
        if (issues.isEmpty() && contrast < thresholds.minContrast()) {
            issues.add(QualityIssue.LOW_CONTRAST);
        }

        LightingQuality quality = classify(issues.size(), clippedFraction);
        double subScore = subScore(brightness, contrast, clippedFraction, thresholds);
        return new LightingAnalysis(brightness, contrast, clippedFraction, quality, subScore, issues);
    }

    /**
     * Good needs no issue and little clipping. A single issue is only fair, whatever the
     * clipping, and so is moderate clipping ({@value #FAIR_CLIPPING} to {@value #POOR_CLIPPING}
     * inclusive). Anything else is poor.
     */
    static LightingQuality classify(int issueCount, double clippedFraction) {
        if (issueCount == 0 && clippedFraction < FAIR_CLIPPING) {
            return LightingQuality.GOOD;
        }
        if (issueCount == 1 || (clippedFraction >= FAIR_CLIPPING && clippedFraction <= POOR_CLIPPING)) {
            return LightingQuality.FAIR;
        }
        return LightingQuality.POOR;
    }

    /**
     * Weighted lighting sub-score in [0, 1]: closeness of brightness to the middle of the
     * accepted band, contrast adequacy, and absence of clipping.
     */
    static double subScore(double brightness, double contrast, double clippedFraction,
                           ImageQualityThresholds thresholds) {
        double halfBand = (thresholds.maxBrightness() - thresholds.minBrightness()) / 2.0;
        double brightnessScore = QualityScoreMath.clampUnit(
            1.0 - Math.abs(brightness - thresholds.idealBrightness()) / halfBand);
        double contrastScore = thresholds.minContrast() == 0.0
            ? 1.0
            : QualityScoreMath.clampUnit(contrast / thresholds.minContrast());
        double distributionScore = QualityScoreMath.clampUnit(1.0 - clippedFraction);

        return BRIGHTNESS_WEIGHT * brightnessScore
            + CONTRAST_WEIGHT * contrastScore
            + DISTRIBUTION_WEIGHT * distributionScore;
    }

    /**
     * Output of {@link #analyze(PixelGrid, ImageQualityThresholds)}.
     *
     * @param brightness mean channel intensity
     * @param contrast standard deviation of channel intensity
     * @param clippedFraction share of channel samples near pure black or white
     * @param lightingQuality coarse lighting verdict
     * @param subScore weighted lighting score in [0, 1]
     * @param issues {@code too_dark}, {@code too_bright} or {@code low_contrast}, if any
     */
    public record LightingAnalysis(double brightness, double contrast, double clippedFraction,
                                   LightingQuality lightingQuality, double subScore,
                                   List<QualityIssue> issues) implements CheckOutcome {

        public LightingAnalysis {
            issues = List.copyOf(issues);
        }

        @Override
        public CheckType checkType() {
            return CheckType.LIGHTING;
        }
    }
}
