package net.riseadvisor.service.image;

import java.util.Objects;
import java.util.Set;
import net.riseadvisor.config.ImageQualityProperties;
import net.riseadvisor.exception.ImageDecodeException;
import net.riseadvisor.exception.UnsupportedCheckException;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.PixelGrid;
import net.riseadvisor.model.image.RetryGuidance;
import net.riseadvisor.model.image.ValidationResult;
import net.riseadvisor.util.image.BlurDetector;
import net.riseadvisor.util.image.BlurDetector.BlurAnalysis;
import net.riseadvisor.util.image.LightingAnalyzer;
import net.riseadvisor.util.image.LightingAnalyzer.LightingAnalysis;
import net.riseadvisor.util.image.PixelGridDecoder;
import net.riseadvisor.util.image.QualityAggregator;
import net.riseadvisor.util.image.ResolutionAnalyzer;
import net.riseadvisor.util.image.ResolutionAnalyzer.ResolutionAnalysis;
import net.riseadvisor.util.image.RetryGuidanceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Quality gate for crop, pest and soil photographs
 *
 * Features:
 * - Rejects empty, oversized (bytes or pixel dimensions) and undecodable uploads without running any analyzer
 * - Runs only the checks the caller asked for (resolution, blur, lighting)
 * - Aggregates sub-scores into one verdict with a numeric quality score
 * - Produces prioritized retake guidance for rejected photographs
 * - Holds no mutable state; concurrent calls never interact
 *
 * Callers must check {@link ValidationResult#valid()} before submitting the photograph
 * for multimodal diagnosis.
 */
@Service
public class ImageQualityService {

    private static final Logger logger = LoggerFactory.getLogger(ImageQualityService.class);

    private final ImageQualityThresholds defaultThresholds;

    @Autowired
    public ImageQualityService(ImageQualityProperties properties) {
        this(properties.toThresholds());
    }

    /**
     * Creates a service with fixed default thresholds, for use outside a Spring context.
     */
    public ImageQualityService(ImageQualityThresholds defaultThresholds) {
        this.defaultThresholds = Objects.requireNonNull(defaultThresholds, "defaultThresholds");
    }

    /** Configured thresholds applied when a caller supplies no overrides. */
    public ImageQualityThresholds defaultThresholds() {
        return defaultThresholds;
    }

    /**
     * Runs every check with the configured thresholds.
     */
    public ValidationResult validate(byte[] imageBytes) {
        return validate(imageBytes, CheckType.ALL, defaultThresholds);
    }

    /**
     * Runs the selected checks with the configured thresholds.
     */
    public ValidationResult validate(byte[] imageBytes, Set<CheckType> checkTypes) {
        return validate(imageBytes, checkTypes, defaultThresholds);
    }

    /**
     * Scores an uploaded photograph.
     *
     * @param imageBytes raw upload bytes
     * @param checkTypes checks to run; unselected checks contribute neither score nor issues
     * @param thresholds tuning values for this call
     * @return the verdict; decode failures become a rejected verdict rather than an exception
     * @throws UnsupportedCheckException when {@code checkTypes} is empty
     */
    public ValidationResult validate(byte[] imageBytes, Set<CheckType> checkTypes, ImageQualityThresholds thresholds) {
        Objects.requireNonNull(checkTypes, "checkTypes");
        Objects.requireNonNull(thresholds, "thresholds");
        if (checkTypes.isEmpty()) {
            throw new UnsupportedCheckException("At least one check type is required");
        }

        PixelGrid grid;
        try {
            grid = PixelGridDecoder.decode(imageBytes, thresholds.maxImageBytes(), thresholds.maxPixels());
        } catch (ImageDecodeException e) {
            logger.warn("Image rejected before analysis ({}): {}", e.getRejectionReason(), e.getMessage());
            return QualityAggregator.rejected(e.getRejectionReason());
        }

        ResolutionAnalysis resolution = checkTypes.contains(CheckType.RESOLUTION)
            ? ResolutionAnalyzer.analyze(grid, thresholds)
            : null;
        BlurAnalysis blur = checkTypes.contains(CheckType.BLUR)
            ? BlurDetector.analyze(grid, thresholds)
            : null;
        LightingAnalysis lighting = checkTypes.contains(CheckType.LIGHTING)
            ? LightingAnalyzer.analyze(grid, thresholds)
            : null;

        ValidationResult result = QualityAggregator.aggregate(resolution, blur, lighting, thresholds);
        if (result.valid()) {
            logger.debug("Image {}x{} accepted with score {} (checks {})",
                grid.width(), grid.height(), result.qualityScore(), checkTypes);
        } else {
            logger.info("Image {}x{} rejected with score {} and issues {} (checks {})",
                grid.width(), grid.height(), result.qualityScore(), result.issues(), checkTypes);
        }
        return result;
    }

    /**
     * Builds retake guidance for a verdict. Valid verdicts yield guidance with
     * {@code retry_needed = false}.
     */
    public RetryGuidance retryGuidance(ValidationResult result) {
        Objects.requireNonNull(result, "result");
        return RetryGuidanceGenerator.generate(result);
    }
}
