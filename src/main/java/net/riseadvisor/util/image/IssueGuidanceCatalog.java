package net.riseadvisor.util.image;

import java.util.List;
import net.riseadvisor.model.image.IssueGuidance;
import net.riseadvisor.model.image.QualityIssue;

/**
 * Retake advice for every {@link QualityIssue}. The switch has no default branch, so
 * adding an issue without advice fails compilation.
 */
public final class IssueGuidanceCatalog {

    private IssueGuidanceCatalog() {
    }

    public static IssueGuidance guidanceFor(QualityIssue issue) {
        return switch (issue) {
            case LOW_RESOLUTION -> new IssueGuidance(issue, "Low Resolution", "📐", List.of(
                "Use your phone camera's highest quality setting",
                "Get closer to the crop for more detail",
                "Ensure camera is set to maximum resolution"));
            case UNUSUAL_ASPECT_RATIO -> new IssueGuidance(issue, "Unusual Framing", "🖼️", List.of(
                "Capture the crop in a balanced, square-like frame",
                "Avoid panorama or cropped strip photos",
                "Keep the affected area in the center of the photo"));
            case VERY_BLURRY, SLIGHTLY_BLURRY -> new IssueGuidance(issue, "Blurry Image", "🔍", List.of(
                "Tap on the crop in your camera app to focus",
                "Hold your phone steady or rest it on a stable surface",
                "Ensure good lighting for faster shutter speed",
                "Clean your camera lens"));
            case TOO_DARK -> new IssueGuidance(issue, "Too Dark", "🌙", List.of(
                "Take photos during daytime",
                "Move to a brighter location",
                "Use additional lighting if indoors",
                "Avoid shadows covering the crop"));
            case TOO_BRIGHT -> new IssueGuidance(issue, "Too Bright", "☀️", List.of(
                "Avoid direct sunlight",
                "Take photos in shade or on cloudy days",
                "Adjust camera exposure down if available",
                "Position yourself to block harsh light"));
            case LOW_CONTRAST -> new IssueGuidance(issue, "Low Contrast", "🌓", List.of(
                "Use diffused natural light",
                "Ensure even lighting without harsh shadows",
                "Place the leaf or soil sample against a plain background"));
            case EMPTY_FILE -> new IssueGuidance(issue, "Empty File", "📁", List.of(
                "The uploaded file contains no data",
                "Take a new photo and upload it again"));
            case FILE_TOO_LARGE -> new IssueGuidance(issue, "File Too Large", "📦", List.of(
                "Reduce the photo size before uploading",
                "Use your camera's standard instead of RAW format"));
            case INVALID_IMAGE -> new IssueGuidance(issue, "Unreadable Image", "⚠️", List.of(
                "Upload a JPEG or PNG photo",
                "Make sure the file is not damaged",
                "Take a new photo with your camera app"));
        };
    }
}
