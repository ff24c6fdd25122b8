package net.riseadvisor.controller;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.riseadvisor.controller.dto.ImageQualityRequest;
import net.riseadvisor.controller.dto.ImageQualityResponse;
import net.riseadvisor.controller.support.ErrorResponseUtils;
import net.riseadvisor.exception.UnsupportedCheckException;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.ValidationResult;
import net.riseadvisor.service.image.ImageQualityService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * Image quality gate endpoints used by the diagnosis workflow before it submits a
 * photograph for multimodal analysis. A {@code valid=false} verdict is still a
 * successful (200) response; 400 is reserved for malformed requests.
 */
@RestController
@RequestMapping("/api/image-quality")
@Slf4j
public class ImageQualityController {

    private static final String DATA_URL_MARKER = ";base64,";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ImageQualityService imageQualityService;

    public ImageQualityController(ImageQualityService imageQualityService) {
        this.imageQualityService = imageQualityService;
    }

    @PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ImageQualityResponse> validate(@RequestBody ImageQualityRequest request) {
        if (request == null || !StringUtils.hasText(request.imageData())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing image_data in request");
        }

        Set<CheckType> checkTypes = CheckType.parseAll(request.checkTypes());
        ImageQualityThresholds thresholds = resolveThresholds(request);
        byte[] imageBytes = decodeBase64(request.imageData());

        return ResponseEntity.ok(assess(imageBytes, checkTypes, thresholds));
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageQualityResponse> upload(@RequestParam("file") MultipartFile file,
                                                       @RequestParam(name = "check_types", required = false) List<String> checkTypes) {
        Set<CheckType> selected = CheckType.parseAll(checkTypes);
        byte[] imageBytes;
        try {
            imageBytes = file.getBytes();
        } catch (IOException ex) {
            log.error("Failed to read uploaded image '{}': {}", file.getOriginalFilename(), ex.getMessage(), ex);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to read uploaded image '" + file.getOriginalFilename() + "'", ex);
        }

        return ResponseEntity.ok(assess(imageBytes, selected, imageQualityService.defaultThresholds()));
    }

    @ExceptionHandler(UnsupportedCheckException.class)
    public ResponseEntity<Map<String, String>> handleUnsupportedCheck(UnsupportedCheckException ex) {
        log.warn("Rejected image quality request: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest("Unsupported check type", ex.getMessage());
    }

    private ImageQualityResponse assess(byte[] imageBytes, Set<CheckType> checkTypes, ImageQualityThresholds thresholds) {
        ValidationResult validation = imageQualityService.validate(imageBytes, checkTypes, thresholds);
        return new ImageQualityResponse(validation, imageQualityService.retryGuidance(validation));
    }

    private ImageQualityThresholds resolveThresholds(ImageQualityRequest request) {
        ImageQualityThresholds defaults = imageQualityService.defaultThresholds();
        if (!request.hasThresholdOverrides()) {
            return defaults;
        }
        try {
            return defaults.withOverrides(
                request.minResolution(),
                request.blurThreshold(),
                request.minBrightness(),
                request.maxBrightness(),
                request.minContrast(),
                request.validityThreshold()
            );
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid threshold override: " + ex.getMessage(), ex);
        }
    }

    private static byte[] decodeBase64(String imageData) {
        String payload = imageData.strip();
        int marker = payload.indexOf(DATA_URL_MARKER);
        if (payload.startsWith("data:") && marker > 0) {
            payload = payload.substring(marker + DATA_URL_MARKER.length());
        }
        try {
            String compact = WHITESPACE.matcher(payload).replaceAll("");
            return Base64.getDecoder().decode(compact.getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid base64 image data", ex);
        }
    }
}
