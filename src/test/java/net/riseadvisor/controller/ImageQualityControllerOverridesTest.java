package net.riseadvisor.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Set;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.model.image.QualityMetrics;
import net.riseadvisor.model.image.RetryGuidance;
import net.riseadvisor.model.image.ValidationResult;
import net.riseadvisor.service.image.ImageQualityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ImageQualityControllerOverridesTest {

    @Mock
    private ImageQualityService imageQualityService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImageQualityController(imageQualityService)).build();
    }

    @Test
    @DisplayName("Overrides are layered on the configured thresholds for one call only")
    void overridesAreAppliedToConfiguredDefaults() throws Exception {
        ValidationResult accepted = new ValidationResult(true, 0.95, List.of(), QualityMetrics.empty(),
            "Excellent image quality - perfect for accurate diagnosis");
        RetryGuidance proceed = new RetryGuidance(false, "Image quality is good. You can proceed with analysis.",
            0.95, List.of(), List.of());
        when(imageQualityService.defaultThresholds()).thenReturn(ImageQualityThresholds.defaults());
        when(imageQualityService.validate(any(byte[].class), eq(Set.of(CheckType.BLUR, CheckType.LIGHTING)),
            any(ImageQualityThresholds.class))).thenReturn(accepted);
        when(imageQualityService.retryGuidance(accepted)).thenReturn(proceed);

        mockMvc.perform(post("/api/image-quality/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"image_data": "AQID", "check_types": ["blur", "LIGHTING"],
                     "blur_threshold": 60.0, "validity_threshold": 0.6}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.validation.quality_score").value(0.95))
            .andExpect(jsonPath("$.retry_guidance.retry_needed").value(false));

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<ImageQualityThresholds> thresholds = ArgumentCaptor.forClass(ImageQualityThresholds.class);
        verify(imageQualityService).validate(bytes.capture(), eq(Set.of(CheckType.BLUR, CheckType.LIGHTING)),
            thresholds.capture());
        assertThat(bytes.getValue()).containsExactly(1, 2, 3);
        assertThat(thresholds.getValue().blurThreshold()).isEqualTo(60.0);
        assertThat(thresholds.getValue().validityThreshold()).isEqualTo(0.6);
        assertThat(thresholds.getValue().minResolution()).isEqualTo(ImageQualityThresholds.DEFAULT_MIN_RESOLUTION);
    }

    @Test
    @DisplayName("Empty check_types list is rejected before the gate runs")
    void emptyCheckTypesAreRejected() throws Exception {
        mockMvc.perform(post("/api/image-quality/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"image_data\": \"AQID\", \"check_types\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unsupported check type"));

        verifyNoInteractions(imageQualityService);
    }
}
