package net.riseadvisor;

import java.util.Base64;
import net.riseadvisor.config.ImageQualityProperties;
import net.riseadvisor.model.image.ImageQualityThresholds;
import net.riseadvisor.service.image.ImageQualityService;
import net.riseadvisor.testutil.ImageFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Application context smoke test
 *
 * Features:
 * - Verifies that the Spring application context loads
 * - Checks that application.yml binds onto the image quality properties
 * - Sends one request through the full MVC stack, including Jackson serialization
 */
@SpringBootTest(properties = "image-quality.blur-threshold=120")
@AutoConfigureMockMvc
class RiseAdvisorApplicationTests {

    @Autowired
    private ImageQualityProperties properties;

    @Autowired
    private ImageQualityService imageQualityService;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
        // Passes when the context starts
    }

    @Test
    void should_BindConfiguredThresholds() {
        ImageQualityThresholds thresholds = imageQualityService.defaultThresholds();

        assertEquals(120.0, thresholds.blurThreshold());
        assertEquals(300, thresholds.minResolution());
        assertEquals(5L * 1024 * 1024, thresholds.maxImageBytes());
        assertEquals(thresholds, properties.toThresholds());
    }

    @Test
    void should_ServeValidationThroughMvcStack() throws Exception {
        byte[] png = ImageFixtures.png(ImageFixtures.gray(100, 100, 0));

        mockMvc.perform(post("/api/image-quality/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"image_data\": \"" + Base64.getEncoder().encodeToString(png) + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.validation.valid").value(false))
            .andExpect(jsonPath("$.validation.issues[0]").value("low_resolution"))
            .andExpect(jsonPath("$.retry_guidance.top_issues[0]").value("low_resolution"));
    }
}
