package net.riseadvisor.model.image;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageQualityThresholdsTest {

    @Test
    void defaults_matchDocumentedValues() {
        ImageQualityThresholds defaults = ImageQualityThresholds.defaults();

        assertThat(defaults.minResolution()).isEqualTo(300);
        assertThat(defaults.maxAspectRatio()).isEqualTo(3.0);
        assertThat(defaults.blurThreshold()).isEqualTo(100.0);
        assertThat(defaults.minBrightness()).isEqualTo(30.0);
        assertThat(defaults.maxBrightness()).isEqualTo(225.0);
        assertThat(defaults.minContrast()).isEqualTo(20.0);
        assertThat(defaults.validityThreshold()).isEqualTo(0.7);
        assertThat(defaults.maxImageBytes()).isEqualTo(5L * 1024 * 1024);
        assertThat(defaults.maxPixels()).isEqualTo(24_000_000L);
        assertThat(defaults.idealBrightness()).isEqualTo(127.5);
    }

    @Test
    void withOverrides_replacesOnlySuppliedValues() {
        ImageQualityThresholds defaults = ImageQualityThresholds.defaults();

        ImageQualityThresholds custom = defaults.withOverrides(200, null, 10.0, null, null, 0.5);

        assertThat(custom.minResolution()).isEqualTo(200);
        assertThat(custom.blurThreshold()).isEqualTo(defaults.blurThreshold());
        assertThat(custom.minBrightness()).isEqualTo(10.0);
        assertThat(custom.maxBrightness()).isEqualTo(defaults.maxBrightness());
        assertThat(custom.validityThreshold()).isEqualTo(0.5);
        assertThat(defaults.minResolution()).isEqualTo(300);
    }

    @Test
    void rejectsInvertedBrightnessBand() {
        assertThatThrownBy(() -> ImageQualityThresholds.defaults().withOverrides(null, null, 200.0, 100.0, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("min_brightness");
    }

    @Test
    void rejectsOutOfRangeValues() {
        ImageQualityThresholds defaults = ImageQualityThresholds.defaults();

        assertThatThrownBy(() -> defaults.withOverrides(0, null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withOverrides(null, -1.0, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> defaults.withOverrides(null, null, null, null, null, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
