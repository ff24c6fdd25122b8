package net.riseadvisor.model.image;

import java.util.ArrayList;
import java.util.List;
import net.riseadvisor.exception.UnsupportedCheckException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckTypeTest {

    @Test
    void should_SelectAllChecks_When_SelectionAbsent() {
        assertThat(CheckType.parseAll(null))
            .containsExactlyInAnyOrder(CheckType.RESOLUTION, CheckType.BLUR, CheckType.LIGHTING);
    }

    @Test
    void should_ParseCaseInsensitiveNames_AndIgnoreDuplicates() {
        assertThat(CheckType.parseAll(List.of(" Blur ", "LIGHTING", "blur")))
            .containsExactlyInAnyOrder(CheckType.BLUR, CheckType.LIGHTING);
    }

    @ParameterizedTest
    @ValueSource(strings = {"sharpness", "exposure", "", "   "})
    void should_FailFast_When_CheckIsUnknown(String raw) {
        assertThatThrownBy(() -> CheckType.parseAll(List.of("blur", raw)))
            .isInstanceOf(UnsupportedCheckException.class)
            .hasMessageContaining("resolution, blur, lighting");
    }

    @Test
    void should_ReportOffendingName() {
        assertThatThrownBy(() -> CheckType.fromValue("focus"))
            .isInstanceOfSatisfying(UnsupportedCheckException.class,
                ex -> assertThat(ex.getRequestedCheck()).isEqualTo("focus"));
    }

    @Test
    void should_RejectNullEntry() {
        List<String> withNull = new ArrayList<>();
        withNull.add(null);

        assertThatThrownBy(() -> CheckType.parseAll(withNull)).isInstanceOf(UnsupportedCheckException.class);
    }

    @Test
    void should_RejectEmptySelection() {
        assertThatThrownBy(() -> CheckType.parseAll(List.of()))
            .isInstanceOf(UnsupportedCheckException.class)
            .hasMessageContaining("at least one");
    }
}
