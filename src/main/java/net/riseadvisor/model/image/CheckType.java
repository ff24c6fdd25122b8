package net.riseadvisor.model.image;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.riseadvisor.exception.UnsupportedCheckException;

/**
 * Quality checks a caller can request for an uploaded photograph.
 */
public enum CheckType {

    RESOLUTION("resolution"),
    BLUR("blur"),
    LIGHTING("lighting");

    /** Every check; used when the caller does not narrow the selection. */
    public static final Set<CheckType> ALL = Collections.unmodifiableSet(EnumSet.allOf(CheckType.class));

    private final String value;

    CheckType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a wire value such as {@code "blur"} (case-insensitive, surrounding whitespace ignored).
     *
     * @param raw the requested check name
     * @return the matching check type
     * @throws UnsupportedCheckException when the name is blank or not a known check
     */
    public static CheckType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnsupportedCheckException(raw, supportedValues());
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CheckType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new UnsupportedCheckException(raw, supportedValues());
    }

    /**
     * Parses a caller-supplied selection. A {@code null} selection means all checks;
     * an explicit empty selection is rejected because it would score nothing.
     *
     * @param rawValues requested check names, or {@code null}
     * @return an immutable set of requested checks
     * @throws UnsupportedCheckException for unknown names or an empty selection
     */
    public static Set<CheckType> parseAll(Collection<String> rawValues) {
        if (rawValues == null) {
            return ALL;
        }
        if (rawValues.isEmpty()) {
            throw new UnsupportedCheckException("check_types must name at least one of " + supportedValues());
        }
        EnumSet<CheckType> selected = EnumSet.noneOf(CheckType.class);
        for (String raw : rawValues) {
            selected.add(fromValue(raw));
        }
        return Collections.unmodifiableSet(selected);
    }

    static String supportedValues() {
        return Arrays.stream(values()).map(CheckType::value).collect(Collectors.joining(", ", "[", "]"));
    }
}
