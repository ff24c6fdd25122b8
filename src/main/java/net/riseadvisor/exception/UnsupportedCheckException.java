package net.riseadvisor.exception;

/**
 * A caller asked for a quality check that does not exist (or for no check at all).
 * This is a caller-input contract violation, so it fails fast instead of producing
 * a partial validation result.
 */
public class UnsupportedCheckException extends IllegalArgumentException {

    private final String requestedCheck;

    /** Creates an exception for an unknown check name. */
    public UnsupportedCheckException(String requestedCheck, String supportedChecks) {
        super("Unsupported check type '" + requestedCheck + "'; supported checks are " + supportedChecks);
        this.requestedCheck = requestedCheck;
    }

    /** Creates an exception for a malformed selection with no single offending name. */
    public UnsupportedCheckException(String message) {
        super(message);
        this.requestedCheck = null;
    }

    /** Returns the offending check name, or null when the whole selection was malformed. */
    public String getRequestedCheck() {
        return requestedCheck;
    }
}
