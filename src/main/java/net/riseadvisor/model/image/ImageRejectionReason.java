package net.riseadvisor.model.image;

/**
 * Reasons an upload was rejected before any analyzer could look at its pixels.
 *
 * <p>All values mean "this upload cannot be scored"; the farmer has to send a
 * different file. They never indicate an infrastructure fault.</p>
 */
public enum ImageRejectionReason {

    EMPTY_FILE(QualityIssue.EMPTY_FILE, "Image file is empty"),
    FILE_TOO_LARGE(QualityIssue.FILE_TOO_LARGE, "Image file is too large"),
    UNREADABLE_IMAGE(QualityIssue.INVALID_IMAGE, "Image file is invalid or corrupted");

    private final QualityIssue issue;
    private final String description;

    ImageRejectionReason(QualityIssue issue, String description) {
        this.issue = issue;
        this.description = description;
    }

    /** Issue tag reported in the validation result. */
    public QualityIssue issue() {
        return issue;
    }

    /** Human-readable description, used as the validation summary. */
    public String description() {
        return description;
    }
}
