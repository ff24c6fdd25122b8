package net.riseadvisor.exception;

import net.riseadvisor.model.image.ImageRejectionReason;

/**
 * Upload bytes could not be turned into pixels (empty, oversized, corrupt or unsupported format).
 * RETRYABLE: No (the same bytes will fail again)
 *
 * <p>Raised while decoding and converted into a rejected validation result by the
 * service; it never crosses the service boundary.</p>
 */
public class ImageDecodeException extends RuntimeException {

    private final ImageRejectionReason rejectionReason;

    public ImageDecodeException(ImageRejectionReason rejectionReason, String detail) {
        super(rejectionReason.description() + ": " + detail);
        this.rejectionReason = rejectionReason;
    }

    public ImageDecodeException(ImageRejectionReason rejectionReason, String detail, Throwable cause) {
        super(rejectionReason.description() + ": " + detail, cause);
        this.rejectionReason = rejectionReason;
    }

    public ImageRejectionReason getRejectionReason() {
        return rejectionReason;
    }
}
