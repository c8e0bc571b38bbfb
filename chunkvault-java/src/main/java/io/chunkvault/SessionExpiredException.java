package io.chunkvault;

import java.time.Instant;

/**
 * Thrown when a session is touched after its inactivity timeout.
 */
public class SessionExpiredException extends ChunkVaultException {

    private final String uploadId;
    private final Instant expiredAt;

    public SessionExpiredException(String uploadId, Instant expiredAt) {
        super("Upload session expired: " + uploadId + " (at " + expiredAt + ")");
        this.uploadId = uploadId;
        this.expiredAt = expiredAt;
    }

    public String getUploadId() {
        return uploadId;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
