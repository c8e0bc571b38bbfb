package io.chunkvault;

/**
 * Thrown when an upload id does not name a known session.
 */
public class SessionNotFoundException extends ChunkVaultException {

    private final String uploadId;

    public SessionNotFoundException(String uploadId) {
        super("Upload session not found: " + uploadId);
        this.uploadId = uploadId;
    }

    public String getUploadId() {
        return uploadId;
    }
}
