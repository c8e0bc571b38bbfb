package io.chunkvault;

/**
 * Thrown when a stored chunk cannot be turned back into its original bytes.
 */
public class CorruptedChunkException extends ChunkVaultException {

    private final String digest;

    public CorruptedChunkException(String digest, String message) {
        super(message);
        this.digest = digest;
    }

    public CorruptedChunkException(String digest, String message, Throwable cause) {
        super(message, cause);
        this.digest = digest;
    }

    public String getDigest() {
        return digest;
    }
}
