package io.chunkvault;

/**
 * Transient failure reaching the metadata index. Safe to retry.
 */
public class IndexUnavailableException extends ChunkVaultException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
