package io.chunkvault;

/**
 * Transient failure persisting a shard. Safe to retry.
 */
public class StorageWriteException extends ChunkVaultException {

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
