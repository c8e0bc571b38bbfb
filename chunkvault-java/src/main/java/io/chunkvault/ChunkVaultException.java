package io.chunkvault;

/**
 * Base exception for chunk ingestion and reconstruction failures.
 *
 * <p>All ChunkVault exceptions extend this class. Failures the resumable
 * upload protocol should retry report {@link #isRetryable()} as true.</p>
 */
public class ChunkVaultException extends RuntimeException {

    public ChunkVaultException(String message) {
        super(message);
    }

    public ChunkVaultException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may safely retry the same request.
     *
     * @return true for transient storage and index failures
     */
    public boolean isRetryable() {
        return false;
    }
}
