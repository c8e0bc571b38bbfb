package io.chunkvault;

/**
 * Thrown when a chunk upload request is malformed: empty body, index out of
 * range, or a client digest that does not match the received bytes.
 */
public class InvalidChunkException extends ChunkVaultException {

    public InvalidChunkException(String message) {
        super(message);
    }
}
