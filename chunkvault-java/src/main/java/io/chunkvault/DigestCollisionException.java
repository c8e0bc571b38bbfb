package io.chunkvault;

/**
 * Thrown when dedup re-verification finds different bytes behind an existing digest.
 */
public class DigestCollisionException extends ChunkVaultException {

    private final String digest;

    public DigestCollisionException(String digest) {
        super("Stored content for digest " + digest + " differs from the submitted chunk");
        this.digest = digest;
    }

    public String getDigest() {
        return digest;
    }
}
