package io.chunkvault;

/**
 * Thrown when a chunk index is already bound to a different digest.
 *
 * <p>Resubmitting identical content at the same index is not an error; this
 * exception only signals a conflicting digest, which is a fatal inconsistency
 * for the manifest.</p>
 */
public class DuplicateChunkIndexException extends ChunkVaultException {

    private final String objectId;
    private final long version;
    private final int chunkIndex;
    private final String existingDigest;
    private final String attemptedDigest;

    public DuplicateChunkIndexException(String objectId, long version, int chunkIndex,
                                        String existingDigest, String attemptedDigest) {
        super("Chunk index " + chunkIndex + " of " + objectId + "@" + version
            + " already holds " + existingDigest + ", refusing " + attemptedDigest);
        this.objectId = objectId;
        this.version = version;
        this.chunkIndex = chunkIndex;
        this.existingDigest = existingDigest;
        this.attemptedDigest = attemptedDigest;
    }

    public String getObjectId() { return objectId; }
    public long getVersion() { return version; }
    public int getChunkIndex() { return chunkIndex; }
    public String getExistingDigest() { return existingDigest; }
    public String getAttemptedDigest() { return attemptedDigest; }
}
