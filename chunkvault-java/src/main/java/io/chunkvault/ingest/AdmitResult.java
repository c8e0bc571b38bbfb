package io.chunkvault.ingest;

/**
 * Outcome of admitting one chunk into an upload session.
 *
 * @param status    how the chunk was handled
 * @param uploadId  session the chunk belongs to
 * @param chunkIndex position of the chunk in the object
 * @param digest    hex SHA-256 of the raw chunk bytes
 * @param sizeBytes raw chunk size
 * @param dedupHit  true if the content was already stored and no shard was written
 */
public record AdmitResult(
    Status status,
    String uploadId,
    int chunkIndex,
    String digest,
    long sizeBytes,
    boolean dedupHit
) {
    public enum Status {
        /** First admission of this index. */
        ACCEPTED,
        /** Identical retry of an index already received. */
        DUPLICATE,
        /** Index re-sent with new content after a failed finalize. */
        REPLACED
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }
}
