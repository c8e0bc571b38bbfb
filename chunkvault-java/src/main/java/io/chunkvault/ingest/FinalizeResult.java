package io.chunkvault.ingest;

import java.util.List;

/**
 * Outcome of a finalize attempt.
 *
 * @param status        COMPLETE, MISMATCH or INCOMPLETE
 * @param missingChunks sorted indices not yet received, empty unless INCOMPLETE
 * @param checksum      SHA-256 of the reassembled object, null when INCOMPLETE
 * @param totalBytes    reassembled size, -1 when INCOMPLETE
 */
public record FinalizeResult(
    Status status,
    String uploadId,
    String objectId,
    long version,
    List<Integer> missingChunks,
    String checksum,
    long totalBytes
) {
    public enum Status { COMPLETE, MISMATCH, INCOMPLETE }

    public FinalizeResult {
        missingChunks = List.copyOf(missingChunks);
    }

    static FinalizeResult complete(String uploadId, String objectId, long version, String checksum, long totalBytes) {
        return new FinalizeResult(Status.COMPLETE, uploadId, objectId, version, List.of(), checksum, totalBytes);
    }

    static FinalizeResult mismatch(String uploadId, String objectId, long version, String checksum, long totalBytes) {
        return new FinalizeResult(Status.MISMATCH, uploadId, objectId, version, List.of(), checksum, totalBytes);
    }

    static FinalizeResult incomplete(String uploadId, String objectId, long version, List<Integer> missing) {
        return new FinalizeResult(Status.INCOMPLETE, uploadId, objectId, version, missing, null, -1);
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }
}
