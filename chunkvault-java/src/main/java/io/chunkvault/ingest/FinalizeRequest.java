package io.chunkvault.ingest;

/**
 * @param uploadId         session to finalize
 * @param objectId         must match the session, or null to skip the check
 * @param version          must match the session, or 0 to skip the check
 * @param originalChecksum whole-object SHA-256, or null to use the one given at session creation
 */
public record FinalizeRequest(
    String uploadId,
    String objectId,
    long version,
    String originalChecksum
) {
    public static FinalizeRequest of(String uploadId) {
        return new FinalizeRequest(uploadId, null, 0, null);
    }
}
