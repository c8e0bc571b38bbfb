package io.chunkvault.session;

/**
 * Parameters for opening an upload session.
 *
 * @param objectId         opaque object identifier
 * @param version          version to write, or 0 to take the next free one
 * @param totalChunks      number of chunks the client will send
 * @param expectedBytes    total object size, or -1 when the client does not declare it
 * @param originalChecksum hex SHA-256 of the whole object
 */
public record SessionRequest(
    String objectId,
    long version,
    int totalChunks,
    long expectedBytes,
    String originalChecksum
) {
    public static SessionRequest of(String objectId, int totalChunks, String originalChecksum) {
        return new SessionRequest(objectId, 0, totalChunks, -1, originalChecksum);
    }
}
