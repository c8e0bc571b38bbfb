package io.chunkvault.index;

import io.chunkvault.DuplicateChunkIndexException;
import io.chunkvault.ObjectNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable mapping of chunk digests to stored chunks, and of object versions to
 * their manifests. The single source of truth consulted before every write and read.
 *
 * <p>Implementations must offer read-your-writes consistency. Backend failures
 * are reported as {@link io.chunkvault.IndexUnavailableException}.</p>
 */
public interface MetadataIndex {

    // ==================== Chunks ====================

    /**
     * Look up a chunk by digest.
     * @param digest hex SHA-256 of the raw chunk bytes
     * @return the chunk row, or empty if the content was never stored
     */
    Optional<ChunkMeta> lookup(String digest);

    /**
     * Atomically insert a chunk row unless one already exists for the digest.
     * A concurrent insert of the same digest resolves to {@link InsertOutcome#ALREADY_EXISTS};
     * it is never an error because the content is identical by construction.
     * @param digest key, must equal {@code meta.digest()}
     * @param meta row to insert
     * @return whether this call created the row
     */
    InsertOutcome insertIfAbsent(String digest, ChunkMeta meta);

    /**
     * Change the storage tier of a chunk.
     * @return false if the chunk does not exist
     */
    boolean updateTier(String digest, Tier tier);

    /**
     * Record a read of the chunk for tiering and garbage collection decisions.
     * The update is atomic with respect to {@link #deleteChunkIfUnchanged}.
     * @return false if the row no longer exists
     */
    boolean recordAccess(String digest, Instant accessedAt);

    /**
     * Remove a chunk row unconditionally.
     * @return false if the chunk did not exist
     */
    boolean deleteChunk(String digest);

    /**
     * Remove a chunk row only while its access time still equals
     * {@code lastAccessedAt}, so a concurrent {@link #recordAccess} wins over
     * the garbage collector.
     * @return false if the row is gone or was accessed since
     */
    boolean deleteChunkIfUnchanged(String digest, Instant lastAccessedAt);

    List<ChunkMeta> listChunks();

    // ==================== Manifests ====================

    /**
     * Open an empty manifest for an object version, owned by an upload session.
     * An existing uncommitted manifest for the same key is discarded.
     * @param uploadId owning session, or null for an unowned manifest
     * @throws IllegalStateException if the version is already committed
     */
    ObjectManifest createManifest(String objectId, long version, String uploadId, Instant createdAt);

    default ObjectManifest createManifest(String objectId, long version, Instant createdAt) {
        return createManifest(objectId, version, null, createdAt);
    }

    /**
     * Bind a digest to a chunk index of an open manifest.
     * @param uploadId session making the write; null skips the owner check
     * @return {@link AppendOutcome#ALREADY_PRESENT} for an identical retry
     * @throws DuplicateChunkIndexException if the index already holds a different digest
     * @throws ObjectNotFoundException if no manifest exists, or it belongs to another session
     * @throws IllegalStateException if the manifest is committed
     */
    AppendOutcome appendManifestEntry(String objectId, long version, String uploadId, int chunkIndex, String digest);

    default AppendOutcome appendManifestEntry(String objectId, long version, int chunkIndex, String digest) {
        return appendManifestEntry(objectId, version, null, chunkIndex, digest);
    }

    /**
     * Overwrite the digest at an index of an {@link ManifestState#INVALID} manifest.
     * The manifest stays INVALID until the next successful commit.
     * @throws IllegalStateException unless the manifest is INVALID
     * @throws ObjectNotFoundException if no manifest exists, or it belongs to another session
     */
    void replaceManifestEntry(String objectId, long version, String uploadId, int chunkIndex, String digest);

    default void replaceManifestEntry(String objectId, long version, int chunkIndex, String digest) {
        replaceManifestEntry(objectId, version, null, chunkIndex, digest);
    }

    /**
     * @throws ObjectNotFoundException if no manifest exists for the key
     */
    ObjectManifest getManifest(String objectId, long version);

    Optional<ObjectManifest> findManifest(String objectId, long version);

    /**
     * Mark a manifest committed. Committing an already committed manifest is a no-op.
     * @throws IllegalStateException if the entries are not contiguous from 0
     */
    ObjectManifest commitManifest(String objectId, long version, int expectedChunks,
                                  long totalBytes, String checksum, Instant committedAt);

    /**
     * Mark an open manifest invalid after a failed verification.
     */
    ObjectManifest invalidateManifest(String objectId, long version);

    /**
     * Drop an uncommitted manifest.
     * @param uploadId session the manifest must belong to; null skips the owner check
     * @return false if none existed or it belongs to another session
     * @throws IllegalStateException if the manifest is committed
     */
    boolean deleteManifest(String objectId, long version, String uploadId);

    default boolean deleteManifest(String objectId, long version) {
        return deleteManifest(objectId, version, null);
    }

    /**
     * Highest version of the object in any state.
     */
    OptionalLong latestVersion(String objectId);

    /**
     * Highest committed version of the object.
     */
    OptionalLong latestCommittedVersion(String objectId);

    List<ObjectManifest> listManifests();
}
