package io.chunkvault.storage;

import java.util.List;
import java.util.Optional;

/**
 * One physical storage device or mount point holding shard files.
 *
 * <p>Shards are addressed by a path relative to the backend root, in the form
 * {@code {digestPrefix}/{digest}.{shardIndex}.shard}. A shard write must be
 * durable before {@link #put} returns.</p>
 */
public interface ShardBackend {

    /**
     * Stable identifier recorded in shard locations.
     */
    String id();

    // ==================== Synchronous Operations ====================

    /**
     * Store a shard durably, replacing any previous bytes at the path.
     * @param path relative shard path
     * @param data shard bytes
     * @throws io.chunkvault.StorageWriteException if the write could not be made durable
     */
    void put(String path, byte[] data);

    /**
     * Read a shard.
     * @param path relative shard path
     * @return shard bytes, or empty if the shard is missing or unreadable
     */
    Optional<byte[]> get(String path);

    /**
     * Check if a shard exists.
     */
    boolean has(String path);

    /**
     * Delete a shard.
     * @return true if the shard existed
     */
    boolean delete(String path);

    /**
     * List all shard paths on this backend.
     */
    List<String> listPaths();

    BackendStats stats();

    // ==================== Health ====================

    /**
     * Whether the backend is currently healthy. Reads prefer ready backends.
     */
    default boolean isReady() {
        return true;
    }

    record BackendStats(String id, int shardCount, long totalBytes, boolean ready) {}
}
