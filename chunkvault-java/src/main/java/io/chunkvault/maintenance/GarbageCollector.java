package io.chunkvault.maintenance;

import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.storage.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Deletes chunks that no manifest references.
 *
 * <p>Liveness is a manifest scan: every digest named by a manifest in any state
 * is live, so chunks of in-flight uploads survive. A chunk must also have been
 * idle for the grace period, which covers the gap between storing a chunk and
 * appending its manifest entry. A dedup hit refreshes the access time before it
 * is counted, and the delete only applies while that time is unchanged.</p>
 */
public class GarbageCollector {

    private static final Logger logger = LoggerFactory.getLogger(GarbageCollector.class);

    private final MetadataIndex index;
    private final ChunkStore chunkStore;
    private final Duration gracePeriod;
    private final Clock clock;

    public GarbageCollector(MetadataIndex index, ChunkStore chunkStore, Duration gracePeriod, Clock clock) {
        this.index = index;
        this.chunkStore = chunkStore;
        this.gracePeriod = gracePeriod;
        this.clock = clock;
    }

    public GcResult collect() {
        Set<String> live = new HashSet<>();
        for (ObjectManifest manifest : index.listManifests()) {
            live.addAll(manifest.getDigests());
        }

        Instant cutoff = clock.instant().minus(gracePeriod);
        int examined = 0;
        int deleted = 0;
        int shardsRemoved = 0;
        long bytesReclaimed = 0;
        for (ChunkMeta chunk : index.listChunks()) {
            examined++;
            if (live.contains(chunk.digest()) || !chunk.lastAccessedAt().isBefore(cutoff)) {
                continue;
            }
            // Skipped when an admission refreshed the row after the listing.
            if (!index.deleteChunkIfUnchanged(chunk.digest(), chunk.lastAccessedAt())) {
                continue;
            }
            // Re-inserted by a concurrent admission of the same content; its shards are live again.
            if (index.lookup(chunk.digest()).isPresent()) {
                continue;
            }
            shardsRemoved += chunkStore.deleteShards(chunk);
            bytesReclaimed += (long) chunk.shardSize() * chunk.totalShards();
            deleted++;
            logger.debug("Collected unreferenced chunk {}", chunk.digest());
        }
        if (deleted > 0) {
            logger.info("Garbage collection removed {} of {} chunks ({} shards, {} bytes)",
                deleted, examined, shardsRemoved, bytesReclaimed);
        }
        return new GcResult(examined, deleted, shardsRemoved, bytesReclaimed);
    }

    public record GcResult(int examined, int deleted, int shardsRemoved, long bytesReclaimed) {}
}
