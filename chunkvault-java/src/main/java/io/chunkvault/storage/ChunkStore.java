package io.chunkvault.storage;

import io.chunkvault.CorruptedChunkException;
import io.chunkvault.InsufficientShardsException;
import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.InsertOutcome;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ShardLocation;
import io.chunkvault.index.Tier;
import io.chunkvault.storage.compress.ChunkCompressor;
import io.chunkvault.storage.erasure.ErasureCoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.zip.DataFormatException;

/**
 * Content-addressed chunk storage.
 *
 * <p>A chunk is compressed, erasure-coded into k+m shards and spread over the
 * shard backends; its row is then inserted into the {@link MetadataIndex} with
 * insert-unless-present semantics. Two writers racing on the same digest both
 * write identical shard files and exactly one of them creates the row.</p>
 */
public class ChunkStore {

    private static final Logger logger = LoggerFactory.getLogger(ChunkStore.class);

    private final MetadataIndex index;
    private final ShardPlacement placement;
    private final ErasureCoder erasureCoder;
    private final ChunkCompressor compressor;
    private final Clock clock;

    public ChunkStore(MetadataIndex index, List<ShardBackend> backends, ErasureCoder erasureCoder,
                      ChunkCompressor compressor, Clock clock) {
        this.index = index;
        this.erasureCoder = erasureCoder;
        this.compressor = compressor;
        this.clock = clock;
        this.placement = new ShardPlacement(backends, erasureCoder.getTotalShards());
    }

    /**
     * Persist novel content. The caller has already computed the digest and
     * checked the index; a concurrent insert of the same digest still resolves
     * to {@link InsertOutcome#ALREADY_EXISTS}.
     *
     * @throws io.chunkvault.StorageWriteException if a shard could not be written;
     *         no index row exists in that case
     */
    public PutResult put(String digest, byte[] raw) {
        byte[] compressed = compressor.compress(raw);
        ErasureCoder.EncodeResult encoded = erasureCoder.encode(compressed);
        byte[][] shards = encoded.shards();

        List<ShardBackend> targets = placement.place(digest, shards.length);
        List<ShardLocation> locations = new ArrayList<>(shards.length);
        for (int i = 0; i < shards.length; i++) {
            String path = ShardPlacement.shardPath(digest, i);
            ShardBackend backend = targets.get(i);
            backend.put(path, shards[i]);
            locations.add(new ShardLocation(i, backend.id(), path));
        }

        Instant now = clock.instant();
        ChunkMeta meta = new ChunkMeta(
            digest,
            raw.length,
            compressed.length,
            erasureCoder.getDataShards(),
            erasureCoder.getParityShards(),
            locations,
            Tier.HOT,
            now,
            now
        );

        InsertOutcome outcome = index.insertIfAbsent(digest, meta);
        if (outcome == InsertOutcome.ALREADY_EXISTS) {
            logger.debug("Chunk {} inserted concurrently by another writer", digest);
            meta = index.lookup(digest).orElse(meta);
        } else {
            logger.debug("Stored chunk {}: {} -> {} bytes in {} shards", digest, raw.length, compressed.length, shards.length);
        }
        return new PutResult(meta, outcome);
    }

    /**
     * Rebuild the raw bytes of a chunk.
     *
     * @throws InsufficientShardsException if fewer than k shards are retrievable
     * @throws CorruptedChunkException if the decoded payload does not inflate to the digest
     */
    public byte[] read(ChunkMeta meta) {
        int required = meta.dataShards();
        byte[][] shards = new byte[meta.totalShards()][];
        int found = 0;

        for (ShardLocation location : orderForRead(meta.shardLocations())) {
            if (found >= required) break;
            Optional<ShardBackend> backend = placement.backend(location.backendId());
            if (backend.isEmpty()) {
                logger.warn("Shard {} of chunk {} lives on unknown backend {}", location.shardIndex(), meta.digest(), location.backendId());
                continue;
            }
            Optional<byte[]> shard = backend.get().get(location.storagePath());
            if (shard.isEmpty()) {
                logger.warn("Shard {} of chunk {} missing on backend {}", location.shardIndex(), meta.digest(), location.backendId());
                continue;
            }
            if (shard.get().length != meta.shardSize()) {
                logger.warn("Shard {} of chunk {} on backend {} has {} bytes, expected {}",
                    location.shardIndex(), meta.digest(), location.backendId(), shard.get().length, meta.shardSize());
                continue;
            }
            shards[location.shardIndex()] = shard.get();
            found++;
        }

        if (found < required) {
            throw new InsufficientShardsException(meta.digest(), found, required);
        }

        ErasureCoder coder = coderFor(meta);
        byte[] compressed = coder.decode(shards, meta.compressedSizeBytes(), meta.shardSize());
        byte[] raw;
        try {
            raw = compressor.decompress(compressed, meta.sizeBytes());
        } catch (DataFormatException e) {
            throw new CorruptedChunkException(meta.digest(), "Chunk " + meta.digest() + " failed to decompress", e);
        }
        String actual = ChunkHasher.digest(raw);
        if (!actual.equals(meta.digest())) {
            throw new CorruptedChunkException(meta.digest(), "Chunk " + meta.digest() + " decoded to content with digest " + actual);
        }
        return raw;
    }

    /**
     * Remove every shard of a chunk. The index row is left to the caller.
     * @return number of shard files removed
     */
    public int deleteShards(ChunkMeta meta) {
        int removed = 0;
        for (ShardLocation location : meta.shardLocations()) {
            Optional<ShardBackend> backend = placement.backend(location.backendId());
            if (backend.isPresent() && backend.get().delete(location.storagePath())) {
                removed++;
            }
        }
        return removed;
    }

    public List<ShardBackend> getBackends() {
        return placement.getBackends();
    }

    public ErasureCoder getErasureCoder() {
        return erasureCoder;
    }

    // Ready backends first, then data shards before parity so the common case skips matrix inversion.
    private List<ShardLocation> orderForRead(List<ShardLocation> locations) {
        List<ShardLocation> ordered = new ArrayList<>(locations);
        ordered.sort(Comparator
            .comparing((ShardLocation l) -> !placement.backend(l.backendId()).map(ShardBackend::isReady).orElse(false))
            .thenComparingInt(ShardLocation::shardIndex));
        return ordered;
    }

    private ErasureCoder coderFor(ChunkMeta meta) {
        if (meta.dataShards() == erasureCoder.getDataShards() && meta.parityShards() == erasureCoder.getParityShards()) {
            return erasureCoder;
        }
        return new ErasureCoder(meta.dataShards(), meta.parityShards());
    }

    public record PutResult(ChunkMeta meta, InsertOutcome outcome) {
        public boolean inserted() {
            return outcome == InsertOutcome.INSERTED;
        }
    }
}
