package io.chunkvault.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Index row for one stored chunk, keyed by its content digest.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkMeta(
    @JsonProperty("digest") String digest,
    @JsonProperty("sizeBytes") int sizeBytes,
    @JsonProperty("compressedSizeBytes") int compressedSizeBytes,
    @JsonProperty("dataShards") int dataShards,
    @JsonProperty("parityShards") int parityShards,
    @JsonProperty("shardLocations") List<ShardLocation> shardLocations,
    @JsonProperty("tier") Tier tier,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastAccessedAt") Instant lastAccessedAt
) {
    public ChunkMeta {
        shardLocations = List.copyOf(shardLocations);
    }

    public int shardSize() {
        return (compressedSizeBytes + dataShards - 1) / dataShards;
    }

    public int totalShards() {
        return dataShards + parityShards;
    }

    public ChunkMeta withTier(Tier newTier) {
        return new ChunkMeta(digest, sizeBytes, compressedSizeBytes, dataShards, parityShards,
            shardLocations, newTier, createdAt, lastAccessedAt);
    }

    public ChunkMeta withLastAccessedAt(Instant accessedAt) {
        return new ChunkMeta(digest, sizeBytes, compressedSizeBytes, dataShards, parityShards,
            shardLocations, tier, createdAt, accessedAt);
    }
}
