package io.chunkvault.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where one erasure-coded shard of a chunk lives.
 *
 * @param shardIndex  position in 0..k+m-1
 * @param backendId   id of the shard backend (one per mount point)
 * @param storagePath path relative to the backend root
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShardLocation(
    @JsonProperty("shardIndex") int shardIndex,
    @JsonProperty("backendId") String backendId,
    @JsonProperty("storagePath") String storagePath
) {}
