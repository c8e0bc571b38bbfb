package io.chunkvault.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps shard indices of a chunk onto backends.
 *
 * <p>Shard {@code i} of digest {@code d} lands on backend
 * {@code (offset(d) + i) mod B}, where the offset comes from the first digest
 * byte. With at least k+m backends every shard of a chunk sits on a different
 * device, so one device failure costs each chunk at most one shard.</p>
 */
public class ShardPlacement {

    private static final Logger logger = LoggerFactory.getLogger(ShardPlacement.class);

    public static final int DIGEST_PREFIX_LENGTH = 2;

    private final List<ShardBackend> backends;
    private final Map<String, ShardBackend> byId;

    public ShardPlacement(List<ShardBackend> backends, int totalShards) {
        if (backends.isEmpty()) {
            throw new IllegalArgumentException("At least one shard backend is required");
        }
        this.backends = List.copyOf(backends);
        this.byId = this.backends.stream().collect(Collectors.toMap(ShardBackend::id, Function.identity(), (a, b) -> a));
        if (byId.size() != this.backends.size()) {
            throw new IllegalArgumentException("Shard backend ids must be unique");
        }
        if (this.backends.size() < totalShards) {
            logger.warn("Only {} backends for {} shards per chunk; a single device failure may cost several shards",
                this.backends.size(), totalShards);
        }
    }

    /**
     * Backends for shard indices 0..totalShards-1 of the digest, in index order.
     */
    public List<ShardBackend> place(String digest, int totalShards) {
        int offset = Integer.parseInt(digest.substring(0, DIGEST_PREFIX_LENGTH), 16);
        List<ShardBackend> placement = new ArrayList<>(totalShards);
        for (int i = 0; i < totalShards; i++) {
            placement.add(backends.get((offset + i) % backends.size()));
        }
        return placement;
    }

    public Optional<ShardBackend> backend(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<ShardBackend> getBackends() {
        return backends;
    }

    /**
     * Relative path of a shard: {@code {digest[0..2]}/{digest}.{shardIndex}.shard}.
     */
    public static String shardPath(String digest, int shardIndex) {
        return digest.substring(0, DIGEST_PREFIX_LENGTH) + "/" + digest + "." + shardIndex + ".shard";
    }
}
