package io.chunkvault;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Tunables of a {@link ChunkVault}. Built programmatically or read from the
 * {@code chunkvault} block of a Typesafe config.
 */
public class VaultOptions {

    public static final long DEFAULT_MAX_CHUNK_BYTES = 64L * 1024 * 1024;

    private final int dataShards;
    private final int parityShards;
    private final int compressionLevel;
    private final Duration sessionTimeout;
    private final Duration committedRetention;
    private final Duration reaperInterval;
    private final boolean verifyOnDedup;
    private final int concurrency;
    private final long maxChunkBytes;
    private final Duration warmAfter;
    private final Duration coldAfter;
    private final Duration tieringInterval;
    private final Duration gcGracePeriod;
    private final Duration gcInterval;
    private final List<Path> storageRoots;
    private final Path indexDirectory;
    private final String httpHost;
    private final int httpPort;

    private VaultOptions(Builder builder) {
        this.dataShards = builder.dataShards;
        this.parityShards = builder.parityShards;
        this.compressionLevel = builder.compressionLevel;
        this.sessionTimeout = builder.sessionTimeout;
        this.committedRetention = builder.committedRetention;
        this.reaperInterval = builder.reaperInterval;
        this.verifyOnDedup = builder.verifyOnDedup;
        this.concurrency = builder.concurrency;
        this.maxChunkBytes = builder.maxChunkBytes;
        this.warmAfter = builder.warmAfter;
        this.coldAfter = builder.coldAfter;
        this.tieringInterval = builder.tieringInterval;
        this.gcGracePeriod = builder.gcGracePeriod;
        this.gcInterval = builder.gcInterval;
        this.storageRoots = List.copyOf(builder.storageRoots);
        this.indexDirectory = builder.indexDirectory;
        this.httpHost = builder.httpHost;
        this.httpPort = builder.httpPort;
    }

    public static VaultOptions defaults() {
        return builder().build();
    }

    public static VaultOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Read options from the {@code chunkvault} path of a config tree.
     * Empty strings and non-positive concurrency fall back to the built-in defaults.
     */
    public static VaultOptions fromConfig(Config root) {
        Config config = root.getConfig("chunkvault");
        Builder builder = builder()
            .dataShards(config.getInt("erasure.data-shards"))
            .parityShards(config.getInt("erasure.parity-shards"))
            .compressionLevel(config.getInt("compression.level"))
            .sessionTimeout(config.getDuration("sessions.timeout"))
            .committedRetention(config.getDuration("sessions.committed-retention"))
            .reaperInterval(config.getDuration("sessions.reaper-interval"))
            .verifyOnDedup(config.getBoolean("dedup.verify"))
            .maxChunkBytes(config.getBytes("ingest.max-chunk-bytes"))
            .warmAfter(config.getDuration("tiering.warm-after"))
            .coldAfter(config.getDuration("tiering.cold-after"))
            .tieringInterval(config.getDuration("tiering.interval"))
            .gcGracePeriod(config.getDuration("gc.grace-period"))
            .gcInterval(config.getDuration("gc.interval"))
            .storageRoots(config.getStringList("storage.roots").stream().map(Path::of).toList())
            .httpHost(config.getString("http.host"))
            .httpPort(config.getInt("http.port"));

        int concurrency = config.getInt("ingest.concurrency");
        if (concurrency > 0) {
            builder.concurrency(concurrency);
        }
        String indexDirectory = config.getString("storage.index-directory");
        if (!indexDirectory.isBlank()) {
            builder.indexDirectory(Path.of(indexDirectory));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int dataShards() { return dataShards; }
    public int parityShards() { return parityShards; }
    public int totalShards() { return dataShards + parityShards; }
    public int compressionLevel() { return compressionLevel; }
    public Duration sessionTimeout() { return sessionTimeout; }
    public Duration committedRetention() { return committedRetention; }
    public Duration reaperInterval() { return reaperInterval; }
    public boolean verifyOnDedup() { return verifyOnDedup; }
    public int concurrency() { return concurrency; }
    public long maxChunkBytes() { return maxChunkBytes; }
    public Duration warmAfter() { return warmAfter; }
    public Duration coldAfter() { return coldAfter; }
    public Duration tieringInterval() { return tieringInterval; }
    public Duration gcGracePeriod() { return gcGracePeriod; }
    public Duration gcInterval() { return gcInterval; }
    /** Backend root directories; empty means in-memory backends. */
    public List<Path> storageRoots() { return storageRoots; }
    /** Directory of the JSON index, or null for an in-memory index. */
    public Path indexDirectory() { return indexDirectory; }
    public String httpHost() { return httpHost; }
    public int httpPort() { return httpPort; }

    public static class Builder {
        private int dataShards = 6;
        private int parityShards = 3;
        private int compressionLevel = 6;
        private Duration sessionTimeout = Duration.ofHours(1);
        private Duration committedRetention = Duration.ofHours(24);
        private Duration reaperInterval = Duration.ofMinutes(1);
        private boolean verifyOnDedup = false;
        private int concurrency = Runtime.getRuntime().availableProcessors();
        private long maxChunkBytes = DEFAULT_MAX_CHUNK_BYTES;
        private Duration warmAfter = Duration.ofDays(7);
        private Duration coldAfter = Duration.ofDays(30);
        private Duration tieringInterval = Duration.ofHours(1);
        private Duration gcGracePeriod = Duration.ofHours(1);
        private Duration gcInterval = Duration.ofHours(6);
        private List<Path> storageRoots = List.of();
        private Path indexDirectory;
        private String httpHost = "0.0.0.0";
        private int httpPort = 8080;

        public Builder dataShards(int shards) { this.dataShards = shards; return this; }
        public Builder parityShards(int shards) { this.parityShards = shards; return this; }
        public Builder compressionLevel(int level) { this.compressionLevel = level; return this; }
        public Builder sessionTimeout(Duration timeout) { this.sessionTimeout = timeout; return this; }
        public Builder committedRetention(Duration retention) { this.committedRetention = retention; return this; }
        public Builder reaperInterval(Duration interval) { this.reaperInterval = interval; return this; }
        public Builder verifyOnDedup(boolean verify) { this.verifyOnDedup = verify; return this; }
        public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Builder maxChunkBytes(long bytes) { this.maxChunkBytes = bytes; return this; }
        public Builder warmAfter(Duration age) { this.warmAfter = age; return this; }
        public Builder coldAfter(Duration age) { this.coldAfter = age; return this; }
        public Builder tieringInterval(Duration interval) { this.tieringInterval = interval; return this; }
        public Builder gcGracePeriod(Duration grace) { this.gcGracePeriod = grace; return this; }
        public Builder gcInterval(Duration interval) { this.gcInterval = interval; return this; }
        public Builder storageRoots(List<Path> roots) { this.storageRoots = roots; return this; }
        public Builder indexDirectory(Path directory) { this.indexDirectory = directory; return this; }
        public Builder httpHost(String host) { this.httpHost = host; return this; }
        public Builder httpPort(int port) { this.httpPort = port; return this; }

        public VaultOptions build() {
            if (dataShards < 1 || parityShards < 1 || dataShards + parityShards > 255) {
                throw new IllegalArgumentException("Invalid erasure layout " + dataShards + "+" + parityShards);
            }
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be positive, got " + concurrency);
            }
            if (maxChunkBytes < 1 || maxChunkBytes > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("maxChunkBytes out of range: " + maxChunkBytes);
            }
            return new VaultOptions(this);
        }
    }
}
