package io.chunkvault;

import io.chunkvault.index.InMemoryMetadataIndex;
import io.chunkvault.index.JsonFileMetadataIndex;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.ingest.AdmitResult;
import io.chunkvault.ingest.FinalizeRequest;
import io.chunkvault.ingest.FinalizeResult;
import io.chunkvault.ingest.IngestPipeline;
import io.chunkvault.maintenance.GarbageCollector;
import io.chunkvault.maintenance.TieringSweeper;
import io.chunkvault.read.ObjectStream;
import io.chunkvault.read.ReconstructionEngine;
import io.chunkvault.session.SessionRequest;
import io.chunkvault.session.SessionStatus;
import io.chunkvault.session.UploadSession;
import io.chunkvault.session.UploadSessionManager;
import io.chunkvault.storage.ChunkStore;
import io.chunkvault.storage.FileShardBackend;
import io.chunkvault.storage.InMemoryShardBackend;
import io.chunkvault.storage.ShardBackend;
import io.chunkvault.storage.compress.ChunkCompressor;
import io.chunkvault.storage.erasure.ErasureCoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Entry point wiring the ingest, read and maintenance components over one
 * metadata index and one set of shard backends.
 */
public class ChunkVault implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChunkVault.class);

    private final VaultOptions options;
    private final MetadataIndex index;
    private final ChunkStore chunkStore;
    private final UploadSessionManager sessions;
    private final IngestPipeline pipeline;
    private final ReconstructionEngine reconstruction;
    private final TieringSweeper tieringSweeper;
    private final GarbageCollector garbageCollector;

    private final ExecutorService executor;
    private final ScheduledExecutorService scheduler;
    private volatile boolean maintenanceStarted;

    public ChunkVault(VaultOptions options) {
        this(options, createIndex(options), createBackends(options), Clock.systemUTC());
    }

    public ChunkVault(VaultOptions options, MetadataIndex index, List<ShardBackend> backends, Clock clock) {
        this.options = options;
        this.index = index;
        this.chunkStore = new ChunkStore(index, backends,
            new ErasureCoder(options.dataShards(), options.parityShards()),
            new ChunkCompressor(options.compressionLevel()), clock);
        this.sessions = new UploadSessionManager(index, options.sessionTimeout(), options.committedRetention(), clock);
        this.pipeline = new IngestPipeline(sessions, index, chunkStore, options.verifyOnDedup(),
            options.maxChunkBytes(), clock);
        this.reconstruction = new ReconstructionEngine(index, chunkStore, clock);
        this.tieringSweeper = new TieringSweeper(index, options.warmAfter(), options.coldAfter(), clock);
        this.garbageCollector = new GarbageCollector(index, chunkStore, options.gcGracePeriod(), clock);

        this.executor = Executors.newFixedThreadPool(options.concurrency());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "chunkvault-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    // ==================== Uploads ====================

    public UploadSession createSession(SessionRequest request) {
        return sessions.create(request);
    }

    public AdmitResult admitChunk(String uploadId, int chunkIndex, byte[] rawBytes) {
        return pipeline.admitChunk(uploadId, chunkIndex, rawBytes);
    }

    public AdmitResult admitChunk(String uploadId, int chunkIndex, byte[] rawBytes, String clientDigest) {
        return pipeline.admitChunk(uploadId, chunkIndex, rawBytes, clientDigest);
    }

    public CompletableFuture<AdmitResult> admitChunkAsync(String uploadId, int chunkIndex, byte[] rawBytes) {
        return CompletableFuture.supplyAsync(() -> pipeline.admitChunk(uploadId, chunkIndex, rawBytes), executor);
    }

    public SessionStatus status(String uploadId) {
        return sessions.status(uploadId);
    }

    public FinalizeResult finalize(FinalizeRequest request) {
        return pipeline.finalize(request);
    }

    public void cancel(String uploadId) {
        sessions.cancel(uploadId);
    }

    // ==================== Reads ====================

    public ObjectStream read(String objectId, long version) {
        return reconstruction.read(objectId, version);
    }

    public ObjectStream read(String objectId, long version, int fromChunkIndex) {
        return reconstruction.read(objectId, version, fromChunkIndex);
    }

    public ObjectStream read(String objectId) {
        return reconstruction.read(objectId);
    }

    public InputStream openInputStream(String objectId, long version) {
        return reconstruction.openInputStream(objectId, version);
    }

    public ObjectManifest getManifest(String objectId, long version) {
        return reconstruction.committedManifest(objectId, version);
    }

    // ==================== Maintenance ====================

    /**
     * Schedule the session reaper, tiering sweeps and garbage collection.
     */
    public synchronized void startMaintenance() {
        if (maintenanceStarted) {
            return;
        }
        maintenanceStarted = true;
        schedule("session reaper", options.reaperInterval(), sessions::reap);
        schedule("tiering sweep", options.tieringInterval(), tieringSweeper::sweep);
        schedule("garbage collection", options.gcInterval(), garbageCollector::collect);
        logger.info("Maintenance scheduled: reaper every {}, tiering every {}, gc every {}",
            options.reaperInterval(), options.tieringInterval(), options.gcInterval());
    }

    private void schedule(String name, Duration interval, Runnable task) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // A thrown exception would cancel every later run.
                logger.error("Scheduled {} failed", name, e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    // ==================== Events & Stats ====================

    public void setOnChunkAdmitted(Consumer<AdmitResult> listener) { pipeline.setOnChunkAdmitted(listener); }
    public void setOnObjectCommitted(Consumer<FinalizeResult> listener) { pipeline.setOnObjectCommitted(listener); }
    public void setOnSessionExpired(Consumer<UploadSession> listener) { sessions.setOnSessionExpired(listener); }

    public VaultStats stats() {
        long storedBytes = 0;
        for (ShardBackend backend : chunkStore.getBackends()) {
            storedBytes += backend.stats().totalBytes();
        }
        return new VaultStats(
            index.listChunks().size(),
            storedBytes,
            pipeline.getLogicalBytesAdmitted(),
            pipeline.getDedupHits(),
            sessions.activeSessionCount(),
            pipeline.getObjectsCommitted()
        );
    }

    public List<ShardBackend.BackendStats> backendStats() {
        return chunkStore.getBackends().stream().map(ShardBackend::stats).toList();
    }

    public VaultOptions getOptions() { return options; }
    public MetadataIndex getIndex() { return index; }
    public ChunkStore getChunkStore() { return chunkStore; }
    public UploadSessionManager getSessionManager() { return sessions; }
    public IngestPipeline getIngestPipeline() { return pipeline; }
    public ReconstructionEngine getReconstructionEngine() { return reconstruction; }
    public TieringSweeper getTieringSweeper() { return tieringSweeper; }
    public GarbageCollector getGarbageCollector() { return garbageCollector; }

    public CompletableFuture<Void> shutdown() {
        return CompletableFuture.runAsync(this::close);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static MetadataIndex createIndex(VaultOptions options) {
        if (options.indexDirectory() == null) {
            logger.warn("No index directory configured; metadata is kept in memory only");
            return new InMemoryMetadataIndex();
        }
        return new JsonFileMetadataIndex(options.indexDirectory());
    }

    private static List<ShardBackend> createBackends(VaultOptions options) {
        List<ShardBackend> backends = new ArrayList<>();
        if (options.storageRoots().isEmpty()) {
            for (int i = 0; i < options.totalShards(); i++) {
                backends.add(new InMemoryShardBackend("mem-" + i));
            }
            return backends;
        }
        int i = 0;
        for (Path root : options.storageRoots()) {
            backends.add(new FileShardBackend("disk-" + i++, root));
        }
        return backends;
    }

    public record VaultStats(
        int chunkCount,
        long storedBytes,
        long logicalBytesAdmitted,
        long dedupHits,
        int activeSessions,
        long objectsCommitted
    ) {}
}
