package io.chunkvault;

import io.chunkvault.index.InMemoryMetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.index.Tier;
import io.chunkvault.ingest.AdmitResult;
import io.chunkvault.ingest.FinalizeRequest;
import io.chunkvault.ingest.FinalizeResult;
import io.chunkvault.read.ObjectStream;
import io.chunkvault.session.SessionRequest;
import io.chunkvault.session.SessionState;
import io.chunkvault.session.UploadSession;
import io.chunkvault.storage.InMemoryShardBackend;
import io.chunkvault.storage.ShardBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkVault")
class ChunkVaultTest {

    private static final List<byte[]> CHUNKS = List.of(
        TestData.random(10_000, 11),
        TestData.random(10_000, 12),
        TestData.random(777, 13)
    );

    private static FinalizeResult upload(ChunkVault vault, String objectId, List<byte[]> chunks) {
        UploadSession session = vault.createSession(
            SessionRequest.of(objectId, chunks.size(), TestData.checksumOf(chunks.toArray(new byte[0][]))));
        for (int i = 0; i < chunks.size(); i++) {
            vault.admitChunk(session.getUploadId(), i, chunks.get(i));
        }
        return vault.finalize(FinalizeRequest.of(session.getUploadId()));
    }

    private static byte[] readAll(ChunkVault vault, String objectId, long version) throws IOException {
        try (InputStream in = vault.openInputStream(objectId, version)) {
            return in.readAllBytes();
        }
    }

    @Nested
    @DisplayName("In memory")
    class InMemoryTests {

        private MutableClock clock;
        private List<InMemoryShardBackend> backends;
        private ChunkVault vault;

        @BeforeEach
        void setUp() {
            clock = new MutableClock();
            backends = new ArrayList<>();
            for (int i = 0; i < 9; i++) {
                backends.add(new InMemoryShardBackend("mem-" + i));
            }
            VaultOptions options = VaultOptions.builder().concurrency(4).build();
            vault = new ChunkVault(options, new InMemoryMetadataIndex(), new ArrayList<ShardBackend>(backends), clock);
        }

        @AfterEach
        void tearDown() {
            vault.close();
        }

        @Test
        @DisplayName("should store and read back an object")
        void roundTrip() throws IOException {
            FinalizeResult result = upload(vault, "report.pdf", CHUNKS);

            assertTrue(result.isComplete());
            assertEquals(1, result.version());
            assertEquals(20_777, result.totalBytes());
            assertArrayEquals(TestData.concat(CHUNKS), readAll(vault, "report.pdf", 1));

            ObjectManifest manifest = vault.getManifest("report.pdf", 1);
            assertEquals(3, manifest.getChunkCount());
            assertEquals(TestData.checksumOf(CHUNKS.toArray(new byte[0][])), manifest.getChecksum());
        }

        @Test
        @DisplayName("a second upload of the same content should store nothing new")
        void dedupAcrossObjects() {
            upload(vault, "a", CHUNKS);
            long storedBefore = vault.stats().storedBytes();

            upload(vault, "b", CHUNKS);

            ChunkVault.VaultStats stats = vault.stats();
            assertEquals(3, stats.chunkCount());
            assertEquals(storedBefore, stats.storedBytes());
            assertEquals(3, stats.dedupHits());
            assertEquals(2 * 20_777, stats.logicalBytesAdmitted());
            assertEquals(2, stats.objectsCommitted());
            assertEquals(0, stats.activeSessions());
        }

        @Test
        @DisplayName("each upload of an object should create a new version")
        void versions() {
            upload(vault, "doc", CHUNKS);
            upload(vault, "doc", List.of(TestData.random(50, 99)));

            try (ObjectStream stream = vault.read("doc")) {
                assertEquals(2, stream.getManifest().getVersion());
            }
            try (ObjectStream stream = vault.read("doc", 1, 2)) {
                assertArrayEquals(CHUNKS.get(2), stream.next());
            }
        }

        @Test
        @DisplayName("async admission should run on the worker pool")
        void async() throws Exception {
            UploadSession session = vault.createSession(
                SessionRequest.of("async", CHUNKS.size(), TestData.checksumOf(CHUNKS.toArray(new byte[0][]))));
            List<CompletableFuture<AdmitResult>> futures = new ArrayList<>();
            for (int i = 0; i < CHUNKS.size(); i++) {
                futures.add(vault.admitChunkAsync(session.getUploadId(), i, CHUNKS.get(i)));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

            assertEquals(List.of(), vault.status(session.getUploadId()).missingChunks());
            assertTrue(vault.finalize(FinalizeRequest.of(session.getUploadId())).isComplete());
        }

        @Test
        @DisplayName("listeners should observe admissions, commits and expiry")
        void listeners() {
            List<AdmitResult> admitted = new CopyOnWriteArrayList<>();
            List<FinalizeResult> committed = new CopyOnWriteArrayList<>();
            List<UploadSession> expired = new CopyOnWriteArrayList<>();
            vault.setOnChunkAdmitted(admitted::add);
            vault.setOnObjectCommitted(committed::add);
            vault.setOnSessionExpired(expired::add);

            upload(vault, "x", CHUNKS);
            UploadSession stale = vault.createSession(SessionRequest.of("y", 1, "a".repeat(64)));
            clock.advance(Duration.ofHours(2));
            vault.getSessionManager().reap();

            assertEquals(3, admitted.size());
            assertEquals(1, committed.size());
            assertEquals("x", committed.get(0).objectId());
            assertEquals(1, expired.size());
            assertEquals(stale.getUploadId(), expired.get(0).getUploadId());
        }

        @Test
        @DisplayName("cancel should expire the session and drop its manifest")
        void cancel() {
            UploadSession session = vault.createSession(SessionRequest.of("gone", 2, "b".repeat(64)));
            vault.admitChunk(session.getUploadId(), 0, CHUNKS.get(0));

            vault.cancel(session.getUploadId());

            assertEquals(SessionState.EXPIRED, vault.getSessionManager().find(session.getUploadId()).orElseThrow().getState());
            assertThrows(SessionExpiredException.class, () -> vault.admitChunk(session.getUploadId(), 1, CHUNKS.get(1)));
            assertTrue(vault.getIndex().findManifest("gone", 1).isEmpty());
            assertThrows(SessionNotFoundException.class, () -> vault.cancel("no-such-upload"));
        }

        @Test
        @DisplayName("maintenance passes should demote and collect through the facade")
        void maintenance() {
            upload(vault, "keep", CHUNKS);
            UploadSession abandoned = vault.createSession(SessionRequest.of("drop", 1, "d".repeat(64)));
            vault.admitChunk(abandoned.getUploadId(), 0, TestData.random(3000, 42));
            vault.cancel(abandoned.getUploadId());
            clock.advance(Duration.ofDays(8));

            assertEquals(1, vault.getGarbageCollector().collect().deleted());
            vault.getTieringSweeper().sweep();

            assertEquals(3, vault.stats().chunkCount());
            assertTrue(vault.getIndex().listChunks().stream().allMatch(c -> c.tier() == Tier.WARM));
        }

        @Test
        @DisplayName("startMaintenance should be idempotent")
        void startMaintenance() {
            vault.startMaintenance();
            vault.startMaintenance();

            assertEquals(9, vault.backendStats().size());
        }
    }

    @Nested
    @DisplayName("On disk")
    class DiskTests {

        @TempDir
        Path tempDir;

        private VaultOptions options() {
            List<Path> roots = new ArrayList<>();
            for (int i = 0; i < 9; i++) {
                roots.add(tempDir.resolve("mount-" + i));
            }
            return VaultOptions.builder()
                .concurrency(2)
                .storageRoots(roots)
                .indexDirectory(tempDir.resolve("index"))
                .build();
        }

        @Test
        @DisplayName("objects should survive reopening the vault")
        void reopen() throws IOException {
            try (ChunkVault vault = new ChunkVault(options())) {
                assertTrue(upload(vault, "persisted", CHUNKS).isComplete());
            }

            try (ChunkVault vault = new ChunkVault(options())) {
                assertArrayEquals(TestData.concat(CHUNKS), readAll(vault, "persisted", 1));
                assertEquals(3, vault.stats().chunkCount());
            }
        }

        @Test
        @DisplayName("losing three mounts should not lose data")
        void toleratesLostMounts() throws IOException {
            try (ChunkVault vault = new ChunkVault(options())) {
                upload(vault, "resilient", CHUNKS);
            }
            for (int i : new int[] {1, 4, 7}) {
                deleteTree(tempDir.resolve("mount-" + i));
            }

            try (ChunkVault vault = new ChunkVault(options())) {
                assertArrayEquals(TestData.concat(CHUNKS), readAll(vault, "resilient", 1));
            }
        }

        private void deleteTree(Path root) throws IOException {
            try (var paths = Files.walk(root)) {
                for (Path path : paths.sorted((a, b) -> b.compareTo(a)).toList()) {
                    Files.delete(path);
                }
            }
        }
    }
}
