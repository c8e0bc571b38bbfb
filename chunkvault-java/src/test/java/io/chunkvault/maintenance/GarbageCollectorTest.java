package io.chunkvault.maintenance;

import io.chunkvault.MutableClock;
import io.chunkvault.TestData;
import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.InMemoryMetadataIndex;
import io.chunkvault.storage.ChunkHasher;
import io.chunkvault.storage.ChunkStore;
import io.chunkvault.storage.InMemoryShardBackend;
import io.chunkvault.storage.ShardBackend;
import io.chunkvault.storage.compress.ChunkCompressor;
import io.chunkvault.storage.erasure.ErasureCoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GarbageCollector")
class GarbageCollectorTest {

    private InMemoryMetadataIndex index;
    private List<InMemoryShardBackend> backends;
    private MutableClock clock;
    private ChunkStore chunkStore;
    private GarbageCollector collector;

    @BeforeEach
    void setUp() {
        index = new InMemoryMetadataIndex();
        backends = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            backends.add(new InMemoryShardBackend("mem-" + i));
        }
        clock = new MutableClock();
        chunkStore = new ChunkStore(index, new ArrayList<ShardBackend>(backends), new ErasureCoder(6, 3),
            new ChunkCompressor(6), clock);
        collector = new GarbageCollector(index, chunkStore, Duration.ofHours(1), clock);
    }

    private ChunkMeta store(byte[] data) {
        return chunkStore.put(ChunkHasher.digest(data), data).meta();
    }

    private int shardCount() {
        return backends.stream().mapToInt(b -> b.listPaths().size()).sum();
    }

    @Test
    @DisplayName("an unreferenced chunk past the grace period should be removed with its shards")
    void collectsOrphan() {
        ChunkMeta orphan = store(TestData.random(5000, 1));
        clock.advance(Duration.ofHours(2));

        GarbageCollector.GcResult result = collector.collect();

        assertEquals(1, result.examined());
        assertEquals(1, result.deleted());
        assertEquals(9, result.shardsRemoved());
        assertEquals((long) orphan.shardSize() * 9, result.bytesReclaimed());
        assertTrue(index.lookup(orphan.digest()).isEmpty());
        assertEquals(0, shardCount());
    }

    @Test
    @DisplayName("chunks inside the grace period should survive")
    void respectsGracePeriod() {
        ChunkMeta fresh = store(TestData.random(5000, 2));
        clock.advance(Duration.ofMinutes(59));

        assertEquals(0, collector.collect().deleted());
        assertTrue(index.lookup(fresh.digest()).isPresent());
        assertEquals(9, shardCount());
    }

    @Test
    @DisplayName("recent access should restart the grace period")
    void accessRestartsGrace() {
        ChunkMeta chunk = store(TestData.random(5000, 3));
        clock.advance(Duration.ofHours(2));
        index.recordAccess(chunk.digest(), clock.instant());

        assertEquals(0, collector.collect().deleted());
    }

    @Test
    @DisplayName("chunks named by any manifest should survive")
    void keepsReferenced() {
        ChunkMeta committed = store(TestData.random(5000, 4));
        ChunkMeta open = store(TestData.random(5000, 5));
        ChunkMeta orphan = store(TestData.random(5000, 6));

        index.createManifest("done", 1, clock.instant());
        index.appendManifestEntry("done", 1, 0, committed.digest());
        index.commitManifest("done", 1, 1, 5000, "e".repeat(64), clock.instant());
        index.createManifest("pending", 1, clock.instant());
        index.appendManifestEntry("pending", 1, 0, open.digest());
        clock.advance(Duration.ofDays(2));

        GarbageCollector.GcResult result = collector.collect();

        assertEquals(3, result.examined());
        assertEquals(1, result.deleted());
        assertTrue(index.lookup(committed.digest()).isPresent());
        assertTrue(index.lookup(open.digest()).isPresent());
        assertTrue(index.lookup(orphan.digest()).isEmpty());
        assertEquals(18, shardCount());
        assertArrayEquals(TestData.random(5000, 5), chunkStore.read(index.lookup(open.digest()).orElseThrow()));
    }

    @Test
    @DisplayName("dropping a manifest should make its chunks collectable")
    void droppedManifest() {
        ChunkMeta chunk = store(TestData.random(5000, 7));
        index.createManifest("abandoned", 1, clock.instant());
        index.appendManifestEntry("abandoned", 1, 0, chunk.digest());
        clock.advance(Duration.ofHours(2));
        assertEquals(0, collector.collect().deleted());

        index.deleteManifest("abandoned", 1);

        assertEquals(1, collector.collect().deleted());
    }

    @Test
    @DisplayName("a chunk accessed after the listing should survive the pass")
    void accessAfterListing() {
        InMemoryMetadataIndex racing = new InMemoryMetadataIndex() {
            @Override
            public List<ChunkMeta> listChunks() {
                List<ChunkMeta> listed = super.listChunks();
                listed.forEach(meta -> recordAccess(meta.digest(), clock.instant()));
                return listed;
            }
        };
        ChunkStore racingStore = new ChunkStore(racing, new ArrayList<ShardBackend>(backends), new ErasureCoder(6, 3),
            new ChunkCompressor(6), clock);
        byte[] data = TestData.random(5000, 8);
        ChunkMeta chunk = racingStore.put(ChunkHasher.digest(data), data).meta();
        clock.advance(Duration.ofHours(2));

        GarbageCollector.GcResult result = new GarbageCollector(racing, racingStore, Duration.ofHours(1), clock).collect();

        assertEquals(0, result.deleted());
        assertTrue(racing.lookup(chunk.digest()).isPresent());
        assertEquals(9, shardCount());
        assertArrayEquals(data, racingStore.read(racing.lookup(chunk.digest()).orElseThrow()));
    }
}
