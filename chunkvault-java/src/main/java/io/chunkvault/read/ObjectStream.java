package io.chunkvault.read;

import io.chunkvault.InsufficientShardsException;
import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.storage.ChunkStore;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, ordered sequence of the raw chunks of one committed object version.
 *
 * <p>Each call to {@link #next()} resolves and decodes exactly one chunk, so at
 * most one chunk is held in memory. A failure is raised when its entry is
 * reached; chunks already returned stay valid and a caller can resume from
 * {@link #nextChunkIndex()} with a new stream.</p>
 */
public class ObjectStream implements Iterator<byte[]>, AutoCloseable {

    private final ObjectManifest manifest;
    private final MetadataIndex index;
    private final ChunkStore chunkStore;
    private final Clock clock;
    private final List<ObjectManifest.Entry> entries;

    private int position;
    private boolean closed;

    ObjectStream(ObjectManifest manifest, int fromChunkIndex, MetadataIndex index, ChunkStore chunkStore, Clock clock) {
        this.manifest = manifest;
        this.index = index;
        this.chunkStore = chunkStore;
        this.clock = clock;
        this.entries = manifest.getEntries();
        this.position = fromChunkIndex;
    }

    @Override
    public boolean hasNext() {
        return !closed && position < entries.size();
    }

    /**
     * @throws InsufficientShardsException if the chunk cannot be rebuilt from its shards
     * @throws io.chunkvault.CorruptedChunkException if the rebuilt chunk fails verification
     */
    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ObjectManifest.Entry entry = entries.get(position);
        ChunkMeta meta = index.lookup(entry.digest())
            .orElseThrow(() -> new InsufficientShardsException(entry.digest(), 0, chunkStore.getErasureCoder().getDataShards()));
        byte[] chunk = chunkStore.read(meta);
        index.recordAccess(entry.digest(), clock.instant());
        position++;
        return chunk;
    }

    /**
     * Index of the chunk the next call to {@link #next()} returns.
     */
    public int nextChunkIndex() {
        return position;
    }

    public ObjectManifest getManifest() {
        return manifest;
    }

    @Override
    public void close() {
        closed = true;
    }
}
