package io.chunkvault.storage;

import io.chunkvault.StorageWriteException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link ShardBackend}, for tests and ephemeral nodes.
 * Health and write failures can be toggled to simulate a failing device.
 */
public class InMemoryShardBackend implements ShardBackend {

    private final String id;
    private final Map<String, byte[]> shards = new ConcurrentHashMap<>();
    private final AtomicLong reads = new AtomicLong();
    private volatile boolean ready = true;
    private volatile boolean failWrites = false;

    public InMemoryShardBackend(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void put(String path, byte[] data) {
        if (failWrites) {
            throw new StorageWriteException("Backend " + id + " rejected write of " + path,
                new IOException("simulated device failure"));
        }
        shards.put(path, data.clone());
    }

    @Override
    public Optional<byte[]> get(String path) {
        reads.incrementAndGet();
        byte[] data = shards.get(path);
        return data != null ? Optional.of(data.clone()) : Optional.empty();
    }

    @Override
    public boolean has(String path) {
        return shards.containsKey(path);
    }

    @Override
    public boolean delete(String path) {
        return shards.remove(path) != null;
    }

    @Override
    public List<String> listPaths() {
        return new ArrayList<>(shards.keySet());
    }

    @Override
    public BackendStats stats() {
        long totalBytes = shards.values().stream()
            .mapToLong(b -> b.length)
            .sum();
        return new BackendStats(id, shards.size(), totalBytes, ready);
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    /**
     * Overwrite stored bytes without any checks, to simulate bit rot.
     */
    public void corrupt(String path, byte[] data) {
        shards.put(path, data.clone());
    }

    public long getReadCount() {
        return reads.get();
    }

    public void clear() {
        shards.clear();
    }
}
