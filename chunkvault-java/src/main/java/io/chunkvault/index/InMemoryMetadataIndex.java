package io.chunkvault.index;

import io.chunkvault.ObjectNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link MetadataIndex} held in concurrent maps.
 *
 * <p>Chunk inserts are a compare-and-set on the digest key. Manifest mutations
 * go through {@link ConcurrentHashMap#compute}, which serializes writers of one
 * manifest without blocking other manifests.</p>
 */
public class InMemoryMetadataIndex implements MetadataIndex {

    private final Map<String, ChunkMeta> chunks = new ConcurrentHashMap<>();
    private final Map<ManifestKey, ObjectManifest> manifests = new ConcurrentHashMap<>();

    @Override
    public Optional<ChunkMeta> lookup(String digest) {
        return Optional.ofNullable(chunks.get(digest));
    }

    @Override
    public InsertOutcome insertIfAbsent(String digest, ChunkMeta meta) {
        requireMatchingDigest(digest, meta);
        return chunks.putIfAbsent(digest, meta) == null ? InsertOutcome.INSERTED : InsertOutcome.ALREADY_EXISTS;
    }

    @Override
    public boolean updateTier(String digest, Tier tier) {
        return chunks.computeIfPresent(digest, (k, meta) -> meta.withTier(tier)) != null;
    }

    @Override
    public boolean recordAccess(String digest, Instant accessedAt) {
        return chunks.computeIfPresent(digest, (k, meta) -> meta.withLastAccessedAt(accessedAt)) != null;
    }

    @Override
    public boolean deleteChunk(String digest) {
        return chunks.remove(digest) != null;
    }

    @Override
    public boolean deleteChunkIfUnchanged(String digest, Instant lastAccessedAt) {
        boolean[] removed = new boolean[1];
        chunks.computeIfPresent(digest, (k, meta) -> {
            if (!Objects.equals(meta.lastAccessedAt(), lastAccessedAt)) {
                return meta;
            }
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    @Override
    public List<ChunkMeta> listChunks() {
        return new ArrayList<>(chunks.values());
    }

    @Override
    public ObjectManifest createManifest(String objectId, long version, String uploadId, Instant createdAt) {
        return manifests.compute(new ManifestKey(objectId, version), (key, existing) -> {
            if (existing != null && existing.isCommitted()) {
                throw new IllegalStateException("Manifest already committed: " + objectId + "@" + version);
            }
            return ObjectManifest.open(objectId, version, uploadId, createdAt);
        });
    }

    @Override
    public AppendOutcome appendManifestEntry(String objectId, long version, String uploadId,
                                             int chunkIndex, String digest) {
        AppendOutcome[] outcome = new AppendOutcome[1];
        mutate(objectId, version, manifest -> {
            ManifestEditor.Result result = ManifestEditor.append(manifest, uploadId, chunkIndex, digest);
            outcome[0] = result.outcome();
            return result.manifest();
        });
        return outcome[0];
    }

    @Override
    public void replaceManifestEntry(String objectId, long version, String uploadId, int chunkIndex, String digest) {
        mutate(objectId, version, manifest -> ManifestEditor.replace(manifest, uploadId, chunkIndex, digest));
    }

    @Override
    public ObjectManifest getManifest(String objectId, long version) {
        return findManifest(objectId, version).orElseThrow(() -> new ObjectNotFoundException(objectId, version));
    }

    @Override
    public Optional<ObjectManifest> findManifest(String objectId, long version) {
        return Optional.ofNullable(manifests.get(new ManifestKey(objectId, version)));
    }

    @Override
    public ObjectManifest commitManifest(String objectId, long version, int expectedChunks,
                                         long totalBytes, String checksum, Instant committedAt) {
        return mutate(objectId, version,
            manifest -> ManifestEditor.commit(manifest, expectedChunks, totalBytes, checksum, committedAt));
    }

    @Override
    public ObjectManifest invalidateManifest(String objectId, long version) {
        return mutate(objectId, version, ManifestEditor::invalidate);
    }

    @Override
    public boolean deleteManifest(String objectId, long version, String uploadId) {
        boolean[] removed = new boolean[1];
        manifests.computeIfPresent(new ManifestKey(objectId, version), (key, existing) -> {
            if (!existing.isOwnedBy(uploadId)) {
                return existing;
            }
            if (existing.isCommitted()) {
                throw new IllegalStateException("Cannot delete committed manifest: " + objectId + "@" + version);
            }
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    @Override
    public OptionalLong latestVersion(String objectId) {
        return manifests.keySet().stream()
            .filter(k -> k.objectId().equals(objectId))
            .mapToLong(ManifestKey::version)
            .max();
    }

    @Override
    public OptionalLong latestCommittedVersion(String objectId) {
        return manifests.values().stream()
            .filter(m -> m.getObjectId().equals(objectId) && m.isCommitted())
            .mapToLong(ObjectManifest::getVersion)
            .max();
    }

    @Override
    public List<ObjectManifest> listManifests() {
        return new ArrayList<>(manifests.values());
    }

    public int chunkCount() {
        return chunks.size();
    }

    public void clear() {
        chunks.clear();
        manifests.clear();
    }

    private ObjectManifest mutate(String objectId, long version, UnaryOperator<ObjectManifest> change) {
        ObjectManifest updated = manifests.computeIfPresent(new ManifestKey(objectId, version), (key, existing) -> change.apply(existing));
        if (updated == null) {
            throw new ObjectNotFoundException(objectId, version);
        }
        return updated;
    }

    static void requireMatchingDigest(String digest, ChunkMeta meta) {
        if (!Objects.equals(digest, meta.digest())) {
            throw new IllegalArgumentException("Key " + digest + " does not match row digest " + meta.digest());
        }
    }

    private record ManifestKey(String objectId, long version) {}
}
