package io.chunkvault.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chunkvault.IndexUnavailableException;
import io.chunkvault.ObjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * {@link MetadataIndex} persisted as one JSON document per chunk and per manifest.
 *
 * <p>Layout under the root directory:</p>
 * <pre>
 * chunks/{digest[0..2]}/{digest}.json
 * manifests/{encoded objectId}/{version}.json
 * </pre>
 *
 * <p>Chunk rows are inserted by hard-linking a fully written temp file to its
 * final name; {@code link(2)} fails when the name exists, which gives
 * insert-unless-present semantics across processes sharing the directory.
 * Updates replace documents with an atomic rename. Writers of one document
 * are serialized within this process by a fixed set of striped locks.</p>
 */
public class JsonFileMetadataIndex implements MetadataIndex {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileMetadataIndex.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final int PREFIX_LENGTH = 2;
    private static final int LOCK_STRIPES = 64;

    private final Path chunksDir;
    private final Path manifestsDir;
    // Striped so the lock table stays fixed in size however many digests pass through.
    private final ReentrantLock[] lockStripes = new ReentrantLock[LOCK_STRIPES];

    public JsonFileMetadataIndex(Path root) {
        this.chunksDir = root.resolve("chunks");
        this.manifestsDir = root.resolve("manifests");
        for (int i = 0; i < lockStripes.length; i++) {
            lockStripes[i] = new ReentrantLock();
        }
        try {
            Files.createDirectories(chunksDir);
            Files.createDirectories(manifestsDir);
        } catch (IOException e) {
            throw new IndexUnavailableException("Cannot create index directories under " + root, e);
        }
        logger.info("Opened JSON metadata index at {}", root);
    }

    // ==================== Chunks ====================

    @Override
    public Optional<ChunkMeta> lookup(String digest) {
        return read(chunkPath(digest), ChunkMeta.class);
    }

    @Override
    public InsertOutcome insertIfAbsent(String digest, ChunkMeta meta) {
        InMemoryMetadataIndex.requireMatchingDigest(digest, meta);
        Path target = chunkPath(digest);
        if (Files.exists(target)) {
            return InsertOutcome.ALREADY_EXISTS;
        }
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = writeTemp(target, meta);
            Files.createLink(target, tmp);
            return InsertOutcome.INSERTED;
        } catch (FileAlreadyExistsException e) {
            return InsertOutcome.ALREADY_EXISTS;
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to insert chunk " + digest, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    @Override
    public boolean updateTier(String digest, Tier tier) {
        return updateChunk(digest, meta -> meta.withTier(tier));
    }

    @Override
    public boolean recordAccess(String digest, Instant accessedAt) {
        return updateChunk(digest, meta -> meta.withLastAccessedAt(accessedAt));
    }

    @Override
    public boolean deleteChunk(String digest) {
        Path path = chunkPath(digest);
        return withLock(path, () -> deleteFile(path, "chunk " + digest));
    }

    @Override
    public boolean deleteChunkIfUnchanged(String digest, Instant lastAccessedAt) {
        Path path = chunkPath(digest);
        return withLock(path, () -> {
            Optional<ChunkMeta> current = read(path, ChunkMeta.class);
            if (current.isEmpty() || !Objects.equals(current.get().lastAccessedAt(), lastAccessedAt)) {
                return false;
            }
            return deleteFile(path, "chunk " + digest);
        });
    }

    @Override
    public List<ChunkMeta> listChunks() {
        return readAll(chunksDir, ChunkMeta.class);
    }

    // ==================== Manifests ====================

    @Override
    public ObjectManifest createManifest(String objectId, long version, String uploadId, Instant createdAt) {
        Path path = manifestPath(objectId, version);
        return withLock(path, () -> {
            Optional<ObjectManifest> existing = read(path, ObjectManifest.class);
            if (existing.isPresent() && existing.get().isCommitted()) {
                throw new IllegalStateException("Manifest already committed: " + objectId + "@" + version);
            }
            ObjectManifest manifest = ObjectManifest.open(objectId, version, uploadId, createdAt);
            writeReplacing(path, manifest);
            return manifest;
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
        return read(manifestPath(objectId, version), ObjectManifest.class);
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
        Path path = manifestPath(objectId, version);
        return withLock(path, () -> {
            Optional<ObjectManifest> existing = read(path, ObjectManifest.class);
            if (existing.isEmpty() || !existing.get().isOwnedBy(uploadId)) {
                return false;
            }
            if (existing.get().isCommitted()) {
                throw new IllegalStateException("Cannot delete committed manifest: " + objectId + "@" + version);
            }
            return deleteFile(path, "manifest " + objectId + "@" + version);
        });
    }

    @Override
    public OptionalLong latestVersion(String objectId) {
        return readAll(objectDir(objectId), ObjectManifest.class).stream()
            .mapToLong(ObjectManifest::getVersion)
            .max();
    }

    @Override
    public OptionalLong latestCommittedVersion(String objectId) {
        return readAll(objectDir(objectId), ObjectManifest.class).stream()
            .filter(ObjectManifest::isCommitted)
            .mapToLong(ObjectManifest::getVersion)
            .max();
    }

    @Override
    public List<ObjectManifest> listManifests() {
        return readAll(manifestsDir, ObjectManifest.class);
    }

    // ==================== Internals ====================

    private boolean updateChunk(String digest, UnaryOperator<ChunkMeta> change) {
        Path path = chunkPath(digest);
        return withLock(path, () -> {
            Optional<ChunkMeta> current = read(path, ChunkMeta.class);
            if (current.isEmpty()) {
                return false;
            }
            writeReplacing(path, change.apply(current.get()));
            return true;
        });
    }

    private ObjectManifest mutate(String objectId, long version, UnaryOperator<ObjectManifest> change) {
        Path path = manifestPath(objectId, version);
        return withLock(path, () -> {
            ObjectManifest current = read(path, ObjectManifest.class)
                .orElseThrow(() -> new ObjectNotFoundException(objectId, version));
            ObjectManifest updated = change.apply(current);
            if (updated != current) {
                writeReplacing(path, updated);
            }
            return updated;
        });
    }

    private <T> T withLock(Path path, Supplier<T> action) {
        ReentrantLock lock = lockStripes[Math.floorMod(path.hashCode(), lockStripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int lockStripeCount() {
        return lockStripes.length;
    }

    private boolean deleteFile(Path path, String what) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to delete " + what, e);
        }
    }

    private <T> Optional<T> read(Path path, Class<T> type) {
        try {
            return Optional.of(MAPPER.readValue(Files.readAllBytes(path), type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to read " + path, e);
        }
    }

    private <T> List<T> readAll(Path dir, Class<T> type) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<T> result = new ArrayList<>();
        try (Stream<Path> files = Files.walk(dir)) {
            for (Path file : (Iterable<Path>) files.filter(p -> p.toString().endsWith(".json"))::iterator) {
                read(file, type).ifPresent(result::add);
            }
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to list " + dir, e);
        }
        return result;
    }

    private void writeReplacing(Path target, Object value) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = writeTemp(target, value);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            tmp = null;
        } catch (IOException e) {
            throw new IndexUnavailableException("Failed to write " + target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private Path writeTemp(Path target, Object value) throws IOException {
        Path tmp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            MAPPER.writeValue(out, value);
        }
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
        return tmp;
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    private Path chunkPath(String digest) {
        if (digest.length() < PREFIX_LENGTH || digest.contains("/") || digest.contains("\\") || digest.startsWith(".")) {
            throw new IllegalArgumentException("Invalid digest: " + digest);
        }
        return chunksDir.resolve(digest.substring(0, PREFIX_LENGTH)).resolve(digest + ".json");
    }

    private Path objectDir(String objectId) {
        String encoded = URLEncoder.encode(objectId, StandardCharsets.UTF_8).replace(".", "%2E").replace("*", "%2A");
        return manifestsDir.resolve(encoded);
    }

    private Path manifestPath(String objectId, long version) {
        return objectDir(objectId).resolve(version + ".json");
    }
}
