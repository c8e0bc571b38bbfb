package io.chunkvault.storage;

import io.chunkvault.StorageWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * {@link ShardBackend} rooted at a directory on one mount point.
 *
 * <p>Writes go to a uniquely named temp file which is fsynced and then
 * atomically renamed over the final path, so concurrent writers of the same
 * shard (identical content) never expose a partial file.</p>
 */
public class FileShardBackend implements ShardBackend {

    private static final Logger logger = LoggerFactory.getLogger(FileShardBackend.class);
    private static final String SHARD_SUFFIX = ".shard";

    private final String id;
    private final Path root;

    public FileShardBackend(String id, Path root) {
        this.id = id;
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create shard directory " + this.root, e);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void put(String path, byte[] data) {
        Path target = resolve(path);
        Path tmp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                out.write(data);
            }
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new StorageWriteException("Failed to write shard " + path + " on backend " + id, e);
        }
    }

    @Override
    public Optional<byte[]> get(String path) {
        try {
            return Optional.of(Files.readAllBytes(resolve(path)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Unreadable shard {} on backend {}: {}", path, id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean has(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public boolean delete(String path) {
        try {
            return Files.deleteIfExists(resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete shard " + path + " on backend " + id, e);
        }
    }

    @Override
    public List<String> listPaths() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(SHARD_SUFFIX))
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list shards on backend " + id, e);
        }
    }

    @Override
    public BackendStats stats() {
        List<String> paths = listPaths();
        long totalBytes = 0;
        for (String path : paths) {
            try {
                totalBytes += Files.size(resolve(path));
            } catch (IOException e) {
                logger.debug("Shard {} vanished while computing stats", path);
            }
        }
        return new BackendStats(id, paths.size(), totalBytes, isReady());
    }

    @Override
    public boolean isReady() {
        return Files.isDirectory(root) && Files.isWritable(root);
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Shard path escapes backend root: " + path);
        }
        return resolved;
    }
}
