package io.chunkvault.index;

import io.chunkvault.DuplicateChunkIndexException;
import io.chunkvault.ObjectNotFoundException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Manifest state transitions shared by the index implementations.
 * Callers hold whatever per-manifest exclusion their storage provides.
 */
final class ManifestEditor {

    private ManifestEditor() {}

    /**
     * @throws ObjectNotFoundException if another session owns the manifest
     */
    static void checkOwner(ObjectManifest manifest, String uploadId) {
        if (!manifest.isOwnedBy(uploadId)) {
            throw new ObjectNotFoundException(manifest.getObjectId(), manifest.getVersion(), uploadId);
        }
    }

    static Result append(ObjectManifest manifest, String uploadId, int chunkIndex, String digest) {
        checkOwner(manifest, uploadId);
        if (manifest.isCommitted()) {
            throw new IllegalStateException("Manifest is committed: " + manifest);
        }
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("Negative chunk index: " + chunkIndex);
        }
        Optional<String> existing = manifest.digestAt(chunkIndex);
        if (existing.isPresent()) {
            if (existing.get().equals(digest)) {
                return new Result(manifest, AppendOutcome.ALREADY_PRESENT);
            }
            throw new DuplicateChunkIndexException(manifest.getObjectId(), manifest.getVersion(),
                chunkIndex, existing.get(), digest);
        }
        List<ObjectManifest.Entry> entries = new ArrayList<>(manifest.getEntries());
        entries.add(new ObjectManifest.Entry(chunkIndex, digest));
        return new Result(manifest.withEntries(entries), AppendOutcome.APPENDED);
    }

    static ObjectManifest replace(ObjectManifest manifest, String uploadId, int chunkIndex, String digest) {
        checkOwner(manifest, uploadId);
        if (manifest.getState() != ManifestState.INVALID) {
            throw new IllegalStateException("Entries can only be replaced in an invalid manifest: " + manifest);
        }
        List<ObjectManifest.Entry> entries = new ArrayList<>(manifest.getEntries());
        entries.removeIf(e -> e.chunkIndex() == chunkIndex);
        entries.add(new ObjectManifest.Entry(chunkIndex, digest));
        return manifest.withEntries(entries);
    }

    static ObjectManifest commit(ObjectManifest manifest, int expectedChunks, long totalBytes,
                                 String checksum, Instant committedAt) {
        if (manifest.isCommitted()) {
            return manifest;
        }
        if (!manifest.isContiguous(expectedChunks)) {
            throw new IllegalStateException("Manifest " + manifest + " does not cover chunks 0.." + (expectedChunks - 1));
        }
        return manifest.committed(totalBytes, checksum, committedAt);
    }

    static ObjectManifest invalidate(ObjectManifest manifest) {
        if (manifest.isCommitted()) {
            throw new IllegalStateException("Cannot invalidate committed manifest: " + manifest);
        }
        return manifest.withState(ManifestState.INVALID);
    }

    record Result(ObjectManifest manifest, AppendOutcome outcome) {}
}
