package io.chunkvault.ingest;

import io.chunkvault.ChecksumMismatchException;
import io.chunkvault.DigestCollisionException;
import io.chunkvault.DuplicateChunkIndexException;
import io.chunkvault.InsufficientShardsException;
import io.chunkvault.InvalidChunkException;
import io.chunkvault.ObjectNotFoundException;
import io.chunkvault.SessionExpiredException;
import io.chunkvault.VaultOptions;
import io.chunkvault.index.AppendOutcome;
import io.chunkvault.index.ChunkMeta;
import io.chunkvault.index.ManifestState;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.session.SessionState;
import io.chunkvault.session.UploadSession;
import io.chunkvault.session.UploadSessionManager;
import io.chunkvault.storage.ChunkHasher;
import io.chunkvault.storage.ChunkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Admits chunks into upload sessions and finalizes completed uploads.
 *
 * <p>Admission never holds a lock across hashing, compression, erasure coding or
 * shard I/O. A chunk is durable in the {@link ChunkStore} before its manifest
 * entry is written, and the manifest entry is written before the session mask
 * bit is set, so a failure at any point leaves a state that a client retry
 * completes.</p>
 */
public class IngestPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IngestPipeline.class);

    private final UploadSessionManager sessions;
    private final MetadataIndex index;
    private final ChunkStore chunkStore;
    private final boolean verifyOnDedup;
    private final long maxChunkBytes;
    private final Clock clock;

    private final AtomicLong logicalBytesAdmitted = new AtomicLong();
    private final AtomicLong dedupHits = new AtomicLong();
    private final AtomicLong objectsCommitted = new AtomicLong();

    private volatile Consumer<AdmitResult> onChunkAdmitted;
    private volatile Consumer<FinalizeResult> onObjectCommitted;

    public IngestPipeline(UploadSessionManager sessions, MetadataIndex index, ChunkStore chunkStore,
                          boolean verifyOnDedup, Clock clock) {
        this(sessions, index, chunkStore, verifyOnDedup, VaultOptions.DEFAULT_MAX_CHUNK_BYTES, clock);
    }

    public IngestPipeline(UploadSessionManager sessions, MetadataIndex index, ChunkStore chunkStore,
                          boolean verifyOnDedup, long maxChunkBytes, Clock clock) {
        if (maxChunkBytes < 1) {
            throw new IllegalArgumentException("maxChunkBytes must be positive, got " + maxChunkBytes);
        }
        this.sessions = sessions;
        this.index = index;
        this.chunkStore = chunkStore;
        this.verifyOnDedup = verifyOnDedup;
        this.maxChunkBytes = maxChunkBytes;
        this.clock = clock;
    }

    public AdmitResult admitChunk(String uploadId, int chunkIndex, byte[] rawBytes) {
        return admitChunk(uploadId, chunkIndex, rawBytes, null);
    }

    /**
     * Store one chunk of an upload.
     *
     * @param clientDigest digest the client computed, or null
     * @throws InvalidChunkException for empty or oversized content, an index out of range or a client digest mismatch
     * @throws DuplicateChunkIndexException if the index already holds different content
     * @throws io.chunkvault.SessionNotFoundException for an unknown session
     * @throws SessionExpiredException for an expired session
     * @throws io.chunkvault.StorageWriteException if the shards could not be written (retryable)
     */
    public AdmitResult admitChunk(String uploadId, int chunkIndex, byte[] rawBytes, String clientDigest) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new InvalidChunkException("Chunk " + chunkIndex + " of upload " + uploadId + " is empty");
        }
        if (rawBytes.length > maxChunkBytes) {
            throw new InvalidChunkException("Chunk " + chunkIndex + " of upload " + uploadId + " is "
                + rawBytes.length + " bytes, limit is " + maxChunkBytes);
        }
        UploadSession session = sessions.require(uploadId);
        sessions.checkIndex(session, chunkIndex);

        String digest = ChunkHasher.digest(rawBytes);
        if (clientDigest != null && !digest.equals(ChunkHasher.normalize(clientDigest))) {
            logger.warn("Chunk {} of upload {} failed client checksum: expected {}, got {}",
                chunkIndex, uploadId, clientDigest, digest);
            throw new InvalidChunkException("Chunk checksum mismatch for chunk " + chunkIndex);
        }

        boolean replacing = false;
        boolean restoring = false;
        if (session.isReceived(chunkIndex)) {
            ObjectManifest manifest = manifestOf(session);
            String existing = manifest.digestAt(chunkIndex).orElse(null);
            if (digest.equals(existing)) {
                if (index.recordAccess(digest, clock.instant())) {
                    sessions.touch(session);
                    logger.debug("Chunk {} of upload {} already received", chunkIndex, uploadId);
                    return new AdmitResult(AdmitResult.Status.DUPLICATE, uploadId, chunkIndex, digest, rawBytes.length, false);
                }
                // The chunk row was collected after the manifest entry was written; store the content again.
                logger.warn("Chunk {} of upload {} lost its stored content {}, storing it again", chunkIndex, uploadId, digest);
                restoring = true;
            } else if (manifest.getState() != ManifestState.INVALID || session.getState() != SessionState.RECEIVING) {
                throw new DuplicateChunkIndexException(session.getObjectId(), session.getVersion(),
                    chunkIndex, existing, digest);
            } else {
                replacing = true;
            }
        }

        boolean dedupHit = store(digest, rawBytes);

        AdmitResult.Status status;
        try {
            if (replacing) {
                index.replaceManifestEntry(session.getObjectId(), session.getVersion(), session.getUploadId(),
                    chunkIndex, digest);
                status = AdmitResult.Status.REPLACED;
                logger.info("Chunk {} of upload {} replaced with {}", chunkIndex, uploadId, digest);
            } else {
                AppendOutcome outcome = index.appendManifestEntry(session.getObjectId(), session.getVersion(),
                    session.getUploadId(), chunkIndex, digest);
                status = outcome == AppendOutcome.APPENDED || restoring
                    ? AdmitResult.Status.ACCEPTED
                    : AdmitResult.Status.DUPLICATE;
            }
        } catch (ObjectNotFoundException e) {
            // Manifest discarded by a concurrent cancel or expiry, possibly already reopened by a successor session.
            throw new SessionExpiredException(uploadId, session.getExpiresAt());
        }

        boolean fresh = sessions.markReceived(session, chunkIndex);
        if (status == AdmitResult.Status.DUPLICATE && fresh) {
            status = AdmitResult.Status.ACCEPTED;
        }

        AdmitResult result = new AdmitResult(status, uploadId, chunkIndex, digest, rawBytes.length,
            dedupHit && status != AdmitResult.Status.DUPLICATE);
        if (status != AdmitResult.Status.DUPLICATE) {
            logicalBytesAdmitted.addAndGet(rawBytes.length);
            if (result.dedupHit()) {
                dedupHits.incrementAndGet();
            }
            Consumer<AdmitResult> listener = onChunkAdmitted;
            if (listener != null) {
                listener.accept(result);
            }
        }
        return result;
    }

    /**
     * Verify and commit a fully received upload.
     *
     * <p>Only one finalization runs per session; a concurrent caller waits and
     * then observes the committed session.</p>
     *
     * @throws IllegalArgumentException if the request names a different object or version
     */
    public FinalizeResult finalize(FinalizeRequest request) {
        UploadSession session = sessions.require(request.uploadId());
        checkTarget(session, request);
        String expected = request.originalChecksum() != null
            ? ChunkHasher.normalize(request.originalChecksum())
            : session.getOriginalChecksum();

        if (session.getState() == SessionState.COMMITTED) {
            return committedResult(session);
        }
        List<Integer> missing = session.getMissingChunks();
        if (!missing.isEmpty()) {
            logger.debug("Finalize of upload {} is missing {} chunks", session.getUploadId(), missing.size());
            return FinalizeResult.incomplete(session.getUploadId(), session.getObjectId(), session.getVersion(), missing);
        }

        session.finalizeLock().lock();
        try {
            if (session.getState() == SessionState.COMMITTED) {
                return committedResult(session);
            }
            if (!sessions.beginFinalizing(session)) {
                throw new SessionExpiredException(session.getUploadId(), session.getExpiresAt());
            }
            try {
                return verifyAndCommit(session, expected);
            } catch (RuntimeException e) {
                sessions.abortFinalizing(session);
                throw e;
            }
        } finally {
            session.finalizeLock().unlock();
        }
    }

    /**
     * Like {@link #finalize(FinalizeRequest)} but reports every non-complete outcome as an exception.
     *
     * @throws ChecksumMismatchException if the reassembled object does not match
     * @throws IllegalStateException if chunks are missing
     */
    public FinalizeResult finalizeOrThrow(FinalizeRequest request) {
        FinalizeResult result = finalize(request);
        if (result.status() == FinalizeResult.Status.INCOMPLETE) {
            throw new IllegalStateException("Missing chunks: " + result.missingChunks());
        }
        if (result.status() == FinalizeResult.Status.MISMATCH) {
            String expected = request.originalChecksum() != null
                ? ChunkHasher.normalize(request.originalChecksum())
                : sessions.require(request.uploadId()).getOriginalChecksum();
            throw new ChecksumMismatchException(request.uploadId(), expected, result.checksum());
        }
        return result;
    }

    private FinalizeResult verifyAndCommit(UploadSession session, String expectedChecksum) {
        ObjectManifest manifest = manifestOf(session);
        if (!manifest.isContiguous(session.getTotalChunks())) {
            throw new IllegalStateException("Manifest " + manifest + " does not cover all " + session.getTotalChunks() + " chunks");
        }

        MessageDigest whole = ChunkHasher.newDigest();
        long totalBytes = 0;
        for (ObjectManifest.Entry entry : manifest.getEntries()) {
            ChunkMeta meta = index.lookup(entry.digest())
                .orElseThrow(() -> new InsufficientShardsException(entry.digest(), 0, chunkStore.getErasureCoder().getDataShards()));
            byte[] chunk = chunkStore.read(meta);
            whole.update(chunk);
            totalBytes += chunk.length;
        }
        String actual = ChunkHasher.toHex(whole);

        boolean sizeMatches = session.getExpectedBytes() < 0 || session.getExpectedBytes() == totalBytes;
        if (!sizeMatches || !actual.equals(expectedChecksum)) {
            index.invalidateManifest(session.getObjectId(), session.getVersion());
            sessions.abortFinalizing(session);
            logger.warn("Upload {} failed verification: expected {} ({} bytes), reassembled {} ({} bytes)",
                session.getUploadId(), expectedChecksum, session.getExpectedBytes(), actual, totalBytes);
            return FinalizeResult.mismatch(session.getUploadId(), session.getObjectId(), session.getVersion(), actual, totalBytes);
        }

        index.commitManifest(session.getObjectId(), session.getVersion(), session.getTotalChunks(),
            totalBytes, actual, clock.instant());
        sessions.markCommitted(session, totalBytes);
        objectsCommitted.incrementAndGet();

        FinalizeResult result = FinalizeResult.complete(session.getUploadId(), session.getObjectId(),
            session.getVersion(), actual, totalBytes);
        Consumer<FinalizeResult> listener = onObjectCommitted;
        if (listener != null) {
            listener.accept(result);
        }
        return result;
    }

    /**
     * A dedup hit only counts once its access time is refreshed; the garbage
     * collector deletes a row only while that time is unchanged, so a row that
     * vanished in between is written again.
     *
     * @return true if the content was already stored
     */
    private boolean store(String digest, byte[] rawBytes) {
        Optional<ChunkMeta> existing = index.lookup(digest);
        if (existing.isPresent()) {
            if (verifyOnDedup) {
                byte[] stored = chunkStore.read(existing.get());
                if (!Arrays.equals(stored, rawBytes)) {
                    throw new DigestCollisionException(digest);
                }
            }
            if (index.recordAccess(digest, clock.instant())) {
                logger.debug("Dedup hit for chunk {}", digest);
                return true;
            }
            logger.debug("Chunk {} was collected during admission, storing it again", digest);
        }
        return !chunkStore.put(digest, rawBytes).inserted();
    }

    private ObjectManifest manifestOf(UploadSession session) {
        ObjectManifest manifest = index.findManifest(session.getObjectId(), session.getVersion())
            .filter(m -> m.isOwnedBy(session.getUploadId()))
            .orElse(null);
        if (manifest == null) {
            throw new SessionExpiredException(session.getUploadId(), session.getExpiresAt());
        }
        return manifest;
    }

    private FinalizeResult committedResult(UploadSession session) {
        return FinalizeResult.complete(session.getUploadId(), session.getObjectId(), session.getVersion(),
            session.getOriginalChecksum(), session.getCommittedBytes());
    }

    private static void checkTarget(UploadSession session, FinalizeRequest request) {
        if (request.objectId() != null && !request.objectId().equals(session.getObjectId())) {
            throw new IllegalArgumentException("Upload " + session.getUploadId() + " belongs to object "
                + session.getObjectId() + ", not " + request.objectId());
        }
        if (request.version() > 0 && request.version() != session.getVersion()) {
            throw new IllegalArgumentException("Upload " + session.getUploadId() + " writes version "
                + session.getVersion() + ", not " + request.version());
        }
    }

    public long getLogicalBytesAdmitted() {
        return logicalBytesAdmitted.get();
    }

    public long getDedupHits() {
        return dedupHits.get();
    }

    public long getObjectsCommitted() {
        return objectsCommitted.get();
    }

    public void setOnChunkAdmitted(Consumer<AdmitResult> listener) { this.onChunkAdmitted = listener; }
    public void setOnObjectCommitted(Consumer<FinalizeResult> listener) { this.onObjectCommitted = listener; }
}
