package io.chunkvault.session;

import io.chunkvault.InvalidChunkException;
import io.chunkvault.SessionExpiredException;
import io.chunkvault.SessionNotFoundException;
import io.chunkvault.index.MetadataIndex;
import io.chunkvault.index.ObjectManifest;
import io.chunkvault.storage.ChunkHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Tracks in-flight resumable uploads.
 *
 * <p>Sessions live in memory; the only index writes made here open and discard
 * uncommitted manifests. Session expiry touches bookkeeping only, never chunk
 * or shard data.</p>
 */
public class UploadSessionManager {

    private static final Logger logger = LoggerFactory.getLogger(UploadSessionManager.class);

    private static final int OBJECT_LOCK_STRIPES = 64;

    private final MetadataIndex index;
    private final Duration inactivityTimeout;
    private final Duration committedRetention;
    private final Clock clock;

    private final Map<String, UploadSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> liveVersions = new ConcurrentHashMap<>();
    private final Object[] objectLocks = new Object[OBJECT_LOCK_STRIPES];

    private volatile Consumer<UploadSession> onSessionExpired;

    public UploadSessionManager(MetadataIndex index, Duration inactivityTimeout, Duration committedRetention, Clock clock) {
        this.index = index;
        this.inactivityTimeout = inactivityTimeout;
        this.committedRetention = committedRetention;
        this.clock = clock;
        for (int i = 0; i < objectLocks.length; i++) {
            objectLocks[i] = new Object();
        }
    }

    /**
     * Open a session and its empty manifest.
     *
     * @throws IllegalArgumentException for a malformed request
     * @throws IllegalStateException if the version is committed or another live session is writing it
     */
    public UploadSession create(SessionRequest request) {
        if (request.objectId() == null || request.objectId().isBlank()) {
            throw new IllegalArgumentException("objectId is required");
        }
        if (request.totalChunks() < 1) {
            throw new IllegalArgumentException("totalChunks must be at least 1, got " + request.totalChunks());
        }
        if (request.version() < 0) {
            throw new IllegalArgumentException("version must be positive, got " + request.version());
        }
        String checksum = ChunkHasher.normalize(request.originalChecksum());
        if (!ChunkHasher.isValidDigest(checksum)) {
            throw new IllegalArgumentException("originalChecksum must be a hex SHA-256 digest");
        }

        String objectId = request.objectId();
        UploadSession session;
        synchronized (objectLock(objectId)) {
            long version = request.version() > 0 ? request.version() : nextVersion(objectId);
            String versionKey = versionKey(objectId, version);

            Optional<ObjectManifest> existing = index.findManifest(objectId, version);
            if (existing.isPresent() && existing.get().isCommitted()) {
                throw new IllegalStateException("Version already committed: " + objectId + "@" + version);
            }
            String holder = liveVersions.get(versionKey);
            if (holder != null && sessions.containsKey(holder)) {
                throw new IllegalStateException("Version " + objectId + "@" + version + " is being uploaded by " + holder);
            }

            Instant now = clock.instant();
            session = new UploadSession(UUID.randomUUID().toString(), objectId, version, request.totalChunks(),
                request.expectedBytes(), checksum, now, inactivityTimeout);
            index.createManifest(objectId, version, session.getUploadId(), now);
            sessions.put(session.getUploadId(), session);
            liveVersions.put(versionKey, session.getUploadId());
        }

        logger.info("Created upload session {} for {}@{} ({} chunks)", session.getUploadId(),
            session.getObjectId(), session.getVersion(), session.getTotalChunks());
        return session;
    }

    /**
     * Resolve a session that is still accepting work.
     *
     * @throws SessionNotFoundException for unknown or forgotten ids
     * @throws SessionExpiredException if the inactivity timeout has passed
     */
    public UploadSession require(String uploadId) {
        UploadSession session = sessions.get(uploadId);
        if (session == null) {
            throw new SessionNotFoundException(uploadId);
        }
        if (session.getState() == SessionState.EXPIRED) {
            throw new SessionExpiredException(uploadId, session.getExpiresAt());
        }
        if (session.isExpiredAt(clock.instant())) {
            expire(session, "inactivity");
            throw new SessionExpiredException(uploadId, session.getExpiresAt());
        }
        return session;
    }

    public Optional<UploadSession> find(String uploadId) {
        return Optional.ofNullable(sessions.get(uploadId));
    }

    /**
     * Resume query: which chunks are still missing.
     */
    public SessionStatus status(String uploadId) {
        UploadSession session = require(uploadId);
        List<Integer> missing = session.getMissingChunks();
        int received = session.getTotalChunks() - missing.size();
        return new SessionStatus(
            session.getUploadId(),
            session.getObjectId(),
            session.getVersion(),
            session.getState(),
            session.getTotalChunks(),
            received,
            missing,
            (double) received / session.getTotalChunks(),
            session.getCreatedAt(),
            session.getExpiresAt()
        );
    }

    /**
     * Validate a chunk index against the session bounds.
     */
    public void checkIndex(UploadSession session, int chunkIndex) {
        if (chunkIndex < 0 || chunkIndex >= session.getTotalChunks()) {
            throw new InvalidChunkException("Chunk index " + chunkIndex + " outside [0, " + session.getTotalChunks() + ")");
        }
    }

    /**
     * Record a durably admitted chunk.
     * @return true if the index was not received before
     */
    public boolean markReceived(UploadSession session, int chunkIndex) {
        checkIndex(session, chunkIndex);
        return session.markReceived(chunkIndex, clock.instant());
    }

    public void touch(UploadSession session) {
        session.touch(clock.instant());
    }

    /**
     * Move a complete session into FINALIZING. Callers hold the finalize lock.
     * @return false if the session is not in RECEIVING
     */
    public boolean beginFinalizing(UploadSession session) {
        return session.transition(SessionState.RECEIVING, SessionState.FINALIZING);
    }

    /**
     * Return a session to RECEIVING after a failed verification.
     */
    public void abortFinalizing(UploadSession session) {
        session.transition(SessionState.FINALIZING, SessionState.RECEIVING);
        session.touch(clock.instant());
    }

    public void markCommitted(UploadSession session, long totalBytes) {
        session.commit(clock.instant(), totalBytes);
        liveVersions.remove(versionKey(session.getObjectId(), session.getVersion()), session.getUploadId());
        logger.info("Upload session {} committed {}@{}", session.getUploadId(), session.getObjectId(), session.getVersion());
    }

    /**
     * Abandon a session. Its uncommitted manifest is discarded; stored chunks stay.
     * The session remains visible as EXPIRED until the reaper forgets it.
     *
     * @throws IllegalStateException if the session already committed
     */
    public void cancel(String uploadId) {
        UploadSession session = sessions.get(uploadId);
        if (session == null) {
            throw new SessionNotFoundException(uploadId);
        }
        if (session.getState() == SessionState.COMMITTED) {
            throw new IllegalStateException("Upload " + uploadId + " is already committed");
        }
        session.finalizeLock().lock();
        try {
            expire(session, "cancelled");
        } finally {
            session.finalizeLock().unlock();
        }
    }

    /**
     * Expire stalled sessions and forget committed ones past the retention window.
     */
    public ReapResult reap() {
        Instant now = clock.instant();
        int expired = 0;
        int forgotten = 0;
        for (UploadSession session : List.copyOf(sessions.values())) {
            if (session.isExpiredAt(now)) {
                if (session.finalizeLock().tryLock()) {
                    try {
                        if (session.isExpiredAt(clock.instant()) && expire(session, "inactivity")) {
                            expired++;
                        }
                    } finally {
                        session.finalizeLock().unlock();
                    }
                }
            } else if (isForgettable(session, now)) {
                sessions.remove(session.getUploadId(), session);
                forgotten++;
            }
        }
        if (expired > 0 || forgotten > 0) {
            logger.info("Session reaper expired {} and forgot {} sessions", expired, forgotten);
        }
        return new ReapResult(expired, forgotten);
    }

    public int activeSessionCount() {
        return (int) sessions.values().stream().filter(s -> !s.getState().isTerminal()).count();
    }

    public void setOnSessionExpired(Consumer<UploadSession> listener) {
        this.onSessionExpired = listener;
    }

    private boolean expire(UploadSession session, String reason) {
        if (!session.expire()) {
            return false;
        }
        // A successor session may open the same version once liveVersions is cleared; delete only our own manifest.
        synchronized (objectLock(session.getObjectId())) {
            liveVersions.remove(versionKey(session.getObjectId(), session.getVersion()), session.getUploadId());
            try {
                index.deleteManifest(session.getObjectId(), session.getVersion(), session.getUploadId());
            } catch (IllegalStateException e) {
                logger.warn("Manifest of expired session {} was already committed", session.getUploadId());
            }
        }
        logger.info("Upload session {} expired ({}) for {}@{}", session.getUploadId(), reason,
            session.getObjectId(), session.getVersion());
        Consumer<UploadSession> listener = onSessionExpired;
        if (listener != null) {
            listener.accept(session);
        }
        return true;
    }

    // Terminal sessions stay visible for the retention window so late clients get a precise answer.
    private boolean isForgettable(UploadSession session, Instant now) {
        Instant since = switch (session.getState()) {
            case COMMITTED -> session.getCommittedAt();
            case EXPIRED -> session.getExpiresAt();
            default -> null;
        };
        return since != null && since.plus(committedRetention).isBefore(now);
    }

    int objectLockCount() {
        return objectLocks.length;
    }

    private Object objectLock(String objectId) {
        return objectLocks[Math.floorMod(objectId.hashCode(), objectLocks.length)];
    }

    private long nextVersion(String objectId) {
        long latest = index.latestVersion(objectId).orElse(0L);
        long candidate = latest + 1;
        while (liveVersions.containsKey(versionKey(objectId, candidate))) {
            candidate++;
        }
        return candidate;
    }

    private static String versionKey(String objectId, long version) {
        return objectId + "@" + version;
    }

    public record ReapResult(int expired, int forgotten) {}
}
