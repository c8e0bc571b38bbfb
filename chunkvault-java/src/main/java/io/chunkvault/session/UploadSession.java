package io.chunkvault.session;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coordination state of one resumable upload.
 *
 * <p>The received mask is a bit vector of {@code totalChunks} bits guarded by
 * a per-session lock that is only held for bit and state updates. Finalization
 * is serialized by a separate lock so chunk admission never waits on it.</p>
 */
public class UploadSession {

    private final String uploadId;
    private final String objectId;
    private final long version;
    private final int totalChunks;
    private final long expectedBytes;
    private final String originalChecksum;
    private final Instant createdAt;
    private final Duration inactivityTimeout;

    private final BitSet received;
    private final ReentrantLock maskLock = new ReentrantLock();
    private final ReentrantLock finalizeLock = new ReentrantLock();

    private volatile SessionState state = SessionState.CREATED;
    private volatile Instant expiresAt;
    private volatile Instant committedAt;
    private volatile long committedBytes = -1;

    UploadSession(String uploadId, String objectId, long version, int totalChunks, long expectedBytes,
                  String originalChecksum, Instant createdAt, Duration inactivityTimeout) {
        this.uploadId = uploadId;
        this.objectId = objectId;
        this.version = version;
        this.totalChunks = totalChunks;
        this.expectedBytes = expectedBytes;
        this.originalChecksum = originalChecksum;
        this.createdAt = createdAt;
        this.inactivityTimeout = inactivityTimeout;
        this.received = new BitSet(totalChunks);
        this.expiresAt = createdAt.plus(inactivityTimeout);
    }

    public String getUploadId() { return uploadId; }
    public String getObjectId() { return objectId; }
    public long getVersion() { return version; }
    public int getTotalChunks() { return totalChunks; }
    public long getExpectedBytes() { return expectedBytes; }
    public String getOriginalChecksum() { return originalChecksum; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getCommittedAt() { return committedAt; }
    public long getCommittedBytes() { return committedBytes; }
    public SessionState getState() { return state; }

    public boolean isReceived(int chunkIndex) {
        maskLock.lock();
        try {
            return received.get(chunkIndex);
        } finally {
            maskLock.unlock();
        }
    }

    public int getReceivedCount() {
        maskLock.lock();
        try {
            return received.cardinality();
        } finally {
            maskLock.unlock();
        }
    }

    public boolean isComplete() {
        return getReceivedCount() == totalChunks;
    }

    public List<Integer> getMissingChunks() {
        maskLock.lock();
        try {
            List<Integer> missing = new ArrayList<>(totalChunks - received.cardinality());
            for (int i = received.nextClearBit(0); i < totalChunks; i = received.nextClearBit(i + 1)) {
                missing.add(i);
            }
            return missing;
        } finally {
            maskLock.unlock();
        }
    }

    /**
     * Lock held by the single finalization attempt in progress.
     */
    public Lock finalizeLock() {
        return finalizeLock;
    }

    boolean isExpiredAt(Instant now) {
        return !state.isTerminal() && state != SessionState.FINALIZING && now.isAfter(expiresAt);
    }

    /**
     * @return true if the bit was newly set
     */
    boolean markReceived(int chunkIndex, Instant now) {
        maskLock.lock();
        try {
            boolean fresh = !received.get(chunkIndex);
            received.set(chunkIndex);
            if (state == SessionState.CREATED) {
                state = SessionState.RECEIVING;
            }
            expiresAt = now.plus(inactivityTimeout);
            return fresh;
        } finally {
            maskLock.unlock();
        }
    }

    void touch(Instant now) {
        maskLock.lock();
        try {
            if (!state.isTerminal()) {
                expiresAt = now.plus(inactivityTimeout);
            }
        } finally {
            maskLock.unlock();
        }
    }

    boolean transition(SessionState from, SessionState to) {
        maskLock.lock();
        try {
            if (state != from) {
                return false;
            }
            state = to;
            return true;
        } finally {
            maskLock.unlock();
        }
    }

    void commit(Instant now, long totalBytes) {
        maskLock.lock();
        try {
            state = SessionState.COMMITTED;
            committedAt = now;
            committedBytes = totalBytes;
        } finally {
            maskLock.unlock();
        }
    }

    /**
     * @return false if the session was already terminal
     */
    boolean expire() {
        maskLock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            state = SessionState.EXPIRED;
            return true;
        } finally {
            maskLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "UploadSession{" + uploadId + ", " + objectId + "@" + version + ", " + state + "}";
    }
}
