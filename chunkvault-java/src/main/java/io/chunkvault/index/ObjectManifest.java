package io.chunkvault.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the ordered chunk references of one object version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ObjectManifest {

    @JsonProperty("objectId")
    private final String objectId;

    @JsonProperty("version")
    private final long version;

    @JsonProperty("state")
    private final ManifestState state;

    @JsonProperty("entries")
    private final List<Entry> entries;

    @JsonProperty("totalBytes")
    private final long totalBytes;

    @JsonProperty("checksum")
    private final String checksum;

    @JsonProperty("createdAt")
    private final Instant createdAt;

    @JsonProperty("committedAt")
    private final Instant committedAt;

    // Upload session that opened the manifest; null when written outside a session.
    @JsonProperty("uploadId")
    private final String uploadId;

    @JsonCreator
    public ObjectManifest(
        @JsonProperty("objectId") String objectId,
        @JsonProperty("version") long version,
        @JsonProperty("state") ManifestState state,
        @JsonProperty("entries") List<Entry> entries,
        @JsonProperty("totalBytes") long totalBytes,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("committedAt") Instant committedAt,
        @JsonProperty("uploadId") String uploadId
    ) {
        this.objectId = objectId;
        this.version = version;
        this.state = state;
        List<Entry> sorted = new ArrayList<>(entries != null ? entries : List.of());
        sorted.sort(Comparator.comparingInt(Entry::chunkIndex));
        this.entries = List.copyOf(sorted);
        this.totalBytes = totalBytes;
        this.checksum = checksum;
        this.createdAt = createdAt;
        this.committedAt = committedAt;
        this.uploadId = uploadId;
    }

    public static ObjectManifest open(String objectId, long version, String uploadId, Instant createdAt) {
        return new ObjectManifest(objectId, version, ManifestState.OPEN, List.of(), -1, null, createdAt, null, uploadId);
    }

    public String getObjectId() { return objectId; }
    public long getVersion() { return version; }
    public ManifestState getState() { return state; }
    public List<Entry> getEntries() { return entries; }
    public long getTotalBytes() { return totalBytes; }
    public String getChecksum() { return checksum; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getCommittedAt() { return committedAt; }
    public String getUploadId() { return uploadId; }

    /**
     * True when {@code candidate} may write this manifest: a null candidate or
     * an unowned manifest always matches.
     */
    public boolean isOwnedBy(String candidate) {
        return candidate == null || uploadId == null || uploadId.equals(candidate);
    }

    @JsonIgnore
    public boolean isCommitted() {
        return state == ManifestState.COMMITTED;
    }

    @JsonIgnore
    public int getChunkCount() {
        return entries.size();
    }

    /**
     * Digests in reassembly order.
     */
    @JsonIgnore
    public List<String> getDigests() {
        return entries.stream().map(Entry::digest).toList();
    }

    public Optional<String> digestAt(int chunkIndex) {
        return entries.stream()
            .filter(e -> e.chunkIndex() == chunkIndex)
            .map(Entry::digest)
            .findFirst();
    }

    /**
     * True when the chunk indices are exactly 0..count-1.
     */
    public boolean isContiguous(int expectedCount) {
        if (entries.size() != expectedCount) return false;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).chunkIndex() != i) return false;
        }
        return true;
    }

    public ObjectManifest withEntries(List<Entry> newEntries) {
        return new ObjectManifest(objectId, version, state, newEntries, totalBytes, checksum, createdAt, committedAt, uploadId);
    }

    public ObjectManifest withState(ManifestState newState) {
        return new ObjectManifest(objectId, version, newState, entries, totalBytes, checksum, createdAt, committedAt, uploadId);
    }

    public ObjectManifest committed(long bytes, String wholeChecksum, Instant at) {
        return new ObjectManifest(objectId, version, ManifestState.COMMITTED, entries, bytes, wholeChecksum, createdAt, at, uploadId);
    }

    @Override
    public String toString() {
        return "ObjectManifest{" + objectId + "@" + version + ", " + state + ", chunks=" + entries.size() + "}";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("chunkIndex") int chunkIndex,
        @JsonProperty("digest") String digest
    ) {}
}
