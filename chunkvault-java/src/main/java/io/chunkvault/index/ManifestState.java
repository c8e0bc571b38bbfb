package io.chunkvault.index;

public enum ManifestState {
    /** Entries are still being appended by an upload session. */
    OPEN,
    /** Finalize found a checksum or size mismatch; entries may be replaced. */
    INVALID,
    /** Terminal. The manifest is immutable and readable. */
    COMMITTED
}
