package io.chunkvault;

/**
 * Thrown when fewer than k shards of a chunk are retrievable.
 *
 * <p>This is a data loss signal and is never retried.</p>
 */
public class InsufficientShardsException extends CorruptedChunkException {

    private final int available;
    private final int required;

    public InsufficientShardsException(String digest, int available, int required) {
        super(digest, "Not enough shards for chunk " + digest + ". Need " + required + ", have " + available);
        this.available = available;
        this.required = required;
    }

    public InsufficientShardsException(int available, int required) {
        super(null, "Need at least " + required + " shards, got " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
