package io.chunkvault;

/**
 * Thrown when a reassembled object does not match the client's whole-file checksum.
 */
public class ChecksumMismatchException extends ChunkVaultException {

    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String uploadId, String expected, String actual) {
        super("Checksum mismatch for upload " + uploadId + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
