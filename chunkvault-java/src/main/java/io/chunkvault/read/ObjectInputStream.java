package io.chunkvault.read;

import io.chunkvault.ChunkVaultException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Byte-level view over an {@link ObjectStream}. Storage failures surface as
 * {@link IOException} with the original exception as cause.
 */
class ObjectInputStream extends InputStream {

    private final ObjectStream chunks;
    private byte[] current = new byte[0];
    private int offset;

    ObjectInputStream(ObjectStream chunks) {
        this.chunks = chunks;
    }

    @Override
    public int read() throws IOException {
        if (!fill()) {
            return -1;
        }
        return current[offset++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int n = Math.min(len, current.length - offset);
        System.arraycopy(current, offset, b, off, n);
        offset += n;
        return n;
    }

    @Override
    public int available() {
        return current.length - offset;
    }

    @Override
    public void close() {
        chunks.close();
    }

    private boolean fill() throws IOException {
        while (offset >= current.length) {
            if (!chunks.hasNext()) {
                return false;
            }
            try {
                current = chunks.next();
            } catch (ChunkVaultException e) {
                throw new IOException("Failed to read chunk " + chunks.nextChunkIndex()
                    + " of " + chunks.getManifest(), e);
            }
            offset = 0;
        }
        return true;
    }
}
