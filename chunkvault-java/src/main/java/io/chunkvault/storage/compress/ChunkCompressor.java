package io.chunkvault.storage.compress;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * DEFLATE compression for chunk payloads.
 *
 * <p>Level 0 stores, 9 compresses hardest. Output carries the zlib header and
 * checksum, so a damaged payload fails to inflate instead of yielding garbage.</p>
 */
public class ChunkCompressor {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final int level;

    public ChunkCompressor() {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    public ChunkCompressor(int level) {
        if (level != Deflater.DEFAULT_COMPRESSION && (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION)) {
            throw new IllegalArgumentException("Compression level must be -1 or between 0 and 9, got " + level);
        }
        this.level = level;
    }

    public byte[] compress(byte[] raw) {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    public byte[] decompress(byte[] compressed) throws DataFormatException {
        return decompress(compressed, -1);
    }

    /**
     * @param expectedSize size of the original payload, or -1 when unknown
     */
    public byte[] decompress(byte[] compressed, int expectedSize) throws DataFormatException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(expectedSize >= 0 ? expectedSize : compressed.length * 2);
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated compressed payload");
                }
                out.write(buffer, 0, n);
            }
            byte[] result = out.toByteArray();
            if (expectedSize >= 0 && result.length != expectedSize) {
                throw new DataFormatException("Inflated " + result.length + " bytes, expected " + expectedSize);
            }
            return result;
        } finally {
            inflater.end();
        }
    }

    public int getLevel() {
        return level;
    }
}
