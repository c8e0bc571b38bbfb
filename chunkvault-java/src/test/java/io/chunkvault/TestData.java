package io.chunkvault;

import io.chunkvault.storage.ChunkHasher;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Random;

public final class TestData {

    private TestData() {}

    public static byte[] random(int size, long seed) {
        byte[] data = new byte[size];
        new Random(seed).nextBytes(data);
        return data;
    }

    public static byte[] concat(List<byte[]> parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    public static String checksumOf(byte[]... parts) {
        return ChunkHasher.digest(concat(List.of(parts)));
    }
}
