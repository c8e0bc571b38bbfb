package io.chunkvault.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SHA-256 content digests, hex encoded.
 */
public final class ChunkHasher {

    public static final String ALGORITHM = "SHA-256";
    public static final int DIGEST_HEX_LENGTH = 64;

    private static final Pattern DIGEST_PATTERN = Pattern.compile("[0-9a-f]{64}");

    private ChunkHasher() {}

    public static String digest(byte[] data) {
        return HexFormat.of().formatHex(newDigest().digest(data));
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String toHex(MessageDigest digest) {
        return HexFormat.of().formatHex(digest.digest());
    }

    public static boolean isValidDigest(String digest) {
        return digest != null && DIGEST_PATTERN.matcher(digest).matches();
    }

    /**
     * Lower-cases a client supplied digest, tolerating an optional {@code sha256:} prefix.
     */
    public static String normalize(String digest) {
        if (digest == null) return null;
        String value = digest.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("sha256:")) {
            value = value.substring("sha256:".length());
        }
        return value;
    }
}
