package de.bsommerfeld.dbkeeper.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 helpers for backup checksums and query digests.
 */
public final class Digests {

    private static final String ALGORITHM = "SHA-256";

    private Digests() {
    }

    public static String sha256(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            digest.update(data);
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandated by the JVM spec
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }

    /**
     * Stable 16-hex-char id for a statement. Whitespace runs and case are
     * normalized, so reformatting a query does not split its history.
     */
    public static String queryDigest(String sql) {
        String normalized = sql.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return sha256(normalized.getBytes(StandardCharsets.UTF_8)).substring(0, 16);
    }
}
