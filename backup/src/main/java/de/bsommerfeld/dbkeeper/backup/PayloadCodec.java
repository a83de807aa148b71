package de.bsommerfeld.dbkeeper.backup;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns serialized payload bytes into what is stored and back: GZIP first,
 * then AES-256-GCM with a key derived from the passphrase (PBKDF2). An
 * encrypted payload is laid out as {@code salt(16) | iv(12) | ciphertext+tag}.
 */
final class PayloadCodec {

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String KEY_DERIVATION = "PBKDF2WithHmacSHA256";
    private static final int SALT_LENGTH = 16;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH_BITS = 256;
    private static final int ITERATIONS = 65_536;

    private static final SecureRandom RANDOM = new SecureRandom();

    private PayloadCodec() {
    }

    /**
     * @param passphrase encrypts when non-null
     */
    static byte[] encode(byte[] payload, boolean compress, String passphrase) throws BackupException {
        try {
            byte[] data = compress ? gzip(payload) : payload;
            return passphrase == null ? data : encrypt(data, passphrase);
        } catch (IOException | GeneralSecurityException e) {
            throw new BackupException("Failed to encode backup payload", e);
        }
    }

    static byte[] decode(byte[] stored, boolean compressed, String passphrase) throws BackupIntegrityException {
        try {
            byte[] data = passphrase == null ? stored : decrypt(stored, passphrase);
            return compressed ? gunzip(data) : data;
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            throw new BackupIntegrityException("Backup payload cannot be decoded: " + e.getMessage(), e);
        }
    }

    // ===== Compression =====

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, data.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] data) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    // ===== Encryption =====

    private static byte[] encrypt(byte[] data, String passphrase) throws GeneralSecurityException {
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        RANDOM.nextBytes(salt);
        RANDOM.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(CIPHER);
        cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase, salt), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
        byte[] encrypted = cipher.doFinal(data);

        return ByteBuffer.allocate(SALT_LENGTH + IV_LENGTH + encrypted.length)
                .put(salt)
                .put(iv)
                .put(encrypted)
                .array();
    }

    private static byte[] decrypt(byte[] stored, String passphrase) throws GeneralSecurityException {
        if (stored.length < SALT_LENGTH + IV_LENGTH)
            throw new GeneralSecurityException("Encrypted payload truncated (" + stored.length + " bytes)");
        ByteBuffer buffer = ByteBuffer.wrap(stored);
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        buffer.get(salt);
        buffer.get(iv);
        byte[] encrypted = new byte[buffer.remaining()];
        buffer.get(encrypted);

        Cipher cipher = Cipher.getInstance(CIPHER);
        cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphrase, salt), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
        return cipher.doFinal(encrypted);
    }

    private static SecretKey deriveKey(String passphrase, byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(passphrase.toCharArray(), salt, ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance(KEY_DERIVATION).generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
