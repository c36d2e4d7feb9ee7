package io.github.yok.phiguard.security;

import io.github.yok.phiguard.exception.PhiGuardException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * AES key used by {@link SecurityHelper}.
 *
 * <p>
 * Keys are 128, 192 or 256 bits. The key bytes are copied on the way in and never exposed except
 * through {@link #toBase64()}, which exists for key provisioning. {@link #toString()} and
 * {@link #fingerprint()} never reveal key bytes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class KeyMaterial {

    // AES algorithm name for SecretKeySpec
    private static final String ALGORITHM = "AES";
    // Key length used by generate()
    private static final int GENERATED_KEY_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] key;

    private KeyMaterial(byte[] key) {
        this.key = key;
    }

    /**
     * Decodes a Base64 (standard or URL-safe) key.
     *
     * @param encoded Base64 text
     * @return key material
     * @throws PhiGuardException SECURITY when the key is absent, not Base64 or of invalid length
     */
    public static KeyMaterial fromBase64(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw PhiGuardException.security("Encryption key is not configured", null);
        }
        String trimmed = encoded.trim();
        if (!Base64.isBase64(trimmed)) {
            throw PhiGuardException.security("Encryption key is not valid Base64", null);
        }
        return fromBytes(Base64.decodeBase64(trimmed));
    }

    /**
     * Wraps raw key bytes.
     *
     * @param bytes 16, 24 or 32 key bytes; copied
     * @return key material
     * @throws PhiGuardException SECURITY when the length is invalid
     */
    public static KeyMaterial fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw PhiGuardException.security("Encryption key is not configured", null);
        }
        int length = bytes.length;
        if (length != 16 && length != 24 && length != 32) {
            throw PhiGuardException.security("Encryption key must be 128, 192 or 256 bits but was "
                    + (length * 8) + " bits", null);
        }
        return new KeyMaterial(Arrays.copyOf(bytes, length));
    }

    /**
     * Generates a fresh random 256-bit key.
     *
     * @return key material
     */
    public static KeyMaterial generate() {
        byte[] bytes = new byte[GENERATED_KEY_BYTES];
        RANDOM.nextBytes(bytes);
        return new KeyMaterial(bytes);
    }

    /**
     * Encodes the key as standard Base64 for storage in a secret store.
     *
     * @return Base64 text
     */
    public String toBase64() {
        return Base64.encodeBase64String(key);
    }

    /**
     * Returns a short non-reversible identifier of the key, safe to log.
     *
     * @return first 16 hex characters of the key's SHA-256
     */
    public String fingerprint() {
        return DigestUtils.sha256Hex(key).substring(0, 16);
    }

    /**
     * Returns the key size.
     *
     * @return size in bits
     */
    public int bitLength() {
        return key.length * 8;
    }

    SecretKey toSecretKey() {
        return new SecretKeySpec(key, ALGORITHM);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyMaterial)) {
            return false;
        }
        return MessageDigest.isEqual(key, ((KeyMaterial) o).key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "KeyMaterial(bits=" + bitLength() + ", fingerprint=" + fingerprint() + ")";
    }
}
