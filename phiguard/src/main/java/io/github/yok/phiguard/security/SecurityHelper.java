package io.github.yok.phiguard.security;

import io.github.yok.phiguard.config.SecurityConfig;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.MaskingLogUtil;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.Map;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;

/**
 * Encrypts, decrypts and masks PHI-like fixture values.
 *
 * <p>
 * Encryption is AES-GCM with a random 96-bit IV per call and a 128-bit authentication tag. A token
 * is the URL-safe Base64 (unpadded) form of {@code version || iv || ciphertext+tag}; the version
 * byte is also bound as associated data. Any tampered, foreign or malformed token fails closed with
 * {@code SECURITY}.
 * </p>
 *
 * <p>
 * The key is passed explicitly as {@link KeyMaterial}; there is no process-wide key. Instances are
 * immutable and may be shared between threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SecurityHelper {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int GCM_IV_LENGTH = 12;
    // Token layout version
    private static final byte VERSION = 0x01;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyMaterial keyMaterial;

    /**
     * Creates a helper bound to the given key.
     *
     * @param keyMaterial AES key
     * @throws PhiGuardException SECURITY when {@code keyMaterial} is {@code null}
     */
    public SecurityHelper(KeyMaterial keyMaterial) {
        if (keyMaterial == null) {
            throw PhiGuardException.security("Encryption key is not configured", null);
        }
        this.keyMaterial = keyMaterial;
        log.info("SecurityHelper initialized: key={}", keyMaterial);
    }

    /**
     * Creates a helper from {@code security.encryption-key}.
     *
     * @param config security configuration
     * @return helper
     * @throws PhiGuardException SECURITY when the key is absent or invalid
     */
    public static SecurityHelper fromConfig(SecurityConfig config) {
        String encoded = config == null ? null : config.getEncryptionKey();
        return new SecurityHelper(KeyMaterial.fromBase64(encoded));
    }

    /**
     * Encrypts text as UTF-8.
     *
     * <p>
     * Text that cannot be encoded losslessly, such as a lone surrogate, is rejected instead of
     * being replaced, so {@link #decrypt(EncryptedBlob)} always returns the original string.
     * </p>
     *
     * @param plaintext text to encrypt
     * @return token
     * @throws PhiGuardException VALIDATION when {@code plaintext} is {@code null} or not valid
     *         UTF-16 text
     */
    public EncryptedBlob encrypt(String plaintext) {
        if (plaintext == null) {
            throw PhiGuardException.validation("plaintext must not be null");
        }
        return encrypt(encodeUtf8(plaintext));
    }

    /**
     * Encrypts raw bytes.
     *
     * @param plaintext bytes to encrypt
     * @return token
     * @throws PhiGuardException VALIDATION when {@code plaintext} is {@code null}; SECURITY when
     *         the cipher fails
     */
    public EncryptedBlob encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw PhiGuardException.validation("plaintext must not be null");
        }
        byte[] iv = new byte[GCM_IV_LENGTH];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyMaterial.toSecretKey(),
                    new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(new byte[] {VERSION});
            byte[] sealed = cipher.doFinal(plaintext);
            ByteBuffer buffer = ByteBuffer.allocate(1 + iv.length + sealed.length);
            buffer.put(VERSION).put(iv).put(sealed);
            return EncryptedBlob.of(Base64.encodeBase64URLSafeString(buffer.array()));
        } catch (GeneralSecurityException e) {
            throw PhiGuardException.security("Encryption failed", e);
        }
    }

    /**
     * Decrypts a token into UTF-8 text.
     *
     * @param blob token
     * @return plaintext
     * @throws PhiGuardException SECURITY when the token is malformed, tampered or foreign
     */
    public String decrypt(EncryptedBlob blob) {
        return new String(decryptBytes(blob), StandardCharsets.UTF_8);
    }

    /**
     * Decrypts a token given as text.
     *
     * @param token token text
     * @return plaintext
     * @throws PhiGuardException VALIDATION when blank; SECURITY when the token cannot be decrypted
     */
    public String decrypt(String token) {
        return decrypt(EncryptedBlob.of(token));
    }

    /**
     * Decrypts a token into raw bytes.
     *
     * @param blob token
     * @return plaintext bytes
     * @throws PhiGuardException SECURITY when the token is malformed, tampered or foreign
     */
    public byte[] decryptBytes(EncryptedBlob blob) {
        if (blob == null) {
            throw PhiGuardException.validation("Encrypted token must not be null");
        }
        String token = blob.getToken();
        if (!Base64.isBase64(token)) {
            throw PhiGuardException.security("Malformed encrypted token", null);
        }
        byte[] raw = Base64.decodeBase64(token);
        if (raw.length < 1 + GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw PhiGuardException.security("Malformed encrypted token", null);
        }
        if (raw[0] != VERSION) {
            throw PhiGuardException.security("Unsupported encrypted token version: " + raw[0],
                    null);
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyMaterial.toSecretKey(),
                    new GCMParameterSpec(GCM_TAG_LENGTH, raw, 1, GCM_IV_LENGTH));
            cipher.updateAAD(raw, 0, 1);
            int offset = 1 + GCM_IV_LENGTH;
            return cipher.doFinal(raw, offset, raw.length - offset);
        } catch (GeneralSecurityException e) {
            throw PhiGuardException.security(
                    "Decryption failed: token is tampered or was encrypted with another key", e);
        }
    }

    private static byte[] encodeUtf8(String text) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw PhiGuardException.validation(
                    "plaintext is not valid UTF-16 text (unpaired surrogate)", e);
        }
    }

    /**
     * Masks sensitive assignments and URL credentials in free text.
     *
     * @param text raw text
     * @return masked text; masking twice gives the same result
     * @see MaskingLogUtil#maskSensitive(String)
     */
    public String mask(String text) {
        return MaskingLogUtil.maskSensitive(text);
    }

    /**
     * Returns a copy of a fixture row with PII fields reduced to their last four characters.
     *
     * @param row fixture row
     * @param fields fields to mask; {@code null} or empty uses the default PII field set
     * @return masked copy
     */
    public Map<String, Object> maskPii(Map<String, ?> row, Collection<String> fields) {
        return MaskingLogUtil.maskFields(row, fields);
    }

    /**
     * Returns the fingerprint of the bound key, safe to log.
     *
     * @return key fingerprint
     */
    public String keyFingerprint() {
        return keyMaterial.fingerprint();
    }
}
