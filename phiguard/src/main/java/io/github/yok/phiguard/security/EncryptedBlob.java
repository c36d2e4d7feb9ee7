package io.github.yok.phiguard.security;

import io.github.yok.phiguard.exception.PhiGuardException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Opaque, URL-safe ciphertext token produced by {@link SecurityHelper#encrypt(String)}.
 *
 * <p>
 * Only the holder of the matching {@link KeyMaterial} can reverse it. The token may be stored in a
 * fixture column or passed on a command line as is.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class EncryptedBlob {

    private final String token;

    private EncryptedBlob(String token) {
        this.token = token;
    }

    /**
     * Wraps an existing token.
     *
     * @param token token text
     * @return blob
     * @throws PhiGuardException VALIDATION when {@code token} is {@code null} or blank
     */
    public static EncryptedBlob of(String token) {
        if (token == null || token.isBlank()) {
            throw PhiGuardException.validation("Encrypted token must not be blank");
        }
        return new EncryptedBlob(token.trim());
    }

    @Override
    public String toString() {
        return token;
    }
}
