package io.github.yok.phiguard.security;

import io.github.yok.phiguard.exception.PhiGuardException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Generates and hashes credentials for synthetic users.
 *
 * <p>
 * Hashes are BCrypt strings ({@code $2a$}) suitable for {@code users.password_hash}. BCrypt only
 * reads the first 72 bytes of a password, so longer passwords are rejected rather than silently
 * truncated.
 * </p>
 *
 * <p>
 * Generated passwords contain at least one lower-case letter, upper-case letter, digit and one of
 * {@code !@#$%^&*}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PasswordHelper {

    /**
     * Length used by {@link #generateSecurePassword()}.
     */
    public static final int DEFAULT_PASSWORD_LENGTH = 12;

    /**
     * Shortest password {@link #generateSecurePassword(int)} returns.
     */
    public static final int MIN_PASSWORD_LENGTH = 8;

    private static final int BCRYPT_MAX_BYTES = 72;

    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String DIGITS = "0123456789";
    private static final String SPECIAL = "!@#$%^&*";
    private static final String ALL = LOWER + UPPER + DIGITS + SPECIAL;

    private final SecureRandom random = new SecureRandom();
    private final BCryptPasswordEncoder encoder;

    /**
     * Creates a helper with the BCrypt default strength (10).
     */
    public PasswordHelper() {
        this(10);
    }

    /**
     * Creates a helper with the given BCrypt strength.
     *
     * @param strength log2 rounds, 4 to 31
     * @throws PhiGuardException VALIDATION when {@code strength} is out of range
     */
    public PasswordHelper(int strength) {
        if (strength < 4 || strength > 31) {
            throw PhiGuardException.validation("BCrypt strength must be 4..31 but was " + strength);
        }
        this.encoder = new BCryptPasswordEncoder(strength, random);
    }

    /**
     * Hashes a password.
     *
     * @param password raw password
     * @return BCrypt hash
     * @throws PhiGuardException VALIDATION when the password is empty or longer than 72 UTF-8
     *         bytes
     */
    public String hashPassword(String password) {
        if (StringUtils.isEmpty(password)) {
            throw PhiGuardException.validation("password must not be empty");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > BCRYPT_MAX_BYTES) {
            throw PhiGuardException
                    .validation("password must not exceed " + BCRYPT_MAX_BYTES + " bytes");
        }
        return encoder.encode(password);
    }

    /**
     * Checks a password against a hash.
     *
     * @param password raw password
     * @param hashed BCrypt hash
     * @return {@code true} on match; {@code false} for a mismatch, a missing value or a hash that
     *         is not BCrypt
     */
    public boolean verifyPassword(String password, String hashed) {
        if (password == null || StringUtils.isBlank(hashed)) {
            return false;
        }
        return encoder.matches(password, hashed);
    }

    /**
     * Generates a password of {@link #DEFAULT_PASSWORD_LENGTH} characters.
     *
     * @return password
     */
    public String generateSecurePassword() {
        return generateSecurePassword(DEFAULT_PASSWORD_LENGTH);
    }

    /**
     * Generates a password with one character of every class.
     *
     * @param length requested length; values below {@link #MIN_PASSWORD_LENGTH} are raised to it
     * @return password
     */
    public String generateSecurePassword(int length) {
        int size = Math.max(length, MIN_PASSWORD_LENGTH);
        List<Character> chars = new ArrayList<>(size);
        chars.add(pick(LOWER));
        chars.add(pick(UPPER));
        chars.add(pick(DIGITS));
        chars.add(pick(SPECIAL));
        while (chars.size() < size) {
            chars.add(pick(ALL));
        }
        Collections.shuffle(chars, random);
        StringBuilder password = new StringBuilder(size);
        chars.forEach(password::append);
        log.debug("Generated password of length {}", size);
        return password.toString();
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }
}
