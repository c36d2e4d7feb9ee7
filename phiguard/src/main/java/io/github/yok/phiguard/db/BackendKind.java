package io.github.yok.phiguard.db;

import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.Locale;

/**
 * Enumerates the relational backends PhiGuard can connect to.
 *
 * <ul>
 * <li>{@code POSTGRESQL}: networked PostgreSQL server</li>
 * <li>{@code MYSQL}: networked MySQL server</li>
 * <li>{@code EMBEDDED_FILE}: single-file embedded database (H2) addressed by path</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum BackendKind {
    // Use the PostgreSQL dialect handler
    POSTGRESQL(true),
    // Use the MySQL dialect handler
    MYSQL(true),
    // Use the embedded file database dialect handler
    EMBEDDED_FILE(false);

    private final boolean networked;

    BackendKind(boolean networked) {
        this.networked = networked;
    }

    /**
     * Returns whether the backend is reached over the network.
     *
     * @return {@code true} when host, port and credentials are required
     */
    public boolean isNetworked() {
        return networked;
    }

    /**
     * Resolves a backend kind from its configuration name.
     *
     * <p>
     * Accepts the constant name in any case, hyphenated forms and the common aliases
     * {@code postgres}, {@code h2}, {@code embedded} and {@code sqlite}.
     * </p>
     *
     * @param value configuration value
     * @return backend kind
     * @throws PhiGuardException VALIDATION when the value is blank or unknown
     */
    public static BackendKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw PhiGuardException.validation("Backend kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "postgresql":
            case "postgres":
                return POSTGRESQL;
            case "mysql":
                return MYSQL;
            case "embedded_file":
            case "embedded":
            case "h2":
            case "sqlite":
                return EMBEDDED_FILE;
            default:
                throw PhiGuardException.validation("Unsupported backend kind: " + value);
        }
    }
}
