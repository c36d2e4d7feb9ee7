package io.github.yok.phiguard.core;

import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.Locale;

/**
 * Actions recorded in the audit trail.
 *
 * @author Yasuharu.Okawauchi
 */
public enum AuditAction {
    LOGIN,
    LOGOUT,
    READ,
    CREATE,
    UPDATE,
    DELETE;

    /**
     * Resolves an action name case-insensitively.
     *
     * @param value action name
     * @return action
     * @throws PhiGuardException VALIDATION when blank or unknown
     */
    public static AuditAction fromString(String value) {
        if (value == null || value.isBlank()) {
            throw PhiGuardException.validation("Audit action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw PhiGuardException.validation("Unknown audit action: " + value, e);
        }
    }
}
