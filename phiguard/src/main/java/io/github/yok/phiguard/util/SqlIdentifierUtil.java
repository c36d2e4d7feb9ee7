package io.github.yok.phiguard.util;

import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Guards identifiers (table and column names) that have to be spliced into SQL text.
 *
 * <p>
 * Values are always bound as parameters; identifiers cannot be, so they are restricted to plain
 * unquoted names.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SqlIdentifierUtil {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");

    @Generated
    private SqlIdentifierUtil() {}

    /**
     * Returns the identifier when it is a plain unquoted name.
     *
     * @param identifier table or column name
     * @param role what the identifier names, for the error message
     * @return {@code identifier}
     * @throws PhiGuardException VALIDATION when the identifier is blank or not a plain name
     */
    public static String requireValid(String identifier, String role) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw PhiGuardException.validation("Invalid " + role + " name: " + identifier);
        }
        return identifier;
    }
}
