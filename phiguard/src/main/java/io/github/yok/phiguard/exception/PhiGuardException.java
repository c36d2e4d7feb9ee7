package io.github.yok.phiguard.exception;

import java.util.Objects;

/**
 * Single unchecked exception type of PhiGuard, tagged with an {@link ErrorKind}.
 *
 * <p>
 * Failures are modeled as one tagged value instead of a class hierarchy. Callers branch on
 * {@link #getKind()} (or {@link #is(ErrorKind)}) rather than on the exception type.
 * </p>
 *
 * <p>
 * {@link ErrorKind#TEST_DATA} failures additionally carry the table name and residual row count so
 * that leftover fixtures can be diagnosed without re-deriving context.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PhiGuardException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    // Only set for TEST_DATA
    private final String table;
    // -1 unless TEST_DATA
    private final long residualCount;

    private PhiGuardException(ErrorKind kind, String message, Throwable cause, String table,
            long residualCount) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.table = table;
        this.residualCount = residualCount;
    }

    /**
     * Creates a {@link ErrorKind#DATABASE_CONNECTION} failure.
     *
     * @param message description including backend kind and target, never the credential
     * @param cause driver cause; may be {@code null}
     * @return exception
     */
    public static PhiGuardException databaseConnection(String message, Throwable cause) {
        return new PhiGuardException(ErrorKind.DATABASE_CONNECTION, message, cause, null, -1);
    }

    /**
     * Creates a {@link ErrorKind#VALIDATION} failure.
     *
     * @param message violated precondition
     * @return exception
     */
    public static PhiGuardException validation(String message) {
        return new PhiGuardException(ErrorKind.VALIDATION, message, null, null, -1);
    }

    /**
     * Creates a {@link ErrorKind#VALIDATION} failure wrapping a cause.
     *
     * @param message violated precondition
     * @param cause cause
     * @return exception
     */
    public static PhiGuardException validation(String message, Throwable cause) {
        return new PhiGuardException(ErrorKind.VALIDATION, message, cause, null, -1);
    }

    /**
     * Creates a {@link ErrorKind#SECURITY} failure.
     *
     * @param message description
     * @param cause cause; may be {@code null}
     * @return exception
     */
    public static PhiGuardException security(String message, Throwable cause) {
        return new PhiGuardException(ErrorKind.SECURITY, message, cause, null, -1);
    }

    /**
     * Creates a {@link ErrorKind#TEST_DATA} failure for rows left behind by cleanup.
     *
     * @param table table still holding fixture rows
     * @param residualCount number of remaining rows
     * @return exception
     */
    public static PhiGuardException testData(String table, long residualCount) {
        String message = "Cleanup left " + residualCount + " residual row(s) in table '" + table
                + "'";
        return new PhiGuardException(ErrorKind.TEST_DATA, message, null, table, residualCount);
    }

    /**
     * Creates a {@link ErrorKind#QUERY} failure.
     *
     * @param message description
     * @param cause driver cause
     * @return exception
     */
    public static PhiGuardException query(String message, Throwable cause) {
        return new PhiGuardException(ErrorKind.QUERY, message, cause, null, -1);
    }

    /**
     * Returns the failure kind.
     *
     * @return kind, never {@code null}
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Tests whether this failure has the given kind.
     *
     * @param expected kind to compare
     * @return {@code true} on match
     */
    public boolean is(ErrorKind expected) {
        return kind == expected;
    }

    /**
     * Returns the table with residual rows.
     *
     * @return table name, or {@code null} unless the kind is {@link ErrorKind#TEST_DATA}
     */
    public String getTable() {
        return table;
    }

    /**
     * Returns the number of residual rows.
     *
     * @return residual count, or {@code -1} unless the kind is {@link ErrorKind#TEST_DATA}
     */
    public long getResidualCount() {
        return residualCount;
    }

    @Override
    public String toString() {
        return kind.getLabel() + ": " + getMessage();
    }
}
