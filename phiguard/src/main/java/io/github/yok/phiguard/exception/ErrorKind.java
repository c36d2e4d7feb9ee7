package io.github.yok.phiguard.exception;

/**
 * Closed set of failure kinds raised by PhiGuard components.
 *
 * <ul>
 * <li>{@code DATABASE_CONNECTION}: connection establishment or loss</li>
 * <li>{@code VALIDATION}: caller precondition violated before any I/O</li>
 * <li>{@code SECURITY}: cryptographic or audit-compliance violation</li>
 * <li>{@code TEST_DATA}: cleanup left residual fixture rows</li>
 * <li>{@code QUERY}: any other statement execution failure</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {
    // Connection could not be opened, or was lost / could not be closed
    DATABASE_CONNECTION("DatabaseConnectionError", 3),
    // Invalid arguments or state, detected before touching the database
    VALIDATION("ValidationError", 2),
    // Decryption failure or missing audit mechanism
    SECURITY("SecurityError", 4),
    // Residual rows after cleanup
    TEST_DATA("TestDataError", 5),
    // Driver-level execution failure
    QUERY("QueryError", 6);

    private final String label;
    private final int exitCode;

    ErrorKind(String label, int exitCode) {
        this.label = label;
        this.exitCode = exitCode;
    }

    /**
     * Returns the display label used in log and console output.
     *
     * @return label such as {@code SecurityError}
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns the process exit code the CLI reports for this kind.
     *
     * @return non-zero exit code
     */
    public int getExitCode() {
        return exitCode;
    }
}
