package io.github.yok.phiguard.db;

/**
 * SQL grammar differences for each database dialect.
 */
public interface DbDialectSqlOperations {

    /**
     * Returns expression for the database's current local timestamp.
     *
     * @return current timestamp expression
     */
    String getCurrentTimestampFunction();

    /**
     * Returns an expression for "now minus N seconds" evaluated on the database clock.
     *
     * <p>
     * The expression contains exactly one {@code ?} placeholder that is bound to the number of
     * seconds as a {@code long}.
     * </p>
     *
     * @return lower-bound expression
     */
    String getRecencyLowerBoundExpression();

    /**
     * Returns the escape character used with {@code LIKE ... ESCAPE}.
     *
     * @return escape character
     */
    default char getLikeEscapeChar() {
        return '!';
    }
}
