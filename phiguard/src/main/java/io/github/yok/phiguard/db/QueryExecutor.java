package io.github.yok.phiguard.db;

import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs parameterized statements over the connection held by a {@link ConnectionManager}.
 *
 * <ul>
 * <li>Parameters are always bound through {@link PreparedStatement}; values are never
 * concatenated into SQL text.</li>
 * <li>Outside {@link #inTransaction(TransactionalWork)} each call commits on its own
 * (auto-commit).</li>
 * <li>Every statement carries the connection's statement timeout. A timeout raises
 * {@code QUERY} with "timed out" in the message.</li>
 * <li>SQL text is logged at DEBUG after masking. Parameters are never logged.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class QueryExecutor {

    // PostgreSQL SQLSTATE for a cancelled statement (statement_timeout)
    private static final String SQLSTATE_QUERY_CANCELED = "57014";
    // MySQL error code for max_execution_time exceeded
    private static final int MYSQL_ER_QUERY_TIMEOUT = 3024;

    private final ConnectionManager connectionManager;

    private boolean transactionActive;

    /**
     * Creates an executor bound to the given connection manager.
     *
     * @param connectionManager connection owner
     */
    public QueryExecutor(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Executes a statement.
     *
     * @param sql SQL text with {@code ?} placeholders
     * @param params positional parameters; {@code null} means none
     * @param fetch {@code true} to return rows, {@code false} to return the affected-row count
     * @return result
     * @throws PhiGuardException VALIDATION when not connected or {@code sql} is blank; QUERY when
     *         the driver fails or the statement times out
     */
    public synchronized QueryResult execute(String sql, List<?> params, boolean fetch) {
        if (StringUtils.isBlank(sql)) {
            throw PhiGuardException.validation("sql must not be blank");
        }
        Connection conn = connectionManager.getConnection();
        DbDialectHandler dialect = connectionManager.getDialect();
        int timeout = connectionManager.getStatementTimeoutSeconds();
        List<?> bind = params == null ? Collections.emptyList() : params;
        String masked = MaskingLogUtil.maskSensitive(sql);
        log.debug("Executing query: {} (params={})", masked, bind.size());

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(timeout);
            for (int i = 0; i < bind.size(); i++) {
                ps.setObject(i + 1, dialect.toBindValue(bind.get(i)));
            }
            if (fetch) {
                try (ResultSet rs = ps.executeQuery()) {
                    QueryResult result = readRows(rs, dialect);
                    log.debug("Query returned {} row(s)", result.size());
                    return result;
                }
            }
            int affected = ps.executeUpdate();
            log.debug("Statement affected {} row(s)", affected);
            return QueryResult.ofAffectedRows(affected);
        } catch (SQLException e) {
            if (isTimeout(e)) {
                throw PhiGuardException.query(
                        "Query timed out after " + timeout + "s: " + masked, e);
            }
            throw PhiGuardException.query("Query failed: " + masked, e);
        }
    }

    /**
     * Executes a fetching statement.
     *
     * @param sql SQL text
     * @param params positional parameters
     * @return rows
     */
    public QueryResult query(String sql, List<?> params) {
        return execute(sql, params, true);
    }

    /**
     * Executes a non-fetching statement.
     *
     * @param sql SQL text
     * @param params positional parameters
     * @return affected row count
     */
    public int update(String sql, List<?> params) {
        return execute(sql, params, false).getAffectedRows();
    }

    /**
     * Executes a single-value numeric query such as {@code SELECT COUNT(*)}.
     *
     * @param sql SQL text
     * @param params positional parameters
     * @return first column of the first row, or {@code 0} when no row or {@code NULL}
     * @throws PhiGuardException QUERY when the value is not numeric
     */
    public long queryForLong(String sql, List<?> params) {
        QueryResult result = query(sql, params);
        if (result.isEmpty() || result.getColumns().isEmpty()) {
            return 0L;
        }
        Object value = result.getRows().get(0).get(result.getColumns().get(0));
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        throw PhiGuardException.query("Expected a numeric value but got "
                + value.getClass().getSimpleName() + " from: " + MaskingLogUtil.maskSensitive(sql),
                null);
    }

    /**
     * Runs {@code work} as one unit: commit on success, rollback on any failure.
     *
     * <p>
     * Auto-commit is switched off for the duration and restored afterwards. A nested call joins the
     * outer unit of work.
     * </p>
     *
     * @param <T> result type
     * @param work statements to run
     * @return value returned by {@code work}
     * @throws PhiGuardException whatever {@code work} raised, after rollback; QUERY when begin,
     *         commit or rollback fails. An {@link Error} from {@code work} is rolled back too.
     */
    public synchronized <T> T inTransaction(TransactionalWork<T> work) {
        Connection conn = connectionManager.getConnection();
        if (transactionActive) {
            return work.run(this);
        }
        boolean previousAutoCommit;
        try {
            previousAutoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw PhiGuardException.query("Failed to begin transaction", e);
        }
        transactionActive = true;
        Throwable failure = null;
        try {
            T result = work.run(this);
            conn.commit();
            log.debug("Transaction committed");
            return result;
        } catch (SQLException e) {
            PhiGuardException commitFailure =
                    PhiGuardException.query("Failed to commit transaction", e);
            failure = commitFailure;
            rollback(conn, commitFailure);
            throw commitFailure;
        } catch (RuntimeException | Error e) {
            failure = e;
            rollback(conn, e);
            throw e;
        } finally {
            transactionActive = false;
            restoreAutoCommit(conn, previousAutoCommit, failure);
        }
    }

    /**
     * Checks whether a table exists in the current schema.
     *
     * @param table table name
     * @return {@code true} when the table exists
     * @throws PhiGuardException QUERY when metadata retrieval fails
     */
    public boolean tableExists(String table) {
        try {
            return connectionManager.getDialect().tableExists(connectionManager.getConnection(),
                    table);
        } catch (SQLException e) {
            throw PhiGuardException.query("Failed to read table metadata for " + table, e);
        }
    }

    /**
     * Returns the dialect of the current connection.
     *
     * @return dialect handler
     */
    public DbDialectHandler getDialect() {
        return connectionManager.getDialect();
    }

    /**
     * Returns the connection manager this executor runs on.
     *
     * @return connection manager
     */
    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    private QueryResult readRows(ResultSet rs, DbDialectHandler dialect) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                Object value = dialect.fromJdbcValue(rs.getObject(i), meta.getColumnType(i),
                        meta.getColumnTypeName(i), meta.getPrecision(i));
                row.put(columns.get(i - 1), value);
            }
            rows.add(row);
        }
        return QueryResult.ofRows(columns, rows);
    }

    private void rollback(Connection conn, Throwable failure) {
        try {
            conn.rollback();
            log.warn("Transaction rolled back: {}", failure.getMessage());
        } catch (SQLException e) {
            failure.addSuppressed(e);
            log.error("Rollback failed", e);
        }
    }

    private void restoreAutoCommit(Connection conn, boolean previous, Throwable failure) {
        try {
            conn.setAutoCommit(previous);
        } catch (SQLException e) {
            if (failure != null) {
                failure.addSuppressed(e);
                return;
            }
            throw PhiGuardException.query("Failed to restore auto-commit", e);
        }
    }

    private static boolean isTimeout(SQLException e) {
        return e instanceof SQLTimeoutException || SQLSTATE_QUERY_CANCELED.equals(e.getSQLState())
                || e.getErrorCode() == MYSQL_ER_QUERY_TIMEOUT;
    }
}
