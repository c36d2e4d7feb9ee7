package io.github.yok.phiguard.db;

import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Owns the single live JDBC connection of one test context.
 *
 * <p>
 * State machine:
 * {@code DISCONNECTED → connect(entry) → CONNECTED → disconnect() → DISCONNECTED}.
 * </p>
 *
 * <ul>
 * <li>The entry is validated before any I/O. Embedded backends need only {@code path}; networked
 * backends need {@code host}, {@code port}, {@code user}, {@code password} and
 * {@code database}.</li>
 * <li>The {@link DbDialectHandler} for the entry's backend is chosen at connect time and builds the
 * URL, driver properties and session settings. A configured {@code driverClass} is loaded;
 * otherwise the dialect's default driver must be on the classpath.</li>
 * <li>{@link #connect(ConnectionConfig.Entry)} while connected fails; the existing handle is kept
 * and never leaked.</li>
 * <li>{@link #disconnect()} is idempotent. A close failure still ends in
 * {@link ConnectionState#DISCONNECTED}.</li>
 * </ul>
 *
 * <p>
 * Instances are not meant to be shared between test contexts; register one per context in
 * {@link io.github.yok.phiguard.junit.ConnectionRegistry} when the JUnit extension is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionManager implements AutoCloseable {

    // Selects the dialect handler for each entry
    private final DbDialectHandlerFactory dialectFactory;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Connection connection;
    private DbDialectHandler dialect;
    private ConnectionConfig.Entry entry;

    /**
     * Creates a manager with the default dialect factory.
     */
    public ConnectionManager() {
        this(new DbDialectHandlerFactory());
    }

    /**
     * Creates a manager with the given dialect factory.
     *
     * @param dialectFactory dialect factory
     */
    public ConnectionManager(DbDialectHandlerFactory dialectFactory) {
        this.dialectFactory = dialectFactory;
    }

    /**
     * Opens the connection described by {@code entry}.
     *
     * @param entry connection descriptor
     * @throws PhiGuardException VALIDATION when already connected or required fields are missing;
     *         DATABASE_CONNECTION when the driver cannot be loaded or the database is unreachable
     */
    public synchronized void connect(ConnectionConfig.Entry entry) {
        if (state == ConnectionState.CONNECTED) {
            throw PhiGuardException.validation("Already connected to " + describe(this.entry)
                    + "; disconnect before connecting again");
        }
        if (entry == null) {
            throw PhiGuardException.validation("Connection entry is required");
        }
        BackendKind kind = dialectFactory.resolveKind(entry);
        validateEntry(entry, kind);

        DbDialectHandler handler = dialectFactory.create(kind);
        String target = describe(entry);
        String driverClass = StringUtils.trimToNull(entry.getDriverClass());
        try {
            if (driverClass != null) {
                Class.forName(driverClass);
            } else {
                // JDBC 4 drivers register through ServiceLoader; only check presence here
                driverClass = handler.getDefaultDriverClass();
                Class.forName(driverClass, false, ConnectionManager.class.getClassLoader());
            }
        } catch (ClassNotFoundException e) {
            throw PhiGuardException.databaseConnection(
                    "JDBC driver not found for " + target + ": " + driverClass, e);
        }

        log.info("Connecting: {}", MaskingLogUtil.maskConnection(entry));
        Connection opened;
        try {
            opened = DriverManager.getConnection(handler.buildJdbcUrl(entry),
                    handler.buildConnectionProperties(entry));
        } catch (SQLException e) {
            throw PhiGuardException.databaseConnection("Failed to connect to " + target, e);
        }

        try {
            handler.prepareConnection(opened, entry.getTimeoutSeconds());
        } catch (SQLException e) {
            closeQuietlyAfterFailure(opened, target);
            throw PhiGuardException.databaseConnection(
                    "Failed to initialize session for " + target, e);
        }

        this.connection = opened;
        this.dialect = handler;
        this.entry = entry;
        this.state = ConnectionState.CONNECTED;
        log.info("Connected: {}", target);
    }

    /**
     * Closes the connection if one is open. Calling this while disconnected does nothing.
     *
     * @throws PhiGuardException DATABASE_CONNECTION when the driver fails to close the handle; the
     *         manager is {@link ConnectionState#DISCONNECTED} regardless
     */
    public synchronized void disconnect() {
        if (state == ConnectionState.DISCONNECTED) {
            log.debug("disconnect() called while already disconnected");
            return;
        }
        String target = describe(entry);
        Connection closing = connection;
        connection = null;
        dialect = null;
        state = ConnectionState.DISCONNECTED;
        try {
            closing.close();
            log.info("Disconnected: {}", target);
        } catch (SQLException e) {
            throw PhiGuardException.databaseConnection("Failed to close connection to " + target,
                    e);
        }
    }

    /**
     * Same as {@link #disconnect()}.
     */
    @Override
    public void close() {
        disconnect();
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return state
     */
    public synchronized ConnectionState getState() {
        return state;
    }

    /**
     * Returns whether a live handle is held.
     *
     * @return {@code true} when {@link ConnectionState#CONNECTED}
     */
    public synchronized boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Returns the live JDBC handle.
     *
     * @return JDBC connection
     * @throws PhiGuardException VALIDATION when not connected; DATABASE_CONNECTION when the handle
     *         has been closed underneath the manager
     */
    public synchronized Connection getConnection() {
        if (state != ConnectionState.CONNECTED) {
            throw PhiGuardException.validation("Not connected; call connect() first");
        }
        boolean closed;
        try {
            closed = connection.isClosed();
        } catch (SQLException e) {
            throw PhiGuardException.databaseConnection(
                    "Failed to check connection to " + describe(entry), e);
        }
        if (closed) {
            String target = describe(entry);
            connection = null;
            dialect = null;
            state = ConnectionState.DISCONNECTED;
            throw PhiGuardException.databaseConnection("Connection lost: " + target, null);
        }
        return connection;
    }

    /**
     * Returns the dialect selected at connect time.
     *
     * @return dialect handler
     * @throws PhiGuardException VALIDATION when not connected
     */
    public synchronized DbDialectHandler getDialect() {
        if (state != ConnectionState.CONNECTED) {
            throw PhiGuardException.validation("Not connected; call connect() first");
        }
        return dialect;
    }

    /**
     * Returns the statement timeout of the current entry.
     *
     * @return timeout in seconds
     * @throws PhiGuardException VALIDATION when not connected
     */
    public synchronized int getStatementTimeoutSeconds() {
        if (state != ConnectionState.CONNECTED) {
            throw PhiGuardException.validation("Not connected; call connect() first");
        }
        return entry.getTimeoutSeconds();
    }

    /**
     * Returns the entry of the last successful connect, for diagnostics.
     *
     * @return entry, or {@code null} before the first connect
     */
    public synchronized ConnectionConfig.Entry getEntry() {
        return entry;
    }

    /**
     * Validates required fields before any I/O.
     *
     * @param entry connection entry
     * @param kind resolved backend kind
     */
    private void validateEntry(ConnectionConfig.Entry entry, BackendKind kind) {
        List<String> missing = new ArrayList<>();
        if (kind.isNetworked()) {
            if (StringUtils.isBlank(entry.getHost())) {
                missing.add("host");
            }
            if (entry.getPort() == null || entry.getPort() <= 0) {
                missing.add("port");
            }
            if (StringUtils.isBlank(entry.getUser())) {
                missing.add("user");
            }
            if (StringUtils.isEmpty(entry.getPassword())) {
                missing.add("password");
            }
            if (StringUtils.isBlank(entry.getDatabase())) {
                missing.add("database");
            }
        } else if (StringUtils.isBlank(entry.getPath())) {
            missing.add("path");
        }
        if (!missing.isEmpty()) {
            throw PhiGuardException.validation("Missing required connection field(s) " + missing
                    + " for " + kind + " connection id=" + entry.getId());
        }
        if (entry.getTimeoutSeconds() <= 0) {
            throw PhiGuardException.validation("timeoutSeconds must be positive for connection id="
                    + entry.getId() + " but was " + entry.getTimeoutSeconds());
        }
    }

    /**
     * Closes a half-initialized handle, attaching any close failure to the log.
     *
     * @param opened handle to close
     * @param target target descriptor for logging
     */
    private void closeQuietlyAfterFailure(Connection opened, String target) {
        try {
            opened.close();
        } catch (SQLException closeError) {
            log.warn("Failed to close connection after session initialization error: {}",
                    target, closeError);
        }
    }

    private static String describe(ConnectionConfig.Entry entry) {
        if (entry == null) {
            return "<none>";
        }
        return entry.getKind() + " " + entry.describeTarget() + " (id=" + entry.getId() + ")";
    }
}
