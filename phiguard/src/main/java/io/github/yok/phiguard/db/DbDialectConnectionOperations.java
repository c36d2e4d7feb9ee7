package io.github.yok.phiguard.db;

import io.github.yok.phiguard.config.ConnectionConfig;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Connection/session related operations for each database dialect.
 */
public interface DbDialectConnectionOperations {

    /**
     * Returns the backend this handler serves.
     *
     * @return backend kind
     */
    BackendKind getBackendKind();

    /**
     * Returns the JDBC driver class required on the classpath when the entry does not configure
     * one.
     *
     * @return fully qualified driver class name
     */
    String getDefaultDriverClass();

    /**
     * Builds the JDBC URL for the provided connection entry.
     *
     * @param entry connection-config entry
     * @return JDBC URL without credentials
     */
    String buildJdbcUrl(ConnectionConfig.Entry entry);

    /**
     * Builds driver properties (credentials, connect timeout, SSL requirement).
     *
     * @param entry connection-config entry
     * @return driver properties
     */
    Properties buildConnectionProperties(ConnectionConfig.Entry entry);

    /**
     * Applies dialect-specific initialization to JDBC connection.
     *
     * @param connection JDBC connection to initialize
     * @param statementTimeoutSeconds server-side statement timeout in seconds
     * @throws SQLException if session initialization fails
     */
    void prepareConnection(Connection connection, int statementTimeoutSeconds)
            throws SQLException;
}
