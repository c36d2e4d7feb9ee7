package io.github.yok.phiguard.db.postgresql;

import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.BackendKind;
import io.github.yok.phiguard.db.DbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL implementation of {@link DbDialectHandler}.
 *
 * <ul>
 * <li>URL: {@code jdbc:postgresql://host:port/database}</li>
 * <li>Connect timeout: {@code connectTimeout} driver property in seconds</li>
 * <li>SSL: {@code sslmode=require} when {@code requireSsl} is set</li>
 * <li>Session: {@code statement_timeout} in milliseconds</li>
 * </ul>
 *
 * <p>
 * {@code jsonb}, {@code inet} and similar columns arrive as {@code PGobject}; the default value
 * conversion renders them as their text form.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PostgresqlDialectHandler implements DbDialectHandler {

    // JDBC driver used when connections[].driver-class is not configured
    private static final String DRIVER_CLASS = "org.postgresql.Driver";

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.POSTGRESQL;
    }

    @Override
    public String getDefaultDriverClass() {
        return DRIVER_CLASS;
    }

    @Override
    public String buildJdbcUrl(ConnectionConfig.Entry entry) {
        return "jdbc:postgresql://" + entry.getHost() + ":" + entry.getPort() + "/"
                + entry.getDatabase();
    }

    @Override
    public Properties buildConnectionProperties(ConnectionConfig.Entry entry) {
        Properties props = new Properties();
        props.setProperty("user", entry.getUser());
        props.setProperty("password", entry.getPassword());
        props.setProperty("connectTimeout", String.valueOf(entry.getTimeoutSeconds()));
        props.setProperty("ApplicationName", "phiguard");
        if (entry.isRequireSsl()) {
            props.setProperty("sslmode", "require");
        }
        return props;
    }

    /**
     * Applies PostgreSQL-specific session initialization to the JDBC {@link Connection}.
     *
     * @param connection JDBC connection to initialize
     * @param statementTimeoutSeconds statement timeout in seconds
     * @throws SQLException if any statement fails during initialization
     */
    @Override
    public void prepareConnection(Connection connection, int statementTimeoutSeconds)
            throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET statement_timeout = " + (statementTimeoutSeconds * 1000L));
        }
        log.debug("PostgreSQL session prepared: statement_timeout={}s", statementTimeoutSeconds);
    }

    @Override
    public String getCurrentTimestampFunction() {
        return "LOCALTIMESTAMP";
    }

    @Override
    public String getRecencyLowerBoundExpression() {
        return "LOCALTIMESTAMP - (CAST(? AS DOUBLE PRECISION) * INTERVAL '1 second')";
    }
}
