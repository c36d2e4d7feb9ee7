package io.github.yok.phiguard.db.mysql;

import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.BackendKind;
import io.github.yok.phiguard.db.DbDialectHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Locale;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * MySQL implementation of {@link DbDialectHandler}.
 *
 * <ul>
 * <li>URL: {@code jdbc:mysql://host:port/database}</li>
 * <li>Connect timeout: {@code connectTimeout} driver property in milliseconds</li>
 * <li>SSL: {@code sslMode=REQUIRED} when {@code requireSsl} is set, otherwise
 * {@code PREFERRED}</li>
 * <li>Session: {@code max_execution_time} in milliseconds and {@code utf8mb4}</li>
 * <li>{@code BIT(1)} and {@code TINYINT(1)} values are read as {@link Boolean}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MySqlDialectHandler implements DbDialectHandler {

    // JDBC driver used when connections[].driver-class is not configured
    private static final String DRIVER_CLASS = "com.mysql.cj.jdbc.Driver";

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.MYSQL;
    }

    @Override
    public String getDefaultDriverClass() {
        return DRIVER_CLASS;
    }

    @Override
    public String buildJdbcUrl(ConnectionConfig.Entry entry) {
        return "jdbc:mysql://" + entry.getHost() + ":" + entry.getPort() + "/"
                + entry.getDatabase();
    }

    @Override
    public Properties buildConnectionProperties(ConnectionConfig.Entry entry) {
        Properties props = new Properties();
        props.setProperty("user", entry.getUser());
        props.setProperty("password", entry.getPassword());
        props.setProperty("connectTimeout", String.valueOf(entry.getTimeoutSeconds() * 1000L));
        if (entry.isRequireSsl()) {
            props.setProperty("sslMode", "REQUIRED");
        } else {
            props.setProperty("sslMode", "PREFERRED");
            props.setProperty("allowPublicKeyRetrieval", "true");
        }
        return props;
    }

    /**
     * Applies MySQL-specific session initialization to the JDBC {@link Connection}.
     *
     * @param connection JDBC connection to initialize
     * @param statementTimeoutSeconds statement timeout in seconds
     * @throws SQLException if any statement fails during initialization
     */
    @Override
    public void prepareConnection(Connection connection, int statementTimeoutSeconds)
            throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET NAMES utf8mb4");
            st.execute("SET SESSION max_execution_time = " + (statementTimeoutSeconds * 1000L));
        }
        log.debug("MySQL session prepared: max_execution_time={}s", statementTimeoutSeconds);
    }

    /**
     * MySQL stores the database as the catalog; the schema argument stays {@code null}.
     *
     * @param connection JDBC connection
     * @return {@code null}
     */
    @Override
    public String resolveSchema(Connection connection) {
        return null;
    }

    @Override
    public Object fromJdbcValue(Object value, int sqlType, String sqlTypeName, int precision)
            throws SQLException {
        if (value instanceof Number && precision == 1 && isBooleanLike(sqlType, sqlTypeName)) {
            return ((Number) value).intValue() != 0;
        }
        return DbDialectHandler.super.fromJdbcValue(value, sqlType, sqlTypeName, precision);
    }

    @Override
    public String getCurrentTimestampFunction() {
        return "CURRENT_TIMESTAMP";
    }

    @Override
    public String getRecencyLowerBoundExpression() {
        return "DATE_SUB(CURRENT_TIMESTAMP, INTERVAL ? SECOND)";
    }

    private static boolean isBooleanLike(int sqlType, String sqlTypeName) {
        if (sqlType == Types.BIT || sqlType == Types.BOOLEAN) {
            return true;
        }
        return sqlTypeName != null && sqlTypeName.toUpperCase(Locale.ROOT).startsWith("TINYINT");
    }
}
