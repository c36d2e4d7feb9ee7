package io.github.yok.phiguard.db.h2;

import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.BackendKind;
import io.github.yok.phiguard.db.DbDialectHandler;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Embedded file database (H2) implementation of {@link DbDialectHandler}.
 *
 * <p>
 * The configured path is resolved to an absolute path and the {@code .mv.db} suffix is removed when
 * present, so both {@code ./target/db} and {@code ./target/db.mv.db} address the same file.
 * Credentials are optional and default to {@code sa} with an empty password.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class H2DialectHandler implements DbDialectHandler {

    // JDBC driver used when connections[].driver-class is not configured
    private static final String DRIVER_CLASS = "org.h2.Driver";

    // Suffix H2 appends to the database file name
    private static final String FILE_SUFFIX = ".mv.db";

    @Override
    public BackendKind getBackendKind() {
        return BackendKind.EMBEDDED_FILE;
    }

    @Override
    public String getDefaultDriverClass() {
        return DRIVER_CLASS;
    }

    @Override
    public String buildJdbcUrl(ConnectionConfig.Entry entry) {
        String path = StringUtils.removeEnd(entry.getPath().trim(), FILE_SUFFIX);
        String absolute = Paths.get(path).toAbsolutePath().normalize().toString()
                .replace('\\', '/');
        return "jdbc:h2:file:" + absolute;
    }

    @Override
    public Properties buildConnectionProperties(ConnectionConfig.Entry entry) {
        Properties props = new Properties();
        props.setProperty("user", StringUtils.defaultIfBlank(entry.getUser(), "sa"));
        props.setProperty("password", StringUtils.defaultString(entry.getPassword()));
        return props;
    }

    /**
     * Applies the session query timeout (milliseconds) to the JDBC {@link Connection}.
     *
     * @param connection JDBC connection to initialize
     * @param statementTimeoutSeconds statement timeout in seconds
     * @throws SQLException if any statement fails during initialization
     */
    @Override
    public void prepareConnection(Connection connection, int statementTimeoutSeconds)
            throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("SET QUERY_TIMEOUT " + (statementTimeoutSeconds * 1000L));
        }
        log.debug("H2 session prepared: query_timeout={}s", statementTimeoutSeconds);
    }

    @Override
    public String getCurrentTimestampFunction() {
        return "LOCALTIMESTAMP";
    }

    @Override
    public String getRecencyLowerBoundExpression() {
        return "DATEADD(SECOND, CAST(? AS BIGINT) * -1, LOCALTIMESTAMP)";
    }
}
