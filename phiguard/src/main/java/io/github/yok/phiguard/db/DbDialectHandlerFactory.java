package io.github.yok.phiguard.db;

import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.h2.H2DialectHandler;
import io.github.yok.phiguard.db.mysql.MySqlDialectHandler;
import io.github.yok.phiguard.db.postgresql.PostgresqlDialectHandler;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the backend kind.
 *
 * <p>
 * The handler is resolved per {@link ConnectionConfig.Entry} using {@code connections[].kind}
 * first and {@code connections[].driver-class} as a fallback.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates a {@link DbDialectHandler} based on the provided connection entry.
     *
     * <ul>
     * <li>{@code POSTGRESQL}: instantiate {@link PostgresqlDialectHandler}</li>
     * <li>{@code MYSQL}: instantiate {@link MySqlDialectHandler}</li>
     * <li>{@code EMBEDDED_FILE}: instantiate {@link H2DialectHandler}</li>
     * </ul>
     *
     * @param entry connection information
     * @return dialect handler
     * @throws PhiGuardException VALIDATION if the backend cannot be determined
     */
    public DbDialectHandler create(ConnectionConfig.Entry entry) {
        if (entry == null) {
            throw PhiGuardException.validation("Connection entry is required");
        }
        return create(resolveKind(entry));
    }

    /**
     * Creates a {@link DbDialectHandler} for the given backend kind.
     *
     * @param kind backend kind
     * @return dialect handler
     * @throws PhiGuardException VALIDATION if {@code kind} is {@code null}
     */
    public DbDialectHandler create(BackendKind kind) {
        if (kind == null) {
            throw PhiGuardException.validation("Backend kind is required");
        }
        DbDialectHandler handler;
        switch (kind) {
            case POSTGRESQL:
                handler = new PostgresqlDialectHandler();
                break;
            case MYSQL:
                handler = new MySqlDialectHandler();
                break;
            default:
                handler = new H2DialectHandler();
                break;
        }
        log.debug("Dialect handler selected: kind={}, handler={}", kind,
                handler.getClass().getSimpleName());
        return handler;
    }

    /**
     * Resolves the backend kind for a connection entry.
     *
     * <p>
     * Resolution priority is {@code kind} first, then {@code driver-class}.
     * </p>
     *
     * @param entry connection entry
     * @return resolved backend kind
     * @throws PhiGuardException VALIDATION if the backend cannot be determined
     */
    public BackendKind resolveKind(ConnectionConfig.Entry entry) {
        if (entry.getKind() != null) {
            return entry.getKind();
        }
        BackendKind fromDriverClass = resolveKindFromDriverClass(entry.getDriverClass());
        if (fromDriverClass != null) {
            return fromDriverClass;
        }
        throw PhiGuardException.validation("Missing required connection field(s) [kind] for id="
                + entry.getId() + " (driver-class=" + entry.getDriverClass() + ")");
    }

    /**
     * Resolves the backend kind from a JDBC driver class name.
     *
     * @param driverClass JDBC driver class name
     * @return resolved backend kind, or {@code null} when not recognized
     */
    private BackendKind resolveKindFromDriverClass(String driverClass) {
        if (driverClass == null || driverClass.isBlank()) {
            return null;
        }
        String normalized = driverClass.trim().toLowerCase(Locale.ROOT);
        if ("org.postgresql.driver".equals(normalized)) {
            return BackendKind.POSTGRESQL;
        }
        if ("com.mysql.cj.jdbc.driver".equals(normalized)
                || "com.mysql.jdbc.driver".equals(normalized)) {
            return BackendKind.MYSQL;
        }
        if ("org.h2.driver".equals(normalized)) {
            return BackendKind.EMBEDDED_FILE;
        }
        return null;
    }
}
