package io.github.yok.phiguard.db;

/**
 * Aggregate interface for database-dialect behavior.
 *
 * <p>
 * This interface composes focused contracts to keep responsibilities separated: connection/session
 * control, metadata access, value conversion, and SQL grammar differences. One implementation
 * exists per {@link BackendKind} and is chosen when a connection is opened.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler extends DbDialectConnectionOperations,
        DbDialectMetadataOperations, DbDialectValueOperations, DbDialectSqlOperations {
}
