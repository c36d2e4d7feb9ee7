package io.github.yok.phiguard.db;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Metadata operations for each database dialect.
 */
public interface DbDialectMetadataOperations {

    /**
     * Resolves the catalog passed to {@link DatabaseMetaData} lookups.
     *
     * @param connection JDBC connection
     * @return catalog name, or {@code null}
     * @throws SQLException if the driver call fails
     */
    default String resolveCatalog(Connection connection) throws SQLException {
        return connection.getCatalog();
    }

    /**
     * Resolves the schema passed to {@link DatabaseMetaData} lookups.
     *
     * @param connection JDBC connection
     * @return schema name, or {@code null}
     * @throws SQLException if the driver call fails
     */
    default String resolveSchema(Connection connection) throws SQLException {
        return connection.getSchema();
    }

    /**
     * Normalizes an identifier according to how the database stores unquoted names.
     *
     * @param meta JDBC metadata
     * @param identifier identifier to normalize; may be {@code null}
     * @return normalized identifier (or {@code null} if input is {@code null})
     * @throws SQLException if metadata access fails
     */
    default String normalizeIdentifier(DatabaseMetaData meta, String identifier)
            throws SQLException {
        if (identifier == null) {
            return null;
        }
        if (meta.storesLowerCaseIdentifiers()) {
            return identifier.toLowerCase(Locale.ROOT);
        }
        if (meta.storesUpperCaseIdentifiers()) {
            return identifier.toUpperCase(Locale.ROOT);
        }
        return identifier;
    }

    /**
     * Checks whether a table exists in the connection's current schema.
     *
     * @param connection JDBC connection
     * @param table table name (case-insensitive)
     * @return {@code true} when the table exists
     * @throws SQLException if metadata retrieval fails
     */
    default boolean tableExists(Connection connection, String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String schema = normalizeIdentifier(meta, resolveSchema(connection));
        String pattern = escapeSearchPattern(meta, normalizeIdentifier(meta, table));
        try (ResultSet rs = meta.getTables(resolveCatalog(connection), schema, pattern, null)) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Escapes LIKE wildcards in a metadata search pattern.
     *
     * @param meta JDBC metadata
     * @param name identifier
     * @return escaped pattern
     * @throws SQLException if metadata access fails
     */
    private static String escapeSearchPattern(DatabaseMetaData meta, String name)
            throws SQLException {
        String escape = meta.getSearchStringEscape();
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%",
                escape + "%");
    }
}
