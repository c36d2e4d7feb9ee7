package io.github.yok.phiguard.util;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Orders fixture tables so that rows can be deleted without violating foreign keys.
 *
 * <p>
 * A table that references another (child) is emptied before the table it references (parent).
 * Edges are read from {@link DatabaseMetaData#getImportedKeys(String, String, String)} and kept in
 * a Guava {@link MutableGraph} pointing from child to parent.
 * </p>
 *
 * <p>
 * At every step the first table in declared order that no remaining table references is taken.
 * A declared order that is already safe comes back unchanged.
 * </p>
 *
 * <p>
 * PostgreSQL stores unquoted names in lower case and H2 in upper case, so the schema and table
 * passed to the metadata call follow {@link DatabaseMetaData#storesLowerCaseIdentifiers()} and
 * {@link DatabaseMetaData#storesUpperCaseIdentifiers()}. A lookup with a catalog that yields no row
 * is repeated without the catalog.
 * </p>
 *
 * <ul>
 * <li>References to tables outside the requested set are ignored, as are self references.</li>
 * <li>Table names are compared case-insensitively; the first spelling wins.</li>
 * <li>Tables caught in a reference cycle are appended in declared order.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableDependencyResolver {

    private TableDependencyResolver() {
        throw new AssertionError("TableDependencyResolver must not be instantiated.");
    }

    /**
     * Resolves a child-first delete order for the given tables.
     *
     * @param conn JDBC connection used only for {@link DatabaseMetaData} access
     * @param catalog catalog passed to {@code getImportedKeys}; may be {@code null}
     * @param schema schema passed to {@code getImportedKeys}; may be {@code null}
     * @param tables table names in declared order; {@code null} or empty yields an empty list
     * @return the caller's table names in delete order
     * @throws IllegalArgumentException if {@code conn} is {@code null} or a name is blank
     * @throws SQLException if metadata retrieval fails
     */
    public static List<String> resolveDeleteOrder(Connection conn, String catalog, String schema,
            List<String> tables) throws SQLException {
        if (tables == null || tables.isEmpty()) {
            return new ArrayList<>();
        }
        Validate.isTrue(conn != null, "conn must not be null.");
        tables.forEach(t -> Validate.notBlank(t, "tables must not contain null/blank names."));

        Map<String, String> declared = dedupe(tables);
        if (declared.size() == 1) {
            return new ArrayList<>(declared.values());
        }

        MutableGraph<String> references = GraphBuilder.directed().allowsSelfLoops(false)
                .expectedNodeCount(declared.size()).build();
        declared.keySet().forEach(references::addNode);

        DatabaseMetaData meta = conn.getMetaData();
        String metaSchema = toMetadataCase(meta, schema);
        for (Map.Entry<String, String> table : declared.entrySet()) {
            String metaTable = toMetadataCase(meta, table.getValue());
            Set<String> parents = importedParents(meta, catalog, metaSchema, metaTable);
            if (parents.isEmpty() && catalog != null) {
                parents = importedParents(meta, null, metaSchema, metaTable);
            }
            for (String parent : parents) {
                if (declared.containsKey(parent) && !parent.equals(table.getKey())
                        && references.putEdge(table.getKey(), parent)) {
                    log.debug("FK dependency detected: child='{}' -> parent='{}'",
                            table.getValue(), declared.get(parent));
                }
            }
        }

        List<String> order = new ArrayList<>(declared.size());
        Set<String> remaining = new LinkedHashSet<>(declared.keySet());
        while (!remaining.isEmpty()) {
            String next = firstUnreferenced(references, remaining);
            if (next == null) {
                List<String> cyclic = new ArrayList<>();
                remaining.forEach(t -> cyclic.add(declared.get(t)));
                log.warn("Circular foreign key reference detected for tables: {}. "
                        + "These tables will be appended in declared order.", cyclic);
                order.addAll(cyclic);
                break;
            }
            remaining.remove(next);
            order.add(declared.get(next));
        }
        log.debug("Resolved delete order: {}", order);
        return order;
    }

    /**
     * Maps lower-cased names to the caller's spelling, keeping the first of any duplicates.
     */
    private static Map<String, String> dedupe(List<String> tables) {
        Map<String, String> declared = new LinkedHashMap<>();
        for (String table : tables) {
            String key = table.toLowerCase(Locale.ROOT);
            String previous = declared.putIfAbsent(key, table);
            if (previous != null) {
                log.warn("Duplicate table name detected (case-insensitive): '{}' and '{}'. "
                        + "Using the first occurrence.", previous, table);
            }
        }
        return declared;
    }

    private static String firstUnreferenced(MutableGraph<String> references,
            Set<String> remaining) {
        Iterator<String> candidates = remaining.iterator();
        while (candidates.hasNext()) {
            String candidate = candidates.next();
            boolean referenced = references.predecessors(candidate).stream()
                    .anyMatch(remaining::contains);
            if (!referenced) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Reads the lower-cased parent tables of one table.
     *
     * @param meta JDBC metadata
     * @param catalog catalog; may be {@code null}
     * @param schema schema in metadata case; may be {@code null}
     * @param table table in metadata case
     * @return parents in metadata order; empty when the table imports no key
     * @throws SQLException if result set access fails
     */
    private static Set<String> importedParents(DatabaseMetaData meta, String catalog,
            String schema, String table) throws SQLException {
        Set<String> parents = new LinkedHashSet<>();
        try (ResultSet rs = meta.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                String pkTable = rs.getString("PKTABLE_NAME");
                if (pkTable != null) {
                    parents.add(pkTable.toLowerCase(Locale.ROOT));
                }
            }
        }
        return parents;
    }

    private static String toMetadataCase(DatabaseMetaData meta, String identifier)
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
}
