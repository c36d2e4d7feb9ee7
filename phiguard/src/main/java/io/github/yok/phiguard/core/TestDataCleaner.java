package io.github.yok.phiguard.core;

import io.github.yok.phiguard.db.DbDialectHandler;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.TableDependencyResolver;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Removes synthetic fixtures across the patient dependency graph without violating referential
 * integrity.
 *
 * <ol>
 * <li>Tables of the scope that do not exist in the schema are skipped with a warning.</li>
 * <li>The declared patient-table order is checked against live foreign-key metadata and
 * re-ordered child-first when needed.</li>
 * <li>The patient pass and then the synthetic-user pass run in one unit of work: every deletion
 * commits or none does.</li>
 * <li>After commit every table in scope is counted again; a residual raises {@code TEST_DATA}
 * naming the table.</li>
 * </ol>
 *
 * <p>
 * Prefixes are bound as {@code LIKE ? ESCAPE '!'} parameters with {@code %}, {@code _} and
 * {@code !} escaped, so a prefix only ever matches literally.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class TestDataCleaner {

    private final QueryExecutor executor;

    /**
     * Deletes every fixture row selected by {@code scope}.
     *
     * @param scope fixtures to remove
     * @return deleted row counts per table
     * @throws PhiGuardException VALIDATION when {@code scope} is {@code null}; QUERY when a
     *         deletion fails (everything is rolled back); TEST_DATA when rows remain after commit
     */
    public CleanupResult cleanup(CleanupScope scope) {
        if (scope == null) {
            throw PhiGuardException.validation("scope must not be null");
        }
        if (scope.isEmpty()) {
            log.info("Cleanup scope is empty; nothing to delete");
            return CleanupResult.empty();
        }

        List<String> skipped = new ArrayList<>();
        List<CleanupTable> patientTables = scope.hasPatientMatchers()
                ? orderChildFirst(existingTables(scope.getPatientTables(), skipped))
                : Collections.emptyList();
        List<CleanupTable> userTables = scope.hasUserMatchers()
                ? existingTables(Collections.singletonList(scope.getUserTable()), skipped)
                : Collections.emptyList();

        char escape = executor.getDialect().getLikeEscapeChar();
        FixtureMatcher patientMatcher =
                new FixtureMatcher(scope.getPatientPrefixes(), scope.getPatientIds(), escape);
        FixtureMatcher userMatcher =
                new FixtureMatcher(scope.getUserPrefixes(), scope.getUserIds(), escape);
        log.info("Cleanup started: patientPrefixes={}, patientIds={}, userPrefixes={}, "
                + "userIds={}, patientTables={}", scope.getPatientPrefixes(),
                scope.getPatientIds().size(), scope.getUserPrefixes(), scope.getUserIds().size(),
                patientTables.stream().map(CleanupTable::getTable).collect(Collectors.toList()));

        Map<String, Integer> deleted = executor.inTransaction(tx -> {
            Map<String, Integer> counts = new LinkedHashMap<>();
            deleteAll(tx, patientTables, patientMatcher, counts);
            deleteAll(tx, userTables, userMatcher, counts);
            return counts;
        });

        verifyNoResidual(patientTables, patientMatcher);
        verifyNoResidual(userTables, userMatcher);

        CleanupResult result = new CleanupResult(deleted, skipped);
        log.info("Cleanup completed: deleted={}, skipped={}", result.getDeletedRows(), skipped);
        return result;
    }

    private void deleteAll(QueryExecutor tx, List<CleanupTable> tables, FixtureMatcher matcher,
            Map<String, Integer> counts) {
        for (CleanupTable table : tables) {
            int rows = tx.update("DELETE FROM " + table.getTable() + " WHERE "
                    + table.predicate(matcher.sql), matcher.params);
            counts.merge(table.getTable(), rows, Integer::sum);
            log.debug("Deleted {} row(s) from {}", rows, table.getTable());
        }
    }

    private void verifyNoResidual(List<CleanupTable> tables, FixtureMatcher matcher) {
        for (CleanupTable table : tables) {
            long residual = executor.queryForLong("SELECT COUNT(*) FROM " + table.getTable()
                    + " WHERE " + table.predicate(matcher.sql), matcher.params);
            if (residual > 0) {
                log.error("Residual fixture rows after cleanup: table={}, count={}",
                        table.getTable(), residual);
                throw PhiGuardException.testData(table.getTable(), residual);
            }
        }
    }

    /**
     * Keeps the tables present in the schema; via-parent tables also need their parent.
     *
     * @param tables declared tables
     * @param skipped receives the names of skipped tables
     * @return present tables in declared order
     */
    private List<CleanupTable> existingTables(List<CleanupTable> tables, List<String> skipped) {
        List<CleanupTable> present = new ArrayList<>();
        for (CleanupTable table : tables) {
            if (!executor.tableExists(table.getTable())) {
                log.warn("Table '{}' does not exist; skipped", table.getTable());
                skipped.add(table.getTable());
                continue;
            }
            if (table.isViaParent() && !executor.tableExists(table.getParentTable())) {
                log.warn("Parent table '{}' of '{}' does not exist; skipped",
                        table.getParentTable(), table.getTable());
                skipped.add(table.getTable());
                continue;
            }
            present.add(table);
        }
        return present;
    }

    /**
     * Re-orders tables so that every referencing table precedes the table it references.
     *
     * @param tables tables in declared order
     * @return tables in delete order
     */
    private List<CleanupTable> orderChildFirst(List<CleanupTable> tables) {
        if (tables.size() < 2) {
            return tables;
        }
        Map<String, CleanupTable> byName = new LinkedHashMap<>();
        for (CleanupTable table : tables) {
            byName.putIfAbsent(table.getTable().toLowerCase(Locale.ROOT), table);
        }
        List<String> ordered;
        try {
            Connection conn = executor.getConnectionManager().getConnection();
            DbDialectHandler dialect = executor.getDialect();
            ordered = TableDependencyResolver.resolveDeleteOrder(conn,
                    dialect.resolveCatalog(conn), dialect.resolveSchema(conn),
                    byName.values().stream().map(CleanupTable::getTable)
                            .collect(Collectors.toList()));
        } catch (SQLException e) {
            throw PhiGuardException.query("Failed to read foreign key metadata", e);
        }
        List<CleanupTable> result = new ArrayList<>(ordered.size());
        for (String name : ordered) {
            result.add(byName.get(name.toLowerCase(Locale.ROOT)));
        }
        if (!result.equals(new ArrayList<>(byName.values()))) {
            log.warn("Declared cleanup order violates foreign keys; using {}", ordered);
        }
        return result;
    }

    /**
     * Escapes LIKE wildcards so that {@code prefix} matches literally, then appends {@code %}.
     *
     * @param prefix raw prefix
     * @param escape escape character
     * @return LIKE pattern
     */
    static String toLikePattern(String prefix, char escape) {
        StringBuilder sb = new StringBuilder(prefix.length() + 4);
        for (char c : prefix.toCharArray()) {
            if (c == escape || c == '%' || c == '_') {
                sb.append(escape);
            }
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    /**
     * Match condition over one key column together with its bind parameters.
     */
    private static final class FixtureMatcher {
        private final UnaryOperator<String> sql;
        private final List<Object> params = new ArrayList<>();

        FixtureMatcher(List<String> prefixes, List<String> ids, char escape) {
            for (String prefix : prefixes) {
                params.add(toLikePattern(prefix, escape));
            }
            params.addAll(ids);
            this.sql = column -> {
                List<String> terms = new ArrayList<>();
                for (int i = 0; i < prefixes.size(); i++) {
                    terms.add(column + " LIKE ? ESCAPE '" + escape + "'");
                }
                if (!ids.isEmpty()) {
                    terms.add(column + " IN (" + String.join(", ",
                            Collections.nCopies(ids.size(), "?")) + ")");
                }
                return "(" + String.join(" OR ", terms) + ")";
            };
        }
    }
}
