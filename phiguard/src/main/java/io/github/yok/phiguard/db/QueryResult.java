package io.github.yok.phiguard.db;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Result of one {@link QueryExecutor} call.
 *
 * <p>
 * Fetching calls carry the ordered rows, each an ordered map keyed by lower-cased column label.
 * Non-fetching calls carry the affected-row count and no rows. Values are portable scalars produced
 * by {@link DbDialectValueOperations#fromJdbcValue(Object, int, String, int)}; SQL {@code NULL} is
 * {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class QueryResult {

    // Lower-cased column labels in select order
    private final List<String> columns;
    // Immutable rows in fetch order
    private final List<Map<String, Object>> rows;
    // Affected row count for non-fetching calls, -1 for fetching calls
    private final int affectedRows;

    private QueryResult(List<String> columns, List<Map<String, Object>> rows, int affectedRows) {
        this.columns = columns;
        this.rows = rows;
        this.affectedRows = affectedRows;
    }

    /**
     * Creates a fetching result.
     *
     * @param columns lower-cased column labels
     * @param rows rows; each map is copied and wrapped unmodifiable
     * @return result
     */
    public static QueryResult ofRows(List<String> columns, List<Map<String, Object>> rows) {
        ImmutableList.Builder<Map<String, Object>> copy = ImmutableList.builder();
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new QueryResult(ImmutableList.copyOf(columns), copy.build(), -1);
    }

    /**
     * Creates a non-fetching result.
     *
     * @param affectedRows affected row count reported by the driver
     * @return result
     */
    public static QueryResult ofAffectedRows(int affectedRows) {
        return new QueryResult(ImmutableList.of(), ImmutableList.of(), affectedRows);
    }

    /**
     * Returns the number of fetched rows.
     *
     * @return row count
     */
    public int size() {
        return rows.size();
    }

    /**
     * Returns whether no rows were fetched.
     *
     * @return {@code true} when empty
     */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns the first row.
     *
     * @return first row, or empty
     */
    public Optional<Map<String, Object>> firstRow() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
