package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one {@link TestDataCleaner#cleanup(CleanupScope)} run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CleanupResult {

    // Table -> deleted rows, in execution order
    private final Map<String, Integer> deletedRows;
    // Tables in scope that do not exist in the schema
    private final List<String> skippedTables;

    /**
     * Creates a result.
     *
     * @param deletedRows deleted rows per table in execution order
     * @param skippedTables tables skipped because they are absent
     */
    public CleanupResult(Map<String, Integer> deletedRows, List<String> skippedTables) {
        this.deletedRows = ImmutableMap.copyOf(deletedRows);
        this.skippedTables = ImmutableList.copyOf(skippedTables);
    }

    /**
     * Returns the result of a run that had nothing to do.
     *
     * @return empty result
     */
    public static CleanupResult empty() {
        return new CleanupResult(ImmutableMap.of(), ImmutableList.of());
    }

    /**
     * Returns the number of rows deleted across all tables.
     *
     * @return total deleted rows
     */
    public int getTotalDeleted() {
        return deletedRows.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Returns the rows deleted from one table.
     *
     * @param table table name
     * @return deleted rows, {@code 0} when the table was not touched
     */
    public int getDeleted(String table) {
        return deletedRows.getOrDefault(table, 0);
    }
}
