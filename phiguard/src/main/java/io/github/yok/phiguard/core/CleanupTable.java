package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.phiguard.util.SqlIdentifierUtil;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One table purged by {@link TestDataCleaner} and how its fixture rows are located.
 *
 * <ul>
 * <li>Direct: the table carries the fixture key itself, e.g. {@code medications.patient_id}.</li>
 * <li>Via parent: the table reaches the fixture key through its parent, e.g. {@code vital_signs}
 * rows whose {@code record_id} belongs to a fixture patient's {@code medical_records}.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CleanupTable {

    /**
     * Patient fixture tables in leaf-to-root order.
     */
    public static final List<CleanupTable> DEFAULT_PATIENT_TABLES = ImmutableList.of(
            direct("audit_trail", "patient_id"),
            viaParent("vital_signs", "record_id", "medical_records", "record_id", "patient_id"),
            direct("medications", "patient_id"),
            direct("patient_allergies", "patient_id"),
            direct("appointments", "patient_id"),
            direct("medical_records", "patient_id"),
            direct("patients", "patient_id"));

    /**
     * Synthetic user accounts, purged after the patient tables.
     */
    public static final CleanupTable USERS = direct("users", "user_id");

    private final String table;
    // Column matched directly, or the column compared against the parent's key
    private final String keyColumn;
    private final String parentTable;
    private final String parentKeyColumn;
    private final String parentMatchColumn;

    private CleanupTable(String table, String keyColumn, String parentTable,
            String parentKeyColumn, String parentMatchColumn) {
        this.table = SqlIdentifierUtil.requireValid(table, "table");
        this.keyColumn = SqlIdentifierUtil.requireValid(keyColumn, "column");
        this.parentTable = parentTable;
        this.parentKeyColumn = parentKeyColumn;
        this.parentMatchColumn = parentMatchColumn;
    }

    /**
     * Creates a table whose own column holds the fixture key.
     *
     * @param table table name
     * @param matchColumn fixture key column
     * @return table definition
     */
    public static CleanupTable direct(String table, String matchColumn) {
        return new CleanupTable(table, matchColumn, null, null, null);
    }

    /**
     * Creates a table that reaches the fixture key through a parent table.
     *
     * @param table table name
     * @param keyColumn column referencing the parent
     * @param parentTable parent table name
     * @param parentKeyColumn parent key referenced by {@code keyColumn}
     * @param parentMatchColumn parent column holding the fixture key
     * @return table definition
     */
    public static CleanupTable viaParent(String table, String keyColumn, String parentTable,
            String parentKeyColumn, String parentMatchColumn) {
        return new CleanupTable(table, keyColumn,
                SqlIdentifierUtil.requireValid(parentTable, "table"),
                SqlIdentifierUtil.requireValid(parentKeyColumn, "column"),
                SqlIdentifierUtil.requireValid(parentMatchColumn, "column"));
    }

    /**
     * Returns whether fixture rows are located through a parent table.
     *
     * @return {@code true} for via-parent tables
     */
    public boolean isViaParent() {
        return parentTable != null;
    }

    /**
     * Builds the WHERE predicate selecting this table's fixture rows.
     *
     * @param matcher builds the match condition for a given key column
     * @return SQL predicate
     */
    String predicate(UnaryOperator<String> matcher) {
        if (!isViaParent()) {
            return matcher.apply(keyColumn);
        }
        return keyColumn + " IN (SELECT " + parentKeyColumn + " FROM " + parentTable + " WHERE "
                + matcher.apply(parentMatchColumn) + ")";
    }
}
