package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.phiguard.config.CleanupConfig;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.ArrayList;
import java.util.List;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Identifies the synthetic fixtures {@link TestDataCleaner} removes.
 *
 * <p>
 * A scope is assembled incrementally while a test creates fixtures: identifier prefixes and exact
 * ids for patients, marker prefixes and exact ids for synthetic users, and the ordered list of
 * patient tables to purge (defaults to {@link CleanupTable#DEFAULT_PATIENT_TABLES}). Running the
 * same scope twice is allowed; the second run finds nothing to delete.
 * </p>
 *
 * <pre>
 * CleanupScope scope = CleanupScope.create().patientPrefix("TEST_").userPrefix("TESTUSER_");
 * scope.patientId(createdPatientId);
 * cleaner.cleanup(scope);
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class CleanupScope {

    private final List<String> patientPrefixes = new ArrayList<>();
    private final List<String> patientIds = new ArrayList<>();
    private final List<String> userPrefixes = new ArrayList<>();
    private final List<String> userIds = new ArrayList<>();
    private List<CleanupTable> patientTables = CleanupTable.DEFAULT_PATIENT_TABLES;
    private CleanupTable userTable = CleanupTable.USERS;

    private CleanupScope() {}

    /**
     * Creates an empty scope over the default tables.
     *
     * @return scope
     */
    public static CleanupScope create() {
        return new CleanupScope();
    }

    /**
     * Creates a scope seeded with the configured marker prefixes.
     *
     * @param config cleanup configuration
     * @return scope
     */
    public static CleanupScope fromConfig(CleanupConfig config) {
        CleanupScope scope = new CleanupScope();
        config.getPatientPrefixes().forEach(scope::patientPrefix);
        config.getUserPrefixes().forEach(scope::userPrefix);
        return scope;
    }

    /**
     * Adds patient identifier prefixes.
     *
     * @param prefixes prefixes such as {@code TEST_}
     * @return this scope
     * @throws PhiGuardException VALIDATION when a prefix is blank
     */
    public CleanupScope patientPrefix(String... prefixes) {
        addAll(patientPrefixes, prefixes, "patient prefix");
        return this;
    }

    /**
     * Adds exact patient ids.
     *
     * @param ids patient ids
     * @return this scope
     * @throws PhiGuardException VALIDATION when an id is blank
     */
    public CleanupScope patientId(String... ids) {
        addAll(patientIds, ids, "patient id");
        return this;
    }

    /**
     * Adds synthetic user marker prefixes.
     *
     * @param prefixes prefixes such as {@code TESTUSER_}
     * @return this scope
     * @throws PhiGuardException VALIDATION when a prefix is blank
     */
    public CleanupScope userPrefix(String... prefixes) {
        addAll(userPrefixes, prefixes, "user prefix");
        return this;
    }

    /**
     * Adds exact synthetic user ids.
     *
     * @param ids user ids
     * @return this scope
     * @throws PhiGuardException VALIDATION when an id is blank
     */
    public CleanupScope userId(String... ids) {
        addAll(userIds, ids, "user id");
        return this;
    }

    /**
     * Replaces the patient tables to purge, in declared leaf-to-root order.
     *
     * @param tables table definitions
     * @return this scope
     * @throws PhiGuardException VALIDATION when {@code tables} is {@code null}
     */
    public CleanupScope patientTables(List<CleanupTable> tables) {
        if (tables == null) {
            throw PhiGuardException.validation("patientTables must not be null");
        }
        this.patientTables = ImmutableList.copyOf(tables);
        return this;
    }

    /**
     * Replaces the synthetic user table definition.
     *
     * @param table table definition
     * @return this scope
     * @throws PhiGuardException VALIDATION when {@code table} is {@code null}
     */
    public CleanupScope userTable(CleanupTable table) {
        if (table == null) {
            throw PhiGuardException.validation("userTable must not be null");
        }
        this.userTable = table;
        return this;
    }

    public List<String> getPatientPrefixes() {
        return ImmutableList.copyOf(patientPrefixes);
    }

    public List<String> getPatientIds() {
        return ImmutableList.copyOf(patientIds);
    }

    public List<String> getUserPrefixes() {
        return ImmutableList.copyOf(userPrefixes);
    }

    public List<String> getUserIds() {
        return ImmutableList.copyOf(userIds);
    }

    public List<CleanupTable> getPatientTables() {
        return patientTables;
    }

    public CleanupTable getUserTable() {
        return userTable;
    }

    /**
     * Returns whether any patient prefix or id was added.
     *
     * @return {@code true} when the patient pass has work
     */
    public boolean hasPatientMatchers() {
        return !patientPrefixes.isEmpty() || !patientIds.isEmpty();
    }

    /**
     * Returns whether any user prefix or id was added.
     *
     * @return {@code true} when the user pass has work
     */
    public boolean hasUserMatchers() {
        return !userPrefixes.isEmpty() || !userIds.isEmpty();
    }

    /**
     * Returns whether the scope selects nothing.
     *
     * @return {@code true} when no prefix or id was added
     */
    public boolean isEmpty() {
        return !hasPatientMatchers() && !hasUserMatchers();
    }

    private static void addAll(List<String> target, String[] values, String role) {
        if (values == null) {
            throw PhiGuardException.validation(role + " must not be null");
        }
        for (String value : values) {
            if (StringUtils.isBlank(value)) {
                throw PhiGuardException.validation(role + " must not be blank");
            }
            String trimmed = value.trim();
            if (!target.contains(trimmed)) {
                target.add(trimmed);
            }
        }
    }
}
