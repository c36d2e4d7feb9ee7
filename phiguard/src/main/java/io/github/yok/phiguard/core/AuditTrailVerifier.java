package io.github.yok.phiguard.core;

import io.github.yok.phiguard.config.AuditConfig;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.db.QueryResult;
import io.github.yok.phiguard.exception.ErrorKind;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.SqlIdentifierUtil;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Verifies that sensitive actions left audit-trail evidence within a bounded recency window.
 *
 * <p>
 * A row matches when its subject ({@code patient_id}), action and actor ({@code user_id}) equal the
 * requested ones and its {@code created_date} lies in {@code [now - window, now]}, "now" being the
 * database clock. A {@code null} subject matches rows whose {@code patient_id IS NULL}. Rows
 * outside the window count as absent.
 * </p>
 *
 * <p>
 * A missing audit table, or any query or connection failure while reading it, is a compliance
 * failure and raises {@link ErrorKind#SECURITY} with the original failure as its cause. Windows
 * longer than 100 years are treated as 100 years.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AuditTrailVerifier {

    /**
     * Longest look-back bound to the query (100 years). Every supported backend can still compute
     * {@code now - window} as a valid timestamp.
     */
    static final long MAX_WINDOW_SECONDS = Duration.ofDays(36525).getSeconds();

    private static final String COLUMNS = "audit_id, patient_id, user_id, action, table_name,"
            + " record_id, old_values, new_values, created_date";

    private final QueryExecutor executor;
    private final Duration defaultWindow;
    private final String table;

    /**
     * Creates a verifier over {@code audit_trail} with a 5-minute default window.
     *
     * @param executor query executor
     */
    public AuditTrailVerifier(QueryExecutor executor) {
        this(executor, new AuditConfig());
    }

    /**
     * Creates a verifier with the given configuration.
     *
     * @param executor query executor
     * @param config audit configuration
     * @throws PhiGuardException VALIDATION when the configured window or table is invalid
     */
    public AuditTrailVerifier(QueryExecutor executor, AuditConfig config) {
        this.executor = executor;
        this.defaultWindow = requirePositive(config.getRecencyWindow());
        this.table = SqlIdentifierUtil.requireValid(config.getTable(), "audit table");
    }

    /**
     * Verifies evidence within the default window.
     *
     * @param subjectId patient id; {@code null} for actions without a patient
     * @param action action
     * @param actorId acting user id
     * @return {@code true} when at least one matching row exists
     */
    public boolean verify(String subjectId, AuditAction action, String actorId) {
        return verify(subjectId, action, actorId, defaultWindow);
    }

    /**
     * Verifies evidence within {@code recencyWindow}.
     *
     * @param subjectId patient id; {@code null} for actions without a patient
     * @param action action
     * @param actorId acting user id
     * @param recencyWindow look-back window, positive
     * @return {@code true} when at least one matching row exists
     * @throws PhiGuardException VALIDATION on blank actor, missing action or non-positive window;
     *         SECURITY when the audit table is missing or unreadable
     */
    public boolean verify(String subjectId, AuditAction action, String actorId,
            Duration recencyWindow) {
        List<Object> params = new ArrayList<>();
        String where = buildWhere(subjectId, action, actorId, recencyWindow, params);
        long count = readAudit(() -> executor
                .queryForLong("SELECT COUNT(*) FROM " + table + " WHERE " + where, params));
        boolean found = count > 0;
        if (found) {
            log.info("Audit trail verified: action={}, subject={}, actor={}", action, subjectId,
                    actorId);
        } else {
            log.warn("Audit trail missing: action={}, subject={}, actor={}, window={}", action,
                    subjectId, actorId, recencyWindow);
        }
        return found;
    }

    /**
     * Requires evidence within the default window.
     *
     * @param subjectId patient id; {@code null} for actions without a patient
     * @param action action
     * @param actorId acting user id
     * @throws PhiGuardException SECURITY when no matching row exists
     */
    public void requireEvent(String subjectId, AuditAction action, String actorId) {
        requireEvent(subjectId, action, actorId, defaultWindow);
    }

    /**
     * Requires evidence within {@code recencyWindow}.
     *
     * @param subjectId patient id; {@code null} for actions without a patient
     * @param action action
     * @param actorId acting user id
     * @param recencyWindow look-back window, positive
     * @throws PhiGuardException SECURITY when no matching row exists
     */
    public void requireEvent(String subjectId, AuditAction action, String actorId,
            Duration recencyWindow) {
        if (!verify(subjectId, action, actorId, recencyWindow)) {
            throw PhiGuardException.security("HIPAA audit trail missing for " + action
                    + " on patient " + subjectId + " by " + actorId + " within " + recencyWindow,
                    null);
        }
    }

    /**
     * Lists matching events, newest first.
     *
     * @param subjectId patient id; {@code null} for actions without a patient
     * @param action action
     * @param actorId acting user id
     * @param recencyWindow look-back window, positive
     * @return matching events
     */
    public List<AuditEvent> findEvents(String subjectId, AuditAction action, String actorId,
            Duration recencyWindow) {
        List<Object> params = new ArrayList<>();
        String where = buildWhere(subjectId, action, actorId, recencyWindow, params);
        QueryResult result = readAudit(() -> executor.query("SELECT " + COLUMNS + " FROM " + table
                + " WHERE " + where + " ORDER BY created_date DESC, audit_id DESC", params));
        List<AuditEvent> events = new ArrayList<>(result.size());
        for (Map<String, Object> row : result.getRows()) {
            events.add(toEvent(row));
        }
        return events;
    }

    /**
     * Returns the window used when callers pass none.
     *
     * @return default window
     */
    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    private String buildWhere(String subjectId, AuditAction action, String actorId,
            Duration recencyWindow, List<Object> params) {
        if (action == null) {
            throw PhiGuardException.validation("action must not be null");
        }
        if (StringUtils.isBlank(actorId)) {
            throw PhiGuardException.validation("actorId must not be blank");
        }
        long seconds = toSeconds(requirePositive(recencyWindow));

        StringBuilder where = new StringBuilder();
        if (subjectId == null) {
            where.append("patient_id IS NULL");
        } else {
            where.append("patient_id = ?");
            params.add(subjectId);
        }
        where.append(" AND UPPER(action) = ?");
        params.add(action.name());
        where.append(" AND user_id = ?");
        params.add(actorId);
        where.append(" AND created_date >= ")
                .append(executor.getDialect().getRecencyLowerBoundExpression());
        params.add(seconds);
        where.append(" AND created_date <= ")
                .append(executor.getDialect().getCurrentTimestampFunction());
        return where.toString();
    }

    private <T> T readAudit(AuditRead<T> read) {
        try {
            if (!executor.tableExists(table)) {
                throw PhiGuardException.security("Audit table '" + table + "' does not exist",
                        null);
            }
            return read.run();
        } catch (PhiGuardException e) {
            if (e.is(ErrorKind.VALIDATION) || e.is(ErrorKind.SECURITY)) {
                throw e;
            }
            throw PhiGuardException.security(
                    "HIPAA audit trail verification failed: " + e.getMessage(), e);
        }
    }

    private static AuditEvent toEvent(Map<String, Object> row) {
        Object id = row.get("audit_id");
        Object created = row.get("created_date");
        return new AuditEvent(id instanceof Number ? ((Number) id).longValue() : null,
                asString(row.get("patient_id")), asString(row.get("user_id")),
                AuditAction.fromString(asString(row.get("action"))),
                created instanceof LocalDateTime ? (LocalDateTime) created : null,
                asString(row.get("table_name")), asString(row.get("record_id")),
                asString(row.get("old_values")), asString(row.get("new_values")));
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Duration requirePositive(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw PhiGuardException.validation("recencyWindow must be positive but was " + window);
        }
        return window;
    }

    /**
     * Converts the window to whole seconds, rounding up and capping at
     * {@link #MAX_WINDOW_SECONDS}.
     *
     * @param window positive window
     * @return seconds bound as the look-back parameter
     */
    static long toSeconds(Duration window) {
        long seconds = window.getSeconds();
        if (seconds >= MAX_WINDOW_SECONDS) {
            return MAX_WINDOW_SECONDS;
        }
        return window.getNano() > 0 ? seconds + 1 : seconds;
    }

    @FunctionalInterface
    private interface AuditRead<T> {
        T run();
    }
}
