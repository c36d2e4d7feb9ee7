package io.github.yok.phiguard.core;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Read-only view of one audit-trail row.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class AuditEvent {

    /**
     * Audit row identifier.
     */
    private final Long auditId;
    /**
     * Patient the action touched; {@code null} for actions without a patient such as LOGIN.
     */
    private final String subjectId;
    /**
     * User who performed the action.
     */
    private final String actorId;
    /**
     * Recorded action.
     */
    private final AuditAction action;
    /**
     * Database timestamp of the record.
     */
    private final LocalDateTime timestamp;
    /**
     * Table the action touched, if recorded.
     */
    private final String tableName;
    /**
     * Key of the touched row, if recorded.
     */
    private final String recordId;
    /**
     * Snapshot before the change, if recorded.
     */
    private final String oldValues;
    /**
     * Snapshot after the change, if recorded.
     */
    private final String newValues;
}
