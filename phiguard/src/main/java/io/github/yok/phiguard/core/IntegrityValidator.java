package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.db.QueryResult;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates that a patient aggregate and its dependents are structurally consistent.
 *
 * <p>
 * Steps:
 * </p>
 * <ol>
 * <li>Look up the patient by primary key. When absent, return {@link IntegrityReport#notFound()}
 * without further queries.</li>
 * <li>Check the required demographic fields {@code first_name}, {@code last_name},
 * {@code date_of_birth} and {@code gender}.</li>
 * <li>Count dependent rows in {@code medical_records}, {@code medications}, {@code appointments}
 * and {@code patient_allergies}.</li>
 * <li>Scan dependents for foreign keys pointing at missing parents. Any hit fails the report.</li>
 * </ol>
 *
 * <p>
 * The check is read-only; two calls without intervening mutation return equal reports.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class IntegrityValidator {

    /**
     * Required demographic fields in check order.
     */
    public static final List<String> REQUIRED_FIELDS =
            ImmutableList.of("first_name", "last_name", "date_of_birth", "gender");

    /**
     * Dependent counts: report field name → count SQL.
     */
    private static final Map<String, String> COUNT_QUERIES = ImmutableMap.of(
            "medical_records", "SELECT COUNT(*) FROM medical_records WHERE patient_id = ?",
            "medications", "SELECT COUNT(*) FROM medications WHERE patient_id = ?",
            "appointments", "SELECT COUNT(*) FROM appointments WHERE patient_id = ?",
            "patient_allergies", "SELECT COUNT(*) FROM patient_allergies WHERE patient_id = ?");

    /**
     * Orphan checks: check name → count SQL. Each query takes the patient id once.
     */
    private static final Map<String, String> ORPHAN_QUERIES = ImmutableMap.of(
            "medications.prescribed_by",
            "SELECT COUNT(*) FROM medications m WHERE m.patient_id = ?"
                    + " AND m.prescribed_by IS NOT NULL AND NOT EXISTS"
                    + " (SELECT 1 FROM providers p WHERE p.provider_id = m.prescribed_by)",
            "medical_records.provider_id",
            "SELECT COUNT(*) FROM medical_records r WHERE r.patient_id = ?"
                    + " AND r.provider_id IS NOT NULL AND NOT EXISTS"
                    + " (SELECT 1 FROM providers p WHERE p.provider_id = r.provider_id)",
            "appointments.provider_id",
            "SELECT COUNT(*) FROM appointments a WHERE a.patient_id = ?"
                    + " AND a.provider_id IS NOT NULL AND NOT EXISTS"
                    + " (SELECT 1 FROM providers p WHERE p.provider_id = a.provider_id)");

    private final QueryExecutor executor;

    /**
     * Validates the aggregate of one patient.
     *
     * @param patientId patient primary key
     * @return integrity report
     * @throws PhiGuardException VALIDATION when {@code patientId} is blank; QUERY when a lookup
     *         fails
     */
    public IntegrityReport validate(String patientId) {
        if (StringUtils.isBlank(patientId)) {
            throw PhiGuardException.validation("patientId must not be blank");
        }

        QueryResult patient = executor.query("SELECT first_name, last_name, date_of_birth, gender"
                + " FROM patients WHERE patient_id = ?", ImmutableList.of(patientId));
        if (patient.isEmpty()) {
            log.warn("Patient not found: {}", patientId);
            return IntegrityReport.notFound();
        }

        Map<String, Object> row = patient.getRows().get(0);
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            Object value = row.get(field);
            if (value == null || StringUtils.isBlank(value.toString())) {
                missing.add(field);
            }
        }

        List<Object> params = ImmutableList.of(patientId);
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : COUNT_QUERIES.entrySet()) {
            counts.put(e.getKey(), executor.queryForLong(e.getValue(), params));
        }

        Map<String, Long> orphans = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ORPHAN_QUERIES.entrySet()) {
            long orphanCount = executor.queryForLong(e.getValue(), params);
            orphans.put(e.getKey(), orphanCount);
            if (orphanCount > 0) {
                log.warn("Orphaned rows detected: check={}, patient={}, count={}", e.getKey(),
                        patientId, orphanCount);
            }
        }

        IntegrityReport report = new IntegrityReport(true, missing,
                counts.get("medical_records"), counts.get("medications"),
                counts.get("appointments"), counts.get("patient_allergies"), orphans);
        if (!missing.isEmpty()) {
            log.warn("Patient {} is missing required field(s): {}", patientId, missing);
        }
        log.info("Patient data integrity validated: patient={}, passed={}", patientId,
                report.isDataIntegrityPassed());
        return report;
    }
}
