package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structural consistency report for one patient aggregate, produced by
 * {@link IntegrityValidator#validate(String)}.
 *
 * <p>
 * {@link #isDataIntegrityPassed()} is derived: the patient exists, all required demographic fields
 * are present and no orphaned dependent row was found. A patient with zero history passes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class IntegrityReport {

    // Patient row found by primary key
    private final boolean patientExists;
    // first_name, last_name, date_of_birth, gender all non-blank
    @Getter(AccessLevel.NONE)
    private final boolean hasRequiredFields;
    // Required fields that were null or blank
    private final List<String> missingFields;
    // Rows in medical_records
    private final long medicalRecordsCount;
    // Rows in medications
    private final long prescriptionsCount;
    // Rows in appointments
    private final long appointmentsCount;
    // Rows in patient_allergies
    private final long allergiesCount;
    // Orphan check name -> orphaned row count
    private final Map<String, Long> orphanedRows;

    /**
     * Creates a report.
     *
     * @param patientExists patient row found
     * @param missingFields required fields that were null or blank
     * @param medicalRecordsCount medical record count
     * @param prescriptionsCount medication count
     * @param appointmentsCount appointment count
     * @param allergiesCount allergy count
     * @param orphanedRows orphan check results
     */
    public IntegrityReport(boolean patientExists, List<String> missingFields,
            long medicalRecordsCount, long prescriptionsCount, long appointmentsCount,
            long allergiesCount, Map<String, Long> orphanedRows) {
        this.patientExists = patientExists;
        this.missingFields = ImmutableList.copyOf(missingFields);
        this.hasRequiredFields = patientExists && this.missingFields.isEmpty();
        this.medicalRecordsCount = medicalRecordsCount;
        this.prescriptionsCount = prescriptionsCount;
        this.appointmentsCount = appointmentsCount;
        this.allergiesCount = allergiesCount;
        this.orphanedRows = ImmutableMap.copyOf(orphanedRows);
    }

    /**
     * Returns the report for a patient id with no row.
     *
     * @return report with every flag false and every count zero
     */
    public static IntegrityReport notFound() {
        return new IntegrityReport(false, ImmutableList.of(), 0, 0, 0, 0, ImmutableMap.of());
    }

    /**
     * Returns whether all required demographic fields are present.
     *
     * @return {@code false} when the patient is absent or a required field is blank
     */
    public boolean hasRequiredFields() {
        return hasRequiredFields;
    }

    /**
     * Returns the total number of orphaned dependent rows.
     *
     * @return orphan count
     */
    public long getOrphanedRowCount() {
        return orphanedRows.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Returns whether the aggregate is structurally consistent.
     *
     * @return {@code true} when the patient exists, has all required fields and has no orphans
     */
    public boolean isDataIntegrityPassed() {
        return patientExists && hasRequiredFields && getOrphanedRowCount() == 0;
    }
}
