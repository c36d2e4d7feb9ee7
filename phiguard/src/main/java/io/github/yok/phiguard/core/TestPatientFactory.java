package io.github.yok.phiguard.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.phiguard.config.CleanupConfig;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.util.SqlIdentifierUtil;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Inserts synthetic patients that {@link TestDataCleaner} can later find and remove.
 *
 * <p>
 * Every patient created here carries one of the configured {@code cleanup.patient-prefixes} in its
 * {@code patient_id}. A generated id is the first prefix followed by a {@code yyMMddHHmmss} stamp
 * and a three-digit sequence, which keeps it within the {@code VARCHAR(20)} key of
 * {@code patients}. Columns the caller leaves out are filled from
 * {@link #DEFAULT_DEMOGRAPHICS}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TestPatientFactory {

    /**
     * Width of {@code patients.patient_id}.
     */
    public static final int PATIENT_ID_MAX_LENGTH = 20;

    /**
     * Column values applied when the caller does not supply them.
     */
    public static final Map<String, Object> DEFAULT_DEMOGRAPHICS =
            ImmutableMap.<String, Object>builder().put("first_name", "Test")
                    .put("last_name", "Patient").put("date_of_birth", LocalDate.of(1980, 1, 1))
                    .put("gender", "O").put("status", "ACTIVE")
                    .put("created_by", "TEST_AUTOMATION").build();

    private static final DateTimeFormatter ID_STAMP = DateTimeFormatter.ofPattern("yyMMddHHmmss");
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final QueryExecutor executor;
    private final List<String> prefixes;
    private final Clock clock;

    /**
     * Creates a factory using the default patient prefixes.
     *
     * @param executor query executor
     */
    public TestPatientFactory(QueryExecutor executor) {
        this(executor, new CleanupConfig());
    }

    /**
     * Creates a factory using the configured patient prefixes.
     *
     * @param executor query executor
     * @param config cleanup configuration
     * @throws PhiGuardException VALIDATION when no usable prefix is configured
     */
    public TestPatientFactory(QueryExecutor executor, CleanupConfig config) {
        this(executor, config, Clock.systemDefaultZone());
    }

    TestPatientFactory(QueryExecutor executor, CleanupConfig config, Clock clock) {
        List<String> configured = config.getPatientPrefixes() == null ? Collections.emptyList()
                : config.getPatientPrefixes();
        if (configured.isEmpty() || configured.stream().anyMatch(StringUtils::isBlank)) {
            throw PhiGuardException
                    .validation("cleanup.patient-prefixes must list non-blank prefixes");
        }
        this.executor = executor;
        this.prefixes = ImmutableList.copyOf(configured);
        this.clock = clock;
    }

    /**
     * Creates a patient with a generated id and default demographics.
     *
     * @return patient id
     */
    public String createTestPatient() {
        return createTestPatient(Collections.emptyMap());
    }

    /**
     * Creates a patient from the given column values.
     *
     * @param patientData column name to value; {@code patient_id} is generated when absent
     * @return patient id
     * @throws PhiGuardException VALIDATION when a column name is invalid or the supplied id carries
     *         no fixture prefix; QUERY when the insert fails
     */
    public String createTestPatient(Map<String, ?> patientData) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (patientData != null) {
            patientData.forEach((column, value) -> row.put(
                    SqlIdentifierUtil.requireValid(column, "patient column")
                            .toLowerCase(Locale.ROOT),
                    value));
        }
        Object suppliedId = row.get("patient_id");
        String patientId;
        if (suppliedId == null || StringUtils.isBlank(suppliedId.toString())) {
            patientId = generatePatientId();
        } else {
            patientId = suppliedId.toString();
            if (prefixes.stream().noneMatch(patientId::startsWith)) {
                throw PhiGuardException.validation("patient_id '" + patientId
                        + "' does not start with a fixture prefix " + prefixes);
            }
        }
        row.put("patient_id", patientId);
        DEFAULT_DEMOGRAPHICS.forEach(row::putIfAbsent);

        List<String> columns = new ArrayList<>(row.keySet());
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        executor.update("INSERT INTO patients (" + String.join(", ", columns) + ") VALUES ("
                + placeholders + ")", new ArrayList<>(row.values()));
        log.info("Test patient created: {}", patientId);
        return patientId;
    }

    /**
     * Generates a fixture patient id from the first configured prefix.
     *
     * @return patient id
     * @throws PhiGuardException VALIDATION when the prefix leaves no room for the stamp
     */
    public String generatePatientId() {
        String prefix = prefixes.get(0);
        String id = prefix + LocalDateTime.now(clock).format(ID_STAMP)
                + String.format("%03d", Math.floorMod(SEQUENCE.getAndIncrement(), 1000));
        if (id.length() > PATIENT_ID_MAX_LENGTH) {
            throw PhiGuardException.validation("Prefix '" + prefix
                    + "' is too long for generated patient ids of at most "
                    + PATIENT_ID_MAX_LENGTH + " characters");
        }
        return id;
    }
}
