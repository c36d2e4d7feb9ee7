package io.github.yok.phiguard.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.phiguard.db.ConnectionManager;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.support.H2TestDatabase;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * 患者の登録から検証、監査確認、後片付けまでを通しで確認するシナリオ試験です。
 */
class PatientLifecycleScenarioTest {

    @TempDir
    Path tempDir;

    private ConnectionManager manager;
    private QueryExecutor executor;

    @BeforeEach
    void setUp() {
        manager = H2TestDatabase.open(tempDir);
        executor = new QueryExecutor(manager);
    }

    @AfterEach
    void tearDown() {
        manager.disconnect();
    }

    @Test
    void scenario_正常ケース_登録から削除まで_各段階の検証結果が期待どおりであること() {
        IntegrityValidator validator = new IntegrityValidator(executor);
        AuditTrailVerifier auditVerifier = new AuditTrailVerifier(executor);
        TestDataCleaner cleaner = new TestDataCleaner(executor);
        CleanupScope scope = CleanupScope.create();

        H2TestDatabase.insertPatient(manager, "P1");
        scope.patientPrefix("P1");
        IntegrityReport fresh = validator.validate("P1");
        assertTrue(fresh.isDataIntegrityPassed());
        assertEquals(0, fresh.getMedicalRecordsCount());

        H2TestDatabase.exec(manager,
                "INSERT INTO medical_records (record_id, patient_id, provider_id, visit_date)"
                        + " VALUES ('MR_P1', 'P1', 'PRV001', CURRENT_DATE)",
                "INSERT INTO audit_trail (patient_id, user_id, action, table_name, record_id)"
                        + " VALUES ('P1', 'USR001', 'CREATE', 'medical_records', 'MR_P1')");
        IntegrityReport withRecord = validator.validate("P1");
        assertEquals(1, withRecord.getMedicalRecordsCount());
        assertTrue(withRecord.isDataIntegrityPassed());
        assertTrue(auditVerifier.verify("P1", AuditAction.CREATE, "USR001"));

        CleanupResult result = cleaner.cleanup(scope);
        assertEquals(1, result.getDeleted("patients"));
        assertEquals(1, result.getDeleted("medical_records"));
        assertEquals(1, result.getDeleted("audit_trail"));

        IntegrityReport afterCleanup = validator.validate("P1");
        assertFalse(afterCleanup.isPatientExists());
        assertFalse(auditVerifier.verify("P1", AuditAction.CREATE, "USR001"));
    }
}
