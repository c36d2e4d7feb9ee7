package io.github.yok.phiguard.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.google.common.collect.ImmutableList;
import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.core.AuditAction;
import io.github.yok.phiguard.core.AuditTrailVerifier;
import io.github.yok.phiguard.core.CleanupResult;
import io.github.yok.phiguard.core.CleanupScope;
import io.github.yok.phiguard.core.IntegrityReport;
import io.github.yok.phiguard.core.IntegrityValidator;
import io.github.yok.phiguard.core.TestDataCleaner;
import io.github.yok.phiguard.db.BackendKind;
import io.github.yok.phiguard.db.ConnectionManager;
import io.github.yok.phiguard.db.ConnectionState;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.exception.ErrorKind;
import io.github.yok.phiguard.exception.PhiGuardException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for PhiGuard against a PostgreSQL container.
 *
 * <p>
 * Covers: connection lifecycle, integrity validation, audit window and fixture cleanup.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresqlIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = createPostgres();

    private static PostgreSQLContainer<?> createPostgres() {
        PostgreSQLContainer<?> container = new PostgreSQLContainer<>("postgres:16-alpine");
        container.withDatabaseName("healthcare_test").withUsername("test_user")
                .withPassword("test_password");
        return container;
    }

    private ConnectionManager manager;
    private QueryExecutor executor;

    @BeforeEach
    void setup_正常ケース_PostgreSQLコンテナに対してFlywayを実行する_マイグレーションが完了すること() {
        PostgresqlIntegrationSupport.prepareDatabase(postgres);
        manager = new ConnectionManager();
        manager.connect(PostgresqlIntegrationSupport.entry(postgres));
        executor = new QueryExecutor(manager);
    }

    @AfterEach
    void tearDown() {
        manager.disconnect();
    }

    @Test
    void connect_正常ケース_接続と切断_状態が遷移すること() {
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals(BackendKind.POSTGRESQL, manager.getDialect().getBackendKind());

        manager.disconnect();

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        manager.connect(PostgresqlIntegrationSupport.entry(postgres));
        assertTrue(manager.isConnected());
    }

    @Test
    void connect_異常ケース_誤ったパスワード_資格情報を含まないDATABASE_CONNECTIONが送出されること() {
        ConnectionConfig.Entry entry = PostgresqlIntegrationSupport.entry(postgres);
        entry.setPassword("wrong-secret-pw");
        ConnectionManager other = new ConnectionManager();

        PhiGuardException ex = assertThrows(PhiGuardException.class, () -> other.connect(entry));

        assertTrue(ex.is(ErrorKind.DATABASE_CONNECTION));
        assertFalse(ex.getMessage().contains("wrong-secret-pw"));
        assertEquals(ConnectionState.DISCONNECTED, other.getState());
    }

    @Test
    void validate_正常ケース_関連データ一式_件数が集計され合格すること() {
        HealthcareFixtures.insertFixtureTree(executor, "TEST_PG001");

        IntegrityReport report = new IntegrityValidator(executor).validate("TEST_PG001");

        assertTrue(report.isDataIntegrityPassed());
        assertEquals(1, report.getMedicalRecordsCount());
        assertEquals(1, report.getPrescriptionsCount());
        assertEquals(1, report.getAppointmentsCount());
        assertEquals(1, report.getAllergiesCount());
        assertFalse(new IntegrityValidator(executor).validate("TEST_NONE").isPatientExists());
    }

    @Test
    void verify_正常ケース_DB時刻基準の窓_直近はtrueで窓外はfalseとなること() {
        HealthcareFixtures.insertPatient(executor, "TEST_PG002");
        executor.update("INSERT INTO audit_trail (patient_id, user_id, action) VALUES (?, ?, ?)",
                ImmutableList.of("TEST_PG002", "USR001", "READ"));
        executor.update("INSERT INTO audit_trail (patient_id, user_id, action, created_date)"
                + " VALUES (?, ?, ?, LOCALTIMESTAMP - INTERVAL '10 minutes')",
                ImmutableList.of("TEST_PG002", "USR003", "UPDATE"));
        AuditTrailVerifier verifier = new AuditTrailVerifier(executor);

        assertTrue(verifier.verify("TEST_PG002", AuditAction.READ, "USR001"));
        assertFalse(verifier.verify("TEST_PG002", AuditAction.UPDATE, "USR003"));
        assertEquals(1, verifier.findEvents("TEST_PG002", AuditAction.UPDATE, "USR003",
                Duration.ofMinutes(15)).size());
    }

    @Test
    void cleanup_正常ケース_2回実行する_残存なしで2回目も成功すること() {
        HealthcareFixtures.insertFixtureTree(executor, "TEST_PG003");
        HealthcareFixtures.insertPatient(executor, "REAL_PG001");
        HealthcareFixtures.insertUser(executor, "TESTUSER_PG1");
        CleanupScope scope = CleanupScope.create().patientPrefix("TEST_").userPrefix("TESTUSER_");
        TestDataCleaner cleaner = new TestDataCleaner(executor);

        CleanupResult first = cleaner.cleanup(scope);
        CleanupResult second = cleaner.cleanup(scope);

        assertEquals(8, first.getTotalDeleted());
        assertEquals(0, second.getTotalDeleted());
        assertEquals(1L, executor.queryForLong("SELECT COUNT(*) FROM patients", null));
        assertEquals(0L, executor.queryForLong("SELECT COUNT(*) FROM vital_signs", null));
    }
}
