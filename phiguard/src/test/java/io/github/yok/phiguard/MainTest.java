package io.github.yok.phiguard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.phiguard.config.AuditConfig;
import io.github.yok.phiguard.config.CleanupConfig;
import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.config.SecurityConfig;
import io.github.yok.phiguard.db.ConnectionManager;
import io.github.yok.phiguard.db.DbDialectHandlerFactory;
import io.github.yok.phiguard.support.H2TestDatabase;
import io.github.yok.phiguard.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path tempDir;

    private ConnectionConfig connectionConfig;
    private SecurityConfig securityConfig;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        // スキーマと初期データを投入してから切断し、Main 側で再接続させる
        ConnectionManager seed = H2TestDatabase.open(tempDir);
        H2TestDatabase.insertFixtureTree(seed, "TEST_P001");
        H2TestDatabase.insertPatient(seed, "REAL_P001");
        H2TestDatabase.insertUser(seed, "TESTUSER_01");
        seed.disconnect();

        connectionConfig = new ConnectionConfig();
        connectionConfig.getConnections().add(H2TestDatabase.entry(tempDir));
        securityConfig = new SecurityConfig();
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) 7);
        securityConfig.setEncryptionKey(Base64.encodeBase64String(key));

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void run_正常ケース_validateで整合した患者_終了コード0でレポートが出力されること() {
        Main main = newMain();

        main.run("--validate", "TEST_P001");

        assertEquals(0, main.getExitCode());
        String stdout = stdout();
        assertTrue(stdout.contains("patientExists=true"));
        assertTrue(stdout.contains("medicalRecordsCount=1"));
    }

    @Test
    void run_正常ケース_validateで存在しない患者_終了コード1となること() {
        Main main = newMain();

        main.run("-v", "TEST_NOPE", "-t", "h2");

        assertEquals(Main.CHECK_FAILED, main.getExitCode());
        assertTrue(stdout().contains("patientExists=false"));
    }

    @Test
    void run_正常ケース_auditで直近の記録あり_終了コード0となること() {
        Main main = newMain();

        main.run("--audit", "TEST_P001,create,USR002");

        assertEquals(0, main.getExitCode());
        assertTrue(stdout().contains("audit event found: true"));
    }

    @Test
    void run_正常ケース_auditで記録なし_終了コード1となること() {
        Main main = newMain();

        main.run("-a", ",LOGIN,USR001");

        assertEquals(Main.CHECK_FAILED, main.getExitCode());
        assertTrue(stdout().contains("audit event found: false"));
    }

    @Test
    void run_異常ケース_auditの引数の数が不正_VALIDATIONの終了コードとなること() {
        Main main = newMain();

        main.run("--audit", "TEST_P001,READ");

        assertEquals(2, main.getExitCode());
        assertTrue(stderr().contains("ValidationError"));
    }

    @Test
    void run_正常ケース_cleanupで接頭辞省略_設定の接頭辞で削除されること() {
        Main main = newMain();

        main.run("--cleanup", "-t", "h2");

        assertEquals(0, main.getExitCode());
        assertTrue(stdout().contains("deleted rows:"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM patients"));
        assertEquals(0, countRows("SELECT COUNT(*) FROM users WHERE user_id = 'TESTUSER_01'"));
    }

    @Test
    void run_正常ケース_cleanupで接頭辞指定_指定した接頭辞のみ削除されること() {
        Main main = newMain();

        main.run("-c", "REAL_");

        assertEquals(0, main.getExitCode());
        assertEquals(0, countRows("SELECT COUNT(*) FROM patients WHERE patient_id = 'REAL_P001'"));
        assertEquals(1, countRows("SELECT COUNT(*) FROM patients WHERE patient_id = 'TEST_P001'"));
    }

    @Test
    void run_正常ケース_encryptとdecrypt_元の文字列に戻ること() {
        Main encrypt = newMain();
        encrypt.run("--encrypt", "123-45-6789");
        String token = stdout().trim();
        assertEquals(0, encrypt.getExitCode());
        assertFalse(token.contains("123-45-6789"));

        out.reset();
        Main decrypt = newMain();
        decrypt.run("--decrypt", token);

        assertEquals(0, decrypt.getExitCode());
        assertEquals("123-45-6789", stdout().trim());
    }

    @Test
    void run_異常ケース_鍵未設定でdecrypt_SECURITYの終了コードとなること() {
        securityConfig.setEncryptionKey(null);
        Main main = newMain();

        main.run("--decrypt", "AQID");

        assertEquals(4, main.getExitCode());
        assertTrue(stderr().contains("SecurityError"));
    }

    @Test
    void run_異常ケース_未知の接続ID_VALIDATIONの終了コードとなること() {
        Main main = newMain();

        main.run("--validate", "TEST_P001", "--target", "nope");

        assertEquals(2, main.getExitCode());
        assertTrue(stderr().contains("Unknown connection id: nope"));
    }

    @Test
    void run_異常ケース_接続設定なし_VALIDATIONの終了コードとなること() {
        connectionConfig.getConnections().clear();
        Main main = newMain();

        main.run("--validate", "TEST_P001");

        assertEquals(2, main.getExitCode());
        assertTrue(stderr().contains("No connections configured"));
    }

    @Test
    void run_異常ケース_モード未指定_終了コード1となること() {
        Main main = newMain();

        main.run("--unknown");

        assertEquals(ErrorHandler.GENERIC_FAILURE, main.getExitCode());
        assertTrue(stderr().contains("ERROR: One of --validate"));
    }

    @Test
    void run_異常ケース_exit無効でモード未指定_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        Main main = newMain();

        assertThrows(IllegalStateException.class, () -> main.run());
    }

    @Test
    void run_異常ケース_validateの引数なし_終了コード1となること() {
        Main main = newMain();

        main.run("--validate");

        assertEquals(ErrorHandler.GENERIC_FAILURE, main.getExitCode());
        assertTrue(stderr().contains("An argument is required in validate mode."));
    }

    private Main newMain() {
        return new Main(connectionConfig, new AuditConfig(), new CleanupConfig(), securityConfig,
                new DbDialectHandlerFactory());
    }

    private long countRows(String sql) {
        try (ConnectionManager manager = new ConnectionManager()) {
            manager.connect(H2TestDatabase.entry(tempDir));
            return H2TestDatabase.count(manager, sql);
        }
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
