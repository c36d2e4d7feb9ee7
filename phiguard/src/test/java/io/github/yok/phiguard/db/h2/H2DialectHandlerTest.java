package io.github.yok.phiguard.db.h2;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.BackendKind;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class H2DialectHandlerTest {

    @TempDir
    Path tempDir;

    private final H2DialectHandler handler = new H2DialectHandler();

    @Test
    void buildJdbcUrl_正常ケース_mvdb拡張子付きパスを指定する_拡張子を除いた絶対パスになること() {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setKind(BackendKind.EMBEDDED_FILE);
        entry.setPath(tempDir.resolve("healthcare.mv.db").toString());

        String url = handler.buildJdbcUrl(entry);

        assertTrue(url.startsWith("jdbc:h2:file:"));
        assertTrue(url.endsWith("/healthcare"));
        assertEquals(url, handler.buildJdbcUrl(withPath(tempDir.resolve("healthcare").toString())));
    }

    @Test
    void buildConnectionProperties_正常ケース_資格情報未指定である_saと空パスワードになること() {
        Properties props = handler.buildConnectionProperties(withPath("db"));
        assertEquals("sa", props.getProperty("user"));
        assertEquals("", props.getProperty("password"));
    }

    @Test
    void prepareConnection_正常ケース_タイムアウトを指定する_QUERY_TIMEOUTが設定されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn, 3);

        verify(st).execute("SET QUERY_TIMEOUT 3000");
    }

    @Test
    void toBindValue_正常ケース_InstantとEnumを指定する_JDBC互換値に変換されること() {
        Instant now = Instant.parse("2024-05-01T10:15:30Z");
        assertEquals(Timestamp.from(now), handler.toBindValue(now));
        assertEquals("EMBEDDED_FILE", handler.toBindValue(BackendKind.EMBEDDED_FILE));
        assertEquals("x", handler.toBindValue("x"));
    }

    @Test
    void fromJdbcValue_正常ケース_JDBC日時型を指定する_java_time型に変換されること() throws Exception {
        Timestamp ts = Timestamp.valueOf("2024-05-01 10:15:30");
        assertEquals(LocalDateTime.of(2024, 5, 1, 10, 15, 30),
                handler.fromJdbcValue(ts, Types.TIMESTAMP, "TIMESTAMP", 26));
        assertEquals(LocalDate.of(2024, 5, 1), handler.fromJdbcValue(
                java.sql.Date.valueOf("2024-05-01"), Types.DATE, "DATE", 10));
        assertInstanceOf(String.class,
                handler.fromJdbcValue(new StringBuilder("abc"), Types.OTHER, "OTHER", 0));
    }

    private static ConnectionConfig.Entry withPath(String path) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setKind(BackendKind.EMBEDDED_FILE);
        entry.setPath(path);
        return entry;
    }
}
