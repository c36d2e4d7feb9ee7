package io.github.yok.phiguard.db.postgresql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.db.BackendKind;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class PostgresqlDialectHandlerTest {

    private final PostgresqlDialectHandler handler = new PostgresqlDialectHandler();

    private static ConnectionConfig.Entry entry() {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId("clinic");
        entry.setKind(BackendKind.POSTGRESQL);
        entry.setHost("db.example");
        entry.setPort(5432);
        entry.setDatabase("healthcare_test");
        entry.setUser("test_user");
        entry.setPassword("secret");
        entry.setTimeoutSeconds(15);
        return entry;
    }

    @Test
    void buildJdbcUrl_正常ケース_ホストとポートを指定する_URLが組み立てられること() {
        assertEquals("jdbc:postgresql://db.example:5432/healthcare_test",
                handler.buildJdbcUrl(entry()));
    }

    @Test
    void buildConnectionProperties_正常ケース_SSL不要を指定する_sslmodeが設定されないこと() {
        Properties props = handler.buildConnectionProperties(entry());
        assertEquals("test_user", props.getProperty("user"));
        assertEquals("secret", props.getProperty("password"));
        assertEquals("15", props.getProperty("connectTimeout"));
        assertEquals("phiguard", props.getProperty("ApplicationName"));
        assertNull(props.getProperty("sslmode"));
    }

    @Test
    void buildConnectionProperties_正常ケース_SSL必須を指定する_sslmodeがrequireであること() {
        ConnectionConfig.Entry entry = entry();
        entry.setRequireSsl(true);
        assertEquals("require", handler.buildConnectionProperties(entry).getProperty("sslmode"));
    }

    @Test
    void prepareConnection_正常ケース_タイムアウトを指定する_ミリ秒でstatement_timeoutが設定されること()
            throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        handler.prepareConnection(conn, 15);

        verify(st).execute("SET statement_timeout = 15000");
        verify(st).close();
    }

    @Test
    void prepareConnection_異常ケース_SET文が失敗する_SQLExceptionが送出されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        doThrow(new SQLException("denied")).when(st).execute("SET statement_timeout = 1000");

        assertThrows(SQLException.class, () -> handler.prepareConnection(conn, 1));
        verify(st).close();
    }

    @Test
    void getRecencyLowerBoundExpression_正常ケース_式を取得する_プレースホルダが1つであること() {
        String expr = handler.getRecencyLowerBoundExpression();
        assertEquals(1, expr.chars().filter(c -> c == '?').count());
        assertEquals("LOCALTIMESTAMP", handler.getCurrentTimestampFunction());
        assertEquals('!', handler.getLikeEscapeChar());
        assertFalse(handler.getDefaultDriverClass().isEmpty());
    }
}
