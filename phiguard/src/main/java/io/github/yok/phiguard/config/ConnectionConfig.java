package io.github.yok.phiguard.config;

import io.github.yok.phiguard.db.BackendKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that manages DB connection settings loaded from {@code application.yml}.<br>
 * Maps each connection descriptor to an {@link Entry}.
 *
 * <pre>
 * connections:
 *   - id: clinic
 *     kind: postgresql
 *     host: localhost
 *     port: 5432
 *     database: healthcare_test
 *     user: test_user
 *     password: test_password
 *     timeout-seconds: 30
 *     require-ssl: false
 *   - id: local
 *     kind: embedded-file
 *     path: ./target/healthcare_test
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Finds the entry with the given logical ID.
     *
     * @param id logical connection ID
     * @return matching entry, or empty when absent
     */
    public Optional<Entry> find(String id) {
        if (id == null || connections == null) {
            return Optional.empty();
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    /**
     * Inner class that holds one DB connection setting.
     */
    @Data
    public static class Entry {
        // Logical ID of the target connection (e.g., "clinic")
        private String id;
        // Backend kind (postgresql / mysql / embedded-file)
        private BackendKind kind;
        // Host name for networked backends
        private String host;
        // Port number for networked backends
        private Integer port;
        // Database name for networked backends
        private String database;
        // Database file path for the embedded backend
        private String path;
        // Database user name
        private String user;
        // Database password (never logged)
        private String password;
        // Connect and statement timeout in seconds
        private int timeoutSeconds = 30;
        // Require an encrypted channel for networked backends
        private boolean requireSsl;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;

        /**
         * Returns a loggable description of the target without any credential.
         *
         * @return target descriptor such as {@code localhost:5432/healthcare_test}
         */
        public String describeTarget() {
            if (kind == BackendKind.EMBEDDED_FILE) {
                return path;
            }
            return host + ":" + port + "/" + database;
        }

        @Override
        public String toString() {
            return "Entry(id=" + id + ", kind=" + kind + ", target=" + describeTarget()
                    + ", user=" + user + ", password=***, timeoutSeconds=" + timeoutSeconds
                    + ", requireSsl=" + requireSsl + ", driverClass=" + driverClass + ")";
        }
    }
}
