package io.github.yok.phiguard;

import io.github.yok.phiguard.config.AuditConfig;
import io.github.yok.phiguard.config.CleanupConfig;
import io.github.yok.phiguard.config.ConnectionConfig;
import io.github.yok.phiguard.config.SecurityConfig;
import io.github.yok.phiguard.core.AuditAction;
import io.github.yok.phiguard.core.AuditTrailVerifier;
import io.github.yok.phiguard.core.CleanupResult;
import io.github.yok.phiguard.core.CleanupScope;
import io.github.yok.phiguard.core.IntegrityReport;
import io.github.yok.phiguard.core.IntegrityValidator;
import io.github.yok.phiguard.core.TestDataCleaner;
import io.github.yok.phiguard.db.ConnectionManager;
import io.github.yok.phiguard.db.DbDialectHandlerFactory;
import io.github.yok.phiguard.db.QueryExecutor;
import io.github.yok.phiguard.exception.PhiGuardException;
import io.github.yok.phiguard.security.SecurityHelper;
import io.github.yok.phiguard.util.ErrorHandler;
import io.github.yok.phiguard.util.MaskingLogUtil;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, opens the target connection and runs one check or maintenance
 * action against it.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --validate <patientId>} or {@code -v <patientId>} prints the integrity report of one
 * patient.</li>
 * <li>{@code --audit <subject>,<action>,<actor>} or {@code -a ...} checks for a recent audit
 * event. An empty subject matches events without a patient.</li>
 * <li>{@code --cleanup [prefix,...]} or {@code -c [prefix,...]} purges fixtures. Without prefixes,
 * {@code cleanup.patient-prefixes} in {@code application.yml} is used.</li>
 * <li>{@code --encrypt <text>} and {@code --decrypt <token>} use
 * {@code security.encryption-key}; they do not touch a database.</li>
 * <li>{@code --target <connectionId>} or {@code -t <connectionId>} selects the connection. If
 * omitted, the first entry in {@code connections} is used.</li>
 * </ul>
 *
 * <p>
 * The process exit code is {@code 0} on success, {@code 1} when a check does not pass or the
 * arguments are unusable, and the {@link io.github.yok.phiguard.exception.ErrorKind} exit code when
 * an operation fails.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionConfig
 * @see AuditConfig
 * @see CleanupConfig
 * @see SecurityConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, AuditConfig.class, CleanupConfig.class,
        SecurityConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    /**
     * Exit code for a check that ran but did not pass.
     */
    public static final int CHECK_FAILED = 1;

    private final ConnectionConfig connectionConfig;
    private final AuditConfig auditConfig;
    private final CleanupConfig cleanupConfig;
    private final SecurityConfig securityConfig;
    private final DbDialectHandlerFactory dialectFactory;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", args.length);

        // Parse CLI arguments
        String mode = null;
        String argument = null;
        String target = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--validate":
                case "-v":
                    mode = "validate";
                    argument = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--audit":
                case "-a":
                    mode = "audit";
                    argument = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--cleanup":
                case "-c":
                    mode = "cleanup";
                    argument = (i + 1 < args.length && !args[i + 1].startsWith("-") ? args[++i]
                            : null);
                    break;
                case "--encrypt":
                    mode = "encrypt";
                    argument = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--decrypt":
                    mode = "decrypt";
                    argument = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--target":
                case "-t":
                    target = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", MaskingLogUtil.maskSensitive(args[i]));
            }
        }

        if (mode == null) {
            exitCode = ErrorHandler.errorAndExit(
                    "One of --validate, --audit, --cleanup, --encrypt or --decrypt is required.");
            return;
        }
        if (!"cleanup".equals(mode) && StringUtils.isBlank(argument)) {
            exitCode = ErrorHandler.errorAndExit("An argument is required in " + mode + " mode.");
            return;
        }

        try {
            if ("encrypt".equals(mode)) {
                System.out.println(SecurityHelper.fromConfig(securityConfig).encrypt(argument));
                exitCode = 0;
            } else if ("decrypt".equals(mode)) {
                System.out.println(SecurityHelper.fromConfig(securityConfig).decrypt(argument));
                exitCode = 0;
            } else {
                exitCode = runAgainstDatabase(mode, argument, resolveEntry(target));
            }
            log.info("Completed. mode={}, exitCode={}", mode, exitCode);
        } catch (RuntimeException e) {
            log.error("Fatal error occurred (mode={}): {}", mode,
                    MaskingLogUtil.maskSensitive(e.getMessage()));
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Opens the connection, runs the database mode and always disconnects.
     *
     * @param mode validate, audit or cleanup
     * @param argument mode argument; may be {@code null} for cleanup
     * @param entry connection entry
     * @return exit code
     */
    private int runAgainstDatabase(String mode, String argument, ConnectionConfig.Entry entry) {
        try (ConnectionManager manager = new ConnectionManager(dialectFactory)) {
            manager.connect(entry);
            QueryExecutor executor = new QueryExecutor(manager);
            switch (mode) {
                case "validate":
                    return validate(executor, argument.trim());
                case "audit":
                    return audit(executor, argument);
                default:
                    return cleanup(executor, argument);
            }
        }
    }

    private int validate(QueryExecutor executor, String patientId) {
        IntegrityReport report = new IntegrityValidator(executor).validate(patientId);
        System.out.println(report);
        if (!report.isDataIntegrityPassed()) {
            log.warn("Integrity check did not pass. patientId={}", patientId);
            return CHECK_FAILED;
        }
        return 0;
    }

    private int audit(QueryExecutor executor, String argument) {
        String[] parts = argument.split(",", -1);
        if (parts.length != 3) {
            throw PhiGuardException
                    .validation("--audit expects <subject>,<action>,<actor> but got: " + argument);
        }
        String subject = StringUtils.trimToNull(parts[0]);
        AuditAction action = AuditAction.fromString(parts[1]);
        String actor = parts[2].trim();
        boolean found =
                new AuditTrailVerifier(executor, auditConfig).verify(subject, action, actor);
        System.out.println("audit event found: " + found);
        return found ? 0 : CHECK_FAILED;
    }

    private int cleanup(QueryExecutor executor, String argument) {
        CleanupScope scope;
        if (StringUtils.isBlank(argument)) {
            scope = CleanupScope.fromConfig(cleanupConfig);
        } else {
            List<String> prefixes = Arrays.stream(argument.split(",")).map(String::trim)
                    .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
            scope = CleanupScope.create().patientPrefix(prefixes.toArray(new String[0]));
            cleanupConfig.getUserPrefixes().forEach(scope::userPrefix);
        }
        CleanupResult result = new TestDataCleaner(executor).cleanup(scope);
        System.out.println("deleted rows: " + result.getDeletedRows());
        return 0;
    }

    /**
     * Resolves the connection entry for {@code --target}.
     *
     * @param target connection ID, or {@code null} for the first configured entry
     * @return entry
     * @throws PhiGuardException VALIDATION when no matching entry is configured
     */
    private ConnectionConfig.Entry resolveEntry(String target) {
        if (target == null) {
            return connectionConfig.getConnections().stream().findFirst()
                    .orElseThrow(() -> PhiGuardException.validation("No connections configured"));
        }
        return connectionConfig.find(target).orElseThrow(
                () -> PhiGuardException.validation("Unknown connection id: " + target));
    }
}
