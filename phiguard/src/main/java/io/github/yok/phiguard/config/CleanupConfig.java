package io.github.yok.phiguard.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the fixture marker prefixes used by test-data cleanup.
 *
 * <p>
 * Synthetic patients are identified by {@code patient_id} prefix and synthetic users by
 * {@code user_id} prefix. If not specified, {@code TEST_}/{@code PAT_} and {@code TESTUSER_} are
 * used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "cleanup")
@Getter
@Setter
@NoArgsConstructor
public class CleanupConfig {

    /**
     * Default patient identifier prefixes.
     */
    public static final List<String> DEFAULT_PATIENT_PREFIXES = ImmutableList.of("TEST_", "PAT_");

    /**
     * Default synthetic user identifier prefixes.
     */
    public static final List<String> DEFAULT_USER_PREFIXES = ImmutableList.of("TESTUSER_");

    private List<String> patientPrefixes = DEFAULT_PATIENT_PREFIXES;

    private List<String> userPrefixes = DEFAULT_USER_PREFIXES;
}
