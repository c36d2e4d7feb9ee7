package io.github.yok.phiguard.config;

import java.time.Duration;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings for audit-trail verification.
 *
 * <ul>
 * <li>{@code audit.recency-window}: default look-back window (e.g. {@code 5m})</li>
 * <li>{@code audit.table}: audit table name</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "audit")
@Getter
@Setter
@NoArgsConstructor
public class AuditConfig {

    /**
     * Default recency window applied when callers do not pass one.
     */
    public static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofMinutes(5);

    /**
     * Default audit table name.
     */
    public static final String DEFAULT_TABLE = "audit_trail";

    private Duration recencyWindow = DEFAULT_RECENCY_WINDOW;

    private String table = DEFAULT_TABLE;
}
