package io.github.yok.phiguard.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the fixture encryption key.
 *
 * <p>
 * {@code security.encryption-key} is a Base64 encoded AES key of 16, 24 or 32 bytes. It is usually
 * supplied through the {@code SECURITY_ENCRYPTION_KEY} environment variable rather than written to
 * a file.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "security")
@Getter
@Setter
@NoArgsConstructor
public class SecurityConfig {

    private String encryptionKey;
}
