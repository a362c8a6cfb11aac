package org.lite.vault.config;

import lombok.Data;
import lombok.ToString;
import org.lite.vault.enums.VaultBackendType;
import org.lite.vault.exception.VaultConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.time.Duration;

@ConfigurationProperties(prefix = "vault")
@Data
public class VaultProperties {

    private VaultBackendType backend = VaultBackendType.LOCAL;

    @ToString.Exclude
    private String encryptionKey; // passphrase the vault key is derived from
    @ToString.Exclude
    private String salt;

    private String path = Paths.get(System.getProperty("user.home"), ".tourguideai", "vault.enc").toString();
    private Duration tokenCacheTtl = Duration.ofMinutes(5);
    private boolean importEnvSecrets = false;

    private Remote remote = new Remote();
    private RotationCheck rotationCheck = new RotationCheck();

    @Data
    public static class Remote {
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RotationCheck {
        private boolean enabled = true;
        private String cron = "0 0 3 * * ?"; // daily at 3:00 AM
    }

    /**
     * Reject incomplete settings before any store is built
     */
    public void validate() {
        if (backend == null) {
            throw new VaultConfigurationException("vault.backend must be one of LOCAL, IN_MEMORY, REMOTE");
        }
        if (!StringUtils.hasText(encryptionKey) || !StringUtils.hasText(salt)) {
            throw new VaultConfigurationException(
                    "Vault encryption configuration missing: set VAULT_ENCRYPTION_KEY and VAULT_SALT");
        }
        if (backend == VaultBackendType.LOCAL && !StringUtils.hasText(path)) {
            throw new VaultConfigurationException("vault.path is required for the LOCAL backend");
        }
        if (tokenCacheTtl == null || tokenCacheTtl.isNegative() || tokenCacheTtl.isZero()) {
            throw new VaultConfigurationException("vault.token-cache-ttl must be positive");
        }
        if (backend == VaultBackendType.REMOTE
                && (remote == null || remote.getTimeout() == null
                        || remote.getTimeout().isNegative() || remote.getTimeout().isZero())) {
            throw new VaultConfigurationException("vault.remote.timeout must be positive");
        }
    }
}
