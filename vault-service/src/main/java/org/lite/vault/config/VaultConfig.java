package org.lite.vault.config;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.exception.VaultConfigurationException;
import org.lite.vault.service.RemoteVaultClient;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.SecretStore;
import org.lite.vault.service.VaultEncryptionService;
import org.lite.vault.service.impl.InMemorySecretStore;
import org.lite.vault.service.impl.LocalFileSecretStore;
import org.lite.vault.service.impl.RemoteSecretStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builds the secret store for the configured backend. The backend is chosen once here and
 * never re-checked per call.
 */
@Configuration
@EnableConfigurationProperties(VaultProperties.class)
@Slf4j
public class VaultConfig {

    @Bean
    public Clock vaultClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecretStore secretStore(VaultProperties properties,
                                   VaultEncryptionService encryptionService,
                                   RotationPolicy rotationPolicy,
                                   Clock vaultClock,
                                   ObjectProvider<RemoteVaultClient> remoteVaultClient) {
        properties.validate();
        log.info("Configuring {} vault backend", properties.getBackend());

        return switch (properties.getBackend()) {
            case LOCAL -> new LocalFileSecretStore(encryptionService, rotationPolicy, vaultClock,
                    properties.getEncryptionKey(), properties.getSalt(), Paths.get(properties.getPath()));
            case IN_MEMORY -> new InMemorySecretStore(encryptionService, rotationPolicy, vaultClock,
                    properties.getEncryptionKey(), properties.getSalt());
            case REMOTE -> {
                RemoteVaultClient client = remoteVaultClient.getIfAvailable();
                if (client == null) {
                    throw new VaultConfigurationException(
                            "REMOTE vault backend selected but no RemoteVaultClient bean is registered");
                }
                yield new RemoteSecretStore(encryptionService, rotationPolicy, vaultClock,
                        properties.getEncryptionKey(), properties.getSalt(), client,
                        properties.getRemote().getTimeout());
            }
        };
    }
}
