package org.lite.vault.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.dto.VaultEnvelope;
import org.lite.vault.dto.VaultFile;
import org.lite.vault.exception.VaultException;
import org.lite.vault.exception.VaultStorageException;
import org.lite.vault.exception.VaultTimeoutException;
import org.lite.vault.service.RemoteVaultClient;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.VaultEncryptionService;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Vault envelope kept by an external secret manager, reached through {@link RemoteVaultClient}.
 * Every remote call is bounded by the caller supplied timeout.
 */
@Slf4j
public class RemoteSecretStore extends AbstractSecretStore {

    private final RemoteVaultClient client;
    private final Duration timeout;

    public RemoteSecretStore(VaultEncryptionService encryptionService,
                             RotationPolicy rotationPolicy,
                             Clock clock,
                             String passphrase,
                             String salt,
                             RemoteVaultClient client,
                             Duration timeout) {
        super(encryptionService, rotationPolicy, clock, passphrase, salt);
        if (client == null) {
            throw new IllegalArgumentException("Remote vault client is required");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Remote vault timeout must be positive");
        }
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    protected VaultFile loadVault() {
        VaultEnvelope envelope = await(client.fetchEnvelope(), "fetch");
        if (envelope == null) {
            log.info("Remote vault does not exist yet. Creating new vault.");
            VaultFile vault = newVault();
            persistVault(vault);
            return vault;
        }
        VaultFile vault = openVault(envelope);
        log.info("Remote vault loaded successfully");
        return vault;
    }

    @Override
    protected void persistVault(VaultFile vault) {
        await(client.storeEnvelope(sealVault(vault)), "store");
        log.debug("Remote vault saved");
    }

    private <T> T await(Mono<T> call, String operation) {
        return call
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new VaultTimeoutException(operation, timeout, e))
                .onErrorMap(e -> !(e instanceof VaultException),
                        e -> new VaultStorageException("Remote vault " + operation + " failed", e))
                .doOnError(e -> log.error("Remote vault {} failed: {}", operation, e.getMessage()))
                .block();
    }
}
