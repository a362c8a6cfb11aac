package org.lite.vault.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.dto.VaultFile;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.VaultEncryptionService;

import java.time.Clock;

/**
 * Ephemeral vault for tests and local development. Records are still encrypted; nothing
 * outlives the process.
 */
@Slf4j
public class InMemorySecretStore extends AbstractSecretStore {

    public InMemorySecretStore(VaultEncryptionService encryptionService,
                               RotationPolicy rotationPolicy,
                               Clock clock,
                               String passphrase,
                               String salt) {
        super(encryptionService, rotationPolicy, clock, passphrase, salt);
    }

    @Override
    protected VaultFile loadVault() {
        log.info("Using in-memory vault; secrets are not persisted");
        return newVault();
    }

    @Override
    protected void persistVault(VaultFile vault) {
        log.debug("In-memory vault now holds {} secrets", vault.getSecrets().size());
    }
}
