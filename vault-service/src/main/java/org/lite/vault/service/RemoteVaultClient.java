package org.lite.vault.service;

import org.lite.vault.dto.VaultEnvelope;
import reactor.core.publisher.Mono;

/**
 * Transport to an external secret manager that holds the encrypted vault envelope.
 * No implementation ships with the vault; integrations register one as a bean.
 */
public interface RemoteVaultClient {

    /**
     * @return the stored envelope, or empty when the remote vault does not exist yet
     */
    Mono<VaultEnvelope> fetchEnvelope();

    Mono<Void> storeEnvelope(VaultEnvelope envelope);
}
