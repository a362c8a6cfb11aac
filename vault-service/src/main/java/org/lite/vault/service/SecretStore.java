package org.lite.vault.service;

import org.lite.vault.dto.SecretStats;
import org.lite.vault.dto.SecretSummary;
import org.lite.vault.enums.SecretType;

import java.util.List;
import java.util.Map;

/**
 * Encrypted storage of secret records, independent of where the vault lives.
 * Every operation initializes the store on first use.
 */
public interface SecretStore {

    /**
     * Derive the vault key and load (or create) the vault. Runs at most once per instance.
     */
    void initialize();

    /**
     * Encrypt and store a new secret
     *
     * @param metadata free-form attributes kept with the record, may be null
     * @return the generated secret id
     */
    String storeSecret(SecretType type, String name, String value, Map<String, String> metadata);

    default String storeSecret(SecretType type, String name, String value) {
        return storeSecret(type, name, value, Map.of());
    }

    /**
     * Decrypt a secret and record the access in its usage metadata.
     * A secret past its rotation date is still returned and a warning is logged. Callers that
     * need to act on it read {@link SecretStats#isNeedsRotation()} from {@link #getSecretStats},
     * or the same flag in {@link #listSecrets} and {@link #getSecretsNeedingRotation}.
     *
     * @throws org.lite.vault.exception.SecretNotFoundException if the id is unknown
     */
    String getSecret(String secretId);

    /**
     * Re-encrypt a secret in place and restart its rotation schedule
     */
    void updateSecret(String secretId, String newValue, Map<String, String> metadata);

    default void updateSecret(String secretId, String newValue) {
        updateSecret(secretId, newValue, Map.of());
    }

    /**
     * Supersede a secret with a new record. The old record is kept, pointing at its successor.
     *
     * @return id of the new record
     */
    String rotateSecret(String secretId, String newValue);

    void deleteSecret(String secretId);

    boolean containsSecret(String secretId);

    /**
     * Metadata of all secrets, optionally restricted to one type
     *
     * @param typeFilter null for all types
     */
    List<SecretSummary> listSecrets(SecretType typeFilter);

    default List<SecretSummary> listSecrets() {
        return listSecrets(null);
    }

    List<SecretSummary> getSecretsNeedingRotation();

    /**
     * Usage statistics; reading them does not count as a use
     */
    SecretStats getSecretStats(String secretId);
}
