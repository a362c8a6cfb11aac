package org.lite.vault.service;

import org.lite.vault.dto.ImportedSecret;
import org.lite.vault.dto.ServiceToken;
import org.lite.vault.dto.TokenRotationStatus;
import org.lite.vault.enums.KnownService;

import java.util.List;

/**
 * Entry point for application code that needs a service token. Resolves service names to
 * vault records, caches decrypted values briefly and falls back to legacy environment
 * configuration for known services.
 */
public interface TokenProvider {

    /**
     * Initialize the store and build the service name to secret id mapping. Idempotent.
     */
    void initialize();

    /**
     * Resolve a token: cache, then the mapped vault record, then the legacy environment variable.
     * A token past its rotation date is still returned; it shows up in
     * {@link #getTokensNeedingRotation()} until it is rotated.
     *
     * @throws org.lite.vault.exception.SecretNotFoundException when no source has a value
     */
    String getToken(String serviceName);

    /**
     * Update the mapped record, or create and map a new one
     *
     * @return id of the record holding the token
     */
    String storeToken(String serviceName, String token);

    /**
     * Rotate the mapped record and point the mapping at its successor
     *
     * @return id of the new record
     * @throws org.lite.vault.exception.SecretNotFoundException when the service is not mapped
     */
    String rotateToken(String serviceName, String newToken);

    void deleteToken(String serviceName);

    /**
     * Mapped services whose secrets are due. Unmapped secrets are not reported.
     */
    List<TokenRotationStatus> getTokensNeedingRotation();

    List<ServiceToken> listTokens();

    /**
     * Copy legacy environment values of known services into the vault
     */
    List<ImportedSecret> importFromEnvironment();

    default String getOpenAiToken() {
        return getToken(KnownService.OPENAI.getServiceName());
    }

    default String getGoogleMapsToken() {
        return getToken(KnownService.GOOGLE_MAPS.getServiceName());
    }

    default String getJwtSecret() {
        return getToken(KnownService.AUTH_JWT.getServiceName());
    }

    default String getEncryptionKey() {
        return getToken(KnownService.DATA_ENCRYPTION.getServiceName());
    }

    default String getSendGridToken() {
        return getToken(KnownService.SENDGRID.getServiceName());
    }
}
