package org.lite.vault.exception;

/**
 * Exception thrown when a secret or a service mapping is not found in the vault
 */
public class SecretNotFoundException extends VaultException {

    public SecretNotFoundException(String message) {
        super(message);
    }

    public static SecretNotFoundException forSecretId(String secretId) {
        return new SecretNotFoundException(String.format("Secret '%s' not found", secretId));
    }

    public static SecretNotFoundException forService(String serviceName) {
        return new SecretNotFoundException(String.format("Token not found for service: %s", serviceName));
    }
}
