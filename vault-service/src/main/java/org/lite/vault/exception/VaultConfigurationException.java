package org.lite.vault.exception;

/**
 * Exception thrown when the vault is missing its encryption passphrase/salt or is otherwise
 * misconfigured. Fatal: the vault never runs unencrypted.
 */
public class VaultConfigurationException extends VaultException {

    public VaultConfigurationException(String message) {
        super(message);
    }

    public VaultConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
