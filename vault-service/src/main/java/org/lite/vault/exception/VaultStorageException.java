package org.lite.vault.exception;

/**
 * Exception thrown when the vault backend cannot be read or written
 */
public class VaultStorageException extends VaultException {

    public VaultStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
