package org.lite.vault.exception;

/**
 * Exception thrown when a payload fails authentication (tampered data or wrong key) or is
 * malformed. Retrying cannot succeed.
 */
public class VaultDecryptionException extends VaultException {

    public VaultDecryptionException(String message) {
        super(message);
    }

    public VaultDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
