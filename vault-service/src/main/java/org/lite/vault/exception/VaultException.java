package org.lite.vault.exception;

/**
 * Base class for every failure raised by the vault core.
 * Messages never carry plaintext, ciphertext or key material.
 */
public class VaultException extends RuntimeException {

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
