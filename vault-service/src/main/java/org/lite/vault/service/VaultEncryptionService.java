package org.lite.vault.service;

import org.lite.vault.dto.EncryptedPayload;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Authenticated encryption of secret payloads and of whole vaults.
 * Uses AES-256-GCM with a key derived from a passphrase through scrypt.
 */
public interface VaultEncryptionService {

    /**
     * Derive the symmetric key from the vault passphrase and salt. scrypt is slow on purpose;
     * callers derive once and keep the key.
     *
     * @throws org.lite.vault.exception.VaultConfigurationException if passphrase or salt is missing
     */
    SecretKey deriveKey(String passphrase, String salt);

    /**
     * Encrypt with a fresh random IV
     */
    EncryptedPayload encrypt(byte[] plaintext, SecretKey key);

    /**
     * @throws org.lite.vault.exception.VaultDecryptionException if the tag does not verify or the
     *                                                         payload is malformed
     */
    byte[] decrypt(EncryptedPayload payload, SecretKey key);

    default EncryptedPayload encryptString(String plaintext, SecretKey key) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
    }

    default String decryptString(EncryptedPayload payload, SecretKey key) {
        return new String(decrypt(payload, key), StandardCharsets.UTF_8);
    }
}
