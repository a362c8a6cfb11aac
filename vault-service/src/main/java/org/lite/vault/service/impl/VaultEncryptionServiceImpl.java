package org.lite.vault.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.crypto.generators.SCrypt;
import org.lite.vault.dto.EncryptedPayload;
import org.lite.vault.exception.VaultConfigurationException;
import org.lite.vault.exception.VaultDecryptionException;
import org.lite.vault.exception.VaultException;
import org.lite.vault.service.VaultEncryptionService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM with scrypt key derivation.
 * The GCM tag is kept apart from the ciphertext so each record stores {encrypted, iv, authTag}.
 */
@Service
@Slf4j
public class VaultEncryptionServiceImpl implements VaultEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits for GCM
    private static final int GCM_TAG_LENGTH = 16; // 128 bits
    private static final int KEY_LENGTH = 32; // 256 bits

    // Same cost parameters as the vaults written before this service existed
    private static final int SCRYPT_N = 16384;
    private static final int SCRYPT_R = 8;
    private static final int SCRYPT_P = 1;

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public SecretKey deriveKey(String passphrase, String salt) {
        if (!StringUtils.hasLength(passphrase) || !StringUtils.hasLength(salt)) {
            throw new VaultConfigurationException("Encryption configuration missing: passphrase and salt are required");
        }
        byte[] keyBytes = SCrypt.generate(
                passphrase.getBytes(StandardCharsets.UTF_8),
                salt.getBytes(StandardCharsets.UTF_8),
                SCRYPT_N, SCRYPT_R, SCRYPT_P, KEY_LENGTH);
        log.debug("Derived vault key (scrypt N={}, r={}, p={})", SCRYPT_N, SCRYPT_R, SCRYPT_P);
        return new SecretKeySpec(keyBytes, "AES");
    }

    @Override
    public EncryptedPayload encrypt(byte[] plaintext, SecretKey key) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        requireKey(key);
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // JCE appends the tag to the ciphertext
            byte[] encrypted = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_LENGTH);
            byte[] authTag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_LENGTH, sealed.length);

            return EncryptedPayload.builder()
                    .encrypted(Hex.encodeHexString(encrypted))
                    .iv(Hex.encodeHexString(iv))
                    .authTag(Hex.encodeHexString(authTag))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new VaultException("Encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(EncryptedPayload payload, SecretKey key) {
        requireKey(key);
        if (payload == null || payload.getEncrypted() == null || payload.getIv() == null
                || payload.getAuthTag() == null) {
            throw new VaultDecryptionException("Encrypted payload is incomplete");
        }

        byte[] encrypted;
        byte[] iv;
        byte[] authTag;
        try {
            encrypted = Hex.decodeHex(payload.getEncrypted());
            iv = Hex.decodeHex(payload.getIv());
            authTag = Hex.decodeHex(payload.getAuthTag());
        } catch (DecoderException e) {
            throw new VaultDecryptionException("Encrypted payload is not valid hex", e);
        }
        if (iv.length == 0 || authTag.length != GCM_TAG_LENGTH) {
            throw new VaultDecryptionException("Encrypted payload has an invalid IV or authentication tag length");
        }

        byte[] sealed = new byte[encrypted.length + authTag.length];
        System.arraycopy(encrypted, 0, sealed, 0, encrypted.length);
        System.arraycopy(authTag, 0, sealed, encrypted.length, authTag.length);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new VaultDecryptionException("Authentication tag mismatch: data was tampered with or the key is wrong", e);
        } catch (GeneralSecurityException e) {
            throw new VaultDecryptionException("Decryption failed", e);
        }
    }

    private void requireKey(SecretKey key) {
        if (key == null) {
            throw new VaultConfigurationException("Vault key has not been derived");
        }
    }
}
