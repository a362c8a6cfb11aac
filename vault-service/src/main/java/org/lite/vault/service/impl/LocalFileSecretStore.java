package org.lite.vault.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.lite.vault.dto.VaultEnvelope;
import org.lite.vault.dto.VaultFile;
import org.lite.vault.exception.VaultDecryptionException;
import org.lite.vault.exception.VaultStorageException;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.VaultEncryptionService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;

/**
 * Vault kept in one encrypted file.
 * The file holds the JSON envelope {encrypted, iv, authTag, version}; every mutation rewrites
 * it atomically.
 */
@Slf4j
public class LocalFileSecretStore extends AbstractSecretStore {

    private final Path vaultPath;

    public LocalFileSecretStore(VaultEncryptionService encryptionService,
                                RotationPolicy rotationPolicy,
                                Clock clock,
                                String passphrase,
                                String salt,
                                Path vaultPath) {
        super(encryptionService, rotationPolicy, clock, passphrase, salt);
        this.vaultPath = vaultPath.toAbsolutePath();
    }

    public Path getVaultPath() {
        return vaultPath;
    }

    Path backupPath() {
        return vaultPath.resolveSibling(vaultPath.getFileName() + ".backup");
    }

    @Override
    protected VaultFile loadVault() {
        if (!Files.exists(vaultPath)) {
            log.info("Vault file not found at {}. Creating new vault.", vaultPath);
            return createVault();
        }

        String content;
        try {
            content = Files.readString(vaultPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read vault file from: {}", vaultPath, e);
            throw new VaultStorageException("Failed to read vault file: " + vaultPath, e);
        }

        if (content.isBlank()) {
            log.error("Vault file is empty: {}. Restore it from {}", vaultPath, backupPath());
            throw new VaultDecryptionException("Vault file is empty: " + vaultPath);
        }

        VaultEnvelope envelope;
        try {
            envelope = objectMapper.readValue(content, VaultEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new VaultDecryptionException("Vault file is corrupted: " + vaultPath, e);
        }

        VaultFile vault = openVault(envelope);
        log.info("Vault file loaded successfully from: {}", vaultPath);
        return vault;
    }

    private VaultFile createVault() {
        VaultFile vault = newVault();
        persistVault(vault);
        return vault;
    }

    /**
     * Atomic write: backup the current file, write a temp file, then rename over the vault
     */
    @Override
    protected void persistVault(VaultFile vault) {
        VaultEnvelope envelope = sealVault(vault);
        Path tempFile = vaultPath.resolveSibling(vaultPath.getFileName() + ".tmp");
        Path backupFile = backupPath();

        try {
            Path parentDir = vaultPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            if (Files.exists(vaultPath)) {
                Files.copy(vaultPath, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }

            Files.writeString(tempFile, objectMapper.writeValueAsString(envelope), StandardCharsets.UTF_8);
            Files.move(tempFile, vaultPath,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save vault file to: {}", vaultPath, e);
            throw new VaultStorageException("Failed to save vault file: " + vaultPath, e);
        }

        restrictPermissions(vaultPath);
        restrictPermissions(backupFile);
        log.debug("Vault saved to {}", vaultPath);
    }

    // 600: owner read/write only
    private void restrictPermissions(Path file) {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = EnumSet.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE);
            Files.setPosixFilePermissions(file, permissions);
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", file);
        } catch (IOException e) {
            log.warn("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }
}
