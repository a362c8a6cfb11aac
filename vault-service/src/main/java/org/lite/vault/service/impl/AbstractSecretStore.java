package org.lite.vault.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.lite.vault.dto.EncryptedPayload;
import org.lite.vault.dto.RotationHistoryEntry;
import org.lite.vault.dto.SecretMetadata;
import org.lite.vault.dto.SecretRecord;
import org.lite.vault.dto.SecretStats;
import org.lite.vault.dto.SecretSummary;
import org.lite.vault.dto.VaultEnvelope;
import org.lite.vault.dto.VaultFile;
import org.lite.vault.enums.SecretType;
import org.lite.vault.exception.SecretNotFoundException;
import org.lite.vault.exception.VaultConfigurationException;
import org.lite.vault.exception.VaultDecryptionException;
import org.lite.vault.exception.VaultStorageException;
import org.lite.vault.service.RotationPolicy;
import org.lite.vault.service.SecretStore;
import org.lite.vault.service.VaultEncryptionService;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Record handling shared by every backend. The vault structure is kept in memory with every
 * value still encrypted per record; subclasses only load and persist it.
 *
 * All mutations run under the write lock for the full copy, mutate, encrypt, write cycle and
 * are committed to memory only after the backend accepted the new vault.
 */
@Slf4j
public abstract class AbstractSecretStore implements SecretStore {

    private static final int SECRET_ID_BYTES = 16;

    protected final VaultEncryptionService encryptionService;
    protected final RotationPolicy rotationPolicy;
    protected final Clock clock;
    protected final ObjectMapper objectMapper;

    private final String passphrase;
    private final String salt;
    private final SecureRandom secureRandom = new SecureRandom();
    private final ReadWriteLock vaultLock = new ReentrantReadWriteLock();

    private SecretKey vaultKey;
    private VaultFile vault;
    private volatile boolean initialized;

    protected AbstractSecretStore(VaultEncryptionService encryptionService,
                                  RotationPolicy rotationPolicy,
                                  Clock clock,
                                  String passphrase,
                                  String salt) {
        if (!StringUtils.hasLength(passphrase) || !StringUtils.hasLength(salt)) {
            throw new VaultConfigurationException("Vault encryption configuration missing: passphrase and salt are required");
        }
        this.encryptionService = encryptionService;
        this.rotationPolicy = rotationPolicy;
        this.clock = clock;
        this.passphrase = passphrase;
        this.salt = salt;
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Read the vault from the backend, creating (and persisting) an empty one when none exists
     */
    protected abstract VaultFile loadVault();

    /**
     * Write the complete vault to the backend
     */
    protected abstract void persistVault(VaultFile vault);

    @Override
    public void initialize() {
        if (initialized) {
            return;
        }
        vaultLock.writeLock().lock();
        try {
            if (initialized) {
                return;
            }
            vaultKey = encryptionService.deriveKey(passphrase, salt);
            vault = normalize(loadVault());
            initialized = true;
            log.info("{} initialized ({} secrets)", getClass().getSimpleName(), vault.getSecrets().size());
        } finally {
            vaultLock.writeLock().unlock();
        }
    }

    protected VaultFile newVault() {
        return VaultFile.createEmpty(clock.instant());
    }

    /**
     * Encrypt the whole vault into its envelope
     */
    protected VaultEnvelope sealVault(VaultFile vaultFile) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(vaultFile);
            return VaultEnvelope.of(encryptionService.encrypt(json, vaultKey));
        } catch (JsonProcessingException e) {
            throw new VaultStorageException("Failed to serialize vault", e);
        }
    }

    /**
     * Decrypt an envelope back into the vault. Any failure is fatal; a tampered vault is never
     * partially recovered.
     */
    protected VaultFile openVault(VaultEnvelope envelope) {
        if (envelope == null) {
            throw new VaultDecryptionException("Vault envelope is empty");
        }
        if (envelope.getVersion() != VaultEnvelope.CURRENT_VERSION) {
            throw new VaultDecryptionException("Unsupported vault envelope version: " + envelope.getVersion());
        }
        byte[] json = encryptionService.decrypt(envelope.toPayload(), vaultKey);
        try {
            return objectMapper.readValue(json, VaultFile.class);
        } catch (IOException e) {
            throw new VaultDecryptionException("Decrypted vault content is not a valid vault", e);
        }
    }

    @Override
    public String storeSecret(SecretType type, String name, String value, Map<String, String> metadata) {
        if (type == null) {
            throw new IllegalArgumentException("Secret type is required");
        }
        requireName(name);
        requireValue(value);
        initialize();
        EncryptedPayload encryptedData = encryptionService.encryptString(value, vaultKey);

        return mutate(current -> {
            Instant now = clock.instant();
            String secretId = newSecretId(current);
            SecretMetadata secretMetadata = SecretMetadata.builder()
                    .createdAt(now)
                    .updatedAt(now)
                    .lastUsed(now)
                    .usageCount(0)
                    .rotationDue(now.plus(rotationPolicy.rotationInterval(type)))
                    .build();
            secretMetadata.mergeAttributes(metadata);

            current.getSecrets().put(secretId, SecretRecord.builder()
                    .type(type.getValue())
                    .name(name)
                    .encryptedData(encryptedData)
                    .metadata(secretMetadata)
                    .build());
            log.info("Stored secret {} (type: {}, name: {})", secretId, type.getValue(), name);
            return secretId;
        });
    }

    @Override
    public String getSecret(String secretId) {
        SecretRecord record = mutate(current -> {
            SecretRecord stored = requireRecord(current, secretId);
            stored.getMetadata().recordAccess(clock.instant());
            return stored.copy();
        });

        if (needsRotation(record)) {
            log.warn("Secret needs rotation: id={}, type={}, name={}, rotationDue={}",
                    secretId, typeName(record), record.getName(), record.getMetadata().getRotationDue());
        }
        return encryptionService.decryptString(record.getEncryptedData(), vaultKey);
    }

    @Override
    public void updateSecret(String secretId, String newValue, Map<String, String> metadata) {
        requireValue(newValue);
        initialize();
        EncryptedPayload encryptedData = encryptionService.encryptString(newValue, vaultKey);

        mutate(current -> {
            SecretRecord stored = requireRecord(current, secretId);
            Instant now = clock.instant();
            SecretMetadata secretMetadata = stored.getMetadata();
            stored.setEncryptedData(encryptedData);
            secretMetadata.mergeAttributes(metadata);
            secretMetadata.setUpdatedAt(now);
            secretMetadata.setRotationDue(now.plus(rotationPolicy.rotationInterval(stored.getSecretType())));
            log.info("Updated secret {} (name: {})", secretId, stored.getName());
            return null;
        });
    }

    @Override
    public String rotateSecret(String secretId, String newValue) {
        requireValue(newValue);
        initialize();
        EncryptedPayload encryptedData = encryptionService.encryptString(newValue, vaultKey);

        return mutate(current -> {
            SecretRecord previous = requireRecord(current, secretId);
            if (previous.isSuperseded()) {
                throw new IllegalStateException(String.format("Secret '%s' was already rotated to '%s'",
                        secretId, previous.getMetadata().getRotatedTo()));
            }
            Instant now = clock.instant();
            SecretMetadata previousMetadata = previous.getMetadata();
            previousMetadata.getRotationHistory().add(new RotationHistoryEntry(now, previousMetadata.getRotationDue()));

            String successorId = newSecretId(current);
            List<RotationHistoryEntry> history = new ArrayList<>();
            previousMetadata.getRotationHistory().forEach(entry ->
                    history.add(new RotationHistoryEntry(entry.getRotatedAt(), entry.getPreviousRotationDue())));

            SecretMetadata successorMetadata = SecretMetadata.builder()
                    .createdAt(now)
                    .updatedAt(now)
                    .lastUsed(now)
                    .usageCount(0)
                    .rotationDue(now.plus(rotationPolicy.rotationInterval(previous.getSecretType())))
                    .rotationHistory(history)
                    .rotatedFrom(secretId)
                    .attributes(new LinkedHashMap<>(previousMetadata.getAttributes()))
                    .otherValues(new LinkedHashMap<>(previousMetadata.getOtherValues()))
                    .build();

            previousMetadata.setRotatedTo(successorId);
            previousMetadata.setUpdatedAt(now);

            current.getSecrets().put(successorId, SecretRecord.builder()
                    .type(previous.getType())
                    .name(previous.getName())
                    .encryptedData(encryptedData)
                    .metadata(successorMetadata)
                    .build());
            log.info("Rotated secret {} -> {} (name: {})", secretId, successorId, previous.getName());
            return successorId;
        });
    }

    @Override
    public void deleteSecret(String secretId) {
        mutate(current -> {
            SecretRecord removed = current.getSecrets().remove(secretId);
            if (removed == null) {
                throw SecretNotFoundException.forSecretId(secretId);
            }
            log.info("Deleted secret {} (name: {})", secretId, removed.getName());
            return null;
        });
    }

    @Override
    public boolean containsSecret(String secretId) {
        return read(current -> current.getSecrets().containsKey(secretId));
    }

    @Override
    public List<SecretSummary> listSecrets(SecretType typeFilter) {
        return read(current -> current.getSecrets().entrySet().stream()
                .filter(entry -> typeFilter == null || entry.getValue().getSecretType() == typeFilter)
                .map(entry -> toSummary(entry.getKey(), entry.getValue()))
                .toList());
    }

    @Override
    public List<SecretSummary> getSecretsNeedingRotation() {
        return listSecrets().stream()
                .filter(SecretSummary::isNeedsRotation)
                .toList();
    }

    @Override
    public SecretStats getSecretStats(String secretId) {
        return read(current -> {
            SecretRecord record = requireRecord(current, secretId);
            SecretMetadata secretMetadata = record.getMetadata();
            return SecretStats.builder()
                    .type(record.getSecretType())
                    .name(record.getName())
                    .createdAt(secretMetadata.getCreatedAt())
                    .lastUsed(secretMetadata.getLastUsed())
                    .usageCount(secretMetadata.getUsageCount())
                    .rotationDue(secretMetadata.getRotationDue())
                    .daysUntilRotation(rotationPolicy.daysUntilRotation(secretMetadata))
                    .needsRotation(needsRotation(record))
                    .build();
        });
    }

    private <T> T mutate(Function<VaultFile, T> mutation) {
        initialize();
        vaultLock.writeLock().lock();
        try {
            VaultFile working = vault.copy();
            T result = mutation.apply(working);
            working.getMetadata().setUpdatedAt(clock.instant());
            persistVault(working);
            vault = working;
            return result;
        } finally {
            vaultLock.writeLock().unlock();
        }
    }

    private <T> T read(Function<VaultFile, T> reader) {
        initialize();
        vaultLock.readLock().lock();
        try {
            return reader.apply(vault);
        } finally {
            vaultLock.readLock().unlock();
        }
    }

    /**
     * Superseded records are retired: readable, but never reported as due
     */
    private boolean needsRotation(SecretRecord record) {
        return !record.isSuperseded() && rotationPolicy.isRotationNeeded(record.getMetadata());
    }

    private SecretSummary toSummary(String secretId, SecretRecord record) {
        SecretMetadata secretMetadata = record.getMetadata();
        return SecretSummary.builder()
                .secretId(secretId)
                .type(record.getSecretType())
                .name(record.getName())
                .createdAt(secretMetadata.getCreatedAt())
                .updatedAt(secretMetadata.getUpdatedAt())
                .lastUsed(secretMetadata.getLastUsed())
                .usageCount(secretMetadata.getUsageCount())
                .rotationDue(secretMetadata.getRotationDue())
                .rotatedTo(secretMetadata.getRotatedTo())
                .rotatedFrom(secretMetadata.getRotatedFrom())
                .attributes(Map.copyOf(secretMetadata.getAttributes()))
                .needsRotation(needsRotation(record))
                .build();
    }

    private SecretRecord requireRecord(VaultFile current, String secretId) {
        SecretRecord record = secretId == null ? null : current.getSecrets().get(secretId);
        if (record == null) {
            throw SecretNotFoundException.forSecretId(secretId);
        }
        return record;
    }

    private String newSecretId(VaultFile current) {
        String secretId;
        do {
            byte[] bytes = new byte[SECRET_ID_BYTES];
            secureRandom.nextBytes(bytes);
            secretId = Hex.encodeHexString(bytes);
        } while (current.getSecrets().containsKey(secretId));
        return secretId;
    }

    /**
     * Fill in structure that older vault files may lack
     */
    private VaultFile normalize(VaultFile loaded) {
        VaultFile normalized = loaded == null ? newVault() : loaded;
        if (normalized.getSecrets() == null) {
            normalized.setSecrets(new LinkedHashMap<>());
        }
        if (normalized.getMetadata() == null) {
            normalized.setMetadata(newVault().getMetadata());
        }
        normalized.getSecrets().values().forEach(record -> {
            if (record.getMetadata() == null) {
                record.setMetadata(new SecretMetadata());
            }
            SecretMetadata secretMetadata = record.getMetadata();
            if (secretMetadata.getRotationHistory() == null) {
                secretMetadata.setRotationHistory(new ArrayList<>());
            }
            if (secretMetadata.getAttributes() == null) {
                secretMetadata.setAttributes(new LinkedHashMap<>());
            }
            if (secretMetadata.getOtherValues() == null) {
                secretMetadata.setOtherValues(new LinkedHashMap<>());
            }
        });
        return normalized;
    }

    private static String typeName(SecretRecord record) {
        return record.getType() == null ? "unknown" : record.getType();
    }

    private static void requireName(String name) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Secret name is required");
        }
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Secret value is required");
        }
    }
}
