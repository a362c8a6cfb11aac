package org.lite.vault.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lite.vault.dto.EncryptedPayload;
import org.lite.vault.dto.SecretSummary;
import org.lite.vault.dto.VaultEnvelope;
import org.lite.vault.enums.SecretType;
import org.lite.vault.exception.VaultDecryptionException;
import org.lite.vault.support.MutableClock;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LocalFileSecretStoreTest {

    private static final String PASSPHRASE = "test-passphrase";
    private static final String SALT = "test-salt";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private VaultEncryptionServiceImpl encryptionService;
    private Path vaultPath;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        encryptionService = new VaultEncryptionServiceImpl();
        vaultPath = tempDir.resolve("nested").resolve("vault.enc");
    }

    private LocalFileSecretStore newStore(String passphrase) {
        return new LocalFileSecretStore(encryptionService, new RotationPolicyImpl(clock), clock,
                passphrase, SALT, vaultPath);
    }

    @Test
    void testInitialize_CreatesVaultFile() {
        // When
        newStore(PASSPHRASE).initialize();

        // Then
        assertTrue(Files.exists(vaultPath));
    }

    @Test
    void testPersistence_AcrossInstances() {
        // Given
        LocalFileSecretStore first = newStore(PASSPHRASE);
        String secretId = first.storeSecret(SecretType.API_KEY, "openai", "sk-test", Map.of("team", "ai"));
        first.getSecret(secretId);

        // When
        LocalFileSecretStore second = newStore(PASSPHRASE);

        // Then
        assertEquals("sk-test", second.getSecret(secretId));
        SecretSummary summary = second.listSecrets().get(0);
        assertEquals(2, summary.getUsageCount());
        assertEquals("ai", summary.getAttributes().get("team"));
        assertEquals(clock.instant().plus(Duration.ofDays(90)), summary.getRotationDue());
    }

    @Test
    void testRotation_SurvivesReload() {
        LocalFileSecretStore first = newStore(PASSPHRASE);
        String secretId = first.storeSecret(SecretType.API_KEY, "openai", "v1");
        String successorId = first.rotateSecret(secretId, "v2");

        LocalFileSecretStore second = newStore(PASSPHRASE);

        assertEquals("v2", second.getSecret(successorId));
        SecretSummary previous = second.listSecrets().stream()
                .filter(summary -> summary.getSecretId().equals(secretId))
                .findFirst()
                .orElseThrow();
        assertEquals(successorId, previous.getRotatedTo());
    }

    @Test
    void testVaultFile_IsEncryptedEnvelope() throws Exception {
        // Given
        newStore(PASSPHRASE).storeSecret(SecretType.API_KEY, "openai", "sk-plaintext-marker");

        // When
        String content = Files.readString(vaultPath, StandardCharsets.UTF_8);
        JsonNode envelope = new ObjectMapper().readTree(content);

        // Then
        assertFalse(content.contains("sk-plaintext-marker"));
        assertFalse(content.contains("openai"));
        assertTrue(envelope.hasNonNull("encrypted"));
        assertEquals(24, envelope.get("iv").asText().length());
        assertEquals(32, envelope.get("authTag").asText().length());
        assertEquals(1, envelope.get("version").asInt());
    }

    @Test
    void testPersist_KeepsBackupAndNoTempFile() {
        LocalFileSecretStore store = newStore(PASSPHRASE);
        store.storeSecret(SecretType.API_KEY, "openai", "v1");

        assertTrue(Files.exists(vaultPath.resolveSibling("vault.enc.backup")));
        assertFalse(Files.exists(vaultPath.resolveSibling("vault.enc.tmp")));
    }

    @Test
    void testPersist_OwnerOnlyPermissions() throws Exception {
        newStore(PASSPHRASE).initialize();
        assumeTrue(Files.getFileStore(vaultPath).supportsFileAttributeView("posix"));

        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(vaultPath);

        assertEquals(Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE), permissions);
    }

    @Test
    void testInitialize_WrongPassphraseFails() {
        newStore(PASSPHRASE).storeSecret(SecretType.API_KEY, "openai", "sk-test");

        LocalFileSecretStore wrong = newStore("another-passphrase");

        assertThrows(VaultDecryptionException.class, wrong::initialize);
    }

    @Test
    void testInitialize_CorruptedFileFails() throws Exception {
        Files.createDirectories(vaultPath.getParent());
        Files.writeString(vaultPath, "{ this is not json", StandardCharsets.UTF_8);

        assertThrows(VaultDecryptionException.class, () -> newStore(PASSPHRASE).initialize());
    }

    @Test
    void testInitialize_TamperedCiphertextFails() throws Exception {
        // Given
        newStore(PASSPHRASE).storeSecret(SecretType.API_KEY, "openai", "sk-test");
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode envelope =
                (ObjectNode) mapper.readTree(Files.readString(vaultPath));
        String encrypted = envelope.get("encrypted").asText();
        char flipped = encrypted.charAt(0) == '0' ? '1' : '0';
        envelope.put("encrypted", flipped + encrypted.substring(1));
        Files.writeString(vaultPath, mapper.writeValueAsString(envelope));

        // When / Then
        assertThrows(VaultDecryptionException.class, () -> newStore(PASSPHRASE).initialize());
    }

    @Test
    void testInitialize_EmptyFileFailsAndKeepsBackup() throws Exception {
        // Given
        LocalFileSecretStore first = newStore(PASSPHRASE);
        first.storeSecret(SecretType.API_KEY, "openai", "v1");
        first.storeSecret(SecretType.API_KEY, "anthropic", "v2");
        Path backup = first.backupPath();
        byte[] backupBefore = Files.readAllBytes(backup);
        Files.write(vaultPath, new byte[0]);

        // When
        LocalFileSecretStore reopened = newStore(PASSPHRASE);

        // Then
        assertThrows(VaultDecryptionException.class, reopened::initialize);
        assertThrows(VaultDecryptionException.class,
                () -> reopened.storeSecret(SecretType.API_KEY, "github", "v3"));
        assertEquals(0, Files.size(vaultPath));
        assertArrayEquals(backupBefore, Files.readAllBytes(backup));
    }

    @Test
    void testInitialize_WhitespaceOnlyFileFails() throws Exception {
        Files.createDirectories(vaultPath.getParent());
        Files.writeString(vaultPath, "  \n", StandardCharsets.UTF_8);

        assertThrows(VaultDecryptionException.class, () -> newStore(PASSPHRASE).initialize());
        assertFalse(Files.exists(vaultPath.resolveSibling("vault.enc.backup")));
    }

    @Test
    void testRewrite_KeepsUnknownStoredType() throws Exception {
        // Given
        String secretId = newStore(PASSPHRASE).storeSecret(SecretType.API_KEY, "signing", "pem-data");
        ObjectNode vault = readVaultJson();
        ((ObjectNode) vault.get("secrets").get(secretId)).put("type", "certificate");
        writeVaultJson(vault);

        // When
        LocalFileSecretStore reopened = newStore(PASSPHRASE);
        reopened.storeSecret(SecretType.API_KEY, "openai", "sk-test");
        reopened.updateSecret(secretId, "pem-data-2", Map.of());

        // Then
        assertEquals("certificate", readVaultJson().get("secrets").get(secretId).get("type").asText());
        SecretSummary summary = reopened.listSecrets().stream()
                .filter(candidate -> candidate.getSecretId().equals(secretId))
                .findFirst()
                .orElseThrow();
        assertNull(summary.getType());
        assertEquals(clock.instant().plus(Duration.ofDays(90)), summary.getRotationDue());
        assertEquals("pem-data-2", newStore(PASSPHRASE).getSecret(secretId));
    }

    @Test
    void testRewrite_KeepsNonTextMetadataValues() throws Exception {
        // Given
        String secretId = newStore(PASSPHRASE).storeSecret(SecretType.API_KEY, "openai", "v1",
                Map.of("team", "ai"));
        ObjectNode vault = readVaultJson();
        ObjectNode metadata = (ObjectNode) vault.get("secrets").get(secretId).get("metadata");
        metadata.put("priority", 3);
        metadata.put("pinned", true);
        metadata.putArray("regions").add("eu").add("us");
        writeVaultJson(vault);

        // When
        LocalFileSecretStore reopened = newStore(PASSPHRASE);
        String successorId = reopened.rotateSecret(secretId, "v2");

        // Then
        JsonNode secrets = readVaultJson().get("secrets");
        for (String id : new String[]{secretId, successorId}) {
            JsonNode stored = secrets.get(id).get("metadata");
            assertEquals(3, stored.get("priority").asInt());
            assertTrue(stored.get("pinned").asBoolean());
            assertEquals(2, stored.get("regions").size());
            assertEquals("ai", stored.get("team").asText());
        }
        assertEquals(Map.of("team", "ai"), newStore(PASSPHRASE).listSecrets().get(0).getAttributes());
    }

    @Test
    void testConcurrentWriters_NoRecordLost() throws Exception {
        // Given
        LocalFileSecretStore store = newStore(PASSPHRASE);
        List<String> existing = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            existing.add(store.storeSecret(SecretType.API_KEY, "existing-" + i, "v" + i));
        }
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers + existing.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < writers; i++) {
                String name = "service-" + i;
                results.add(executor.submit(() -> {
                    start.await();
                    return store.storeSecret(SecretType.API_KEY, name, "value-" + name);
                }));
            }
            for (String secretId : existing) {
                results.add(executor.submit(() -> {
                    start.await();
                    return store.rotateSecret(secretId, "rotated");
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        LocalFileSecretStore reopened = newStore(PASSPHRASE);
        List<SecretSummary> summaries = reopened.listSecrets();
        assertEquals(existing.size() * 2 + writers, summaries.size());
        for (Future<String> result : results) {
            assertTrue(reopened.containsSecret(result.get()));
        }
        for (int i = 0; i < writers; i++) {
            String name = "service-" + i;
            assertTrue(summaries.stream().anyMatch(summary -> summary.getName().equals(name)));
        }
        for (String secretId : existing) {
            assertNotNull(summaries.stream()
                    .filter(summary -> summary.getSecretId().equals(secretId))
                    .findFirst()
                    .orElseThrow()
                    .getRotatedTo());
        }
    }

    @Test
    void testInitialize_UnsupportedVersionFails() throws Exception {
        newStore(PASSPHRASE).initialize();
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode envelope =
                (ObjectNode) mapper.readTree(Files.readString(vaultPath));
        envelope.put("version", 2);
        Files.writeString(vaultPath, mapper.writeValueAsString(envelope));

        assertThrows(VaultDecryptionException.class, () -> newStore(PASSPHRASE).initialize());
    }

    private ObjectNode readVaultJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        VaultEnvelope envelope = mapper.readValue(Files.readString(vaultPath), VaultEnvelope.class);
        byte[] json = encryptionService.decrypt(envelope.toPayload(), encryptionService.deriveKey(PASSPHRASE, SALT));
        return (ObjectNode) mapper.readTree(json);
    }

    private void writeVaultJson(ObjectNode vault) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        EncryptedPayload payload = encryptionService.encrypt(mapper.writeValueAsBytes(vault),
                encryptionService.deriveKey(PASSPHRASE, SALT));
        Files.writeString(vaultPath, mapper.writeValueAsString(VaultEnvelope.of(payload)));
    }
}
