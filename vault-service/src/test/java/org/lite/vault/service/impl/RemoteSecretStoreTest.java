package org.lite.vault.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.vault.dto.VaultEnvelope;
import org.lite.vault.enums.SecretType;
import org.lite.vault.exception.VaultStorageException;
import org.lite.vault.exception.VaultTimeoutException;
import org.lite.vault.service.RemoteVaultClient;
import org.lite.vault.support.MutableClock;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoteSecretStoreTest {

    @Mock
    private RemoteVaultClient client;

    private MutableClock clock;
    private VaultEncryptionServiceImpl encryptionService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        encryptionService = new VaultEncryptionServiceImpl();
    }

    private RemoteSecretStore newStore(Duration timeout) {
        return new RemoteSecretStore(encryptionService, new RotationPolicyImpl(clock), clock,
                "test-passphrase", "test-salt", client, timeout);
    }

    @Test
    void testInitialize_EmptyRemoteCreatesVault() {
        // Given
        when(client.fetchEnvelope()).thenReturn(Mono.empty());
        when(client.storeEnvelope(any())).thenReturn(Mono.empty());

        // When
        RemoteSecretStore store = newStore(Duration.ofSeconds(5));
        store.initialize();

        // Then
        verify(client).storeEnvelope(any(VaultEnvelope.class));
        assertTrue(store.listSecrets().isEmpty());
    }

    @Test
    void testStoreSecret_PushesEnvelopeReadableByNextInstance() {
        // Given
        when(client.fetchEnvelope()).thenReturn(Mono.empty());
        when(client.storeEnvelope(any())).thenReturn(Mono.empty());
        RemoteSecretStore first = newStore(Duration.ofSeconds(5));
        String secretId = first.storeSecret(SecretType.API_KEY, "openai", "sk-remote");

        ArgumentCaptor<VaultEnvelope> pushed = ArgumentCaptor.forClass(VaultEnvelope.class);
        verify(client, times(2)).storeEnvelope(pushed.capture());
        VaultEnvelope latest = pushed.getValue();

        // When
        when(client.fetchEnvelope()).thenReturn(Mono.just(latest));
        RemoteSecretStore second = newStore(Duration.ofSeconds(5));

        // Then
        assertEquals("sk-remote", second.getSecret(secretId));
    }

    @Test
    void testFetch_TimesOut() {
        // Given
        when(client.fetchEnvelope()).thenReturn(Mono.never());
        RemoteSecretStore store = newStore(Duration.ofMillis(100));

        // When
        VaultTimeoutException exception = assertThrows(VaultTimeoutException.class, store::initialize);

        // Then
        assertTrue(exception.getMessage().contains("fetch"));
    }

    @Test
    void testStore_TimesOutAndKeepsPreviousState() {
        // Given
        when(client.fetchEnvelope()).thenReturn(Mono.empty());
        when(client.storeEnvelope(any())).thenReturn(Mono.empty());
        RemoteSecretStore store = newStore(Duration.ofMillis(100));
        store.initialize();

        when(client.storeEnvelope(any())).thenReturn(Mono.never());

        // When / Then
        assertThrows(VaultTimeoutException.class,
                () -> store.storeSecret(SecretType.API_KEY, "openai", "sk-test"));
        assertTrue(store.listSecrets().isEmpty(), "failed write is not committed");
    }

    @Test
    void testFetch_ClientErrorBecomesStorageException() {
        when(client.fetchEnvelope()).thenReturn(Mono.error(new IOException("connection refused")));
        RemoteSecretStore store = newStore(Duration.ofSeconds(1));

        assertThrows(VaultStorageException.class, store::initialize);
    }

    @Test
    void testConstructor_RejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> newStore(Duration.ZERO));
    }
}
