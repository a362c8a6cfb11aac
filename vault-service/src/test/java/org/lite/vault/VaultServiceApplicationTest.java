package org.lite.vault;

import org.junit.jupiter.api.Test;
import org.lite.vault.scheduler.RotationCheckScheduler;
import org.lite.vault.service.SecretStore;
import org.lite.vault.service.TokenProvider;
import org.lite.vault.service.impl.InMemorySecretStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "vault.backend=IN_MEMORY",
        "vault.encryption-key=app-test-passphrase",
        "vault.salt=app-test-salt"
})
class VaultServiceApplicationTest {

    @Autowired
    private SecretStore secretStore;

    @Autowired
    private TokenProvider tokenProvider;

    @Autowired
    private RotationCheckScheduler rotationCheckScheduler;

    @Test
    void testContextLoads_StoreAndTokenRoundTrip() {
        // Given
        assertInstanceOf(InMemorySecretStore.class, secretStore);

        // When
        tokenProvider.storeToken("google_maps", "maps-key");

        // Then
        assertEquals("maps-key", tokenProvider.getGoogleMapsToken());
        assertEquals(1, tokenProvider.listTokens().size());
        assertDoesNotThrow(rotationCheckScheduler::checkRotationDue);
    }
}
