package org.lite.vault.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Short lived plaintext cache in front of the secret store, keyed by service name
 */
public interface TokenCache {

    Optional<String> get(String serviceName);

    /**
     * Cache a token for the default TTL
     */
    void put(String serviceName, String token);

    void put(String serviceName, String token, Duration ttl);

    void evict(String serviceName);

    void clear();
}
