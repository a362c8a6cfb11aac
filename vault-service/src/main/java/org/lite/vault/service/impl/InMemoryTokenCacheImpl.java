package org.lite.vault.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.config.VaultProperties;
import org.lite.vault.service.TokenCache;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class InMemoryTokenCacheImpl implements TokenCache {

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    private record CacheEntry(String token, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    @Autowired
    public InMemoryTokenCacheImpl(Clock vaultClock, VaultProperties properties) {
        this(vaultClock, properties.getTokenCacheTtl());
    }

    public InMemoryTokenCacheImpl(Clock clock, Duration defaultTtl) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Token cache TTL must be positive");
        }
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Optional<String> get(String serviceName) {
        CacheEntry entry = cache.get(serviceName);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            cache.remove(serviceName, entry);
            return Optional.empty();
        }
        return Optional.of(entry.token());
    }

    @Override
    public void put(String serviceName, String token) {
        put(serviceName, token, defaultTtl);
    }

    @Override
    public void put(String serviceName, String token, Duration ttl) {
        cache.put(serviceName, new CacheEntry(token, clock.instant().plus(ttl)));
    }

    @Override
    public void evict(String serviceName) {
        cache.remove(serviceName);
    }

    @Override
    public void clear() {
        cache.clear();
        log.debug("Token cache cleared");
    }
}
