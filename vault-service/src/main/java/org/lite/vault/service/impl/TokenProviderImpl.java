package org.lite.vault.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.vault.config.VaultProperties;
import org.lite.vault.dto.ImportedSecret;
import org.lite.vault.dto.SecretSummary;
import org.lite.vault.dto.ServiceToken;
import org.lite.vault.dto.TokenRotationStatus;
import org.lite.vault.enums.KnownService;
import org.lite.vault.enums.SecretType;
import org.lite.vault.exception.SecretNotFoundException;
import org.lite.vault.service.SecretStore;
import org.lite.vault.service.TokenCache;
import org.lite.vault.service.TokenProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertyResolver;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Slf4j
public class TokenProviderImpl implements TokenProvider {

    static final String MANAGED_BY_ATTRIBUTE = "managedBy";
    static final String MANAGED_BY_VALUE = "token-provider";
    static final String SOURCE_ATTRIBUTE = "source";
    static final String ENVIRONMENT_IMPORT = "environment_import";

    private final SecretStore secretStore;
    private final TokenCache tokenCache;
    private final PropertyResolver legacyProperties;
    private final boolean importEnvSecrets;

    private final Map<String, String> serviceMappings = new ConcurrentHashMap<>();
    // per service lock and write counter; a read only caches when no write happened meanwhile
    private final Map<String, Object> serviceLocks = new ConcurrentHashMap<>();
    private final Map<String, Long> writeGenerations = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    @Autowired
    public TokenProviderImpl(SecretStore secretStore,
                             TokenCache tokenCache,
                             Environment environment,
                             VaultProperties properties) {
        this(secretStore, tokenCache, environment, properties.isImportEnvSecrets());
    }

    public TokenProviderImpl(SecretStore secretStore,
                             TokenCache tokenCache,
                             PropertyResolver legacyProperties,
                             boolean importEnvSecrets) {
        this.secretStore = secretStore;
        this.tokenCache = tokenCache;
        this.legacyProperties = legacyProperties;
        this.importEnvSecrets = importEnvSecrets;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            secretStore.initialize();
            loadSecretMappings();
            if (importEnvSecrets) {
                List<ImportedSecret> imported = importLegacySecrets();
                log.info("Imported {} secrets from environment", imported.size());
            }
            initialized = true;
            log.info("Token provider initialized with {} service mappings", serviceMappings.size());
        } catch (RuntimeException e) {
            log.error("Token provider initialization failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Rebuild the mapping from the store listing. Per service the live (not superseded)
     * record wins; among several the newest one.
     */
    void loadSecretMappings() {
        Map<String, String> rebuilt = secretStore.listSecrets().stream()
                .filter(secret -> secret.getRotatedTo() == null)
                .filter(this::isProviderManaged)
                .collect(Collectors.groupingBy(SecretSummary::getName,
                        Collectors.collectingAndThen(
                                Collectors.maxBy(Comparator.comparing(SecretSummary::getCreatedAt,
                                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))),
                                newest -> newest.map(SecretSummary::getSecretId).orElseThrow())));

        serviceMappings.clear();
        serviceMappings.putAll(rebuilt);
        log.debug("Loaded {} service mappings", rebuilt.size());
    }

    private boolean isProviderManaged(SecretSummary secret) {
        if (KnownService.fromServiceName(secret.getName()).isPresent()) {
            return true;
        }
        Map<String, String> attributes = secret.getAttributes();
        return attributes != null && MANAGED_BY_VALUE.equals(attributes.get(MANAGED_BY_ATTRIBUTE));
    }

    @Override
    public String getToken(String serviceName) {
        requireServiceName(serviceName);
        ensureInitialized();

        Optional<String> cached = tokenCache.get(serviceName);
        if (cached.isPresent()) {
            log.debug("Token cache hit for service {}", sanitize(serviceName));
            return cached.get();
        }

        long generation = writeGeneration(serviceName);
        String secretId = serviceMappings.get(serviceName);
        if (secretId != null) {
            try {
                String token = secretStore.getSecret(secretId);
                cacheIfUnchanged(serviceName, generation, token);
                return token;
            } catch (SecretNotFoundException e) {
                log.warn("Mapped secret for service {} no longer exists, trying legacy configuration",
                        sanitize(serviceName));
                serviceMappings.remove(serviceName, secretId);
            }
        }

        Optional<String> legacyToken = legacyToken(serviceName);
        if (legacyToken.isPresent()) {
            log.debug("Using legacy environment value for service {}", sanitize(serviceName));
            cacheIfUnchanged(serviceName, generation, legacyToken.get());
            return legacyToken.get();
        }

        throw SecretNotFoundException.forService(serviceName);
    }

    @Override
    public String storeToken(String serviceName, String token) {
        requireServiceName(serviceName);
        ensureInitialized();

        synchronized (lockFor(serviceName)) {
            try {
                return storeLocked(serviceName, token);
            } catch (RuntimeException e) {
                log.error("Failed to store token for service: {}", sanitize(serviceName), e);
                throw e;
            } finally {
                bumpWriteGeneration(serviceName);
            }
        }
    }

    private String storeLocked(String serviceName, String token) {
        String secretId = serviceMappings.get(serviceName);
        if (secretId != null) {
            try {
                secretStore.updateSecret(secretId, token);
                tokenCache.put(serviceName, token);
                return secretId;
            } catch (SecretNotFoundException e) {
                log.warn("Mapped secret for service {} no longer exists, storing a new one",
                        sanitize(serviceName));
                serviceMappings.remove(serviceName, secretId);
            }
        }

        SecretType type = KnownService.fromServiceName(serviceName)
                .map(KnownService::getSecretType)
                .orElse(SecretType.API_KEY);
        secretId = secretStore.storeSecret(type, serviceName, token,
                Map.of(MANAGED_BY_ATTRIBUTE, MANAGED_BY_VALUE));
        serviceMappings.put(serviceName, secretId);
        tokenCache.put(serviceName, token);
        return secretId;
    }

    @Override
    public String rotateToken(String serviceName, String newToken) {
        requireServiceName(serviceName);
        ensureInitialized();

        synchronized (lockFor(serviceName)) {
            String secretId = serviceMappings.get(serviceName);
            if (secretId == null) {
                throw SecretNotFoundException.forService(serviceName);
            }
            try {
                String successorId = secretStore.rotateSecret(secretId, newToken);
                serviceMappings.put(serviceName, successorId);
                tokenCache.put(serviceName, newToken);
                log.info("Rotated token for service {}", sanitize(serviceName));
                return successorId;
            } catch (RuntimeException e) {
                log.error("Failed to rotate token for service: {}", sanitize(serviceName), e);
                throw e;
            } finally {
                bumpWriteGeneration(serviceName);
            }
        }
    }

    @Override
    public void deleteToken(String serviceName) {
        requireServiceName(serviceName);
        ensureInitialized();

        synchronized (lockFor(serviceName)) {
            String secretId = serviceMappings.get(serviceName);
            if (secretId == null) {
                throw SecretNotFoundException.forService(serviceName);
            }
            try {
                secretStore.deleteSecret(secretId);
            } catch (SecretNotFoundException e) {
                log.warn("Mapped secret for service {} was already removed", sanitize(serviceName));
            } finally {
                serviceMappings.remove(serviceName);
                tokenCache.evict(serviceName);
                bumpWriteGeneration(serviceName);
            }
        }
        log.info("Deleted token for service {}", sanitize(serviceName));
    }

    @Override
    public List<TokenRotationStatus> getTokensNeedingRotation() {
        ensureInitialized();

        Map<String, String> servicesBySecretId = new HashMap<>();
        serviceMappings.forEach((service, secretId) -> servicesBySecretId.put(secretId, service));

        return secretStore.getSecretsNeedingRotation().stream()
                .filter(secret -> servicesBySecretId.containsKey(secret.getSecretId()))
                .map(secret -> TokenRotationStatus.builder()
                        .serviceName(servicesBySecretId.get(secret.getSecretId()))
                        .secretId(secret.getSecretId())
                        .lastUsed(secret.getLastUsed())
                        .rotationDue(secret.getRotationDue())
                        .build())
                .sorted(Comparator.comparing(TokenRotationStatus::getServiceName))
                .toList();
    }

    @Override
    public List<ServiceToken> listTokens() {
        ensureInitialized();

        Map<String, SecretSummary> secretsById = secretStore.listSecrets().stream()
                .collect(Collectors.toMap(SecretSummary::getSecretId, Function.identity()));

        List<ServiceToken> tokens = new ArrayList<>();
        serviceMappings.forEach((service, secretId) -> {
            SecretSummary secret = secretsById.get(secretId);
            if (secret != null) {
                tokens.add(ServiceToken.builder().serviceName(service).secret(secret).build());
            }
        });
        tokens.sort(Comparator.comparing(ServiceToken::getServiceName));
        return tokens;
    }

    @Override
    public synchronized List<ImportedSecret> importFromEnvironment() {
        ensureInitialized();
        return importLegacySecrets();
    }

    /**
     * Store every known service that has a legacy value but no mapping yet
     */
    private List<ImportedSecret> importLegacySecrets() {
        List<ImportedSecret> imported = new ArrayList<>();
        for (KnownService service : KnownService.values()) {
            if (serviceMappings.containsKey(service.getServiceName())) {
                continue;
            }
            String value = legacyProperties.getProperty(service.getEnvVariable());
            if (!StringUtils.hasText(value)) {
                continue;
            }
            String secretId = secretStore.storeSecret(service.getSecretType(), service.getServiceName(), value,
                    Map.of(SOURCE_ATTRIBUTE, ENVIRONMENT_IMPORT, MANAGED_BY_ATTRIBUTE, MANAGED_BY_VALUE));
            serviceMappings.put(service.getServiceName(), secretId);
            imported.add(new ImportedSecret(service.getServiceName(), secretId));
            log.info("Imported {} from environment variable {}", service.getDisplayName(), service.getEnvVariable());
        }
        return imported;
    }

    private Optional<String> legacyToken(String serviceName) {
        return KnownService.fromServiceName(serviceName)
                .map(service -> legacyProperties.getProperty(service.getEnvVariable()))
                .filter(StringUtils::hasText);
    }

    private Object lockFor(String serviceName) {
        return serviceLocks.computeIfAbsent(serviceName, name -> new Object());
    }

    private long writeGeneration(String serviceName) {
        return writeGenerations.getOrDefault(serviceName, 0L);
    }

    private void bumpWriteGeneration(String serviceName) {
        writeGenerations.merge(serviceName, 1L, Long::sum);
    }

    private void cacheIfUnchanged(String serviceName, long generation, String token) {
        synchronized (lockFor(serviceName)) {
            if (writeGeneration(serviceName) == generation) {
                tokenCache.put(serviceName, token);
            } else {
                log.debug("Token for service {} changed during lookup, not caching", sanitize(serviceName));
            }
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private static void requireServiceName(String serviceName) {
        if (!StringUtils.hasText(serviceName)) {
            throw new IllegalArgumentException("Service name is required");
        }
    }

    // no line breaks in log output
    private static String sanitize(String serviceName) {
        return serviceName.replaceAll("[\\r\\n]", "");
    }
}
