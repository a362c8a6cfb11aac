package org.lite.vault.enums;

import java.util.Optional;

/**
 * Services whose tokens the provider manages by name, with the legacy environment
 * variable each one used before the vault existed.
 */
public enum KnownService {
    OPENAI("openai", "OPENAI_API_KEY", SecretType.API_KEY, "OpenAI API"),
    GOOGLE_MAPS("google_maps", "GOOGLE_MAPS_API_KEY", SecretType.API_KEY, "Google Maps API"),
    AUTH_JWT("auth_jwt", "JWT_SECRET", SecretType.JWT_SECRET, "JWT Authentication Secret"),
    DATA_ENCRYPTION("data_encryption", "ENCRYPTION_KEY", SecretType.ENCRYPTION_KEY, "Data Encryption Key"),
    SENDGRID("sendgrid", "SENDGRID_API_KEY", SecretType.API_KEY, "SendGrid API");

    private final String serviceName;
    private final String envVariable;
    private final SecretType secretType;
    private final String displayName;

    KnownService(String serviceName, String envVariable, SecretType secretType, String displayName) {
        this.serviceName = serviceName;
        this.envVariable = envVariable;
        this.secretType = secretType;
        this.displayName = displayName;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getEnvVariable() {
        return envVariable;
    }

    public SecretType getSecretType() {
        return secretType;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Keys for these services are machine generated rather than issued by a third party
     */
    public boolean isGenerated() {
        return this == AUTH_JWT || this == DATA_ENCRYPTION;
    }

    public static Optional<KnownService> fromServiceName(String serviceName) {
        for (KnownService service : values()) {
            if (service.serviceName.equals(serviceName)) {
                return Optional.of(service);
            }
        }
        return Optional.empty();
    }
}
