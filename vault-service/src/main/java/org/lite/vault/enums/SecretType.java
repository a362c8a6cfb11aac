package org.lite.vault.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of secret held in the vault. The rotation interval of each kind lives in
 * {@link org.lite.vault.service.RotationPolicy}.
 */
public enum SecretType {
    API_KEY("api_key"),
    JWT_SECRET("jwt_secret"),
    ENCRYPTION_KEY("encryption_key"),
    DATABASE("database"),
    OAUTH("oauth"),
    SSH_KEY("ssh_key"),
    TOKEN("token");

    private final String value;

    SecretType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve the stored name of a type. Returns null for names this build does not know,
     * which the rotation policy treats as the default interval.
     */
    @JsonCreator
    public static SecretType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SecretType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
