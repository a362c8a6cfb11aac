package org.lite.vault.enums;

/**
 * Storage backends a vault can run on
 */
public enum VaultBackendType {
    LOCAL,
    IN_MEMORY,
    REMOTE
}
