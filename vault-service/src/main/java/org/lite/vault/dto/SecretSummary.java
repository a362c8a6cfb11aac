package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.vault.enums.SecretType;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata-only view of a secret returned by listings. Carries no ciphertext or plaintext.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecretSummary {

    private String secretId;
    private SecretType type;
    private String name;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsed;
    private long usageCount;
    private Instant rotationDue;
    private String rotatedTo;
    private String rotatedFrom;
    private Map<String, String> attributes;
    private boolean needsRotation;
}
