package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.vault.enums.SecretType;

import java.time.Instant;

/**
 * Usage statistics of a single secret
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SecretStats {

    private SecretType type;
    private String name;
    private Instant createdAt;
    private Instant lastUsed;
    private long usageCount;
    private Instant rotationDue;
    private long daysUntilRotation;
    private boolean needsRotation;
}
