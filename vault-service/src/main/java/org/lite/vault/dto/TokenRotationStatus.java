package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A provider-managed token whose rotation date has passed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRotationStatus {

    private String serviceName;
    private String secretId;
    private Instant lastUsed;
    private Instant rotationDue;
}
