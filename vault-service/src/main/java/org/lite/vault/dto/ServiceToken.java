package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A service name together with the metadata of the secret it is mapped to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceToken {

    private String serviceName;
    private SecretSummary secret;
}
