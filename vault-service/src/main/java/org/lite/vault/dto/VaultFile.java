package org.lite.vault.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DTO representing the decrypted vault structure
 * Contains every secret record keyed by secret id
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultFile {

    @Builder.Default
    private Map<String, SecretRecord> secrets = new LinkedHashMap<>();

    private VaultMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class VaultMetadata {
        private Instant createdAt;
        private Instant updatedAt;
    }

    /**
     * Deep copy; changes are made on the copy until it has been persisted
     */
    public VaultFile copy() {
        Map<String, SecretRecord> copiedSecrets = new LinkedHashMap<>();
        if (secrets != null) {
            secrets.forEach((id, record) -> copiedSecrets.put(id, record.copy()));
        }
        return VaultFile.builder()
                .secrets(copiedSecrets)
                .metadata(metadata == null ? null : new VaultMetadata(metadata.getCreatedAt(), metadata.getUpdatedAt()))
                .build();
    }

    /**
     * Create empty vault structure
     */
    public static VaultFile createEmpty(Instant now) {
        return VaultFile.builder()
                .secrets(new LinkedHashMap<>())
                .metadata(VaultMetadata.builder()
                        .createdAt(now)
                        .updatedAt(now)
                        .build())
                .build();
    }
}
