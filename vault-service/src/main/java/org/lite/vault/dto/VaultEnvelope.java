package org.lite.vault.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk form of a whole vault: the serialized {@link VaultFile} encrypted as one payload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultEnvelope {

    public static final int CURRENT_VERSION = 1;

    private String encrypted;
    private String iv;
    private String authTag;
    private int version;

    public static VaultEnvelope of(EncryptedPayload payload) {
        return VaultEnvelope.builder()
                .encrypted(payload.getEncrypted())
                .iv(payload.getIv())
                .authTag(payload.getAuthTag())
                .version(CURRENT_VERSION)
                .build();
    }

    public EncryptedPayload toPayload() {
        return new EncryptedPayload(encrypted, iv, authTag);
    }
}
