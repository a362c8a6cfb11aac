package org.lite.vault.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.vault.enums.SecretType;

/**
 * One secret inside the vault. Only the encrypted form of the value is ever held here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SecretRecord {

    /**
     * Stored type name, kept as written so types this build does not know survive a rewrite
     */
    private String type;
    private String name;
    private EncryptedPayload encryptedData;
    private SecretMetadata metadata;

    /**
     * @return the resolved type, or null when the stored name is unknown
     */
    @JsonIgnore
    public SecretType getSecretType() {
        return SecretType.fromValue(type);
    }

    @JsonIgnore
    public boolean isSuperseded() {
        return metadata != null && metadata.getRotatedTo() != null;
    }

    public SecretRecord copy() {
        return SecretRecord.builder()
                .type(type)
                .name(name)
                .encryptedData(encryptedData == null ? null : new EncryptedPayload(
                        encryptedData.getEncrypted(), encryptedData.getIv(), encryptedData.getAuthTag()))
                .metadata(metadata == null ? null : metadata.copy())
                .build();
    }
}
