package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of one AES-GCM encryption, each part hex encoded
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedPayload {

    private String encrypted;
    private String iv;
    private String authTag;
}
