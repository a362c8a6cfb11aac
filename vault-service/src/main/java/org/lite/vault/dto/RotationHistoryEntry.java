package org.lite.vault.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RotationHistoryEntry {

    private Instant rotatedAt;
    private Instant previousRotationDue;
}
