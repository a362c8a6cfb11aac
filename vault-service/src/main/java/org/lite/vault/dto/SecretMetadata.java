package org.lite.vault.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle and usage metadata of a secret record.
 * Caller supplied attributes are serialized flat next to the fixed fields. Stored values that
 * are not text are kept as read and never exposed as attributes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecretMetadata {

    private static final Set<String> RESERVED_NAMES = Set.of(
            "createdAt", "updatedAt", "lastUsed", "usageCount", "rotationDue",
            "rotationHistory", "rotatedTo", "rotatedFrom", "attributes", "otherValues");

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsed;
    private long usageCount;
    private Instant rotationDue;

    @Builder.Default
    private List<RotationHistoryEntry> rotationHistory = new ArrayList<>();

    private String rotatedTo;
    private String rotatedFrom;

    @JsonIgnore
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    // non-text values found in a stored vault, written back unchanged
    @JsonIgnore
    @Builder.Default
    private Map<String, Object> otherValues = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> extraFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (otherValues != null) {
            fields.putAll(otherValues);
        }
        if (attributes != null) {
            fields.putAll(attributes);
        }
        return fields;
    }

    @JsonAnySetter
    public void putExtraField(String key, Object value) {
        if (key == null || value == null) {
            return;
        }
        if (value instanceof String text) {
            putAttribute(key, text);
            return;
        }
        if (otherValues == null) {
            otherValues = new LinkedHashMap<>();
        }
        otherValues.put(key, value);
    }

    public void putAttribute(String key, String value) {
        if (key == null || value == null) {
            return;
        }
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(key, value);
        if (otherValues != null) {
            otherValues.remove(key);
        }
    }

    /**
     * Record one read of the secret
     */
    public void recordAccess(Instant now) {
        usageCount++;
        lastUsed = now;
    }

    /**
     * Merge caller attributes; names of the fixed fields are ignored
     */
    public void mergeAttributes(Map<String, String> extra) {
        if (extra == null) {
            return;
        }
        extra.forEach((key, value) -> {
            if (!RESERVED_NAMES.contains(key)) {
                putAttribute(key, value);
            }
        });
    }

    public SecretMetadata copy() {
        return SecretMetadata.builder()
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .lastUsed(lastUsed)
                .usageCount(usageCount)
                .rotationDue(rotationDue)
                .rotationHistory(rotationHistory == null ? new ArrayList<>() : new ArrayList<>(rotationHistory.stream()
                        .map(entry -> new RotationHistoryEntry(entry.getRotatedAt(), entry.getPreviousRotationDue()))
                        .toList()))
                .rotatedTo(rotatedTo)
                .rotatedFrom(rotatedFrom)
                .attributes(attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes))
                .otherValues(otherValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(otherValues))
                .build();
    }
}
