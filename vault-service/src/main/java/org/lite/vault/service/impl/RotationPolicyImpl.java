package org.lite.vault.service.impl;

import lombok.RequiredArgsConstructor;
import org.lite.vault.dto.SecretMetadata;
import org.lite.vault.enums.SecretType;
import org.lite.vault.service.RotationPolicy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@RequiredArgsConstructor
public class RotationPolicyImpl implements RotationPolicy {

    static final int DEFAULT_ROTATION_DAYS = 90;

    private final Clock clock;

    @Override
    public Duration rotationInterval(SecretType type) {
        if (type == null) {
            return Duration.ofDays(DEFAULT_ROTATION_DAYS);
        }
        int days = switch (type) {
            case API_KEY -> 90;
            case JWT_SECRET -> 180;
            case ENCRYPTION_KEY -> 365;
            case DATABASE -> 180;
            case OAUTH -> 30;
            case SSH_KEY -> 180;
            case TOKEN -> 30;
        };
        return Duration.ofDays(days);
    }

    @Override
    public Instant calculateNextRotationDate(SecretType type) {
        return clock.instant().plus(rotationInterval(type));
    }

    @Override
    public boolean isRotationNeeded(SecretMetadata metadata) {
        if (metadata == null || metadata.getRotationDue() == null) {
            return true;
        }
        return !metadata.getRotationDue().isAfter(clock.instant());
    }

    @Override
    public long daysUntilRotation(SecretMetadata metadata) {
        if (metadata == null || metadata.getRotationDue() == null) {
            return 0;
        }
        long days = Duration.between(clock.instant(), metadata.getRotationDue()).toDays();
        return Math.max(0, days);
    }
}
