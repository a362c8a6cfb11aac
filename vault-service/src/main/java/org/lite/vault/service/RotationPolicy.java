package org.lite.vault.service;

import org.lite.vault.dto.SecretMetadata;
import org.lite.vault.enums.SecretType;

import java.time.Duration;
import java.time.Instant;

/**
 * Rotation schedule per secret type. Stateless apart from the clock it reads "now" from.
 */
public interface RotationPolicy {

    /**
     * Interval for the type, or the default interval when the type is unknown (null)
     */
    Duration rotationInterval(SecretType type);

    /**
     * now + interval(type)
     */
    Instant calculateNextRotationDate(SecretType type);

    /**
     * rotationDue <= now; a missing due date counts as due
     */
    boolean isRotationNeeded(SecretMetadata metadata);

    /**
     * Whole days left until the due date, never negative
     */
    long daysUntilRotation(SecretMetadata metadata);
}
