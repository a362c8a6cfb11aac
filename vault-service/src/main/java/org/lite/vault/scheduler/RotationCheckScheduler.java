package org.lite.vault.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.vault.dto.TokenRotationStatus;
import org.lite.vault.service.TokenProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scheduler reporting provider-managed tokens that are due for rotation.
 * Runs daily at 3:00 AM unless vault.rotation-check.cron says otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "vault.rotation-check", name = "enabled", matchIfMissing = true)
public class RotationCheckScheduler {

    private final TokenProvider tokenProvider;

    @Scheduled(cron = "${vault.rotation-check.cron:0 0 3 * * ?}")
    public void checkRotationDue() {
        log.info("Starting scheduled token rotation check");
        try {
            List<TokenRotationStatus> due = tokenProvider.getTokensNeedingRotation();
            if (due.isEmpty()) {
                log.info("No tokens need rotation");
                return;
            }
            due.forEach(status -> log.warn("Token for service {} needs rotation (secret: {}, due: {}, last used: {})",
                    status.getServiceName(), status.getSecretId(), status.getRotationDue(), status.getLastUsed()));
            log.warn("{} token(s) need rotation", due.size());
        } catch (RuntimeException e) {
            log.error("Scheduled token rotation check failed: {}", e.getMessage(), e);
        }
    }
}
