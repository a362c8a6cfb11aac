package org.lite.vault.listener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.vault.service.TokenProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Opens the vault once the application is ready, so a bad key or a corrupted vault
 * stops startup instead of the first token request.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultStartupListener {

    private final TokenProvider tokenProvider;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("Initializing token provider");
        tokenProvider.initialize();
    }
}
