package org.lite.vault.exception;

import java.time.Duration;

/**
 * Exception thrown when a remote backend does not answer within the caller's deadline
 */
public class VaultTimeoutException extends VaultException {

    public VaultTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("Remote vault %s did not complete within %d ms", operation, timeout.toMillis()), cause);
    }
}
