package com.alertsentinel.core.error;

import java.time.Duration;

/**
 * A component lock could not be acquired within its bounded wait.
 *
 * @since 1.0.0
 */
public class ConcurrencyTimeoutException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public ConcurrencyTimeoutException(String lockName, Duration waited) {
        super("Timed out after " + waited.toMillis() + " ms waiting for lock '" + lockName + "'");
    }

    public ConcurrencyTimeoutException(String lockName, InterruptedException cause) {
        super("Interrupted while waiting for lock '" + lockName + "'", cause);
    }
}
