package com.alertsentinel.core.error;

/**
 * Root of the unchecked exception hierarchy raised by the alerting and
 * incident-response core.
 *
 * <p>
 * Subclasses classify the failure so that callers can decide whether to
 * surface it ({@link ValidationException}, {@link NotFoundException},
 * {@link ConcurrencyTimeoutException}) or absorb it
 * ({@link CollaboratorException}).
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
