package com.alertsentinel.core.error;

/**
 * Malformed input or configuration: an empty metric name, a non-finite value,
 * an unknown comparator, action or incident kind, a negative cooldown.
 *
 * <p>
 * Always raised before any state is touched, so a rejected call leaves the
 * component exactly as it was.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
