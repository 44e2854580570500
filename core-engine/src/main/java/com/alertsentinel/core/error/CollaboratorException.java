package com.alertsentinel.core.error;

/**
 * Failure reported by an external collaborator (notification transport,
 * enforcement gateway, alert callback).
 *
 * <p>
 * Never propagated to the caller of {@code evaluate} or {@code execute}: it is
 * caught where the collaborator is invoked, logged, counted, and reflected in
 * the resulting {@code ResponseRecord}.
 * </p>
 *
 * @since 1.0.0
 */
public class CollaboratorException extends SentinelException {

    private static final long serialVersionUID = 1L;

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
