package com.alertsentinel.core.error;

/**
 * An alert or incident was asked to move to a status its lifecycle does not
 * allow from where it currently is.
 *
 * @since 1.0.0
 */
public class StateTransitionException extends ValidationException {

    private static final long serialVersionUID = 1L;

    public StateTransitionException(String message) {
        super(message);
    }
}
