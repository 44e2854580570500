package com.alertsentinel.core.model;

/**
 * Lifecycle of an {@link Alert}: {@code ACTIVE} moves once to one of the
 * terminal states.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    ACTIVE,
    RESOLVED,
    SUPPRESSED,
    IGNORED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
