package com.alertsentinel.core.model;

/**
 * Incident lifecycle. Transitions only move forward in declaration order;
 * {@code RESOLVED} may still be closed, {@code CLOSED} is final.
 *
 * @since 1.0.0
 */
public enum IncidentStatus {
    DETECTED,
    INVESTIGATING,
    CONTAINED,
    RESOLVED,
    CLOSED;

    public static IncidentStatus parse(String raw) {
        return Names.parse(IncidentStatus.class, raw, "incident status");
    }

    /**
     * @return {@code true} for {@code RESOLVED} and {@code CLOSED}
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    public boolean isOpen() {
        return !isTerminal();
    }

    /**
     * @param target requested status
     * @return whether the lifecycle allows moving from this status to
     *         {@code target}
     */
    public boolean canMoveTo(IncidentStatus target) {
        if (this == CLOSED) {
            return false;
        }
        if (this == RESOLVED) {
            return target == CLOSED;
        }
        return target.ordinal() > ordinal();
    }
}
