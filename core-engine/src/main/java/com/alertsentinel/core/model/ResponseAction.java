package com.alertsentinel.core.model;

/**
 * Closed set of automatic response actions. Resolved once when response
 * rules are loaded, so an unknown action name never reaches execution.
 *
 * @since 1.0.0
 */
public enum ResponseAction {
    ISOLATE,
    QUARANTINE,
    BLOCK,
    NOTIFY_SUBJECT_GROUP,
    NOTIFY_OPERATOR,
    NOTIFY_EXTERNAL_AUTHORITY,
    ESCALATE,
    /** Moves the incident to {@link IncidentStatus#INVESTIGATING}. */
    INVESTIGATE,
    /** Moves the incident to {@link IncidentStatus#CONTAINED}. */
    CONTAIN,
    /** Moves the incident to {@link IncidentStatus#RESOLVED}. */
    REMEDIATE,
    MONITOR,
    LOG;

    public static ResponseAction parse(String raw) {
        return Names.parse(ResponseAction.class, raw, "response action");
    }

    public String wireName() {
        return Names.wireName(this);
    }
}
