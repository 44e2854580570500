package com.alertsentinel.core.model;

/**
 * Severity of an {@link Alert}, lowest first.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public static AlertSeverity parse(String raw) {
        return Names.parse(AlertSeverity.class, raw, "alert severity");
    }

    /**
     * Severity an incident raised from an alert of this severity gets.
     *
     * @return the matching incident severity
     */
    public IncidentSeverity toIncidentSeverity() {
        return switch (this) {
            case INFO -> IncidentSeverity.LOW;
            case WARNING -> IncidentSeverity.MEDIUM;
            case ERROR -> IncidentSeverity.HIGH;
            case CRITICAL -> IncidentSeverity.CRITICAL;
        };
    }
}
