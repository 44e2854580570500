package com.alertsentinel.core.model;

/**
 * Priority attached to an outgoing notification.
 *
 * @since 1.0.0
 */
public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT,
    EMERGENCY;

    public static NotificationPriority forSeverity(IncidentSeverity severity) {
        return switch (severity) {
            case LOW -> LOW;
            case MEDIUM -> MEDIUM;
            case HIGH -> HIGH;
            case CRITICAL -> URGENT;
        };
    }
}
