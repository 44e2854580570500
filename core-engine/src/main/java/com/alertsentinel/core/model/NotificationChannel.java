package com.alertsentinel.core.model;

/**
 * Delivery channel requested for a notification.
 *
 * @since 1.0.0
 */
public enum NotificationChannel {
    EMAIL,
    SMS,
    PUSH,
    WEBHOOK,
    CHAT;

    public static NotificationChannel parse(String raw) {
        return Names.parse(NotificationChannel.class, raw, "notification channel");
    }
}
