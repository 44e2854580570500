package com.alertsentinel.core.model;

/**
 * Who a notification is addressed to. The transport resolves a class to
 * concrete recipients.
 *
 * @since 1.0.0
 */
public enum RecipientClass {
    /** Guardians or group owners of the affected subject. */
    SUBJECT_GROUP,
    OPERATOR,
    EXTERNAL_AUTHORITY,
    SECURITY_TEAM,
    MANAGEMENT,
    EXECUTIVES;

    public static RecipientClass parse(String raw) {
        return Names.parse(RecipientClass.class, raw, "recipient class");
    }
}
