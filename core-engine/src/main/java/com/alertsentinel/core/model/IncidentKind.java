package com.alertsentinel.core.model;

/**
 * Classification of a security incident as reported by detectors.
 *
 * @since 1.0.0
 */
public enum IncidentKind {
    MALWARE,
    INTRUSION,
    DATA_BREACH,
    PHISHING,
    SOCIAL_ENGINEERING,
    UNAUTHORIZED_ACCESS,
    CHILD_EXPLOITATION,
    ELDERLY_FRAUD,
    NETWORK_ATTACK,
    DEVICE_COMPROMISE,
    UNKNOWN;

    public static IncidentKind parse(String raw) {
        return Names.parse(IncidentKind.class, raw, "incident kind");
    }
}
