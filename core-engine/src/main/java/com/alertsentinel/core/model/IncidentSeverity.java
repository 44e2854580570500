package com.alertsentinel.core.model;

/**
 * Severity of a {@link SecurityIncident}. Declaration order is the rank order
 * used by response-rule severity floors: low &lt; medium &lt; high &lt; critical.
 *
 * @since 1.0.0
 */
public enum IncidentSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static IncidentSeverity parse(String raw) {
        return Names.parse(IncidentSeverity.class, raw, "incident severity");
    }

    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(IncidentSeverity floor) {
        return rank() >= floor.rank();
    }
}
