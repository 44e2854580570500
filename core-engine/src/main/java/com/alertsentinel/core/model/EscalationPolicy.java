package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * How and when open incidents of one severity are escalated.
 *
 * <p>
 * An incident is escalated when {@code escalateImmediately} is set, or once
 * it has been open for {@code escalationAgeSeconds}. Each contact class is
 * notified on each channel.
 * </p>
 *
 * @since 1.0.0
 */
public final class EscalationPolicy {

    private final IncidentSeverity severity;
    private final boolean escalateImmediately;
    private final long escalationAgeSeconds;
    private final List<RecipientClass> contactClasses;
    private final List<NotificationChannel> notifyChannels;

    /**
     * @throws ValidationException if the severity is missing, the age is
     *                             negative, or no contact class is given
     */
    @JsonCreator
    public EscalationPolicy(@JsonProperty("severity") IncidentSeverity severity,
            @JsonProperty("escalateImmediately") boolean escalateImmediately,
            @JsonProperty("escalationAgeSeconds") long escalationAgeSeconds,
            @JsonProperty("contactClasses") List<RecipientClass> contactClasses,
            @JsonProperty("notifyChannels") List<NotificationChannel> notifyChannels) {
        if (severity == null) {
            throw new ValidationException("Escalation policy requires 'severity'");
        }
        if (escalationAgeSeconds < 0) {
            throw new ValidationException("Escalation policy for " + severity
                    + " requires 'escalationAgeSeconds' >= 0, got: " + escalationAgeSeconds);
        }
        if (contactClasses == null || contactClasses.isEmpty()) {
            throw new ValidationException("Escalation policy for " + severity + " requires at least one contact class");
        }
        this.severity = severity;
        this.escalateImmediately = escalateImmediately;
        this.escalationAgeSeconds = escalationAgeSeconds;
        this.contactClasses = List.copyOf(contactClasses);
        this.notifyChannels = notifyChannels == null || notifyChannels.isEmpty()
                ? List.of(NotificationChannel.EMAIL)
                : List.copyOf(notifyChannels);
    }

    public IncidentSeverity getSeverity() {
        return severity;
    }

    public boolean isEscalateImmediately() {
        return escalateImmediately;
    }

    public long getEscalationAgeSeconds() {
        return escalationAgeSeconds;
    }

    public List<RecipientClass> getContactClasses() {
        return contactClasses;
    }

    public List<NotificationChannel> getNotifyChannels() {
        return notifyChannels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EscalationPolicy that))
            return false;
        return escalateImmediately == that.escalateImmediately
                && escalationAgeSeconds == that.escalationAgeSeconds
                && severity == that.severity
                && contactClasses.equals(that.contactClasses)
                && notifyChannels.equals(that.notifyChannels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, escalateImmediately, escalationAgeSeconds, contactClasses, notifyChannels);
    }

    @Override
    public String toString() {
        return "EscalationPolicy{" +
                "severity=" + severity +
                ", escalateImmediately=" + escalateImmediately +
                ", escalationAgeSeconds=" + escalationAgeSeconds +
                ", contactClasses=" + contactClasses +
                ", notifyChannels=" + notifyChannels +
                '}';
    }
}
