package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.EscalationPolicy;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.NotificationChannel;
import com.alertsentinel.core.model.RecipientClass;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of an escalation policy.
 *
 * @since 1.0.0
 */
public class EscalationPolicyDefinition {

    private String severity;
    private boolean escalateImmediately;
    private long escalationAgeSeconds;
    private List<String> contactClasses = new ArrayList<>();
    private List<String> notifyChannels = new ArrayList<>();

    /**
     * @return the resolved policy
     * @throws ValidationException listing every problem found
     */
    public EscalationPolicy toPolicy() {
        List<String> errors = new ArrayList<>();
        IncidentSeverity sev = null;
        try {
            sev = IncidentSeverity.parse(severity);
        } catch (ValidationException e) {
            errors.add("Escalation policy: " + e.getMessage());
        }
        List<RecipientClass> contacts = new ArrayList<>();
        for (String raw : contactClasses) {
            try {
                contacts.add(RecipientClass.parse(raw));
            } catch (ValidationException e) {
                errors.add("Escalation policy for '" + severity + "': " + e.getMessage());
            }
        }
        List<NotificationChannel> channels = new ArrayList<>();
        for (String raw : notifyChannels) {
            try {
                channels.add(NotificationChannel.parse(raw));
            } catch (ValidationException e) {
                errors.add("Escalation policy for '" + severity + "': " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
        return new EscalationPolicy(sev, escalateImmediately, escalationAgeSeconds, contacts, channels);
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public boolean isEscalateImmediately() {
        return escalateImmediately;
    }

    public void setEscalateImmediately(boolean escalateImmediately) {
        this.escalateImmediately = escalateImmediately;
    }

    public long getEscalationAgeSeconds() {
        return escalationAgeSeconds;
    }

    public void setEscalationAgeSeconds(long escalationAgeSeconds) {
        this.escalationAgeSeconds = escalationAgeSeconds;
    }

    public List<String> getContactClasses() {
        return contactClasses;
    }

    public void setContactClasses(List<String> contactClasses) {
        this.contactClasses = contactClasses != null ? new ArrayList<>(contactClasses) : new ArrayList<>();
    }

    public List<String> getNotifyChannels() {
        return notifyChannels;
    }

    public void setNotifyChannels(List<String> notifyChannels) {
        this.notifyChannels = notifyChannels != null ? new ArrayList<>(notifyChannels) : new ArrayList<>();
    }
}
