package com.alertsentinel.core.incident;

import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseRecord;
import com.alertsentinel.core.model.SecurityIncident;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Post-incident report: the incident, how long it has been (or was) open,
 * and the timeline of response records.
 *
 * @since 1.0.0
 */
public final class IncidentReport {

    private static final Set<ResponseAction> NOTIFYING = EnumSet.of(
            ResponseAction.NOTIFY_SUBJECT_GROUP,
            ResponseAction.NOTIFY_OPERATOR,
            ResponseAction.NOTIFY_EXTERNAL_AUTHORITY,
            ResponseAction.ESCALATE);

    private final SecurityIncident incident;
    private final Instant generatedAt;
    private final long durationSeconds;
    private final List<ResponseAction> actionsTaken;
    private final List<IncidentStatus> statusHistory;
    private final long notificationsSent;
    private final long failedActions;
    private final List<ResponseRecord> timeline;

    private IncidentReport(SecurityIncident incident, Instant generatedAt, List<ResponseRecord> records) {
        this.incident = incident;
        this.generatedAt = generatedAt;
        Instant end = incident.getResolutionTime() != null ? incident.getResolutionTime() : generatedAt;
        this.durationSeconds = Math.max(0, Duration.between(incident.getDetectionTime(), end).getSeconds());
        this.actionsTaken = List.copyOf(incident.getResponseActionsTaken());
        this.statusHistory = List.copyOf(incident.getStatusHistory());
        this.timeline = records.stream()
                .sorted(Comparator.comparing(ResponseRecord::getTimestamp))
                .toList();
        this.notificationsSent = timeline.stream()
                .filter(r -> r.isSuccess() && NOTIFYING.contains(r.getAction()))
                .count();
        this.failedActions = timeline.stream().filter(r -> !r.isSuccess()).count();
    }

    /**
     * @param incident    snapshot of the incident
     * @param records     response records of that incident, any order
     * @param generatedAt report time; open incidents are measured up to it
     */
    public static IncidentReport of(SecurityIncident incident, List<ResponseRecord> records, Instant generatedAt) {
        Objects.requireNonNull(incident, "incident must not be null");
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        return new IncidentReport(incident, generatedAt, records);
    }

    public SecurityIncident getIncident() {
        return incident;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public long getDurationSeconds() {
        return durationSeconds;
    }

    public List<ResponseAction> getActionsTaken() {
        return actionsTaken;
    }

    public List<IncidentStatus> getStatusHistory() {
        return statusHistory;
    }

    public long getNotificationsSent() {
        return notificationsSent;
    }

    public long getFailedActions() {
        return failedActions;
    }

    public List<ResponseRecord> getTimeline() {
        return timeline;
    }
}
