package com.alertsentinel.core.model;

import com.alertsentinel.core.error.StateTransitionException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tracked security event affecting one or more monitored subjects (a device,
 * an account, a session).
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code DETECTED → INVESTIGATING → CONTAINED → RESOLVED → CLOSED}. Moves are
 * forward only; steps may be skipped. {@code escalated} is a flag that can be
 * raised once on any open incident without changing its status.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Only the incident registry mutates instances, under its
 * lock; everyone else works on {@link #copy() copies}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = SecurityIncident.Builder.class)
public final class SecurityIncident {

    private final String incidentId;
    private final IncidentKind kind;
    private final IncidentSeverity severity;
    private final String title;
    private final String description;
    private final Instant detectionTime;
    private final String source;
    private final Set<String> affectedSubjects;
    private final String subjectId;
    private final String subjectRole;

    private IncidentStatus status;
    private final List<IncidentStatus> statusHistory;
    private final List<String> evidence;
    private final List<ResponseAction> responseActionsTaken;
    private String assignedTo;
    private Instant resolutionTime;
    private String resolutionNotes;
    private String resolvedBy;
    private boolean escalated;
    private Instant escalatedAt;

    private SecurityIncident(Builder b) {
        this.incidentId = Objects.requireNonNull(b.incidentId, "incidentId must not be null");
        this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.title = b.title;
        this.description = b.description;
        this.detectionTime = Objects.requireNonNull(b.detectionTime, "detectionTime must not be null");
        this.source = b.source;
        this.affectedSubjects = b.affectedSubjects != null
                ? new LinkedHashSet<>(b.affectedSubjects)
                : new LinkedHashSet<>();
        this.subjectId = b.subjectId;
        this.subjectRole = b.subjectRole;
        this.status = b.status != null ? b.status : IncidentStatus.DETECTED;
        this.statusHistory = b.statusHistory != null && !b.statusHistory.isEmpty()
                ? new ArrayList<>(b.statusHistory)
                : new ArrayList<>(List.of(this.status));
        this.evidence = b.evidence != null ? new ArrayList<>(b.evidence) : new ArrayList<>();
        this.responseActionsTaken = b.responseActionsTaken != null
                ? new ArrayList<>(b.responseActionsTaken)
                : new ArrayList<>();
        this.assignedTo = b.assignedTo;
        this.resolutionTime = b.resolutionTime;
        this.resolutionNotes = b.resolutionNotes;
        this.resolvedBy = b.resolvedBy;
        this.escalated = b.escalated;
        this.escalatedAt = b.escalatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an independent deep copy
     */
    public SecurityIncident copy() {
        return new Builder()
                .incidentId(incidentId)
                .kind(kind)
                .severity(severity)
                .status(status)
                .statusHistory(statusHistory)
                .title(title)
                .description(description)
                .detectionTime(detectionTime)
                .source(source)
                .affectedSubjects(affectedSubjects)
                .subjectId(subjectId)
                .subjectRole(subjectRole)
                .evidence(evidence)
                .responseActionsTaken(responseActionsTaken)
                .assignedTo(assignedTo)
                .resolutionTime(resolutionTime)
                .resolutionNotes(resolutionNotes)
                .resolvedBy(resolvedBy)
                .escalated(escalated)
                .escalatedAt(escalatedAt)
                .build();
    }

    // ---------------------------------------------------------------
    // Mutators (registry only)
    // ---------------------------------------------------------------

    /**
     * Move the incident forward.
     *
     * @param target requested status
     * @throws StateTransitionException if the lifecycle forbids the move
     */
    public void transitionTo(IncidentStatus target) {
        Objects.requireNonNull(target, "target status must not be null");
        if (!status.canMoveTo(target)) {
            throw new StateTransitionException(
                    "Incident " + incidentId + " cannot move from " + status + " to " + target);
        }
        status = target;
        statusHistory.add(target);
    }

    /**
     * Resolve the incident.
     *
     * @throws StateTransitionException unless the incident is open
     */
    public void resolve(String notes, String by, Instant at) {
        if (status.isTerminal()) {
            throw new StateTransitionException(
                    "Incident " + incidentId + " is already " + status + " and cannot be resolved");
        }
        transitionTo(IncidentStatus.RESOLVED);
        this.resolutionTime = at;
        this.resolutionNotes = notes;
        this.resolvedBy = by;
        if (by != null) {
            this.assignedTo = by;
        }
    }

    /**
     * Raise the escalation flag.
     *
     * @return {@code true} if the flag was raised by this call, {@code false}
     *         if the incident was already escalated or is no longer open
     */
    public boolean markEscalated(Instant at) {
        if (escalated || status.isTerminal()) {
            return false;
        }
        escalated = true;
        escalatedAt = at;
        return true;
    }

    public void addEvidence(String item) {
        evidence.add(Objects.requireNonNull(item, "evidence must not be null"));
    }

    public void recordActionTaken(ResponseAction action) {
        responseActionsTaken.add(Objects.requireNonNull(action, "action must not be null"));
    }

    public void assignTo(String assignee) {
        this.assignedTo = assignee;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getIncidentId() {
        return incidentId;
    }

    public IncidentKind getKind() {
        return kind;
    }

    public IncidentSeverity getSeverity() {
        return severity;
    }

    public IncidentStatus getStatus() {
        return status;
    }

    /**
     * @return every status the incident has held, oldest first
     */
    public List<IncidentStatus> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Instant getDetectionTime() {
        return detectionTime;
    }

    public String getSource() {
        return source;
    }

    public Set<String> getAffectedSubjects() {
        return Collections.unmodifiableSet(affectedSubjects);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getSubjectRole() {
        return subjectRole;
    }

    public List<String> getEvidence() {
        return Collections.unmodifiableList(evidence);
    }

    public List<ResponseAction> getResponseActionsTaken() {
        return Collections.unmodifiableList(responseActionsTaken);
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public Instant getResolutionTime() {
        return resolutionTime;
    }

    public String getResolutionNotes() {
        return resolutionNotes;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public Instant getEscalatedAt() {
        return escalatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SecurityIncident that))
            return false;
        return escalated == that.escalated
                && incidentId.equals(that.incidentId)
                && kind == that.kind
                && severity == that.severity
                && status == that.status
                && statusHistory.equals(that.statusHistory)
                && Objects.equals(title, that.title)
                && Objects.equals(description, that.description)
                && detectionTime.equals(that.detectionTime)
                && Objects.equals(source, that.source)
                && affectedSubjects.equals(that.affectedSubjects)
                && Objects.equals(subjectId, that.subjectId)
                && Objects.equals(subjectRole, that.subjectRole)
                && evidence.equals(that.evidence)
                && responseActionsTaken.equals(that.responseActionsTaken)
                && Objects.equals(assignedTo, that.assignedTo)
                && Objects.equals(resolutionTime, that.resolutionTime)
                && Objects.equals(resolutionNotes, that.resolutionNotes)
                && Objects.equals(resolvedBy, that.resolvedBy)
                && Objects.equals(escalatedAt, that.escalatedAt);
    }

    @Override
    public int hashCode() {
        return incidentId.hashCode();
    }

    @Override
    public String toString() {
        return "SecurityIncident{" +
                "incidentId='" + incidentId + '\'' +
                ", kind=" + kind +
                ", severity=" + severity +
                ", status=" + status +
                ", subjectId='" + subjectId + '\'' +
                ", escalated=" + escalated +
                '}';
    }

    /**
     * Fluent builder. {@code incidentId}, {@code kind}, {@code severity} and
     * {@code detectionTime} are required.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String incidentId;
        private IncidentKind kind;
        private IncidentSeverity severity;
        private IncidentStatus status;
        private List<IncidentStatus> statusHistory;
        private String title;
        private String description;
        private Instant detectionTime;
        private String source;
        private Set<String> affectedSubjects;
        private String subjectId;
        private String subjectRole;
        private List<String> evidence;
        private List<ResponseAction> responseActionsTaken;
        private String assignedTo;
        private Instant resolutionTime;
        private String resolutionNotes;
        private String resolvedBy;
        private boolean escalated;
        private Instant escalatedAt;

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder kind(IncidentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(IncidentSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(IncidentStatus status) {
            this.status = status;
            return this;
        }

        public Builder statusHistory(List<IncidentStatus> statusHistory) {
            this.statusHistory = statusHistory;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder detectionTime(Instant detectionTime) {
            this.detectionTime = detectionTime;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder affectedSubjects(Set<String> affectedSubjects) {
            this.affectedSubjects = affectedSubjects;
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder subjectRole(String subjectRole) {
            this.subjectRole = subjectRole;
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder responseActionsTaken(List<ResponseAction> responseActionsTaken) {
            this.responseActionsTaken = responseActionsTaken;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder resolutionTime(Instant resolutionTime) {
            this.resolutionTime = resolutionTime;
            return this;
        }

        public Builder resolutionNotes(String resolutionNotes) {
            this.resolutionNotes = resolutionNotes;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder escalated(boolean escalated) {
            this.escalated = escalated;
            return this;
        }

        public Builder escalatedAt(Instant escalatedAt) {
            this.escalatedAt = escalatedAt;
            return this;
        }

        public SecurityIncident build() {
            return new SecurityIncident(this);
        }
    }
}
