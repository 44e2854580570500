package com.alertsentinel.core.incident;

import com.alertsentinel.core.model.ResponseStats;
import com.alertsentinel.core.model.SecurityIncident;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only aggregation over the incidents of one subject, or of all
 * subjects when {@link #getSubjectId()} is {@code null}.
 *
 * @since 1.0.0
 */
public final class IncidentSummary {

    private final String subjectId;
    private final int totalIncidents;
    private final int openIncidents;
    private final int resolvedIncidents;
    private final int closedIncidents;
    private final int escalatedIncidents;
    private final Map<String, Long> bySeverity;
    private final Map<String, Long> byKind;
    private final Map<String, Long> byStatus;
    private final List<SecurityIncident> recentIncidents;
    private final ResponseStats responseStats;

    IncidentSummary(String subjectId, int totalIncidents, int openIncidents, int resolvedIncidents,
            int closedIncidents, int escalatedIncidents, Map<String, Long> bySeverity,
            Map<String, Long> byKind, Map<String, Long> byStatus, List<SecurityIncident> recentIncidents,
            ResponseStats responseStats) {
        this.subjectId = subjectId;
        this.totalIncidents = totalIncidents;
        this.openIncidents = openIncidents;
        this.resolvedIncidents = resolvedIncidents;
        this.closedIncidents = closedIncidents;
        this.escalatedIncidents = escalatedIncidents;
        this.bySeverity = Map.copyOf(bySeverity);
        this.byKind = Map.copyOf(byKind);
        this.byStatus = Map.copyOf(byStatus);
        this.recentIncidents = List.copyOf(recentIncidents);
        this.responseStats = Objects.requireNonNull(responseStats, "responseStats must not be null");
    }

    /**
     * @return a copy carrying {@code stats} instead of the current response
     *         counters
     */
    public IncidentSummary withResponseStats(ResponseStats stats) {
        return new IncidentSummary(subjectId, totalIncidents, openIncidents, resolvedIncidents, closedIncidents,
                escalatedIncidents, bySeverity, byKind, byStatus, recentIncidents, stats);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public int getTotalIncidents() {
        return totalIncidents;
    }

    public int getOpenIncidents() {
        return openIncidents;
    }

    public int getResolvedIncidents() {
        return resolvedIncidents;
    }

    public int getClosedIncidents() {
        return closedIncidents;
    }

    public int getEscalatedIncidents() {
        return escalatedIncidents;
    }

    public Map<String, Long> getBySeverity() {
        return bySeverity;
    }

    public Map<String, Long> getByKind() {
        return byKind;
    }

    public Map<String, Long> getByStatus() {
        return byStatus;
    }

    /** Most recent incidents first. */
    public List<SecurityIncident> getRecentIncidents() {
        return recentIncidents;
    }

    public ResponseStats getResponseStats() {
        return responseStats;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentSummary that))
            return false;
        return totalIncidents == that.totalIncidents
                && openIncidents == that.openIncidents
                && resolvedIncidents == that.resolvedIncidents
                && closedIncidents == that.closedIncidents
                && escalatedIncidents == that.escalatedIncidents
                && Objects.equals(subjectId, that.subjectId)
                && bySeverity.equals(that.bySeverity)
                && byKind.equals(that.byKind)
                && byStatus.equals(that.byStatus)
                && recentIncidents.equals(that.recentIncidents)
                && responseStats.equals(that.responseStats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectId, totalIncidents, openIncidents, bySeverity, byKind, byStatus);
    }

    @Override
    public String toString() {
        return "IncidentSummary{" +
                "subjectId='" + subjectId + '\'' +
                ", total=" + totalIncidents +
                ", open=" + openIncidents +
                ", resolved=" + resolvedIncidents +
                ", closed=" + closedIncidents +
                ", bySeverity=" + bySeverity +
                '}';
    }
}
