package com.alertsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Counters over all response records, used to surface systemic collaborator
 * failures without failing individual calls.
 *
 * @since 1.0.0
 */
public final class ResponseStats {

    private final long totalRecords;
    private final long failedRecords;
    private final long notificationsSent;
    private final long notificationFailures;
    private final Map<String, Long> recordsByAction;

    @JsonCreator
    public ResponseStats(@JsonProperty("totalRecords") long totalRecords,
            @JsonProperty("failedRecords") long failedRecords,
            @JsonProperty("notificationsSent") long notificationsSent,
            @JsonProperty("notificationFailures") long notificationFailures,
            @JsonProperty("recordsByAction") Map<String, Long> recordsByAction) {
        this.totalRecords = totalRecords;
        this.failedRecords = failedRecords;
        this.notificationsSent = notificationsSent;
        this.notificationFailures = notificationFailures;
        this.recordsByAction = recordsByAction != null ? Map.copyOf(recordsByAction) : Map.of();
    }

    public static ResponseStats empty() {
        return new ResponseStats(0, 0, 0, 0, Map.of());
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public long getFailedRecords() {
        return failedRecords;
    }

    public long getNotificationsSent() {
        return notificationsSent;
    }

    public long getNotificationFailures() {
        return notificationFailures;
    }

    public Map<String, Long> getRecordsByAction() {
        return recordsByAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResponseStats that))
            return false;
        return totalRecords == that.totalRecords
                && failedRecords == that.failedRecords
                && notificationsSent == that.notificationsSent
                && notificationFailures == that.notificationFailures
                && recordsByAction.equals(that.recordsByAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalRecords, failedRecords, notificationsSent, notificationFailures, recordsByAction);
    }

    @Override
    public String toString() {
        return "ResponseStats{total=" + totalRecords + ", failed=" + failedRecords
                + ", notificationsSent=" + notificationsSent
                + ", notificationFailures=" + notificationFailures + '}';
    }
}
