package com.alertsentinel.core.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only record of one executed response action. Never mutated after
 * creation.
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = ResponseRecord.Builder.class)
public final class ResponseRecord {

    private final String recordId;
    private final String incidentId;
    private final ResponseAction action;
    private final Instant timestamp;
    private final String performedBy;
    private final String description;
    private final boolean success;
    private final Map<String, String> details;

    private ResponseRecord(Builder b) {
        this.recordId = Objects.requireNonNull(b.recordId, "recordId must not be null");
        this.incidentId = Objects.requireNonNull(b.incidentId, "incidentId must not be null");
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.performedBy = b.performedBy;
        this.description = b.description;
        this.success = b.success;
        this.details = b.details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.details))
                : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRecordId() {
        return recordId;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public ResponseAction getAction() {
        return action;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getPerformedBy() {
        return performedBy;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResponseRecord that))
            return false;
        return success == that.success
                && recordId.equals(that.recordId)
                && incidentId.equals(that.incidentId)
                && action == that.action
                && timestamp.equals(that.timestamp)
                && Objects.equals(performedBy, that.performedBy)
                && Objects.equals(description, that.description)
                && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return recordId.hashCode();
    }

    @Override
    public String toString() {
        return "ResponseRecord{" +
                "incidentId='" + incidentId + '\'' +
                ", action=" + action +
                ", success=" + success +
                ", performedBy='" + performedBy + '\'' +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String recordId;
        private String incidentId;
        private ResponseAction action;
        private Instant timestamp;
        private String performedBy;
        private String description;
        private boolean success;
        private Map<String, String> details;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder incidentId(String incidentId) {
            this.incidentId = incidentId;
            return this;
        }

        public Builder action(ResponseAction action) {
            this.action = action;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder performedBy(String performedBy) {
            this.performedBy = performedBy;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder details(Map<String, String> details) {
            this.details = details;
            return this;
        }

        public ResponseRecord build() {
            return new ResponseRecord(this);
        }
    }
}
