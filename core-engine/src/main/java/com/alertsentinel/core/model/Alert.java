package com.alertsentinel.core.model;

import com.alertsentinel.core.error.StateTransitionException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * De-duplicated alert emitted when a rule fires and every suppression gate
 * passes.
 *
 * <p>
 * Everything except the status is fixed at construction. The status moves
 * once from {@link AlertStatus#ACTIVE} to a terminal state via
 * {@link #transitionTo(AlertStatus, String, Instant)}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. The alert engine mutates its own instances under its lock
 * and hands callers {@link #copy() copies}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = Alert.Builder.class)
public final class Alert {

    private final String alertId;
    private final String ruleId;
    private final String ruleName;
    private final AlertSeverity severity;
    private final Instant timestamp;
    private final String metricName;
    private final double observedValue;
    private final double thresholdValue;
    private final Map<String, String> tags;
    private final int occurrences;
    private final String message;

    private AlertStatus status;
    private String statusReason;
    private Instant statusChangedAt;

    private Alert(Builder builder) {
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.metricName = builder.metricName;
        this.observedValue = builder.observedValue;
        this.thresholdValue = builder.thresholdValue;
        this.tags = builder.tags != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags))
                : Collections.emptyMap();
        this.occurrences = builder.occurrences;
        this.message = builder.message;
        this.status = builder.status != null ? builder.status : AlertStatus.ACTIVE;
        this.statusReason = builder.statusReason;
        this.statusChangedAt = builder.statusChangedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return an independent instance with identical fields
     */
    public Alert copy() {
        return new Builder()
                .alertId(alertId)
                .ruleId(ruleId)
                .ruleName(ruleName)
                .severity(severity)
                .status(status)
                .timestamp(timestamp)
                .metricName(metricName)
                .observedValue(observedValue)
                .thresholdValue(thresholdValue)
                .tags(tags)
                .occurrences(occurrences)
                .message(message)
                .statusReason(statusReason)
                .statusChangedAt(statusChangedAt)
                .build();
    }

    /**
     * Move an active alert to a terminal status.
     *
     * @param target terminal status
     * @param reason free-text reason, may be {@code null}
     * @param at     time of the change
     * @throws StateTransitionException if the alert is no longer active or the
     *                                  target is {@link AlertStatus#ACTIVE}
     */
    public void transitionTo(AlertStatus target, String reason, Instant at) {
        Objects.requireNonNull(target, "target status must not be null");
        if (status != AlertStatus.ACTIVE || !target.isTerminal()) {
            throw new StateTransitionException(
                    "Alert " + alertId + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.statusReason = reason;
        this.statusChangedAt = at;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * @return qualifying observations inside the debounce window when the
     *         alert fired
     */
    public int getOccurrences() {
        return occurrences;
    }

    public String getMessage() {
        return message;
    }

    public String getStatusReason() {
        return statusReason;
    }

    public Instant getStatusChangedAt() {
        return statusChangedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Double.compare(observedValue, alert.observedValue) == 0
                && Double.compare(thresholdValue, alert.thresholdValue) == 0
                && occurrences == alert.occurrences
                && alertId.equals(alert.alertId)
                && ruleId.equals(alert.ruleId)
                && Objects.equals(ruleName, alert.ruleName)
                && severity == alert.severity
                && status == alert.status
                && timestamp.equals(alert.timestamp)
                && Objects.equals(metricName, alert.metricName)
                && tags.equals(alert.tags)
                && Objects.equals(message, alert.message)
                && Objects.equals(statusReason, alert.statusReason)
                && Objects.equals(statusChangedAt, alert.statusChangedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alertId, ruleId, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId='" + alertId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", severity=" + severity +
                ", status=" + status +
                ", timestamp=" + timestamp +
                ", message='" + message + '\'' +
                '}';
    }

    /**
     * Fluent builder for {@link Alert} instances.
     *
     * <p>
     * {@code alertId}, {@code ruleId}, {@code severity} and {@code timestamp}
     * are <strong>required</strong>.
     * </p>
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String alertId;
        private String ruleId;
        private String ruleName;
        private AlertSeverity severity;
        private AlertStatus status;
        private Instant timestamp;
        private String metricName;
        private double observedValue;
        private double thresholdValue;
        private Map<String, String> tags;
        private int occurrences = 1;
        private String message;
        private String statusReason;
        private Instant statusChangedAt;

        public Builder alertId(String alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder thresholdValue(double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder occurrences(int occurrences) {
            this.occurrences = occurrences;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder statusReason(String statusReason) {
            this.statusReason = statusReason;
            return this;
        }

        public Builder statusChangedAt(Instant statusChangedAt) {
            this.statusChangedAt = statusChangedAt;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if a required field is missing
         */
        public Alert build() {
            return new Alert(this);
        }
    }
}
