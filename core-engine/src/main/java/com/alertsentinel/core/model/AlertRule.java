package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Threshold rule evaluated against every sample of one metric.
 *
 * <p>
 * Instances are immutable. The live threshold of an adaptive rule is tracked
 * by the alert engine, which starts from {@link #getThreshold()} and blends it
 * toward the observed baseline.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code ruleId} and {@code metricName} are non-blank</li>
 * <li>{@code cooldownSeconds >= 0}</li>
 * <li>{@code minOccurrences >= 1}</li>
 * <li>{@code maxAlertsPerHour >= 1}</li>
 * <li>{@code threshold} is finite</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AlertRule.Builder.class)
public final class AlertRule {

    private final String ruleId;
    private final String name;
    private final String metricName;
    private final ComparisonOperator comparator;
    private final double threshold;
    private final AlertSeverity severity;
    private final long cooldownSeconds;
    private final int minOccurrences;
    private final int maxAlertsPerHour;
    private final boolean adaptive;
    private final IncidentKind incidentKind;

    private AlertRule(Builder b) {
        this.ruleId = b.ruleId;
        this.name = b.name != null && !b.name.isBlank() ? b.name : b.ruleId;
        this.metricName = b.metricName;
        this.comparator = b.comparator;
        this.threshold = b.threshold;
        this.severity = b.severity;
        this.cooldownSeconds = b.cooldownSeconds;
        this.minOccurrences = b.minOccurrences;
        this.maxAlertsPerHour = b.maxAlertsPerHour;
        this.adaptive = b.adaptive;
        this.incidentKind = b.incidentKind;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this rule's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .ruleId(ruleId)
                .name(name)
                .metricName(metricName)
                .comparator(comparator)
                .threshold(threshold)
                .severity(severity)
                .cooldownSeconds(cooldownSeconds)
                .minOccurrences(minOccurrences)
                .maxAlertsPerHour(maxAlertsPerHour)
                .adaptive(adaptive)
                .incidentKind(incidentKind);
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getName() {
        return name;
    }

    public String getMetricName() {
        return metricName;
    }

    public ComparisonOperator getComparator() {
        return comparator;
    }

    public double getThreshold() {
        return threshold;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public int getMinOccurrences() {
        return minOccurrences;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public boolean isAdaptive() {
        return adaptive;
    }

    /**
     * @return kind of incident raised when this rule fires, or {@code null} if
     *         the rule only produces alerts
     */
    public IncidentKind getIncidentKind() {
        return incidentKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && cooldownSeconds == that.cooldownSeconds
                && minOccurrences == that.minOccurrences
                && maxAlertsPerHour == that.maxAlertsPerHour
                && adaptive == that.adaptive
                && ruleId.equals(that.ruleId)
                && Objects.equals(name, that.name)
                && metricName.equals(that.metricName)
                && comparator == that.comparator
                && severity == that.severity
                && incidentKind == that.incidentKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, metricName, comparator, threshold, severity);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "ruleId='" + ruleId + '\'' +
                ", metricName='" + metricName + '\'' +
                ", comparator=" + comparator.symbol() +
                ", threshold=" + threshold +
                ", severity=" + severity +
                ", cooldownSeconds=" + cooldownSeconds +
                ", minOccurrences=" + minOccurrences +
                ", maxAlertsPerHour=" + maxAlertsPerHour +
                ", adaptive=" + adaptive +
                '}';
    }

    /**
     * Fluent builder. {@link #build()} validates every invariant and reports
     * all violations at once.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String ruleId;
        private String name;
        private String metricName;
        private ComparisonOperator comparator = ComparisonOperator.GREATER_THAN;
        private double threshold;
        private AlertSeverity severity = AlertSeverity.WARNING;
        private long cooldownSeconds = 300;
        private int minOccurrences = 1;
        private int maxAlertsPerHour = 10;
        private boolean adaptive;
        private IncidentKind incidentKind;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder comparator(ComparisonOperator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder cooldownSeconds(long cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
            return this;
        }

        public Builder minOccurrences(int minOccurrences) {
            this.minOccurrences = minOccurrences;
            return this;
        }

        public Builder maxAlertsPerHour(int maxAlertsPerHour) {
            this.maxAlertsPerHour = maxAlertsPerHour;
            return this;
        }

        public Builder adaptive(boolean adaptive) {
            this.adaptive = adaptive;
            return this;
        }

        public Builder incidentKind(IncidentKind incidentKind) {
            this.incidentKind = incidentKind;
            return this;
        }

        /**
         * @return a validated rule
         * @throws ValidationException listing every violated invariant
         */
        public AlertRule build() {
            List<String> errors = new ArrayList<>();
            if (ruleId == null || ruleId.isBlank()) {
                errors.add("'ruleId' is required");
            }
            String label = ruleId == null ? "<unnamed>" : ruleId;
            if (metricName == null || metricName.isBlank()) {
                errors.add("Rule '" + label + "' requires 'metricName'");
            }
            if (comparator == null) {
                errors.add("Rule '" + label + "' requires 'comparator'");
            }
            if (severity == null) {
                errors.add("Rule '" + label + "' requires 'severity'");
            }
            if (!Double.isFinite(threshold)) {
                errors.add("Rule '" + label + "' requires a finite 'threshold'");
            }
            if (cooldownSeconds < 0) {
                errors.add("Rule '" + label + "' requires 'cooldownSeconds' >= 0, got: " + cooldownSeconds);
            }
            if (minOccurrences < 1) {
                errors.add("Rule '" + label + "' requires 'minOccurrences' >= 1, got: " + minOccurrences);
            }
            if (maxAlertsPerHour < 1) {
                errors.add("Rule '" + label + "' requires 'maxAlertsPerHour' >= 1, got: " + maxAlertsPerHour);
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid AlertRule: " + String.join("; ", errors));
            }
            return new AlertRule(this);
        }
    }
}
