package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.IncidentKind;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML shape of an alert rule. Every enum-valued field is a string here and
 * is resolved by {@link #toRule()}.
 *
 * <pre>
 * alertRules:
 *   - ruleId: high_cpu
 *     metricName: cpu
 *     comparator: "&gt;"
 *     threshold: 80
 *     severity: warning
 *     cooldownSeconds: 300
 *     minOccurrences: 1
 *     maxAlertsPerHour: 5
 * </pre>
 *
 * @since 1.0.0
 */
public class AlertRuleDefinition {

    private String ruleId;
    private String name;
    private String metricName;
    private String comparator = ">";
    private Double threshold;
    private String severity = "warning";
    private long cooldownSeconds = 300;
    private int minOccurrences = 1;
    private int maxAlertsPerHour = 10;
    private boolean adaptive;
    private String incidentKind;

    /**
     * Resolve this definition into an immutable rule.
     *
     * @return the resolved rule
     * @throws ValidationException listing every problem found
     */
    public AlertRule toRule() {
        List<String> errors = new ArrayList<>();
        String label = ruleId == null ? "<unnamed>" : ruleId;

        ComparisonOperator op = null;
        try {
            op = ComparisonOperator.fromSymbol(comparator);
        } catch (ValidationException e) {
            errors.add("Alert rule '" + label + "': " + e.getMessage());
        }
        AlertSeverity sev = null;
        try {
            sev = AlertSeverity.parse(severity);
        } catch (ValidationException e) {
            errors.add("Alert rule '" + label + "': " + e.getMessage());
        }
        IncidentKind kind = null;
        if (incidentKind != null && !incidentKind.isBlank()) {
            try {
                kind = IncidentKind.parse(incidentKind);
            } catch (ValidationException e) {
                errors.add("Alert rule '" + label + "': " + e.getMessage());
            }
        }
        if (threshold == null) {
            errors.add("Alert rule '" + label + "' requires 'threshold'");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }

        return AlertRule.builder()
                .ruleId(ruleId)
                .name(name)
                .metricName(metricName)
                .comparator(op)
                .threshold(threshold)
                .severity(sev)
                .cooldownSeconds(cooldownSeconds)
                .minOccurrences(minOccurrences)
                .maxAlertsPerHour(maxAlertsPerHour)
                .adaptive(adaptive)
                .incidentKind(kind)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public String getComparator() {
        return comparator;
    }

    public void setComparator(String comparator) {
        this.comparator = comparator;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public int getMinOccurrences() {
        return minOccurrences;
    }

    public void setMinOccurrences(int minOccurrences) {
        this.minOccurrences = minOccurrences;
    }

    public int getMaxAlertsPerHour() {
        return maxAlertsPerHour;
    }

    public void setMaxAlertsPerHour(int maxAlertsPerHour) {
        this.maxAlertsPerHour = maxAlertsPerHour;
    }

    public boolean isAdaptive() {
        return adaptive;
    }

    public void setAdaptive(boolean adaptive) {
        this.adaptive = adaptive;
    }

    public String getIncidentKind() {
        return incidentKind;
    }

    public void setIncidentKind(String incidentKind) {
        this.incidentKind = incidentKind;
    }
}
