package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.EscalationPolicy;
import com.alertsentinel.core.model.ResponseRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * alertRules:
 *   - ruleId: high_cpu
 *     metricName: cpu
 *     comparator: "&gt;"
 *     threshold: 80
 * responseRules:
 *   - ruleId: malware_response
 *     incidentKind: malware
 *     severityFloor: medium
 *     actions: [isolate, notify-subject-group]
 * escalationPolicies:
 *   - severity: critical
 *     escalateImmediately: true
 *     contactClasses: [executives]
 * tuning:
 *   debounceWindowSeconds: 300
 * </pre>
 *
 * <p>
 * Call {@link #resolve()} to validate every section and obtain the
 * enum-typed model. Nothing is returned unless every section is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private List<AlertRuleDefinition> alertRules = new ArrayList<>();
    private List<ResponseRuleDefinition> responseRules = new ArrayList<>();
    private List<EscalationPolicyDefinition> escalationPolicies = new ArrayList<>();
    private TuningConfig tuning = new TuningConfig();

    /**
     * Validate the whole configuration and resolve it.
     *
     * <p>
     * Collects all errors and throws a single exception if any section is
     * invalid.
     * </p>
     *
     * @return resolved configuration
     * @throws ValidationException listing every problem found
     */
    public ResolvedConfig resolve() {
        List<String> errors = new ArrayList<>();

        List<AlertRule> resolvedAlertRules = new ArrayList<>();
        for (int i = 0; i < alertRules.size(); i++) {
            AlertRuleDefinition def = alertRules.get(i);
            if (def == null) {
                errors.add("Alert rule at index " + i + " is null");
                continue;
            }
            try {
                resolvedAlertRules.add(def.toRule());
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
        }

        List<ResponseRule> resolvedResponseRules = new ArrayList<>();
        for (int i = 0; i < responseRules.size(); i++) {
            ResponseRuleDefinition def = responseRules.get(i);
            if (def == null) {
                errors.add("Response rule at index " + i + " is null");
                continue;
            }
            try {
                resolvedResponseRules.add(def.toRule());
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
        }

        List<EscalationPolicy> resolvedPolicies = new ArrayList<>();
        for (int i = 0; i < escalationPolicies.size(); i++) {
            EscalationPolicyDefinition def = escalationPolicies.get(i);
            if (def == null) {
                errors.add("Escalation policy at index " + i + " is null");
                continue;
            }
            try {
                resolvedPolicies.add(def.toPolicy());
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
        }

        try {
            tuning.validate();
        } catch (ValidationException e) {
            errors.add(e.getMessage());
        }
        checkUniqueIds(resolvedAlertRules.stream().map(AlertRule::getRuleId).toList(), "alert rule", errors);
        checkUniqueIds(resolvedResponseRules.stream().map(ResponseRule::getRuleId).toList(), "response rule",
                errors);
        checkUniqueIds(resolvedPolicies.stream().map(p -> p.getSeverity().name()).toList(),
                "escalation policy severity", errors);

        if (!errors.isEmpty()) {
            throw new ValidationException(
                    "Sentinel configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }

        return ResolvedConfig.builder()
                .alertRules(resolvedAlertRules)
                .responseRules(resolvedResponseRules)
                .escalationPolicies(resolvedPolicies.isEmpty()
                        ? ResolvedConfig.defaultEscalationPolicies()
                        : resolvedPolicies)
                .tuning(tuning)
                .build();
    }

    static void checkUniqueIds(List<String> ids, String what, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (!seen.add(id)) {
                errors.add("Duplicate " + what + " id: '" + id + "'");
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public List<AlertRuleDefinition> getAlertRules() {
        return Collections.unmodifiableList(alertRules);
    }

    public void setAlertRules(List<AlertRuleDefinition> alertRules) {
        this.alertRules = alertRules != null ? new ArrayList<>(alertRules) : new ArrayList<>();
    }

    public List<ResponseRuleDefinition> getResponseRules() {
        return Collections.unmodifiableList(responseRules);
    }

    public void setResponseRules(List<ResponseRuleDefinition> responseRules) {
        this.responseRules = responseRules != null ? new ArrayList<>(responseRules) : new ArrayList<>();
    }

    public List<EscalationPolicyDefinition> getEscalationPolicies() {
        return Collections.unmodifiableList(escalationPolicies);
    }

    public void setEscalationPolicies(List<EscalationPolicyDefinition> escalationPolicies) {
        this.escalationPolicies = escalationPolicies != null ? new ArrayList<>(escalationPolicies)
                : new ArrayList<>();
    }

    public TuningConfig getTuning() {
        return tuning;
    }

    public void setTuning(TuningConfig tuning) {
        this.tuning = tuning != null ? tuning : new TuningConfig();
    }

    @Override
    public String toString() {
        return "SentinelConfig{alertRules=" + alertRules.size()
                + ", responseRules=" + responseRules.size()
                + ", escalationPolicies=" + escalationPolicies.size() + '}';
    }
}
