package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.IncidentCondition;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML shape of a response rule.
 *
 * <pre>
 * responseRules:
 *   - ruleId: malware_response
 *     incidentKind: malware
 *     severityFloor: medium
 *     subjectRole: child
 *     condition:
 *       evidenceRequired: false
 *     actions: [isolate, quarantine, notify-subject-group]
 * </pre>
 *
 * @since 1.0.0
 */
public class ResponseRuleDefinition {

    private String ruleId;
    private String name;
    private String description;
    private String incidentKind;
    private String severityFloor = "low";
    private Map<String, Object> condition = new LinkedHashMap<>();
    private List<String> actions = new ArrayList<>();
    private String subjectRole;
    private boolean enabled = true;

    /**
     * @return the resolved rule
     * @throws ValidationException listing every problem found
     */
    public ResponseRule toRule() {
        List<String> errors = new ArrayList<>();
        String label = ruleId == null ? "<unnamed>" : ruleId;

        IncidentKind kind = null;
        try {
            kind = IncidentKind.parse(incidentKind);
        } catch (ValidationException e) {
            errors.add("Response rule '" + label + "': " + e.getMessage());
        }
        IncidentSeverity floor = null;
        try {
            floor = IncidentSeverity.parse(severityFloor);
        } catch (ValidationException e) {
            errors.add("Response rule '" + label + "': " + e.getMessage());
        }
        IncidentCondition predicate = null;
        try {
            predicate = IncidentCondition.parse(condition);
        } catch (ValidationException e) {
            errors.add("Response rule '" + label + "': " + e.getMessage());
        }
        List<ResponseAction> resolved = new ArrayList<>();
        for (String raw : actions) {
            try {
                resolved.add(ResponseAction.parse(raw));
            } catch (ValidationException e) {
                errors.add("Response rule '" + label + "': " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }

        return ResponseRule.builder()
                .ruleId(ruleId)
                .name(name)
                .description(description)
                .incidentKind(kind)
                .severityFloor(floor)
                .condition(predicate)
                .actions(resolved)
                .subjectRole(subjectRole)
                .enabled(enabled)
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getIncidentKind() {
        return incidentKind;
    }

    public void setIncidentKind(String incidentKind) {
        this.incidentKind = incidentKind;
    }

    public String getSeverityFloor() {
        return severityFloor;
    }

    public void setSeverityFloor(String severityFloor) {
        this.severityFloor = severityFloor;
    }

    public Map<String, Object> getCondition() {
        return condition;
    }

    public void setCondition(Map<String, Object> condition) {
        this.condition = condition != null ? new LinkedHashMap<>(condition) : new LinkedHashMap<>();
    }

    public List<String> getActions() {
        return actions;
    }

    public void setActions(List<String> actions) {
        this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
    }

    public String getSubjectRole() {
        return subjectRole;
    }

    public void setSubjectRole(String subjectRole) {
        this.subjectRole = subjectRole;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
