package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps incident characteristics to an ordered list of automatic actions.
 *
 * <p>
 * A rule applies to an incident when the kind matches, the incident severity
 * ranks at or above {@code severityFloor}, the optional subject-role filter
 * equals the incident's subject role, and the {@link IncidentCondition}
 * holds. Immutable; {@link #withEnabled(boolean)} returns a toggled copy.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = ResponseRule.Builder.class)
public final class ResponseRule {

    private final String ruleId;
    private final String name;
    private final String description;
    private final IncidentKind incidentKind;
    private final IncidentSeverity severityFloor;
    private final IncidentCondition condition;
    private final List<ResponseAction> actions;
    private final String subjectRole;
    private final boolean enabled;

    private ResponseRule(Builder b) {
        this.ruleId = b.ruleId;
        this.name = b.name != null && !b.name.isBlank() ? b.name : b.ruleId;
        this.description = b.description;
        this.incidentKind = b.incidentKind;
        this.severityFloor = b.severityFloor;
        this.condition = b.condition != null ? b.condition : IncidentCondition.always();
        this.actions = List.copyOf(b.actions);
        this.subjectRole = b.subjectRole != null && !b.subjectRole.isBlank() ? b.subjectRole : null;
        this.enabled = b.enabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ResponseRule withEnabled(boolean enabled) {
        return new Builder()
                .ruleId(ruleId)
                .name(name)
                .description(description)
                .incidentKind(incidentKind)
                .severityFloor(severityFloor)
                .condition(condition)
                .actions(actions)
                .subjectRole(subjectRole)
                .enabled(enabled)
                .build();
    }

    /**
     * @param incident incident to test
     * @return whether this rule applies, ignoring {@link #isEnabled()}
     */
    public boolean matches(SecurityIncident incident) {
        if (incident.getKind() != incidentKind) {
            return false;
        }
        if (!incident.getSeverity().isAtLeast(severityFloor)) {
            return false;
        }
        if (subjectRole != null && !subjectRole.equalsIgnoreCase(incident.getSubjectRole())) {
            return false;
        }
        return condition.test(incident);
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public IncidentKind getIncidentKind() {
        return incidentKind;
    }

    public IncidentSeverity getSeverityFloor() {
        return severityFloor;
    }

    public IncidentCondition getCondition() {
        return condition;
    }

    public List<ResponseAction> getActions() {
        return actions;
    }

    public String getSubjectRole() {
        return subjectRole;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResponseRule that))
            return false;
        return enabled == that.enabled
                && ruleId.equals(that.ruleId)
                && Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && incidentKind == that.incidentKind
                && severityFloor == that.severityFloor
                && condition.equals(that.condition)
                && actions.equals(that.actions)
                && Objects.equals(subjectRole, that.subjectRole);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, incidentKind, severityFloor, actions);
    }

    @Override
    public String toString() {
        return "ResponseRule{" +
                "ruleId='" + ruleId + '\'' +
                ", incidentKind=" + incidentKind +
                ", severityFloor=" + severityFloor +
                ", subjectRole='" + subjectRole + '\'' +
                ", actions=" + actions +
                ", enabled=" + enabled +
                '}';
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String ruleId;
        private String name;
        private String description;
        private IncidentKind incidentKind;
        private IncidentSeverity severityFloor = IncidentSeverity.LOW;
        private IncidentCondition condition;
        private List<ResponseAction> actions = new ArrayList<>();
        private String subjectRole;
        private boolean enabled = true;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder incidentKind(IncidentKind incidentKind) {
            this.incidentKind = incidentKind;
            return this;
        }

        public Builder severityFloor(IncidentSeverity severityFloor) {
            this.severityFloor = severityFloor;
            return this;
        }

        public Builder condition(IncidentCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder actions(List<ResponseAction> actions) {
            this.actions = actions != null ? new ArrayList<>(actions) : new ArrayList<>();
            return this;
        }

        public Builder subjectRole(String subjectRole) {
            this.subjectRole = subjectRole;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * @throws ValidationException if the id, kind, floor or actions are
         *                             missing
         */
        public ResponseRule build() {
            List<String> errors = new ArrayList<>();
            if (ruleId == null || ruleId.isBlank()) {
                errors.add("'ruleId' is required");
            }
            String label = ruleId == null ? "<unnamed>" : ruleId;
            if (incidentKind == null) {
                errors.add("Response rule '" + label + "' requires 'incidentKind'");
            }
            if (severityFloor == null) {
                errors.add("Response rule '" + label + "' requires 'severityFloor'");
            }
            if (actions.isEmpty()) {
                errors.add("Response rule '" + label + "' requires at least one action");
            } else if (actions.contains(null)) {
                errors.add("Response rule '" + label + "' contains a null action");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid ResponseRule: " + String.join("; ", errors));
            }
            return new ResponseRule(this);
        }
    }
}
