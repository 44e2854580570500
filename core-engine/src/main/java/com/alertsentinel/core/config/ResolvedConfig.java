package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.EscalationPolicy;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.NotificationChannel;
import com.alertsentinel.core.model.RecipientClass;
import com.alertsentinel.core.model.ResponseRule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, enum-typed configuration handed to the core components.
 *
 * <p>
 * Produced by {@link SentinelConfig#resolve()} or assembled directly through
 * {@link #builder()}. Both paths reject duplicate rule ids and duplicate
 * escalation severities.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedConfig {

    private final List<AlertRule> alertRules;
    private final List<ResponseRule> responseRules;
    private final Map<IncidentSeverity, EscalationPolicy> escalationPolicies;
    private final TuningConfig tuning;

    private ResolvedConfig(Builder b) {
        this.alertRules = List.copyOf(b.alertRules);
        this.responseRules = List.copyOf(b.responseRules);
        Map<IncidentSeverity, EscalationPolicy> policies = new EnumMap<>(IncidentSeverity.class);
        for (EscalationPolicy policy : b.escalationPolicies) {
            policies.put(policy.getSeverity(), policy);
        }
        this.escalationPolicies = policies;
        this.tuning = b.tuning;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Escalation policies used when the configuration names none.
     *
     * @return one policy per incident severity
     */
    public static List<EscalationPolicy> defaultEscalationPolicies() {
        return List.of(
                new EscalationPolicy(IncidentSeverity.CRITICAL, true, 0,
                        List.of(RecipientClass.EXECUTIVES, RecipientClass.SECURITY_TEAM),
                        List.of(NotificationChannel.SMS, NotificationChannel.PUSH)),
                new EscalationPolicy(IncidentSeverity.HIGH, false, Duration.ofMinutes(30).toSeconds(),
                        List.of(RecipientClass.MANAGEMENT),
                        List.of(NotificationChannel.EMAIL, NotificationChannel.PUSH)),
                new EscalationPolicy(IncidentSeverity.MEDIUM, false, Duration.ofMinutes(120).toSeconds(),
                        List.of(RecipientClass.SECURITY_TEAM),
                        List.of(NotificationChannel.EMAIL)),
                new EscalationPolicy(IncidentSeverity.LOW, false, Duration.ofMinutes(480).toSeconds(),
                        List.of(RecipientClass.SECURITY_TEAM),
                        List.of(NotificationChannel.EMAIL)));
    }

    public List<AlertRule> getAlertRules() {
        return alertRules;
    }

    public List<ResponseRule> getResponseRules() {
        return responseRules;
    }

    /**
     * @return policies keyed by severity; unmodifiable
     */
    public Map<IncidentSeverity, EscalationPolicy> getEscalationPolicies() {
        return Map.copyOf(escalationPolicies);
    }

    public TuningConfig getTuning() {
        return tuning;
    }

    public static final class Builder {
        private List<AlertRule> alertRules = new ArrayList<>();
        private List<ResponseRule> responseRules = new ArrayList<>();
        private List<EscalationPolicy> escalationPolicies = defaultEscalationPolicies();
        private TuningConfig tuning = TuningConfig.defaults();

        public Builder alertRules(List<AlertRule> alertRules) {
            this.alertRules = new ArrayList<>(Objects.requireNonNull(alertRules, "alertRules must not be null"));
            return this;
        }

        public Builder responseRules(List<ResponseRule> responseRules) {
            this.responseRules = new ArrayList<>(
                    Objects.requireNonNull(responseRules, "responseRules must not be null"));
            return this;
        }

        public Builder escalationPolicies(List<EscalationPolicy> escalationPolicies) {
            this.escalationPolicies = new ArrayList<>(
                    Objects.requireNonNull(escalationPolicies, "escalationPolicies must not be null"));
            return this;
        }

        public Builder tuning(TuningConfig tuning) {
            this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
            return this;
        }

        /**
         * @throws ValidationException on duplicate ids or severities, or
         *                             invalid tuning
         */
        public ResolvedConfig build() {
            List<String> errors = new ArrayList<>();
            SentinelConfig.checkUniqueIds(alertRules.stream().map(AlertRule::getRuleId).toList(),
                    "alert rule", errors);
            SentinelConfig.checkUniqueIds(responseRules.stream().map(ResponseRule::getRuleId).toList(),
                    "response rule", errors);
            SentinelConfig.checkUniqueIds(escalationPolicies.stream().map(p -> p.getSeverity().name()).toList(),
                    "escalation policy severity", errors);
            try {
                tuning.validate();
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid configuration: " + String.join("; ", errors));
            }
            return new ResolvedConfig(this);
        }
    }
}
