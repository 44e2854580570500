package com.alertsentinel.core.alerting;

import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertRule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializable copy of everything the {@link AlertRuleEngine} owns: rules
 * with their live thresholds, per-rule gate state, alert history and
 * counters.
 *
 * @since 1.0.0
 */
public class AlertEngineState {

    private List<AlertRule> rules = new ArrayList<>();
    private List<RuleGateState> ruleStates = new ArrayList<>();
    private List<Alert> alerts = new ArrayList<>();
    private List<String> escalatedAlertIds = new ArrayList<>();
    private long samplesEvaluated;
    private long suppressedByCooldown;
    private long suppressedByHourlyCap;
    private long suppressedByDebounce;
    private long callbackErrors;

    public List<AlertRule> getRules() {
        return rules;
    }

    public void setRules(List<AlertRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<RuleGateState> getRuleStates() {
        return ruleStates;
    }

    public void setRuleStates(List<RuleGateState> ruleStates) {
        this.ruleStates = ruleStates != null ? new ArrayList<>(ruleStates) : new ArrayList<>();
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public void setAlerts(List<Alert> alerts) {
        this.alerts = alerts != null ? new ArrayList<>(alerts) : new ArrayList<>();
    }

    public List<String> getEscalatedAlertIds() {
        return escalatedAlertIds;
    }

    public void setEscalatedAlertIds(List<String> escalatedAlertIds) {
        this.escalatedAlertIds = escalatedAlertIds != null ? new ArrayList<>(escalatedAlertIds) : new ArrayList<>();
    }

    public long getSamplesEvaluated() {
        return samplesEvaluated;
    }

    public void setSamplesEvaluated(long samplesEvaluated) {
        this.samplesEvaluated = samplesEvaluated;
    }

    public long getSuppressedByCooldown() {
        return suppressedByCooldown;
    }

    public void setSuppressedByCooldown(long suppressedByCooldown) {
        this.suppressedByCooldown = suppressedByCooldown;
    }

    public long getSuppressedByHourlyCap() {
        return suppressedByHourlyCap;
    }

    public void setSuppressedByHourlyCap(long suppressedByHourlyCap) {
        this.suppressedByHourlyCap = suppressedByHourlyCap;
    }

    public long getSuppressedByDebounce() {
        return suppressedByDebounce;
    }

    public void setSuppressedByDebounce(long suppressedByDebounce) {
        this.suppressedByDebounce = suppressedByDebounce;
    }

    public long getCallbackErrors() {
        return callbackErrors;
    }

    public void setCallbackErrors(long callbackErrors) {
        this.callbackErrors = callbackErrors;
    }

    /**
     * Gate bookkeeping of one rule.
     */
    public static class RuleGateState {

        private String ruleId;
        private Instant lastFired;
        private List<Instant> occurrences = new ArrayList<>();
        private List<Instant> fireHistory = new ArrayList<>();
        private List<Double> baseline = new ArrayList<>();

        public String getRuleId() {
            return ruleId;
        }

        public void setRuleId(String ruleId) {
            this.ruleId = ruleId;
        }

        public Instant getLastFired() {
            return lastFired;
        }

        public void setLastFired(Instant lastFired) {
            this.lastFired = lastFired;
        }

        public List<Instant> getOccurrences() {
            return occurrences;
        }

        public void setOccurrences(List<Instant> occurrences) {
            this.occurrences = occurrences != null ? new ArrayList<>(occurrences) : new ArrayList<>();
        }

        public List<Instant> getFireHistory() {
            return fireHistory;
        }

        public void setFireHistory(List<Instant> fireHistory) {
            this.fireHistory = fireHistory != null ? new ArrayList<>(fireHistory) : new ArrayList<>();
        }

        public List<Double> getBaseline() {
            return baseline;
        }

        public void setBaseline(List<Double> baseline) {
            this.baseline = baseline != null ? new ArrayList<>(baseline) : new ArrayList<>();
        }
    }
}
