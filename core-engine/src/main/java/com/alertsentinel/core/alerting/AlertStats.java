package com.alertsentinel.core.alerting;

import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time counters of the alert rule engine.
 *
 * @since 1.0.0
 */
public final class AlertStats {

    private final int ruleCount;
    private final int totalAlerts;
    private final int activeAlerts;
    private final Map<String, Long> alertsBySeverity;
    private final Map<String, Long> alertsByStatus;
    private final Map<String, Long> alertsByRule;
    private final Map<String, Integer> hourlyCounts;
    private final long samplesEvaluated;
    private final long suppressedByCooldown;
    private final long suppressedByHourlyCap;
    private final long suppressedByDebounce;
    private final long callbackErrors;
    private final int escalatedAlerts;

    AlertStats(int ruleCount, int totalAlerts, int activeAlerts,
            Map<String, Long> alertsBySeverity, Map<String, Long> alertsByStatus,
            Map<String, Long> alertsByRule, Map<String, Integer> hourlyCounts,
            long samplesEvaluated, long suppressedByCooldown, long suppressedByHourlyCap,
            long suppressedByDebounce, long callbackErrors, int escalatedAlerts) {
        this.ruleCount = ruleCount;
        this.totalAlerts = totalAlerts;
        this.activeAlerts = activeAlerts;
        this.alertsBySeverity = Map.copyOf(alertsBySeverity);
        this.alertsByStatus = Map.copyOf(alertsByStatus);
        this.alertsByRule = Map.copyOf(alertsByRule);
        this.hourlyCounts = Map.copyOf(hourlyCounts);
        this.samplesEvaluated = samplesEvaluated;
        this.suppressedByCooldown = suppressedByCooldown;
        this.suppressedByHourlyCap = suppressedByHourlyCap;
        this.suppressedByDebounce = suppressedByDebounce;
        this.callbackErrors = callbackErrors;
        this.escalatedAlerts = escalatedAlerts;
    }

    public int getRuleCount() {
        return ruleCount;
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    /** Retained alerts per lowercase severity name. */
    public Map<String, Long> getAlertsBySeverity() {
        return alertsBySeverity;
    }

    public Map<String, Long> getAlertsByStatus() {
        return alertsByStatus;
    }

    public Map<String, Long> getAlertsByRule() {
        return alertsByRule;
    }

    /** Alerts fired per rule in the latest wall-clock hour the rule has seen. */
    public Map<String, Integer> getHourlyCounts() {
        return hourlyCounts;
    }

    public long getSamplesEvaluated() {
        return samplesEvaluated;
    }

    public long getSuppressedByCooldown() {
        return suppressedByCooldown;
    }

    public long getSuppressedByHourlyCap() {
        return suppressedByHourlyCap;
    }

    public long getSuppressedByDebounce() {
        return suppressedByDebounce;
    }

    public long getCallbackErrors() {
        return callbackErrors;
    }

    public int getEscalatedAlerts() {
        return escalatedAlerts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertStats that))
            return false;
        return ruleCount == that.ruleCount
                && totalAlerts == that.totalAlerts
                && activeAlerts == that.activeAlerts
                && samplesEvaluated == that.samplesEvaluated
                && suppressedByCooldown == that.suppressedByCooldown
                && suppressedByHourlyCap == that.suppressedByHourlyCap
                && suppressedByDebounce == that.suppressedByDebounce
                && callbackErrors == that.callbackErrors
                && escalatedAlerts == that.escalatedAlerts
                && alertsBySeverity.equals(that.alertsBySeverity)
                && alertsByStatus.equals(that.alertsByStatus)
                && alertsByRule.equals(that.alertsByRule)
                && hourlyCounts.equals(that.hourlyCounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleCount, totalAlerts, activeAlerts, alertsBySeverity, alertsByStatus,
                alertsByRule, hourlyCounts, samplesEvaluated, callbackErrors);
    }

    @Override
    public String toString() {
        return "AlertStats{" +
                "rules=" + ruleCount +
                ", total=" + totalAlerts +
                ", active=" + activeAlerts +
                ", bySeverity=" + alertsBySeverity +
                ", samplesEvaluated=" + samplesEvaluated +
                ", callbackErrors=" + callbackErrors +
                '}';
    }
}
