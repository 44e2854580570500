package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Capacity, window and timing knobs shared by the core components.
 *
 * <p>
 * Every field has a default, so a configuration file may omit the
 * {@code tuning} section entirely or override only a few keys.
 * </p>
 *
 * <h3>Defaults</h3>
 * <table>
 * <caption>Tuning defaults</caption>
 * <tr><td>debounceWindowSeconds</td><td>300</td></tr>
 * <tr><td>adaptiveBlendWeight</td><td>0.2</td></tr>
 * <tr><td>deviationMultiplier</td><td>2.0</td></tr>
 * <tr><td>baselineCapacity / baselineTrim</td><td>100 / 50</td></tr>
 * <tr><td>baselineMinimum</td><td>10</td></tr>
 * <tr><td>metricCapacity / metricTrim</td><td>1000 / 500</td></tr>
 * <tr><td>alertHistoryCapacity / alertHistoryTrim</td><td>1000 / 500</td></tr>
 * <tr><td>lockTimeoutMillis</td><td>5000</td></tr>
 * <tr><td>escalationIntervalSeconds</td><td>60</td></tr>
 * <tr><td>cleanupIntervalSeconds</td><td>3600</td></tr>
 * <tr><td>retentionSeconds</td><td>604800 (7 days)</td></tr>
 * <tr><td>recentIncidentCount</td><td>10</td></tr>
 * <tr><td>callbackErrorBudget</td><td>10</td></tr>
 * <tr><td>criticalAlertLimit</td><td>5</td></tr>
 * <tr><td>staleAlertAgeSeconds</td><td>900</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public class TuningConfig {

    private long debounceWindowSeconds = 300;
    private double adaptiveBlendWeight = 0.2;
    private double deviationMultiplier = 2.0;
    private int baselineCapacity = 100;
    private int baselineTrim = 50;
    private int baselineMinimum = 10;
    private int metricCapacity = 1000;
    private int metricTrim = 500;
    private int alertHistoryCapacity = 1000;
    private int alertHistoryTrim = 500;
    private long lockTimeoutMillis = 5000;
    private long escalationIntervalSeconds = 60;
    private long cleanupIntervalSeconds = 3600;
    private long retentionSeconds = Duration.ofDays(7).toSeconds();
    private int recentIncidentCount = 10;
    private int callbackErrorBudget = 10;
    private int criticalAlertLimit = 5;
    private long staleAlertAgeSeconds = 900;

    /**
     * @return a configuration holding only defaults
     */
    public static TuningConfig defaults() {
        return new TuningConfig();
    }

    /**
     * @throws ValidationException listing every out-of-range value
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (debounceWindowSeconds <= 0) {
            errors.add("'debounceWindowSeconds' must be > 0");
        }
        if (adaptiveBlendWeight <= 0 || adaptiveBlendWeight > 1) {
            errors.add("'adaptiveBlendWeight' must be in (0, 1]");
        }
        if (deviationMultiplier < 0) {
            errors.add("'deviationMultiplier' must be >= 0");
        }
        checkCapacity(errors, "baseline", baselineCapacity, baselineTrim);
        if (baselineMinimum < 2 || baselineMinimum > baselineCapacity) {
            errors.add("'baselineMinimum' must be between 2 and baselineCapacity");
        }
        checkCapacity(errors, "metric", metricCapacity, metricTrim);
        checkCapacity(errors, "alertHistory", alertHistoryCapacity, alertHistoryTrim);
        if (lockTimeoutMillis <= 0) {
            errors.add("'lockTimeoutMillis' must be > 0");
        }
        if (escalationIntervalSeconds <= 0) {
            errors.add("'escalationIntervalSeconds' must be > 0");
        }
        if (cleanupIntervalSeconds <= 0) {
            errors.add("'cleanupIntervalSeconds' must be > 0");
        }
        if (retentionSeconds <= 0) {
            errors.add("'retentionSeconds' must be > 0");
        }
        if (recentIncidentCount < 0) {
            errors.add("'recentIncidentCount' must be >= 0");
        }
        if (callbackErrorBudget < 0) {
            errors.add("'callbackErrorBudget' must be >= 0");
        }
        if (criticalAlertLimit < 0) {
            errors.add("'criticalAlertLimit' must be >= 0");
        }
        if (staleAlertAgeSeconds <= 0) {
            errors.add("'staleAlertAgeSeconds' must be > 0");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid tuning: " + String.join("; ", errors));
        }
    }

    private static void checkCapacity(List<String> errors, String prefix, int capacity, int trim) {
        if (capacity < 1) {
            errors.add("'" + prefix + "Capacity' must be >= 1");
        }
        if (trim < 1 || trim > capacity) {
            errors.add("'" + prefix + "Trim' must be between 1 and " + prefix + "Capacity");
        }
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public Duration debounceWindow() {
        return Duration.ofSeconds(debounceWindowSeconds);
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMillis);
    }

    public Duration escalationInterval() {
        return Duration.ofSeconds(escalationIntervalSeconds);
    }

    public Duration cleanupInterval() {
        return Duration.ofSeconds(cleanupIntervalSeconds);
    }

    public Duration retention() {
        return Duration.ofSeconds(retentionSeconds);
    }

    public Duration staleAlertAge() {
        return Duration.ofSeconds(staleAlertAgeSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public long getDebounceWindowSeconds() {
        return debounceWindowSeconds;
    }

    public void setDebounceWindowSeconds(long debounceWindowSeconds) {
        this.debounceWindowSeconds = debounceWindowSeconds;
    }

    public double getAdaptiveBlendWeight() {
        return adaptiveBlendWeight;
    }

    public void setAdaptiveBlendWeight(double adaptiveBlendWeight) {
        this.adaptiveBlendWeight = adaptiveBlendWeight;
    }

    public double getDeviationMultiplier() {
        return deviationMultiplier;
    }

    public void setDeviationMultiplier(double deviationMultiplier) {
        this.deviationMultiplier = deviationMultiplier;
    }

    public int getBaselineCapacity() {
        return baselineCapacity;
    }

    public void setBaselineCapacity(int baselineCapacity) {
        this.baselineCapacity = baselineCapacity;
    }

    public int getBaselineTrim() {
        return baselineTrim;
    }

    public void setBaselineTrim(int baselineTrim) {
        this.baselineTrim = baselineTrim;
    }

    public int getBaselineMinimum() {
        return baselineMinimum;
    }

    public void setBaselineMinimum(int baselineMinimum) {
        this.baselineMinimum = baselineMinimum;
    }

    public int getMetricCapacity() {
        return metricCapacity;
    }

    public void setMetricCapacity(int metricCapacity) {
        this.metricCapacity = metricCapacity;
    }

    public int getMetricTrim() {
        return metricTrim;
    }

    public void setMetricTrim(int metricTrim) {
        this.metricTrim = metricTrim;
    }

    public int getAlertHistoryCapacity() {
        return alertHistoryCapacity;
    }

    public void setAlertHistoryCapacity(int alertHistoryCapacity) {
        this.alertHistoryCapacity = alertHistoryCapacity;
    }

    public int getAlertHistoryTrim() {
        return alertHistoryTrim;
    }

    public void setAlertHistoryTrim(int alertHistoryTrim) {
        this.alertHistoryTrim = alertHistoryTrim;
    }

    public long getLockTimeoutMillis() {
        return lockTimeoutMillis;
    }

    public void setLockTimeoutMillis(long lockTimeoutMillis) {
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    public long getEscalationIntervalSeconds() {
        return escalationIntervalSeconds;
    }

    public void setEscalationIntervalSeconds(long escalationIntervalSeconds) {
        this.escalationIntervalSeconds = escalationIntervalSeconds;
    }

    public long getCleanupIntervalSeconds() {
        return cleanupIntervalSeconds;
    }

    public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) {
        this.cleanupIntervalSeconds = cleanupIntervalSeconds;
    }

    public long getRetentionSeconds() {
        return retentionSeconds;
    }

    public void setRetentionSeconds(long retentionSeconds) {
        this.retentionSeconds = retentionSeconds;
    }

    public int getRecentIncidentCount() {
        return recentIncidentCount;
    }

    public void setRecentIncidentCount(int recentIncidentCount) {
        this.recentIncidentCount = recentIncidentCount;
    }

    public int getCallbackErrorBudget() {
        return callbackErrorBudget;
    }

    public void setCallbackErrorBudget(int callbackErrorBudget) {
        this.callbackErrorBudget = callbackErrorBudget;
    }

    public int getCriticalAlertLimit() {
        return criticalAlertLimit;
    }

    public void setCriticalAlertLimit(int criticalAlertLimit) {
        this.criticalAlertLimit = criticalAlertLimit;
    }

    public long getStaleAlertAgeSeconds() {
        return staleAlertAgeSeconds;
    }

    public void setStaleAlertAgeSeconds(long staleAlertAgeSeconds) {
        this.staleAlertAgeSeconds = staleAlertAgeSeconds;
    }
}
