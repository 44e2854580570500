package com.alertsentinel.core;

import java.util.Objects;

/**
 * Health of a {@link SentinelCore}: healthy unless alert callbacks have
 * exhausted their error budget or too many critical alerts are active.
 *
 * @since 1.0.0
 */
public final class HealthReport {

    private final boolean healthy;
    private final long callbackErrors;
    private final long activeCriticalAlerts;
    private final int openIncidents;
    private final boolean paused;
    private final boolean workersRunning;

    HealthReport(boolean healthy, long callbackErrors, long activeCriticalAlerts, int openIncidents,
            boolean paused, boolean workersRunning) {
        this.healthy = healthy;
        this.callbackErrors = callbackErrors;
        this.activeCriticalAlerts = activeCriticalAlerts;
        this.openIncidents = openIncidents;
        this.paused = paused;
        this.workersRunning = workersRunning;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public long getCallbackErrors() {
        return callbackErrors;
    }

    public long getActiveCriticalAlerts() {
        return activeCriticalAlerts;
    }

    public int getOpenIncidents() {
        return openIncidents;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isWorkersRunning() {
        return workersRunning;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HealthReport that))
            return false;
        return healthy == that.healthy
                && callbackErrors == that.callbackErrors
                && activeCriticalAlerts == that.activeCriticalAlerts
                && openIncidents == that.openIncidents
                && paused == that.paused
                && workersRunning == that.workersRunning;
    }

    @Override
    public int hashCode() {
        return Objects.hash(healthy, callbackErrors, activeCriticalAlerts, openIncidents, paused, workersRunning);
    }

    @Override
    public String toString() {
        return "HealthReport{healthy=" + healthy
                + ", callbackErrors=" + callbackErrors
                + ", activeCriticalAlerts=" + activeCriticalAlerts
                + ", openIncidents=" + openIncidents
                + ", paused=" + paused + '}';
    }
}
