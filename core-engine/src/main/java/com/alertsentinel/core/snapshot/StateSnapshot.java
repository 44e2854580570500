package com.alertsentinel.core.snapshot;

import com.alertsentinel.core.alerting.AlertEngineState;
import com.alertsentinel.core.model.MetricSample;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.response.ResponseEngineState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full in-memory state of a core instance: alert rules and history,
 * incidents, response rules and records, and retained metric samples.
 *
 * @since 1.0.0
 */
public class StateSnapshot {

    /** Bumped whenever the layout changes incompatibly. */
    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private Instant exportedAt;
    private AlertEngineState alerting = new AlertEngineState();
    private List<SecurityIncident> incidents = new ArrayList<>();
    private ResponseEngineState response = new ResponseEngineState();
    private Map<String, List<MetricSample>> metrics = new LinkedHashMap<>();

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public Instant getExportedAt() {
        return exportedAt;
    }

    public void setExportedAt(Instant exportedAt) {
        this.exportedAt = exportedAt;
    }

    public AlertEngineState getAlerting() {
        return alerting;
    }

    public void setAlerting(AlertEngineState alerting) {
        this.alerting = alerting != null ? alerting : new AlertEngineState();
    }

    public List<SecurityIncident> getIncidents() {
        return incidents;
    }

    public void setIncidents(List<SecurityIncident> incidents) {
        this.incidents = incidents != null ? new ArrayList<>(incidents) : new ArrayList<>();
    }

    public ResponseEngineState getResponse() {
        return response;
    }

    public void setResponse(ResponseEngineState response) {
        this.response = response != null ? response : new ResponseEngineState();
    }

    public Map<String, List<MetricSample>> getMetrics() {
        return metrics;
    }

    public void setMetrics(Map<String, List<MetricSample>> metrics) {
        this.metrics = metrics != null ? new LinkedHashMap<>(metrics) : new LinkedHashMap<>();
    }
}
