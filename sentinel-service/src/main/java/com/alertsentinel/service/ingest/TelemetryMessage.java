package com.alertsentinel.service.ingest;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.MetricSample;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Wire shape of one telemetry record on the sample topic.
 *
 * <pre>
 * {"metricName":"cpu","value":91.5,"timestamp":"2024-05-01T10:00:00Z","tags":{"host":"web-1"}}
 * </pre>
 *
 * <p>
 * {@code timestamp} is optional; the ingestion time is used when absent.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryMessage {

    private String metricName;
    private Double value;
    private Instant timestamp;
    private Map<String, String> tags = new HashMap<>();

    /**
     * @param receivedAt fallback observation time
     * @throws ValidationException if the value is missing or the sample is
     *                             otherwise invalid
     */
    public MetricSample toSample(Instant receivedAt) {
        if (value == null) {
            throw new ValidationException("Telemetry for '" + metricName + "' has no value");
        }
        return new MetricSample(metricName, value, timestamp != null ? timestamp : receivedAt, tags);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (Jackson)
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public void setMetricName(String metricName) {
        this.metricName = metricName;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags != null ? new HashMap<>(tags) : new HashMap<>();
    }
}
