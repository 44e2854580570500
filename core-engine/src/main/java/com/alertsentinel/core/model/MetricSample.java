package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One numeric telemetry observation. Immutable once recorded.
 *
 * @since 1.0.0
 */
public final class MetricSample {

    private final String metricName;
    private final double value;
    private final Instant timestamp;
    private final Map<String, String> tags;

    /**
     * @param metricName non-blank metric name
     * @param value      finite value
     * @param timestamp  observation time
     * @param tags       optional labels, copied
     * @throws ValidationException if the name is blank, the value is NaN or
     *                             infinite, or the timestamp is missing
     */
    @JsonCreator
    public MetricSample(@JsonProperty("metricName") String metricName,
            @JsonProperty("value") double value,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("tags") Map<String, String> tags) {
        if (metricName == null || metricName.isBlank()) {
            throw new ValidationException("Metric name must not be empty");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("Metric '" + metricName + "' value must be finite, got: " + value);
        }
        if (timestamp == null) {
            throw new ValidationException("Metric '" + metricName + "' timestamp is required");
        }
        this.metricName = metricName;
        this.value = value;
        this.timestamp = timestamp;
        this.tags = tags == null || tags.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public MetricSample(String metricName, double value, Instant timestamp) {
        this(metricName, value, timestamp, null);
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && metricName.equals(that.metricName)
                && timestamp.equals(that.timestamp)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, timestamp, tags);
    }

    @Override
    public String toString() {
        return "MetricSample{" + metricName + '=' + value + " @" + timestamp + '}';
    }
}
