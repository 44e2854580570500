package com.alertsentinel.service;

import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.model.Alert;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meter definitions for Alert Sentinel.
 *
 * <p>
 * The registry implementation decides how meters are exported; the service
 * only defines them.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code sentinel.samples.ingested} – telemetry samples handed to the
 * core</li>
 * <li>{@code sentinel.detections.ingested} – detection reports turned into
 * incidents</li>
 * <li>{@code sentinel.records.malformed} – ingress records dropped, tagged by
 * topic</li>
 * <li>{@code sentinel.alerts.fired} – fired alerts, tagged by severity</li>
 * <li>{@code sentinel.notifications} – outbound notifications, tagged by
 * outcome</li>
 * <li>{@code sentinel.processing.latency} – per-record processing time</li>
 * <li>{@code sentinel.alerts.active}, {@code sentinel.incidents.open} –
 * gauges read from the core</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SentinelMetrics {

    private final MeterRegistry registry;
    private final Counter samplesIngested;
    private final Counter detectionsIngested;
    private final Counter notificationsDelivered;
    private final Counter notificationsFailed;
    private final Timer processingLatency;

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        this.samplesIngested = Counter.builder("sentinel.samples.ingested")
                .description("Telemetry samples recorded")
                .register(registry);
        this.detectionsIngested = Counter.builder("sentinel.detections.ingested")
                .description("Detection reports accepted as incidents")
                .register(registry);
        this.notificationsDelivered = Counter.builder("sentinel.notifications")
                .description("Outbound notifications")
                .tag("outcome", "delivered")
                .register(registry);
        this.notificationsFailed = Counter.builder("sentinel.notifications")
                .description("Outbound notifications")
                .tag("outcome", "failed")
                .register(registry);
        this.processingLatency = Timer.builder("sentinel.processing.latency")
                .description("Time spent handling one ingress record")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Register gauges that read live figures from {@code core}.
     */
    public void bindCore(SentinelCore core) {
        Objects.requireNonNull(core, "core must not be null");
        Gauge.builder("sentinel.alerts.active", core, c -> c.getAlertStats().getActiveAlerts())
                .description("Alerts currently active")
                .strongReference(true)
                .register(registry);
        Gauge.builder("sentinel.incidents.open", core, c -> c.health().getOpenIncidents())
                .description("Incidents not yet resolved or closed")
                .strongReference(true)
                .register(registry);
    }

    public void incrementSamplesIngested() {
        samplesIngested.increment();
    }

    public void incrementDetectionsIngested() {
        detectionsIngested.increment();
    }

    public void incrementMalformed(String topic) {
        Counter.builder("sentinel.records.malformed")
                .description("Ingress records that could not be decoded or were rejected")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void recordAlert(Alert alert) {
        Counter.builder("sentinel.alerts.fired")
                .description("Alerts fired by the rule engine")
                .tag("severity", alert.getSeverity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordNotification(boolean delivered) {
        if (delivered) {
            notificationsDelivered.increment();
        } else {
            notificationsFailed.increment();
        }
    }

    public void recordLatency(long milliseconds) {
        processingLatency.record(milliseconds, TimeUnit.MILLISECONDS);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
