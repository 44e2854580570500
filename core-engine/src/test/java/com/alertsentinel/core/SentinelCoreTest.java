package com.alertsentinel.core;

import com.alertsentinel.core.config.ResolvedConfig;
import com.alertsentinel.core.config.SentinelConfig;
import com.alertsentinel.core.config.SentinelConfigLoader;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.incident.IncidentReport;
import com.alertsentinel.core.incident.IncidentSummary;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.support.MutableClock;
import com.alertsentinel.core.support.RecordingDispatcher;
import com.alertsentinel.core.support.RecordingGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SentinelCore} wired from the test configuration.
 */
class SentinelCoreTest {

    private static final Instant T0 = Instant.parse("2024-07-01T10:00:00Z");

    private MutableClock clock;
    private RecordingDispatcher dispatcher;
    private RecordingGateway gateway;
    private SentinelCore core;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        dispatcher = new RecordingDispatcher();
        gateway = new RecordingGateway();
        core = new SentinelCore(SentinelConfigLoader.fromClasspath("test-sentinel.yml"), dispatcher, gateway, clock);
    }

    @AfterEach
    void tearDown() {
        core.close();
    }

    @Test
    @DisplayName("An alert with an incident kind should open an incident for the tagged subject")
    void shouldBridgeAlertToIncident() {
        List<Alert> alerts = core.recordSample("latency", 0.2, T0, Map.of("subject", "alice"));

        assertThat(alerts).singleElement()
                .extracting(Alert::getSeverity).isEqualTo(AlertSeverity.CRITICAL);
        IncidentSummary summary = core.getIncidentSummary("alice");
        assertThat(summary.getTotalIncidents()).isEqualTo(1);
        SecurityIncident incident = summary.getRecentIncidents().get(0);
        assertThat(incident.getKind()).isEqualTo(IncidentKind.NETWORK_ATTACK);
        assertThat(incident.getSeverity()).isEqualTo(IncidentSeverity.CRITICAL);
        assertThat(incident.getTitle()).isEqualTo("Latency floor on latency");
        assertThat(incident.getEvidence()).singleElement().satisfies(e ->
                assertThat(e).contains(alerts.get(0).getAlertId()));
    }

    @Test
    @DisplayName("Reported malware should trigger automatic response before returning")
    void shouldRespondToReportedIncident() {
        String id = core.reportIncident(IncidentKind.MALWARE, IncidentSeverity.HIGH, "Trojan detected",
                "Dropper found on laptop", "edr", List.of("bob"), "bob", "child");

        assertThat(core.getResponseRecords(id)).extracting(r -> r.getAction())
                .containsExactly(ResponseAction.ISOLATE, ResponseAction.NOTIFY_SUBJECT_GROUP);
        assertThat(core.getIncident(id).getStatus()).isEqualTo(IncidentStatus.DETECTED);
        assertThat(gateway.getApplied()).containsExactly(ResponseAction.ISOLATE);

        IncidentSummary summary = core.getIncidentSummary("bob");
        assertThat(summary.getResponseStats().getTotalRecords()).isEqualTo(2);
        assertThat(summary.getResponseStats().getNotificationsSent()).isEqualTo(1);
    }

    @Test
    @DisplayName("Report should cover actions, notifications and duration")
    void shouldGenerateReport() {
        String id = core.reportIncident(IncidentKind.MALWARE, IncidentSeverity.HIGH, "Trojan detected",
                null, "edr", List.of(), "bob", null);
        clock.advance(Duration.ofMinutes(20));
        core.resolveIncident(id, "reimaged", "carol");
        clock.advance(Duration.ofMinutes(5));

        IncidentReport report = core.generateReport(id);

        assertThat(report.getDurationSeconds()).isEqualTo(Duration.ofMinutes(20).toSeconds());
        assertThat(report.getActionsTaken())
                .containsExactly(ResponseAction.ISOLATE, ResponseAction.NOTIFY_SUBJECT_GROUP);
        assertThat(report.getNotificationsSent()).isEqualTo(1);
        assertThat(report.getFailedActions()).isZero();
        assertThat(report.getStatusHistory()).containsExactly(IncidentStatus.DETECTED, IncidentStatus.RESOLVED);
        assertThat(report.getTimeline()).hasSize(2);
    }

    @Test
    @DisplayName("Critical incidents from alerts should be escalated by the scan")
    void shouldEscalateThroughScan() {
        core.recordSample("latency", 0.1, T0);

        assertThat(core.runEscalationScan().getEscalatedIncidents()).isEqualTo(1);
        assertThat(core.runEscalationScan().getEscalatedIncidents()).isZero();
        assertThat(core.getIncidentSummary(null).getEscalatedIncidents()).isEqualTo(1);
    }

    @Test
    @DisplayName("While paused samples should be stored but not evaluated")
    void shouldStoreWithoutEvaluatingWhenPaused() {
        core.pause();

        assertThat(core.recordSample("cpu", 99, T0)).isEmpty();
        assertThat(core.isPaused()).isTrue();
        assertThat(core.getMetricSummary("cpu")).isPresent();
        assertThat(core.getAlertStats().getSamplesEvaluated()).isZero();

        core.resume();
        assertThat(core.recordSample("cpu", 99, T0.plusSeconds(1))).hasSize(1);
    }

    @Test
    @DisplayName("History should be read relative to the clock")
    void shouldReadHistoryWindow() {
        core.recordSample("cpu", 10, T0.minusSeconds(120));
        core.recordSample("cpu", 20, T0.minusSeconds(30));
        core.recordSample("cpu", 30, T0);

        assertThat(core.getMetricHistory("cpu", Duration.ofMinutes(1)))
                .extracting(s -> s.getValue()).containsExactly(20.0, 30.0);
        assertThat(core.getMetricSummaries()).containsOnlyKeys("cpu");
    }

    @Test
    @DisplayName("Health should degrade past the callback error budget")
    void shouldReportUnhealthyOnCallbackErrors() {
        TuningConfig tuning = new TuningConfig();
        tuning.setCallbackErrorBudget(0);
        try (SentinelCore strict = new SentinelCore(ResolvedConfig.builder()
                .alertRules(List.of(AlertRule.builder().ruleId("cpu").metricName("cpu").threshold(80).build()))
                .tuning(tuning)
                .build(), dispatcher, gateway, clock)) {
            assertThat(strict.isHealthy()).isTrue();

            strict.addAlertCallback(alert -> {
                throw new IllegalStateException("sink down");
            });
            strict.recordSample("cpu", 90, T0);

            HealthReport health = strict.health();
            assertThat(health.isHealthy()).isFalse();
            assertThat(health.getCallbackErrors()).isEqualTo(1);
            assertThat(health.isWorkersRunning()).isFalse();
        }
    }

    @Test
    @DisplayName("Health should degrade past the active critical alert limit")
    void shouldReportUnhealthyOnCriticalAlerts() {
        TuningConfig tuning = new TuningConfig();
        tuning.setCriticalAlertLimit(0);
        try (SentinelCore strict = new SentinelCore(ResolvedConfig.builder()
                .alertRules(List.of(AlertRule.builder().ruleId("disk").metricName("disk")
                        .severity(AlertSeverity.CRITICAL).threshold(95).build()))
                .tuning(tuning)
                .build(), dispatcher, gateway, clock)) {
            List<Alert> fired = strict.recordSample("disk", 99, T0);

            assertThat(strict.health().getActiveCriticalAlerts()).isEqualTo(1);
            assertThat(strict.isHealthy()).isFalse();

            strict.resolveAlert(fired.get(0).getAlertId());
            assertThat(strict.isHealthy()).isTrue();
        }
    }

    @Test
    @DisplayName("Concurrent producers should lose no samples")
    void shouldAcceptConcurrentProducers() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 250; i++) {
                        core.recordSample("cpu", 10, T0.plusMillis(thread * 1000L + i));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(core.getMetricSummary("cpu")).get().extracting(s -> s.getCount()).isEqualTo(1000);
        assertThat(core.getAlertStats().getSamplesEvaluated()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Invalid configuration should be rejected without touching the running rules")
    void shouldRejectInvalidConfig() throws IOException {
        SentinelConfig invalid;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("invalid-sentinel.yml")) {
            invalid = SentinelConfigLoader.parse(is);
        }

        assertThatThrownBy(() -> core.setConfig(invalid)).isInstanceOf(ValidationException.class);
        assertThat(core.getAlertStats().getRuleCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Reloaded configuration should keep cooldown state for unchanged rules")
    void shouldHotReload() {
        core.recordSample("cpu", 90, T0);
        ResolvedConfig current = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        core.setConfig(current);

        assertThat(core.recordSample("cpu", 95, T0.plusSeconds(5))).isEmpty();
        assertThat(core.getAlertStats().getSuppressedByCooldown()).isEqualTo(1);
    }

    @Test
    @DisplayName("Disabled response rules should be skipped")
    void shouldToggleResponseRule() {
        core.setResponseRuleEnabled("test_malware", false);

        String id = core.reportIncident(IncidentKind.MALWARE, IncidentSeverity.CRITICAL, "Worm", null, null,
                List.of(), null, null);

        assertThat(core.getResponseRecords(id)).isEmpty();
    }

    @Test
    @DisplayName("Start and stop should manage the background workers")
    void shouldStartAndStopWorkers() {
        core.start();
        assertThat(core.health().isWorkersRunning()).isTrue();

        core.stop();
        assertThat(core.health().isWorkersRunning()).isFalse();
    }

    @Test
    @DisplayName("Cleanup should drop data older than the retention period")
    void shouldCleanUp() {
        core.recordSample("cpu", 90, T0);
        clock.advance(Duration.ofDays(8));
        core.recordSample("cpu", 10, T0.plus(Duration.ofDays(8)));

        core.runCleanup();

        assertThat(core.getAlerts()).isEmpty();
        assertThat(core.getMetricSummary("cpu")).get().extracting(s -> s.getCount()).isEqualTo(1);
    }
}
