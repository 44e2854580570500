package com.alertsentinel.core.alerting;

import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.StateTransitionException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.AlertStatus;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.MetricSample;
import com.alertsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AlertRuleEngine}.
 */
class AlertRuleEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private AlertRuleEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        engine = new AlertRuleEngine(TuningConfig.defaults(), clock);
    }

    // ---- Gates

    @Test
    @DisplayName("Should fire once for a burst above threshold inside the cooldown")
    void shouldFireOnceWithinCooldown() {
        engine.replaceRules(List.of(cpuRule().build()));

        List<Alert> fired = new ArrayList<>();
        fired.addAll(engine.evaluate(sample("cpu", 85, 0)));
        fired.addAll(engine.evaluate(sample("cpu", 90, 1)));
        fired.addAll(engine.evaluate(sample("cpu", 70, 2)));

        assertThat(fired).hasSize(1);
        Alert alert = fired.get(0);
        assertThat(alert.getObservedValue()).isEqualTo(85.0);
        assertThat(alert.getThresholdValue()).isEqualTo(80.0);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
        assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(alert.getMessage()).isEqualTo("High CPU: cpu = 85.00 > 80.00");
        assertThat(engine.stats().getSuppressedByCooldown()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fire again once the cooldown has elapsed")
    void shouldFireAfterCooldown() {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(60).build()));

        assertThat(engine.evaluate(sample("cpu", 85, 0))).hasSize(1);
        assertThat(engine.evaluate(sample("cpu", 85, 59))).isEmpty();
        assertThat(engine.evaluate(sample("cpu", 85, 60))).hasSize(1);
    }

    @Test
    @DisplayName("Should stop firing at the hourly cap and reset on the next hour")
    void shouldApplyHourlyCap() {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(0).maxAlertsPerHour(2).build()));

        int fired = 0;
        for (int i = 0; i < 5; i++) {
            fired += engine.evaluate(sample("cpu", 95, i * 10L)).size();
        }
        assertThat(fired).isEqualTo(2);
        assertThat(engine.stats().getSuppressedByHourlyCap()).isEqualTo(3);

        assertThat(engine.evaluate(sample("cpu", 95, 3600))).hasSize(1);
        clock.set(T0.plusSeconds(3600));
        assertThat(engine.stats().getHourlyCounts()).containsEntry("cpu_high", 1);
    }

    @Test
    @DisplayName("Late samples should be capped against the hour they belong to")
    void shouldCapLateSamplesAgainstTheirOwnHour() {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(0).minOccurrences(2).maxAlertsPerHour(1).build()));

        List<Alert> fired = new ArrayList<>();
        for (long offset : new long[] {0, 1, 3700, 2, 3}) {
            fired.addAll(engine.evaluate(sample("cpu", 95, offset)));
        }

        assertThat(fired).extracting(Alert::getTimestamp).containsExactly(T0.plusSeconds(1));
        assertThat(engine.stats().getSuppressedByHourlyCap()).isEqualTo(2);
        assertThat(engine.stats().getHourlyCounts()).containsEntry("cpu_high", 1);
    }

    @Test
    @DisplayName("Hourly counts in stats should roll over with the clock even without new samples")
    void hourlyCountsShouldFollowClock() {
        engine.replaceRules(List.of(cpuRule().build()));
        engine.evaluate(sample("cpu", 95, 0));

        assertThat(engine.stats().getHourlyCounts()).containsEntry("cpu_high", 1);

        clock.advance(Duration.ofHours(1));

        assertThat(engine.stats().getHourlyCounts()).containsEntry("cpu_high", 0);
    }

    @Test
    @DisplayName("Should require the minimum number of occurrences inside the debounce window")
    void shouldDebounce() {
        engine.replaceRules(List.of(cpuRule().minOccurrences(3).build()));

        assertThat(engine.evaluate(sample("cpu", 85, 0))).isEmpty();
        assertThat(engine.evaluate(sample("cpu", 85, 10))).isEmpty();
        List<Alert> third = engine.evaluate(sample("cpu", 85, 20));

        assertThat(third).singleElement().satisfies(a -> assertThat(a.getOccurrences()).isEqualTo(3));
        assertThat(engine.stats().getSuppressedByDebounce()).isEqualTo(2);
    }

    @Test
    @DisplayName("Occurrences that left the debounce window should not count")
    void shouldForgetOccurrencesOutsideWindow() {
        engine.replaceRules(List.of(cpuRule().minOccurrences(2).build()));

        assertThat(engine.evaluate(sample("cpu", 85, 0))).isEmpty();
        // default window is 300 s, so the first occurrence has expired
        assertThat(engine.evaluate(sample("cpu", 85, 300))).isEmpty();
        assertThat(engine.evaluate(sample("cpu", 85, 310))).hasSize(1);
    }

    @Test
    @DisplayName("Equality comparator should use a small tolerance")
    void shouldCompareWithTolerance() {
        engine.replaceRules(List.of(AlertRule.builder()
                .ruleId("exact").metricName("queue").comparator(ComparisonOperator.EQUAL)
                .threshold(5.0).cooldownSeconds(0).build()));

        assertThat(engine.evaluate(sample("queue", 5.0005, 0))).hasSize(1);
        assertThat(engine.evaluate(sample("queue", 5.01, 1))).isEmpty();
    }

    @Test
    @DisplayName("Samples on other metrics should be ignored")
    void shouldIgnoreOtherMetrics() {
        engine.replaceRules(List.of(cpuRule().build()));

        assertThat(engine.evaluate(sample("memory", 99, 0))).isEmpty();
        assertThat(engine.stats().getSamplesEvaluated()).isEqualTo(1);
    }

    // ---- Adaptive thresholds

    @Test
    @DisplayName("Adaptive threshold should blend toward the observed baseline")
    void shouldAdaptThreshold() {
        engine.replaceRules(List.of(cpuRule().threshold(100).adaptive(true).build()));

        for (int i = 0; i < 9; i++) {
            engine.evaluate(sample("cpu", 50, i));
        }
        assertThat(engine.getRule("cpu_high").getThreshold()).isEqualTo(100.0);

        engine.evaluate(sample("cpu", 50, 9));
        assertThat(engine.getRule("cpu_high").getThreshold()).isCloseTo(90.0, within(1e-9));

        engine.evaluate(sample("cpu", 50, 10));
        assertThat(engine.getRule("cpu_high").getThreshold()).isCloseTo(82.0, within(1e-9));
    }

    @Test
    @DisplayName("Non-adaptive threshold should never move")
    void shouldKeepStaticThreshold() {
        engine.replaceRules(List.of(cpuRule().build()));

        for (int i = 0; i < 20; i++) {
            engine.evaluate(sample("cpu", 10, i));
        }

        assertThat(engine.getRule("cpu_high").getThreshold()).isEqualTo(80.0);
    }

    // ---- Callbacks

    @Test
    @DisplayName("A failing callback should not stop the others")
    void shouldIsolateCallbackFailures() {
        engine.replaceRules(List.of(cpuRule().build()));
        List<Alert> received = new ArrayList<>();
        engine.addCallback(alert -> {
            throw new IllegalStateException("boom");
        });
        engine.addCallback(received::add);

        List<Alert> fired = engine.evaluate(sample("cpu", 85, 0));

        assertThat(fired).hasSize(1);
        assertThat(received).hasSize(1);
        assertThat(engine.getCallbackErrorCount()).isEqualTo(1);
        assertThat(engine.stats().getCallbackErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Removed callbacks should no longer be invoked")
    void shouldRemoveCallback() {
        engine.replaceRules(List.of(cpuRule().build()));
        List<Alert> received = new ArrayList<>();
        AlertCallback callback = received::add;
        engine.addCallback(callback);

        assertThat(engine.removeCallback(callback)).isTrue();
        engine.evaluate(sample("cpu", 85, 0));

        assertThat(received).isEmpty();
    }

    // ---- Rule management

    @Test
    @DisplayName("Reloading rules should keep gate state for unchanged ids")
    void shouldKeepStateOnReload() {
        engine.replaceRules(List.of(cpuRule().build()));
        assertThat(engine.evaluate(sample("cpu", 85, 0))).hasSize(1);

        engine.replaceRules(List.of(cpuRule().threshold(70).build(), memoryRule()));

        assertThat(engine.getRule("cpu_high").getThreshold()).isEqualTo(70.0);
        assertThat(engine.evaluate(sample("cpu", 75, 10))).isEmpty();
        assertThat(engine.stats().getSuppressedByCooldown()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reloading should drop state for removed rules")
    void shouldDropStateForRemovedRules() {
        engine.replaceRules(List.of(cpuRule().build()));
        engine.evaluate(sample("cpu", 85, 0));

        engine.replaceRules(List.of(memoryRule()));
        engine.replaceRules(List.of(cpuRule().build()));

        assertThat(engine.evaluate(sample("cpu", 85, 10))).hasSize(1);
    }

    @Test
    @DisplayName("Should reject duplicate rule ids")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> engine.replaceRules(List.of(cpuRule().build(), cpuRule().build())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cpu_high");

        engine.addRule(cpuRule().build());
        assertThatThrownBy(() -> engine.addRule(cpuRule().build())).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Unknown rule ids should raise NotFoundException")
    void shouldRaiseNotFoundForRules() {
        assertThatThrownBy(() -> engine.getRule("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> engine.removeRule("missing")).isInstanceOf(NotFoundException.class);
    }

    // ---- Alert lifecycle

    @Test
    @DisplayName("Should resolve, suppress and ignore active alerts")
    void shouldChangeAlertStatus() {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(0).build()));
        String first = engine.evaluate(sample("cpu", 85, 0)).get(0).getAlertId();
        String second = engine.evaluate(sample("cpu", 85, 1)).get(0).getAlertId();
        String third = engine.evaluate(sample("cpu", 85, 2)).get(0).getAlertId();
        clock.advance(Duration.ofMinutes(5));

        Alert resolved = engine.resolveAlert(first);
        Alert suppressed = engine.suppressAlert(second, "maintenance window");
        engine.ignoreAlert(third);

        assertThat(resolved.getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.getStatusChangedAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(suppressed.getStatusReason()).isEqualTo("maintenance window");
        assertThat(engine.getActiveAlerts()).isEmpty();
        assertThat(engine.stats().getAlertsByStatus())
                .containsEntry("resolved", 1L)
                .containsEntry("suppressed", 1L)
                .containsEntry("ignored", 1L);
    }

    @Test
    @DisplayName("Terminal alerts cannot change status again")
    void shouldRejectSecondTransition() {
        engine.replaceRules(List.of(cpuRule().build()));
        String id = engine.evaluate(sample("cpu", 85, 0)).get(0).getAlertId();
        engine.resolveAlert(id);

        assertThatThrownBy(() -> engine.ignoreAlert(id)).isInstanceOf(StateTransitionException.class);
        assertThatThrownBy(() -> engine.resolveAlert("no-such-alert")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Returned alerts should be copies")
    void shouldReturnCopies() {
        engine.replaceRules(List.of(cpuRule().build()));
        Alert fired = engine.evaluate(sample("cpu", 85, 0)).get(0);

        fired.transitionTo(AlertStatus.IGNORED, null, T0);

        assertThat(engine.getAlert(fired.getAlertId())).get()
                .extracting(Alert::getStatus).isEqualTo(AlertStatus.ACTIVE);
    }

    @Test
    @DisplayName("Stale active alerts should be reported exactly once")
    void shouldEscalateStaleAlertsOnce() {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(0).build()));
        Alert old = engine.evaluate(sample("cpu", 85, 0)).get(0);
        Alert resolved = engine.evaluate(sample("cpu", 85, 1)).get(0);
        engine.resolveAlert(resolved.getAlertId());
        engine.evaluate(sample("cpu", 85, 1000));

        Instant now = T0.plusSeconds(1000);
        List<Alert> stale = engine.escalateStaleAlerts(now, Duration.ofMinutes(15));

        assertThat(stale).extracting(Alert::getAlertId).containsExactly(old.getAlertId());
        assertThat(engine.escalateStaleAlerts(now.plusSeconds(60), Duration.ofMinutes(15))).isEmpty();
        assertThat(engine.stats().getEscalatedAlerts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Alert history should be trimmed once its capacity is exceeded")
    void shouldTrimAlertHistory() {
        TuningConfig tuning = new TuningConfig();
        tuning.setAlertHistoryCapacity(4);
        tuning.setAlertHistoryTrim(2);
        AlertRuleEngine small = new AlertRuleEngine(tuning, clock);
        small.replaceRules(List.of(cpuRule().cooldownSeconds(0).maxAlertsPerHour(100).build()));

        for (int i = 0; i < 5; i++) {
            small.evaluate(sample("cpu", 81 + i, i));
        }

        assertThat(small.getAlerts()).extracting(Alert::getObservedValue).containsExactly(84.0, 85.0);
    }

    @Test
    @DisplayName("Stats should break alerts down by severity and rule")
    void shouldReportStats() {
        engine.replaceRules(List.of(cpuRule().build(), memoryRule()));
        engine.evaluate(sample("cpu", 85, 0));
        engine.evaluate(sample("memory", 95, 0));

        AlertStats stats = engine.stats();

        assertThat(stats.getRuleCount()).isEqualTo(2);
        assertThat(stats.getTotalAlerts()).isEqualTo(2);
        assertThat(stats.getActiveAlerts()).isEqualTo(2);
        assertThat(stats.getAlertsBySeverity()).isEqualTo(Map.of("warning", 1L, "critical", 1L));
        assertThat(stats.getAlertsByRule()).isEqualTo(Map.of("cpu_high", 1L, "memory_high", 1L));
        assertThat(engine.countActive(AlertSeverity.CRITICAL)).isEqualTo(1);
    }

    @Test
    @DisplayName("Exported state should restore gate behaviour in a new engine")
    void shouldExportAndImportState() {
        engine.replaceRules(List.of(cpuRule().build()));
        engine.evaluate(sample("cpu", 85, 0));

        AlertRuleEngine restored = new AlertRuleEngine(TuningConfig.defaults(), clock);
        restored.importState(engine.exportState());

        assertThat(restored.stats()).isEqualTo(engine.stats());
        assertThat(restored.evaluate(sample("cpu", 85, 10))).isEmpty();
        assertThat(restored.stats().getSuppressedByCooldown()).isEqualTo(1);
    }

    @Test
    @DisplayName("Callbacks should see alerts in creation order under concurrent evaluation")
    void callbacksShouldPreserveCreationOrder() throws Exception {
        engine.replaceRules(List.of(cpuRule().cooldownSeconds(0).maxAlertsPerHour(10_000).build()));
        List<String> delivered = Collections.synchronizedList(new ArrayList<>());
        engine.addCallback(alert -> {
            Thread.yield();
            delivered.add(alert.getAlertId());
        });

        int threads = 4;
        int perThread = 200;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int lane = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        engine.evaluate(sample("cpu", 95, (long) i * threads + lane));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> created = engine.getAlerts().stream().map(Alert::getAlertId).toList();
        assertThat(created).hasSize(threads * perThread);
        assertThat(delivered).containsExactlyElementsOf(created);
    }

    // ---- Helpers

    private static AlertRule.Builder cpuRule() {
        return AlertRule.builder()
                .ruleId("cpu_high")
                .name("High CPU")
                .metricName("cpu")
                .comparator(ComparisonOperator.GREATER_THAN)
                .threshold(80)
                .severity(AlertSeverity.WARNING);
    }

    private static AlertRule memoryRule() {
        return AlertRule.builder()
                .ruleId("memory_high")
                .metricName("memory")
                .threshold(90)
                .severity(AlertSeverity.CRITICAL)
                .build();
    }

    private static MetricSample sample(String name, double value, long offsetSeconds) {
        return new MetricSample(name, value, T0.plusSeconds(offsetSeconds));
    }
}
