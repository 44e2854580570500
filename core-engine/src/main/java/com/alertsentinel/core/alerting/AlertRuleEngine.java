package com.alertsentinel.core.alerting;

import com.alertsentinel.core.concurrent.GuardedLock;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.metrics.MetricSummary;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.AlertStatus;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluates metric samples against alert rules and emits de-duplicated
 * alerts.
 *
 * <h3>Gates</h3>
 * <p>
 * For every rule on the sample's metric, in registration order:
 * </p>
 * <ol>
 * <li>the comparator must hold against the rule's live threshold</li>
 * <li>cooldown: no alert for the rule within {@code cooldownSeconds}</li>
 * <li>hourly cap: fewer than {@code maxAlertsPerHour} alerts in the current
 * wall-clock hour</li>
 * <li>debounce: at least {@code minOccurrences} qualifying observations,
 * this one included, inside the debounce window</li>
 * </ol>
 * <p>
 * A sample that passes all gates produces one {@link Alert}. Afterwards, for
 * adaptive rules, the observed value joins the rule's baseline and the live
 * threshold is blended toward {@code mean ± k·stddev}.
 * </p>
 *
 * <h3>Time</h3>
 * <p>
 * Gates use the sample's own timestamp, never the wall clock. The hourly
 * cap counts fired alerts by the hour their sample belongs to, so late
 * samples are capped against their own hour. The injected {@link Clock}
 * stamps manual alert status changes and picks the hour reported by
 * {@link #stats()}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Rule state and alert history sit behind a single {@link GuardedLock}.
 * Fired alerts join a delivery queue in creation order while that lock is
 * held. Callbacks run after the lock is released, from whichever evaluating
 * thread drains the queue, one alert at a time, so every callback sees
 * alerts in creation order. An alert may therefore reach the callbacks
 * before or after {@code evaluate} returns in the thread that fired it.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final TuningConfig tuning;
    private final Clock clock;
    private final GuardedLock lock;

    private final Map<String, RuleState> rules = new LinkedHashMap<>();
    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final Set<String> escalatedAlertIds = new LinkedHashSet<>();
    private final List<AlertCallback> callbacks = new CopyOnWriteArrayList<>();
    private final Queue<Alert> pendingDelivery = new ConcurrentLinkedQueue<>();
    private final ReentrantLock deliveryLock = new ReentrantLock();

    private long samplesEvaluated;
    private long suppressedByCooldown;
    private long suppressedByHourlyCap;
    private long suppressedByDebounce;
    private final AtomicLong callbackErrors = new AtomicLong();

    public AlertRuleEngine(TuningConfig tuning, Clock clock) {
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lock = new GuardedLock("alert-rule-engine", tuning.lockTimeout());
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    /**
     * Replace the rule set. Gate state, fire history and baselines survive
     * for every rule id present before and after; state of removed rules is
     * dropped. A kept rule takes the new definition's threshold.
     *
     * @throws ValidationException on duplicate rule ids
     */
    public void replaceRules(List<AlertRule> newRules) {
        Objects.requireNonNull(newRules, "rules must not be null");
        Set<String> ids = new HashSet<>();
        for (AlertRule rule : newRules) {
            Objects.requireNonNull(rule, "rule must not be null");
            if (!ids.add(rule.getRuleId())) {
                throw new ValidationException("Duplicate alert rule id: '" + rule.getRuleId() + "'");
            }
        }
        lock.runLocked(() -> {
            Map<String, RuleState> previous = new LinkedHashMap<>(rules);
            rules.clear();
            int kept = 0;
            for (AlertRule rule : newRules) {
                RuleState state = previous.get(rule.getRuleId());
                if (state != null) {
                    state.rule = rule;
                    kept++;
                } else {
                    state = new RuleState(rule);
                }
                rules.put(rule.getRuleId(), state);
            }
            LOG.info("Alert rules replaced: {} total, {} kept state, {} dropped",
                    rules.size(), kept, previous.size() - kept);
        });
    }

    /**
     * Register one rule.
     *
     * @throws ValidationException if the id is already registered
     */
    public void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        lock.runLocked(() -> {
            if (rules.containsKey(rule.getRuleId())) {
                throw new ValidationException("Duplicate alert rule id: '" + rule.getRuleId() + "'");
            }
            rules.put(rule.getRuleId(), new RuleState(rule));
            LOG.info("Alert rule added: {}", rule);
        });
    }

    /**
     * @throws NotFoundException if no such rule is registered
     */
    public void removeRule(String ruleId) {
        lock.runLocked(() -> {
            if (rules.remove(ruleId) == null) {
                throw new NotFoundException("alert rule", ruleId);
            }
            LOG.info("Alert rule removed: {}", ruleId);
        });
    }

    /**
     * @return the rule with its live threshold
     * @throws NotFoundException if no such rule is registered
     */
    public AlertRule getRule(String ruleId) {
        return lock.withLock(() -> {
            RuleState state = rules.get(ruleId);
            if (state == null) {
                throw new NotFoundException("alert rule", ruleId);
            }
            return state.rule;
        });
    }

    public List<AlertRule> getRules() {
        return lock.withLock(() -> rules.values().stream().map(s -> s.rule).toList());
    }

    // ---------------------------------------------------------------
    // Callbacks
    // ---------------------------------------------------------------

    public void addCallback(AlertCallback callback) {
        callbacks.add(Objects.requireNonNull(callback, "callback must not be null"));
    }

    public boolean removeCallback(AlertCallback callback) {
        return callbacks.remove(callback);
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate one sample against every rule on its metric.
     *
     * @param sample sample to evaluate
     * @return alerts fired by this sample, in rule registration order
     */
    public List<Alert> evaluate(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        List<Alert> fired = lock.withLock(() -> {
            samplesEvaluated++;
            List<Alert> out = new ArrayList<>();
            for (RuleState state : rules.values()) {
                if (!state.rule.getMetricName().equals(sample.getMetricName())) {
                    continue;
                }
                Alert alert = applyGates(state, sample);
                if (alert != null) {
                    out.add(alert.copy());
                    pendingDelivery.add(alert.copy());
                }
                if (state.rule.isAdaptive()) {
                    adaptThreshold(state, sample.getValue());
                }
            }
            return out;
        });
        if (!fired.isEmpty()) {
            drainDeliveries();
        }
        return fired;
    }

    /**
     * Deliver queued alerts in order. A thread that finds another one
     * draining leaves its alerts to it; the drainer re-checks the queue after
     * letting go of the delivery lock.
     */
    private void drainDeliveries() {
        while (!pendingDelivery.isEmpty()) {
            if (!deliveryLock.tryLock()) {
                return;
            }
            try {
                Alert alert;
                while ((alert = pendingDelivery.poll()) != null) {
                    dispatch(alert);
                }
            } finally {
                deliveryLock.unlock();
            }
        }
    }

    private Alert applyGates(RuleState state, MetricSample sample) {
        AlertRule rule = state.rule;
        Instant now = sample.getTimestamp();

        if (!rule.getComparator().test(sample.getValue(), rule.getThreshold())) {
            return null;
        }
        int occurrences = state.recordOccurrence(now, tuning.debounceWindow());

        if (state.lastFired != null
                && Duration.between(state.lastFired, now).compareTo(Duration.ofSeconds(rule.getCooldownSeconds())) < 0) {
            suppressedByCooldown++;
            LOG.debug("Rule [{}] suppressed by cooldown at {}", rule.getRuleId(), now);
            return null;
        }
        if (state.firesInHourOf(now) >= rule.getMaxAlertsPerHour()) {
            suppressedByHourlyCap++;
            LOG.debug("Rule [{}] suppressed by hourly cap {}", rule.getRuleId(), rule.getMaxAlertsPerHour());
            return null;
        }
        if (occurrences < rule.getMinOccurrences()) {
            suppressedByDebounce++;
            LOG.debug("Rule [{}] debounced: {}/{} occurrences", rule.getRuleId(), occurrences,
                    rule.getMinOccurrences());
            return null;
        }

        Alert alert = Alert.builder()
                .alertId(UUID.randomUUID().toString())
                .ruleId(rule.getRuleId())
                .ruleName(rule.getName())
                .severity(rule.getSeverity())
                .timestamp(now)
                .metricName(rule.getMetricName())
                .observedValue(sample.getValue())
                .thresholdValue(rule.getThreshold())
                .tags(sample.getTags())
                .occurrences(occurrences)
                .message(String.format(Locale.ROOT, "%s: %s = %.2f %s %.2f", rule.getName(),
                        rule.getMetricName(), sample.getValue(), rule.getComparator().symbol(),
                        rule.getThreshold()))
                .build();

        alerts.addLast(alert);
        if (alerts.size() > tuning.getAlertHistoryCapacity()) {
            while (alerts.size() > tuning.getAlertHistoryTrim()) {
                Alert dropped = alerts.pollFirst();
                escalatedAlertIds.remove(dropped.getAlertId());
            }
        }
        state.recordFire(now, tuning.getAlertHistoryCapacity());

        LOG.info("Alert fired: rule={}, severity={}, value={}, threshold={}",
                rule.getRuleId(), rule.getSeverity(), sample.getValue(), rule.getThreshold());
        return alert;
    }

    private void adaptThreshold(RuleState state, double value) {
        state.baseline.addLast(value);
        if (state.baseline.size() > tuning.getBaselineCapacity()) {
            while (state.baseline.size() > tuning.getBaselineTrim()) {
                state.baseline.pollFirst();
            }
        }
        if (state.baseline.size() < tuning.getBaselineMinimum()) {
            return;
        }
        double[] values = state.baseline.stream().mapToDouble(Double::doubleValue).toArray();
        double mean = MetricSummary.mean(values);
        double sigma = MetricSummary.sampleStdDev(values, mean);
        AlertRule rule = state.rule;
        ComparisonOperator op = rule.getComparator();
        double candidate;
        if (op.isUpperBound()) {
            candidate = mean + tuning.getDeviationMultiplier() * sigma;
        } else if (op.isLowerBound()) {
            candidate = mean - tuning.getDeviationMultiplier() * sigma;
        } else {
            candidate = rule.getThreshold();
        }
        double weight = tuning.getAdaptiveBlendWeight();
        double blended = (1 - weight) * rule.getThreshold() + weight * candidate;
        if (blended != rule.getThreshold()) {
            state.rule = rule.toBuilder().threshold(blended).build();
            LOG.debug("Rule [{}] adaptive threshold {} -> {}", rule.getRuleId(), rule.getThreshold(), blended);
        }
    }

    private void dispatch(Alert alert) {
        for (AlertCallback callback : callbacks) {
            try {
                callback.onAlert(alert.copy());
            } catch (RuntimeException e) {
                long errors = callbackErrors.incrementAndGet();
                LOG.warn("Alert callback failed for alert {} ({} callback error(s) so far)",
                        alert.getAlertId(), errors, e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Alert lifecycle
    // ---------------------------------------------------------------

    public Alert resolveAlert(String alertId) {
        return changeStatus(alertId, AlertStatus.RESOLVED, null);
    }

    public Alert suppressAlert(String alertId, String reason) {
        return changeStatus(alertId, AlertStatus.SUPPRESSED, reason);
    }

    public Alert ignoreAlert(String alertId) {
        return changeStatus(alertId, AlertStatus.IGNORED, null);
    }

    private Alert changeStatus(String alertId, AlertStatus target, String reason) {
        Instant now = clock.instant();
        Alert changed = lock.withLock(() -> {
            Alert alert = find(alertId);
            alert.transitionTo(target, reason, now);
            return alert.copy();
        });
        LOG.info("Alert {} -> {}", alertId, target);
        return changed;
    }

    private Alert find(String alertId) {
        for (Alert alert : alerts) {
            if (alert.getAlertId().equals(alertId)) {
                return alert;
            }
        }
        throw new NotFoundException("alert", alertId);
    }

    public Optional<Alert> getAlert(String alertId) {
        return lock.withLock(() -> alerts.stream()
                .filter(a -> a.getAlertId().equals(alertId))
                .findFirst()
                .map(Alert::copy));
    }

    public List<Alert> getActiveAlerts() {
        return lock.withLock(() -> alerts.stream()
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE)
                .map(Alert::copy)
                .toList());
    }

    /**
     * @return every retained alert, oldest first
     */
    public List<Alert> getAlerts() {
        return lock.withLock(() -> alerts.stream().map(Alert::copy).toList());
    }

    public long countActive(AlertSeverity severity) {
        return lock.withLock(() -> alerts.stream()
                .filter(a -> a.getStatus() == AlertStatus.ACTIVE && a.getSeverity() == severity)
                .count());
    }

    public long getCallbackErrorCount() {
        return callbackErrors.get();
    }

    // ---------------------------------------------------------------
    // Background maintenance
    // ---------------------------------------------------------------

    /**
     * Mark alerts that are still active at {@code now} and at least
     * {@code age} old as escalated. Each alert is returned once over the
     * engine's lifetime.
     *
     * @return newly escalated alerts
     */
    public List<Alert> escalateStaleAlerts(Instant now, Duration age) {
        Instant cutoff = now.minus(age);
        return lock.withLock(() -> {
            List<Alert> stale = new ArrayList<>();
            for (Alert alert : alerts) {
                if (alert.getStatus() == AlertStatus.ACTIVE
                        && !alert.getTimestamp().isAfter(cutoff)
                        && escalatedAlertIds.add(alert.getAlertId())) {
                    stale.add(alert.copy());
                }
            }
            return stale;
        });
    }

    /**
     * Drop alerts and rule histories older than {@code cutoff}.
     *
     * @return number of alerts removed
     */
    public int purgeOlderThan(Instant cutoff) {
        return lock.withLock(() -> {
            int before = alerts.size();
            alerts.removeIf(a -> a.getTimestamp().isBefore(cutoff));
            Set<String> retained = new HashSet<>();
            alerts.forEach(a -> retained.add(a.getAlertId()));
            escalatedAlertIds.retainAll(retained);
            rules.values().forEach(s -> s.pruneBefore(cutoff));
            return before - alerts.size();
        });
    }

    // ---------------------------------------------------------------
    // Stats and snapshots
    // ---------------------------------------------------------------

    public AlertStats stats() {
        return lock.withLock(() -> {
            Map<String, Long> bySeverity = new TreeMap<>();
            Map<String, Long> byStatus = new TreeMap<>();
            Map<String, Long> byRule = new TreeMap<>();
            int active = 0;
            for (Alert alert : alerts) {
                bySeverity.merge(alert.getSeverity().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
                byStatus.merge(alert.getStatus().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
                byRule.merge(alert.getRuleId(), 1L, Long::sum);
                if (alert.getStatus() == AlertStatus.ACTIVE) {
                    active++;
                }
            }
            Instant now = clock.instant();
            Map<String, Integer> hourly = new TreeMap<>();
            rules.forEach((id, s) -> hourly.put(id, s.firesInHourOf(now)));
            return new AlertStats(rules.size(), alerts.size(), active, bySeverity, byStatus, byRule, hourly,
                    samplesEvaluated, suppressedByCooldown, suppressedByHourlyCap, suppressedByDebounce,
                    callbackErrors.get(), escalatedAlertIds.size());
        });
    }

    public AlertEngineState exportState() {
        return lock.withLock(() -> {
            AlertEngineState state = new AlertEngineState();
            List<AlertRule> ruleList = new ArrayList<>();
            List<AlertEngineState.RuleGateState> gates = new ArrayList<>();
            for (RuleState s : rules.values()) {
                ruleList.add(s.rule);
                AlertEngineState.RuleGateState g = new AlertEngineState.RuleGateState();
                g.setRuleId(s.rule.getRuleId());
                g.setLastFired(s.lastFired);
                g.setOccurrences(new ArrayList<>(s.occurrences));
                g.setFireHistory(new ArrayList<>(s.fireHistory));
                g.setBaseline(new ArrayList<>(s.baseline));
                gates.add(g);
            }
            state.setRules(ruleList);
            state.setRuleStates(gates);
            state.setAlerts(alerts.stream().map(Alert::copy).toList());
            state.setEscalatedAlertIds(new ArrayList<>(escalatedAlertIds));
            state.setSamplesEvaluated(samplesEvaluated);
            state.setSuppressedByCooldown(suppressedByCooldown);
            state.setSuppressedByHourlyCap(suppressedByHourlyCap);
            state.setSuppressedByDebounce(suppressedByDebounce);
            state.setCallbackErrors(callbackErrors.get());
            return state;
        });
    }

    /**
     * Replace everything this engine owns with {@code state}.
     */
    public void importState(AlertEngineState state) {
        Objects.requireNonNull(state, "state must not be null");
        Map<String, AlertEngineState.RuleGateState> gates = new LinkedHashMap<>();
        state.getRuleStates().forEach(g -> gates.put(g.getRuleId(), g));
        lock.runLocked(() -> {
            rules.clear();
            for (AlertRule rule : state.getRules()) {
                RuleState s = new RuleState(rule);
                AlertEngineState.RuleGateState g = gates.get(rule.getRuleId());
                if (g != null) {
                    s.lastFired = g.getLastFired();
                    s.occurrences.addAll(g.getOccurrences());
                    s.fireHistory.addAll(g.getFireHistory());
                    s.baseline.addAll(g.getBaseline());
                }
                rules.put(rule.getRuleId(), s);
            }
            alerts.clear();
            state.getAlerts().forEach(a -> alerts.addLast(a.copy()));
            escalatedAlertIds.clear();
            escalatedAlertIds.addAll(state.getEscalatedAlertIds());
            samplesEvaluated = state.getSamplesEvaluated();
            suppressedByCooldown = state.getSuppressedByCooldown();
            suppressedByHourlyCap = state.getSuppressedByHourlyCap();
            suppressedByDebounce = state.getSuppressedByDebounce();
            callbackErrors.set(state.getCallbackErrors());
            LOG.info("Alert engine state imported: {} rule(s), {} alert(s)", rules.size(), alerts.size());
        });
    }
}
