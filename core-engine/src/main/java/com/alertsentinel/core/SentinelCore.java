package com.alertsentinel.core;

import com.alertsentinel.core.alerting.AlertCallback;
import com.alertsentinel.core.alerting.AlertRuleEngine;
import com.alertsentinel.core.alerting.AlertStats;
import com.alertsentinel.core.concurrent.PeriodicTask;
import com.alertsentinel.core.config.ResolvedConfig;
import com.alertsentinel.core.config.SentinelConfig;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.StateTransitionException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.escalation.EscalationScheduler;
import com.alertsentinel.core.incident.AlertIncidentBridge;
import com.alertsentinel.core.incident.IncidentRegistry;
import com.alertsentinel.core.incident.IncidentReport;
import com.alertsentinel.core.incident.IncidentRequest;
import com.alertsentinel.core.incident.IncidentSummary;
import com.alertsentinel.core.metrics.MetricStore;
import com.alertsentinel.core.metrics.MetricSummary;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.MetricSample;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseRecord;
import com.alertsentinel.core.model.ResponseRule;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.notify.LoggingNotificationDispatcher;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.response.EnforcementGateway;
import com.alertsentinel.core.response.LoggingEnforcementGateway;
import com.alertsentinel.core.response.ResponseRuleEngine;
import com.alertsentinel.core.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the alerting and incident-response core.
 *
 * <p>
 * Wires the components together and exposes the ingress, query,
 * configuration and persistence operations:
 * </p>
 *
 * <pre>
 * sample → MetricStore → AlertRuleEngine → Alert
 *                                           └→ AlertIncidentBridge → IncidentRegistry
 * report → IncidentRegistry → ResponseRuleEngine → actions, notifications
 * timer  → EscalationScheduler, cleanup
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code construct → start() → serve → (setConfig) → stop()}. Tuning is
 * fixed at construction; {@link #setConfig(ResolvedConfig)} replaces rules
 * and escalation policies only.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelCore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelCore.class);

    private static final Duration STOP_WAIT = Duration.ofSeconds(5);

    private final Clock clock;
    private final TuningConfig tuning;
    private final MetricStore metricStore;
    private final AlertRuleEngine alertEngine;
    private final IncidentRegistry registry;
    private final ResponseRuleEngine responseEngine;
    private final EscalationScheduler scheduler;
    private final PeriodicTask cleanupTask;
    private final AtomicBoolean paused = new AtomicBoolean(false);

    public SentinelCore(ResolvedConfig config, NotificationDispatcher dispatcher, EnforcementGateway gateway,
            Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        Objects.requireNonNull(gateway, "gateway must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.tuning = config.getTuning();

        this.metricStore = new MetricStore(tuning.getMetricCapacity(), tuning.getMetricTrim(), tuning.lockTimeout());
        this.alertEngine = new AlertRuleEngine(tuning, clock);
        this.registry = new IncidentRegistry(tuning, clock);
        this.responseEngine = new ResponseRuleEngine(registry, dispatcher, gateway, tuning, clock);
        this.scheduler = new EscalationScheduler(registry, responseEngine, alertEngine, dispatcher, tuning, clock);
        this.cleanupTask = new PeriodicTask("cleanup", tuning.cleanupInterval(), this::runCleanup);

        registry.addListener(responseEngine::execute);
        alertEngine.addCallback(new AlertIncidentBridge(alertEngine, registry));
        setConfig(config);
    }

    /**
     * Core with logging-only collaborators and the UTC system clock.
     */
    public static SentinelCore withDefaults(ResolvedConfig config) {
        return new SentinelCore(config, new LoggingNotificationDispatcher(), new LoggingEnforcementGateway(),
                Clock.systemUTC());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the escalation and cleanup workers.
     */
    public void start() {
        scheduler.start();
        cleanupTask.start();
        LOG.info("Sentinel core started");
    }

    /**
     * Stop both workers; each finishes its current iteration.
     */
    public void stop() {
        scheduler.stop(STOP_WAIT);
        cleanupTask.stop(STOP_WAIT);
        LOG.info("Sentinel core stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /** Keep storing samples but stop evaluating rules. */
    public void pause() {
        if (paused.compareAndSet(false, true)) {
            LOG.info("Rule evaluation paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            LOG.info("Rule evaluation resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    // ---------------------------------------------------------------
    // Telemetry ingress
    // ---------------------------------------------------------------

    /**
     * @return alerts fired by this sample
     * @throws ValidationException if the name is blank or the value is not
     *                             finite
     */
    public List<Alert> recordSample(String metricName, double value, Instant timestamp) {
        return recordSample(new MetricSample(metricName, value, timestamp));
    }

    public List<Alert> recordSample(String metricName, double value, Instant timestamp, Map<String, String> tags) {
        return recordSample(new MetricSample(metricName, value, timestamp, tags));
    }

    public List<Alert> recordSample(MetricSample sample) {
        metricStore.append(sample);
        if (paused.get()) {
            LOG.debug("Paused, sample {} stored without evaluation", sample.getMetricName());
            return List.of();
        }
        return alertEngine.evaluate(sample);
    }

    // ---------------------------------------------------------------
    // Detection ingress
    // ---------------------------------------------------------------

    /**
     * Create an incident and run automatic response before returning.
     *
     * @return id of the new incident
     */
    public String reportIncident(IncidentRequest request) {
        return registry.create(request).getIncidentId();
    }

    public String reportIncident(IncidentKind kind, IncidentSeverity severity, String title, String description,
            String source, Collection<String> affectedSubjects, String subjectId, String subjectRole) {
        return reportIncident(IncidentRequest.builder()
                .kind(kind)
                .severity(severity)
                .title(title)
                .description(description)
                .source(source)
                .affectedSubjects(affectedSubjects)
                .subjectId(subjectId)
                .subjectRole(subjectRole)
                .build());
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public List<Alert> getActiveAlerts() {
        return alertEngine.getActiveAlerts();
    }

    public List<Alert> getAlerts() {
        return alertEngine.getAlerts();
    }

    public AlertStats getAlertStats() {
        return alertEngine.stats();
    }

    public Alert resolveAlert(String alertId) {
        return alertEngine.resolveAlert(alertId);
    }

    public Alert suppressAlert(String alertId, String reason) {
        return alertEngine.suppressAlert(alertId, reason);
    }

    public Alert ignoreAlert(String alertId) {
        return alertEngine.ignoreAlert(alertId);
    }

    public void addAlertCallback(AlertCallback callback) {
        alertEngine.addCallback(callback);
    }

    public Optional<MetricSummary> getMetricSummary(String metricName) {
        return metricStore.summary(metricName);
    }

    public Map<String, MetricSummary> getMetricSummaries() {
        return metricStore.summaries();
    }

    public List<MetricSample> getMetricHistory(String metricName, Duration window) {
        return metricStore.history(metricName, window, clock.instant());
    }

    // ---------------------------------------------------------------
    // Incidents
    // ---------------------------------------------------------------

    /**
     * @param subjectId optional subject filter
     */
    public IncidentSummary getIncidentSummary(String subjectId) {
        return registry.getSummary(subjectId).withResponseStats(responseEngine.stats());
    }

    public SecurityIncident getIncident(String incidentId) {
        return registry.getIncident(incidentId);
    }

    public List<SecurityIncident> listIncidents(IncidentStatus status, IncidentSeverity severity) {
        return registry.listIncidents(status, severity);
    }

    public SecurityIncident resolveIncident(String incidentId, String notes, String resolvedBy) {
        return registry.resolve(incidentId, notes, resolvedBy);
    }

    /**
     * @throws StateTransitionException unless the incident is resolved
     */
    public SecurityIncident closeIncident(String incidentId) {
        return registry.close(incidentId);
    }

    public SecurityIncident transitionIncident(String incidentId, IncidentStatus target, String actor) {
        return registry.transition(incidentId, target, actor);
    }

    public SecurityIncident assignIncident(String incidentId, String assignee) {
        return registry.assign(incidentId, assignee);
    }

    public SecurityIncident addEvidence(String incidentId, String evidence) {
        return registry.addEvidence(incidentId, evidence);
    }

    public IncidentReport generateReport(String incidentId) {
        SecurityIncident incident = registry.getIncident(incidentId);
        return IncidentReport.of(incident, responseEngine.recordsFor(incidentId), clock.instant());
    }

    // ---------------------------------------------------------------
    // Response
    // ---------------------------------------------------------------

    public List<ResponseRecord> respond(String incidentId, List<ResponseAction> actions, String performedBy) {
        return responseEngine.respond(incidentId, actions, performedBy);
    }

    /**
     * @throws NotFoundException if the rule is unknown
     */
    public ResponseRule setResponseRuleEnabled(String ruleId, boolean enabled) {
        return responseEngine.setRuleEnabled(ruleId, enabled);
    }

    public List<ResponseRecord> getResponseRecords(String incidentId) {
        return responseEngine.recordsFor(incidentId);
    }

    public EscalationScheduler.ScanResult runEscalationScan() {
        return scheduler.scan();
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Replace alert rules, response rules and escalation policies. Gate
     * state and history survive for alert rules whose id is unchanged.
     *
     * @throws ValidationException if the configuration is invalid; nothing
     *                             is applied in that case
     */
    public void setConfig(ResolvedConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (config.getTuning() != tuning) {
            LOG.warn("Tuning changes take effect on restart only");
        }
        alertEngine.replaceRules(config.getAlertRules());
        responseEngine.replaceRules(config.getResponseRules());
        responseEngine.setEscalationPolicies(config.getEscalationPolicies());
    }

    /**
     * Resolve {@code config} completely before applying any of it.
     */
    public void setConfig(SentinelConfig config) {
        setConfig(Objects.requireNonNull(config, "config must not be null").resolve());
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Drop alerts, rule histories and samples older than the retention
     * period.
     */
    public void runCleanup() {
        Instant cutoff = clock.instant().minus(tuning.retention());
        int alerts = alertEngine.purgeOlderThan(cutoff);
        int samples = metricStore.purgeOlderThan(cutoff);
        LOG.info("Cleanup before {}: {} alert(s), {} sample(s) removed", cutoff, alerts, samples);
    }

    public HealthReport health() {
        long callbackErrors = alertEngine.getCallbackErrorCount();
        long critical = alertEngine.countActive(AlertSeverity.CRITICAL);
        boolean healthy = callbackErrors <= tuning.getCallbackErrorBudget()
                && critical <= tuning.getCriticalAlertLimit();
        return new HealthReport(healthy, callbackErrors, critical, registry.openIncidents().size(),
                paused.get(), scheduler.isRunning() && cleanupTask.isRunning());
    }

    public boolean isHealthy() {
        return health().isHealthy();
    }

    // ---------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------

    public StateSnapshot exportState() {
        StateSnapshot snapshot = new StateSnapshot();
        snapshot.setExportedAt(clock.instant());
        snapshot.setAlerting(alertEngine.exportState());
        snapshot.setIncidents(registry.exportIncidents());
        snapshot.setResponse(responseEngine.exportState());
        snapshot.setMetrics(metricStore.exportSeries());
        return snapshot;
    }

    /**
     * Replace all in-memory state with {@code snapshot}. Escalation policies
     * stay as configured.
     */
    public void importState(StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        alertEngine.importState(snapshot.getAlerting());
        registry.importIncidents(snapshot.getIncidents());
        responseEngine.importState(snapshot.getResponse());
        metricStore.importSeries(snapshot.getMetrics());
        LOG.info("State imported from snapshot taken at {}", snapshot.getExportedAt());
    }

    public TuningConfig getTuning() {
        return tuning;
    }
}
