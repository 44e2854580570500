package com.alertsentinel.core.escalation;

import com.alertsentinel.core.alerting.AlertRuleEngine;
import com.alertsentinel.core.concurrent.PeriodicTask;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.incident.IncidentRegistry;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.EscalationPolicy;
import com.alertsentinel.core.model.NotificationChannel;
import com.alertsentinel.core.model.NotificationPriority;
import com.alertsentinel.core.model.RecipientClass;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.notify.NotificationRequest;
import com.alertsentinel.core.response.ResponseRuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Periodically escalates open incidents and stale alerts.
 *
 * <h3>Incidents</h3>
 * <p>
 * An open, not yet escalated incident is escalated when its severity's
 * policy says {@code escalateImmediately}, or once it has been open for
 * {@code escalationAgeSeconds}. Escalation goes through
 * {@link ResponseRuleEngine#escalate}, which is idempotent, so two scans in a
 * row yield one escalation record.
 * </p>
 *
 * <h3>Alerts</h3>
 * <p>
 * Alerts still active after the stale-alert age are reported to the operator
 * once each.
 * </p>
 *
 * @since 1.0.0
 */
public class EscalationScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(EscalationScheduler.class);

    private final IncidentRegistry registry;
    private final ResponseRuleEngine responseEngine;
    private final AlertRuleEngine alertEngine;
    private final NotificationDispatcher dispatcher;
    private final TuningConfig tuning;
    private final Clock clock;
    private final PeriodicTask task;

    public EscalationScheduler(IncidentRegistry registry, ResponseRuleEngine responseEngine,
            AlertRuleEngine alertEngine, NotificationDispatcher dispatcher, TuningConfig tuning, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.responseEngine = Objects.requireNonNull(responseEngine, "responseEngine must not be null");
        this.alertEngine = Objects.requireNonNull(alertEngine, "alertEngine must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.task = new PeriodicTask("escalation", tuning.escalationInterval(), this::scan);
    }

    public void start() {
        task.start();
    }

    public boolean stop(Duration await) {
        return task.stop(await);
    }

    public boolean isRunning() {
        return task.isRunning();
    }

    /**
     * One scan at the clock's current time.
     */
    public ScanResult scan() {
        return scan(clock.instant());
    }

    /**
     * One scan as of {@code now}.
     */
    public ScanResult scan(Instant now) {
        int escalated = 0;
        for (SecurityIncident incident : registry.openIncidents()) {
            if (incident.isEscalated()) {
                continue;
            }
            Optional<EscalationPolicy> policy = responseEngine.escalationPolicy(incident.getSeverity());
            if (policy.isEmpty()) {
                continue;
            }
            String reason = dueReason(incident, policy.get(), now);
            if (reason == null) {
                continue;
            }
            if (responseEngine.escalate(incident.getIncidentId(), reason, ResponseRuleEngine.SYSTEM_ACTOR)
                    .isPresent()) {
                escalated++;
            }
        }

        int stale = 0;
        for (Alert alert : alertEngine.escalateStaleAlerts(now, tuning.staleAlertAge())) {
            stale++;
            reportStale(alert, now);
        }
        if (escalated > 0 || stale > 0) {
            LOG.info("Escalation scan: {} incident(s) escalated, {} stale alert(s) reported", escalated, stale);
        }
        return new ScanResult(escalated, stale);
    }

    private static String dueReason(SecurityIncident incident, EscalationPolicy policy, Instant now) {
        if (policy.isEscalateImmediately()) {
            return "immediate escalation for " + incident.getSeverity().name().toLowerCase(Locale.ROOT) + " severity";
        }
        long age = Duration.between(incident.getDetectionTime(), now).getSeconds();
        if (age >= policy.getEscalationAgeSeconds()) {
            return "open for " + age + "s (limit " + policy.getEscalationAgeSeconds() + "s)";
        }
        return null;
    }

    private void reportStale(Alert alert, Instant now) {
        long age = Duration.between(alert.getTimestamp(), now).getSeconds();
        NotificationRequest request = new NotificationRequest(RecipientClass.OPERATOR,
                NotificationPriority.forSeverity(alert.getSeverity().toIncidentSeverity()),
                NotificationChannel.EMAIL,
                "Alert still active after " + age + "s: " + alert.getMessage(),
                Map.of("alert_id", alert.getAlertId(), "rule_id", alert.getRuleId()));
        try {
            if (!dispatcher.notify(request)) {
                LOG.warn("Stale alert {} notification not delivered", alert.getAlertId());
            }
        } catch (RuntimeException e) {
            LOG.warn("Stale alert {} notification failed", alert.getAlertId(), e);
        }
    }

    /**
     * Counts produced by one scan.
     */
    public static final class ScanResult {
        private final int escalatedIncidents;
        private final int staleAlerts;

        public ScanResult(int escalatedIncidents, int staleAlerts) {
            this.escalatedIncidents = escalatedIncidents;
            this.staleAlerts = staleAlerts;
        }

        public int getEscalatedIncidents() {
            return escalatedIncidents;
        }

        public int getStaleAlerts() {
            return staleAlerts;
        }

        @Override
        public String toString() {
            return "ScanResult{escalatedIncidents=" + escalatedIncidents + ", staleAlerts=" + staleAlerts + '}';
        }
    }
}
