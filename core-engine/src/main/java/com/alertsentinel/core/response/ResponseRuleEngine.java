package com.alertsentinel.core.response;

import com.alertsentinel.core.concurrent.GuardedLock;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.StateTransitionException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.incident.IncidentRegistry;
import com.alertsentinel.core.model.EscalationPolicy;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.NotificationChannel;
import com.alertsentinel.core.model.NotificationPriority;
import com.alertsentinel.core.model.RecipientClass;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseRecord;
import com.alertsentinel.core.model.ResponseRule;
import com.alertsentinel.core.model.ResponseStats;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.notify.NotificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Matches incidents against response rules and executes their actions.
 *
 * <h3>Matching</h3>
 * <p>
 * Every enabled rule whose kind, severity floor, subject-role filter and
 * condition match is applied, in registration order. There is no
 * single-winner selection.
 * </p>
 *
 * <h3>Execution</h3>
 * <p>
 * Each action produces exactly one {@link ResponseRecord}. A failing action
 * (collaborator error or illegal status move) is recorded with
 * {@code success=false} and does not stop later actions.
 * {@code investigate}, {@code contain} and {@code remediate} move the
 * incident through {@link IncidentRegistry}; every other action leaves its
 * status untouched.
 * </p>
 *
 * <h3>Escalation</h3>
 * <p>
 * {@link #escalate(String, String, String)} is shared with the escalation
 * scheduler. It raises the incident's escalated flag under the registry lock,
 * so of two concurrent callers only one notifies and records.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Rules and records sit behind one {@link GuardedLock}, which is never held
 * while calling the registry or a collaborator.
 * </p>
 *
 * @since 1.0.0
 */
public class ResponseRuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseRuleEngine.class);

    /** performedBy value of the scheduler and of rule-free escalations. */
    public static final String SYSTEM_ACTOR = "system";

    private final IncidentRegistry registry;
    private final NotificationDispatcher dispatcher;
    private final EnforcementGateway gateway;
    private final Clock clock;
    private final GuardedLock lock;

    private final Map<String, ResponseRule> rules = new LinkedHashMap<>();
    private final List<ResponseRecord> records = new ArrayList<>();
    private volatile Map<IncidentSeverity, EscalationPolicy> policies = Map.of();
    private long notificationsSent;
    private long notificationFailures;

    public ResponseRuleEngine(IncidentRegistry registry, NotificationDispatcher dispatcher,
            EnforcementGateway gateway, TuningConfig tuning, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lock = new GuardedLock("response-rule-engine",
                Objects.requireNonNull(tuning, "tuning must not be null").lockTimeout());
    }

    // ---------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------

    /**
     * Replace all rules, keeping registration order.
     *
     * @throws ValidationException on duplicate rule ids
     */
    public void replaceRules(List<ResponseRule> newRules) {
        Objects.requireNonNull(newRules, "rules must not be null");
        Set<String> ids = new HashSet<>();
        for (ResponseRule rule : newRules) {
            if (!ids.add(rule.getRuleId())) {
                throw new ValidationException("Duplicate response rule id: '" + rule.getRuleId() + "'");
            }
        }
        lock.runLocked(() -> {
            rules.clear();
            newRules.forEach(r -> rules.put(r.getRuleId(), r));
        });
        LOG.info("Response rules replaced: {} total", newRules.size());
    }

    /**
     * @throws NotFoundException if no such rule is registered
     */
    public ResponseRule setRuleEnabled(String ruleId, boolean enabled) {
        ResponseRule updated = lock.withLock(() -> {
            ResponseRule rule = rules.get(ruleId);
            if (rule == null) {
                throw new NotFoundException("response rule", ruleId);
            }
            ResponseRule toggled = rule.withEnabled(enabled);
            rules.put(ruleId, toggled);
            return toggled;
        });
        LOG.info("Response rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return updated;
    }

    public List<ResponseRule> getRules() {
        return lock.withLock(() -> List.copyOf(rules.values()));
    }

    public void setEscalationPolicies(Map<IncidentSeverity, EscalationPolicy> escalationPolicies) {
        Map<IncidentSeverity, EscalationPolicy> copy = new EnumMap<>(IncidentSeverity.class);
        copy.putAll(Objects.requireNonNull(escalationPolicies, "escalationPolicies must not be null"));
        this.policies = copy;
    }

    public Optional<EscalationPolicy> escalationPolicy(IncidentSeverity severity) {
        return Optional.ofNullable(policies.get(severity));
    }

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------

    /**
     * Apply every matching enabled rule to {@code incident}.
     *
     * @return records produced, in execution order
     */
    public List<ResponseRecord> execute(SecurityIncident incident) {
        Objects.requireNonNull(incident, "incident must not be null");
        List<ResponseRule> matched = lock.withLock(() -> rules.values().stream()
                .filter(ResponseRule::isEnabled)
                .filter(r -> r.matches(incident))
                .toList());
        if (matched.isEmpty()) {
            LOG.debug("No response rule matched incident {}", incident.getIncidentId());
            return List.of();
        }
        List<ResponseRecord> produced = new ArrayList<>();
        for (ResponseRule rule : matched) {
            LOG.info("Response rule {} matched incident {}", rule.getRuleId(), incident.getIncidentId());
            for (ResponseAction action : rule.getActions()) {
                produced.add(perform(incident.getIncidentId(), action, rule, "rule:" + rule.getRuleId()));
            }
        }
        return produced;
    }

    /**
     * Execute an explicit action list for an incident, outside rule matching.
     *
     * @throws NotFoundException if the incident is unknown
     */
    public List<ResponseRecord> respond(String incidentId, List<ResponseAction> actions, String performedBy) {
        Objects.requireNonNull(actions, "actions must not be null");
        registry.getIncident(incidentId);
        List<ResponseRecord> produced = new ArrayList<>();
        for (ResponseAction action : actions) {
            produced.add(perform(incidentId, action, null, performedBy));
        }
        return produced;
    }

    /**
     * Escalate an open incident that has not been escalated yet: notify
     * every contact class on every channel of its severity's policy and
     * record one {@code escalate} record.
     *
     * @return the record, or empty if the incident was already escalated or
     *         is no longer open
     * @throws NotFoundException if the incident is unknown
     */
    public Optional<ResponseRecord> escalate(String incidentId, String reason, String performedBy) {
        if (!registry.markEscalated(incidentId)) {
            LOG.debug("Incident {} already escalated or closed", incidentId);
            return Optional.empty();
        }
        SecurityIncident incident = registry.getIncident(incidentId);
        Outcome outcome = notifyEscalationContacts(incident, reason);
        ResponseRecord record = record(incident, ResponseAction.ESCALATE, null, performedBy,
                "Escalated: " + reason, outcome);
        registry.recordActionTaken(incidentId, ResponseAction.ESCALATE);
        LOG.info("Incident {} escalated ({}), delivered={}", incidentId, reason, outcome.success);
        return Optional.of(record);
    }

    private ResponseRecord perform(String incidentId, ResponseAction action, ResponseRule rule, String performedBy) {
        SecurityIncident incident = registry.getIncident(incidentId);
        Outcome outcome = run(action, incident, rule, performedBy);
        ResponseRecord record = record(incident, action, rule, performedBy, describe(action, incident), outcome);
        if (outcome.success) {
            registry.recordActionTaken(incidentId, action);
        }
        return record;
    }

    private Outcome run(ResponseAction action, SecurityIncident incident, ResponseRule rule, String performedBy) {
        try {
            return switch (action) {
                case ISOLATE, QUARANTINE, BLOCK -> Outcome.of(gateway.apply(action, incident), null);
                case NOTIFY_SUBJECT_GROUP -> send(incident, RecipientClass.SUBJECT_GROUP, NotificationChannel.PUSH,
                        describe(action, incident));
                case NOTIFY_OPERATOR -> send(incident, RecipientClass.OPERATOR, NotificationChannel.EMAIL,
                        describe(action, incident));
                case NOTIFY_EXTERNAL_AUTHORITY -> send(incident, RecipientClass.EXTERNAL_AUTHORITY,
                        NotificationChannel.EMAIL, describe(action, incident));
                case ESCALATE -> escalateFromAction(incident, rule);
                case INVESTIGATE -> move(incident, IncidentStatus.INVESTIGATING, performedBy);
                case CONTAIN -> move(incident, IncidentStatus.CONTAINED, performedBy);
                case REMEDIATE -> {
                    registry.resolve(incident.getIncidentId(), "Remediated by " + performedBy, performedBy);
                    yield Outcome.of(true, null);
                }
                case MONITOR, LOG -> {
                    LOG.info("Incident {} {}: {}", incident.getIncidentId(), action.wireName(), incident.getTitle());
                    yield Outcome.of(true, null);
                }
            };
        } catch (StateTransitionException e) {
            LOG.warn("Action {} on incident {} rejected: {}", action.wireName(), incident.getIncidentId(),
                    e.getMessage());
            return Outcome.of(false, e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Action {} on incident {} failed", action.wireName(), incident.getIncidentId(), e);
            return Outcome.of(false, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private Outcome move(SecurityIncident incident, IncidentStatus target, String performedBy) {
        registry.transition(incident.getIncidentId(), target, performedBy);
        return Outcome.of(true, null);
    }

    private Outcome escalateFromAction(SecurityIncident incident, ResponseRule rule) {
        if (!registry.markEscalated(incident.getIncidentId())) {
            return Outcome.of(true, "already escalated");
        }
        String reason = rule != null ? "response rule " + rule.getRuleId() : "manual response";
        return notifyEscalationContacts(registry.getIncident(incident.getIncidentId()), reason);
    }

    private Outcome notifyEscalationContacts(SecurityIncident incident, String reason) {
        EscalationPolicy policy = policies.get(incident.getSeverity());
        List<RecipientClass> contacts = policy != null ? policy.getContactClasses() : List.of(RecipientClass.OPERATOR);
        List<NotificationChannel> channels = policy != null ? policy.getNotifyChannels()
                : List.of(NotificationChannel.EMAIL);
        String message = "Escalation of " + incident.getSeverity().name().toLowerCase(Locale.ROOT) + " incident '"
                + incident.getTitle() + "': " + reason;
        boolean allDelivered = true;
        String error = null;
        for (RecipientClass contact : contacts) {
            for (NotificationChannel channel : channels) {
                Outcome sent = send(incident, contact, channel, message);
                if (!sent.success) {
                    allDelivered = false;
                    error = sent.error;
                }
            }
        }
        return Outcome.of(allDelivered, error);
    }

    private Outcome send(SecurityIncident incident, RecipientClass recipient, NotificationChannel channel,
            String message) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("incident_id", incident.getIncidentId());
        metadata.put("kind", incident.getKind().name().toLowerCase(Locale.ROOT));
        metadata.put("severity", incident.getSeverity().name().toLowerCase(Locale.ROOT));
        if (incident.getSubjectId() != null) {
            metadata.put("subject_id", incident.getSubjectId());
        }
        NotificationRequest request = new NotificationRequest(recipient,
                NotificationPriority.forSeverity(incident.getSeverity()), channel, message, metadata);
        boolean delivered;
        String error = null;
        try {
            delivered = dispatcher.notify(request);
            if (!delivered) {
                error = "not delivered to " + recipient.name().toLowerCase(Locale.ROOT);
            }
        } catch (RuntimeException e) {
            LOG.warn("Notification to {} via {} failed for incident {}", recipient, channel,
                    incident.getIncidentId(), e);
            delivered = false;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        boolean ok = delivered;
        lock.runLocked(() -> {
            if (ok) {
                notificationsSent++;
            } else {
                notificationFailures++;
            }
        });
        return Outcome.of(delivered, error);
    }

    private ResponseRecord record(SecurityIncident incident, ResponseAction action, ResponseRule rule,
            String performedBy, String description, Outcome outcome) {
        Map<String, String> details = new LinkedHashMap<>();
        if (rule != null) {
            details.put("rule_id", rule.getRuleId());
            details.put("rule_name", rule.getName());
        }
        details.put("kind", incident.getKind().name().toLowerCase(Locale.ROOT));
        details.put("severity", incident.getSeverity().name().toLowerCase(Locale.ROOT));
        if (outcome.error != null) {
            details.put(outcome.success ? "note" : "error", outcome.error);
        }
        ResponseRecord record = ResponseRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .incidentId(incident.getIncidentId())
                .action(action)
                .timestamp(clock.instant())
                .performedBy(performedBy)
                .description(description)
                .success(outcome.success)
                .details(details)
                .build();
        lock.runLocked(() -> records.add(record));
        return record;
    }

    private static String describe(ResponseAction action, SecurityIncident incident) {
        return action.wireName() + " for incident '" + incident.getTitle() + "'";
    }

    // ---------------------------------------------------------------
    // Queries and snapshots
    // ---------------------------------------------------------------

    public List<ResponseRecord> recordsFor(String incidentId) {
        return lock.withLock(() -> records.stream()
                .filter(r -> r.getIncidentId().equals(incidentId))
                .toList());
    }

    public List<ResponseRecord> getRecords() {
        return lock.withLock(() -> List.copyOf(records));
    }

    public ResponseStats stats() {
        return lock.withLock(() -> {
            Map<String, Long> byAction = new TreeMap<>();
            long failed = 0;
            for (ResponseRecord record : records) {
                byAction.merge(record.getAction().wireName(), 1L, Long::sum);
                if (!record.isSuccess()) {
                    failed++;
                }
            }
            return new ResponseStats(records.size(), failed, notificationsSent, notificationFailures, byAction);
        });
    }

    public ResponseEngineState exportState() {
        return lock.withLock(() -> {
            ResponseEngineState state = new ResponseEngineState();
            state.setRules(new ArrayList<>(rules.values()));
            state.setRecords(new ArrayList<>(records));
            state.setNotificationsSent(notificationsSent);
            state.setNotificationFailures(notificationFailures);
            return state;
        });
    }

    public void importState(ResponseEngineState state) {
        Objects.requireNonNull(state, "state must not be null");
        lock.runLocked(() -> {
            rules.clear();
            state.getRules().forEach(r -> rules.put(r.getRuleId(), r));
            records.clear();
            records.addAll(state.getRecords());
            notificationsSent = state.getNotificationsSent();
            notificationFailures = state.getNotificationFailures();
            LOG.info("Response engine state imported: {} rule(s), {} record(s)", rules.size(), records.size());
        });
    }

    /**
     * Result of one action against its collaborator.
     */
    private static final class Outcome {
        final boolean success;
        final String error;

        private Outcome(boolean success, String error) {
            this.success = success;
            this.error = error;
        }

        static Outcome of(boolean success, String error) {
            return new Outcome(success, error);
        }
    }
}
