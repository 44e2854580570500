package com.alertsentinel.core.incident;

import com.alertsentinel.core.concurrent.GuardedLock;
import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.StateTransitionException;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseStats;
import com.alertsentinel.core.model.SecurityIncident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Owns every {@link SecurityIncident}, its lifecycle and the per-subject
 * index.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@code detected → investigating → contained → resolved → closed}. Status
 * only moves forward; {@code resolved} and {@code closed} are terminal apart
 * from {@code resolved → closed}. The escalated flag is orthogonal and can be
 * raised once while the incident is open.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Guarded by one {@link GuardedLock}. Callers always receive copies, so an
 * incident can only change through this class. {@link IncidentListener}s are
 * invoked after the lock is released.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentRegistry.class);

    private final Clock clock;
    private final int recentCount;
    private final GuardedLock lock;

    private final Map<String, SecurityIncident> incidents = new LinkedHashMap<>();
    private final Map<String, Set<String>> bySubject = new LinkedHashMap<>();
    private final List<IncidentListener> listeners = new CopyOnWriteArrayList<>();

    public IncidentRegistry(TuningConfig tuning, Clock clock) {
        Objects.requireNonNull(tuning, "tuning must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.recentCount = tuning.getRecentIncidentCount();
        this.lock = new GuardedLock("incident-registry", tuning.lockTimeout());
    }

    public void addListener(IncidentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    // ---------------------------------------------------------------
    // Creation
    // ---------------------------------------------------------------

    /**
     * Create an incident in {@code DETECTED} status and notify listeners
     * synchronously.
     *
     * @return copy of the new incident, as it was before listeners ran
     */
    public SecurityIncident create(IncidentRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        SecurityIncident incident = SecurityIncident.builder()
                .incidentId(UUID.randomUUID().toString())
                .kind(request.getKind())
                .severity(request.getSeverity())
                .title(request.getTitle())
                .description(request.getDescription())
                .detectionTime(clock.instant())
                .source(request.getSource())
                .affectedSubjects(request.getAffectedSubjects())
                .subjectId(request.getSubjectId())
                .subjectRole(request.getSubjectRole())
                .evidence(request.getEvidence())
                .build();
        SecurityIncident created = lock.withLock(() -> {
            incidents.put(incident.getIncidentId(), incident);
            index(incident);
            return incident.copy();
        });
        LOG.info("Incident created: id={}, kind={}, severity={}, subject={}",
                created.getIncidentId(), created.getKind(), created.getSeverity(), created.getSubjectId());

        for (IncidentListener listener : listeners) {
            try {
                listener.onIncidentCreated(created.copy());
            } catch (RuntimeException e) {
                LOG.warn("Incident listener failed for incident {}", created.getIncidentId(), e);
            }
        }
        return created;
    }

    private void index(SecurityIncident incident) {
        if (incident.getSubjectId() != null) {
            bySubject.computeIfAbsent(incident.getSubjectId(), k -> new LinkedHashSet<>())
                    .add(incident.getIncidentId());
        }
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    /**
     * Resolve an open incident.
     *
     * @throws NotFoundException        if the id is unknown
     * @throws StateTransitionException if the incident is already resolved or
     *                                  closed
     */
    public SecurityIncident resolve(String incidentId, String notes, String resolvedBy) {
        Instant now = clock.instant();
        SecurityIncident resolved = mutate(incidentId, i -> i.resolve(notes, resolvedBy, now));
        LOG.info("Incident resolved: id={}, by={}", incidentId, resolvedBy);
        return resolved;
    }

    /**
     * Close a resolved incident.
     *
     * @throws StateTransitionException unless the incident is resolved
     */
    public SecurityIncident close(String incidentId) {
        SecurityIncident closed = mutate(incidentId, i -> {
            if (i.getStatus() != IncidentStatus.RESOLVED) {
                throw new StateTransitionException(
                        "Incident " + incidentId + " can only be closed once resolved, status is " + i.getStatus());
            }
            i.transitionTo(IncidentStatus.CLOSED);
        });
        LOG.info("Incident closed: id={}", incidentId);
        return closed;
    }

    /**
     * Move an open incident to {@code INVESTIGATING} or {@code CONTAINED}.
     * {@code RESOLVED} is routed through {@link #resolve}; {@code CLOSED}
     * through {@link #close}.
     *
     * @throws StateTransitionException on a backward or terminal move
     */
    public SecurityIncident transition(String incidentId, IncidentStatus target, String actor) {
        Objects.requireNonNull(target, "target must not be null");
        return switch (target) {
            case RESOLVED -> resolve(incidentId, null, actor);
            case CLOSED -> close(incidentId);
            default -> {
                SecurityIncident moved = mutate(incidentId, i -> i.transitionTo(target));
                LOG.info("Incident {} -> {} ({})", incidentId, target, actor);
                yield moved;
            }
        };
    }

    /**
     * Raise the escalation flag once.
     *
     * @return {@code true} if this call raised it
     */
    public boolean markEscalated(String incidentId) {
        Instant now = clock.instant();
        return lock.withLock(() -> require(incidentId).markEscalated(now));
    }

    public SecurityIncident recordActionTaken(String incidentId, ResponseAction action) {
        return mutate(incidentId, i -> i.recordActionTaken(action));
    }

    public SecurityIncident addEvidence(String incidentId, String evidence) {
        Objects.requireNonNull(evidence, "evidence must not be null");
        return mutate(incidentId, i -> i.addEvidence(evidence));
    }

    public SecurityIncident assign(String incidentId, String assignee) {
        SecurityIncident assigned = mutate(incidentId, i -> i.assignTo(assignee));
        LOG.info("Incident {} assigned to {}", incidentId, assignee);
        return assigned;
    }

    private SecurityIncident mutate(String incidentId, Consumer<SecurityIncident> change) {
        return lock.withLock(() -> {
            SecurityIncident incident = require(incidentId);
            change.accept(incident);
            return incident.copy();
        });
    }

    private SecurityIncident require(String incidentId) {
        SecurityIncident incident = incidents.get(incidentId);
        if (incident == null) {
            throw new NotFoundException("incident", incidentId);
        }
        return incident;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @throws NotFoundException if the id is unknown
     */
    public SecurityIncident getIncident(String incidentId) {
        return lock.withLock(() -> require(incidentId).copy());
    }

    /**
     * @param status   optional status filter
     * @param severity optional severity filter
     * @return matching incidents in creation order
     */
    public List<SecurityIncident> listIncidents(IncidentStatus status, IncidentSeverity severity) {
        return select(i -> (status == null || i.getStatus() == status)
                && (severity == null || i.getSeverity() == severity));
    }

    public List<SecurityIncident> openIncidents() {
        return select(i -> i.getStatus().isOpen());
    }

    /**
     * @return the oldest open incident created from {@code source}, if any
     */
    public Optional<SecurityIncident> findOpenBySource(String source) {
        return select(i -> i.getStatus().isOpen() && Objects.equals(source, i.getSource()))
                .stream()
                .findFirst();
    }

    public List<SecurityIncident> incidentsForSubject(String subjectId) {
        return lock.withLock(() -> bySubject.getOrDefault(subjectId, Set.of()).stream()
                .map(incidents::get)
                .map(SecurityIncident::copy)
                .toList());
    }

    private List<SecurityIncident> select(Predicate<SecurityIncident> filter) {
        return lock.withLock(() -> incidents.values().stream()
                .filter(filter)
                .map(SecurityIncident::copy)
                .toList());
    }

    public int size() {
        return lock.withLock(incidents::size);
    }

    /**
     * Aggregate incidents of one subject, or all incidents when
     * {@code subjectId} is {@code null}. Never mutates.
     */
    public IncidentSummary getSummary(String subjectId) {
        List<SecurityIncident> scope = subjectId == null
                ? select(i -> true)
                : incidentsForSubject(subjectId);

        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byKind = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();
        int open = 0;
        int resolved = 0;
        int closed = 0;
        int escalated = 0;
        for (SecurityIncident incident : scope) {
            bySeverity.merge(lower(incident.getSeverity()), 1L, Long::sum);
            byKind.merge(lower(incident.getKind()), 1L, Long::sum);
            byStatus.merge(lower(incident.getStatus()), 1L, Long::sum);
            switch (incident.getStatus()) {
                case RESOLVED -> resolved++;
                case CLOSED -> closed++;
                default -> open++;
            }
            if (incident.isEscalated()) {
                escalated++;
            }
        }
        List<SecurityIncident> recent = scope.stream()
                .sorted(Comparator.comparing(SecurityIncident::getDetectionTime).reversed())
                .limit(recentCount)
                .toList();
        return new IncidentSummary(subjectId, scope.size(), open, resolved, closed, escalated,
                bySeverity, byKind, byStatus, recent, ResponseStats.empty());
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------
    // Snapshot support
    // ---------------------------------------------------------------

    public List<SecurityIncident> exportIncidents() {
        return select(i -> true);
    }

    public void importIncidents(List<SecurityIncident> imported) {
        Objects.requireNonNull(imported, "imported incidents must not be null");
        List<SecurityIncident> copies = new ArrayList<>();
        imported.forEach(i -> copies.add(i.copy()));
        lock.runLocked(() -> {
            incidents.clear();
            bySubject.clear();
            for (SecurityIncident incident : copies) {
                incidents.put(incident.getIncidentId(), incident);
                index(incident);
            }
            LOG.info("Incident registry imported {} incident(s)", incidents.size());
        });
    }
}
