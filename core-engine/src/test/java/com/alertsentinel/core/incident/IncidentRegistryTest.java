package com.alertsentinel.core.incident;

import com.alertsentinel.core.config.TuningConfig;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.error.StateTransitionException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.SecurityIncident;
import com.alertsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IncidentRegistry}.
 */
class IncidentRegistryTest {

    private static final Instant T0 = Instant.parse("2024-03-10T12:00:00Z");

    private MutableClock clock;
    private IncidentRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new IncidentRegistry(TuningConfig.defaults(), clock);
    }

    @Test
    @DisplayName("New incidents should start in DETECTED with a unique id")
    void shouldCreateDetectedIncident() {
        SecurityIncident a = registry.create(request("alice", IncidentSeverity.HIGH).build());
        SecurityIncident b = registry.create(request("alice", IncidentSeverity.HIGH).build());

        assertThat(a.getStatus()).isEqualTo(IncidentStatus.DETECTED);
        assertThat(a.getStatusHistory()).containsExactly(IncidentStatus.DETECTED);
        assertThat(a.getDetectionTime()).isEqualTo(T0);
        assertThat(a.getIncidentId()).isNotEqualTo(b.getIncidentId());
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should notify listeners and survive a failing one")
    void shouldNotifyListeners() {
        List<SecurityIncident> seen = new ArrayList<>();
        registry.addListener(i -> {
            throw new IllegalStateException("listener down");
        });
        registry.addListener(seen::add);

        SecurityIncident created = registry.create(request("bob", IncidentSeverity.LOW).build());

        assertThat(seen).extracting(SecurityIncident::getIncidentId).containsExactly(created.getIncidentId());
    }

    @Test
    @DisplayName("Status should only move forward")
    void shouldEnforceForwardLifecycle() {
        String id = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();

        registry.transition(id, IncidentStatus.CONTAINED, "analyst");

        assertThatThrownBy(() -> registry.transition(id, IncidentStatus.INVESTIGATING, "analyst"))
                .isInstanceOf(StateTransitionException.class);
        assertThatThrownBy(() -> registry.transition(id, IncidentStatus.DETECTED, "analyst"))
                .isInstanceOf(StateTransitionException.class);
        assertThat(registry.getIncident(id).getStatusHistory())
                .containsExactly(IncidentStatus.DETECTED, IncidentStatus.CONTAINED);
    }

    @Test
    @DisplayName("Resolving should record notes, resolver and time")
    void shouldResolve() {
        String id = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();
        clock.advance(Duration.ofMinutes(45));

        SecurityIncident resolved = registry.resolve(id, "false positive", "carol");

        assertThat(resolved.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(resolved.getResolutionNotes()).isEqualTo("false positive");
        assertThat(resolved.getResolvedBy()).isEqualTo("carol");
        assertThat(resolved.getAssignedTo()).isEqualTo("carol");
        assertThat(resolved.getResolutionTime()).isEqualTo(T0.plus(Duration.ofMinutes(45)));
        assertThatThrownBy(() -> registry.resolve(id, "again", "carol"))
                .isInstanceOf(StateTransitionException.class);
    }

    @Test
    @DisplayName("Close should only be allowed from RESOLVED")
    void shouldCloseOnlyWhenResolved() {
        String id = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();

        assertThatThrownBy(() -> registry.close(id)).isInstanceOf(StateTransitionException.class);

        registry.transition(id, IncidentStatus.RESOLVED, "carol");
        SecurityIncident closed = registry.close(id);

        assertThat(closed.getStatus()).isEqualTo(IncidentStatus.CLOSED);
        assertThatThrownBy(() -> registry.transition(id, IncidentStatus.CLOSED, "carol"))
                .isInstanceOf(StateTransitionException.class);
    }

    @Test
    @DisplayName("Escalation flag should be raised once and only on open incidents")
    void shouldEscalateOnce() {
        String id = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();
        String other = registry.create(request("alice", IncidentSeverity.LOW).build()).getIncidentId();
        registry.resolve(other, null, null);

        assertThat(registry.markEscalated(id)).isTrue();
        assertThat(registry.markEscalated(id)).isFalse();
        assertThat(registry.markEscalated(other)).isFalse();
        assertThat(registry.getIncident(id).getEscalatedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("Returned incidents should be independent copies")
    void shouldReturnCopies() {
        SecurityIncident created = registry.create(request("alice", IncidentSeverity.HIGH).build());

        created.addEvidence("tampered");
        created.recordActionTaken(ResponseAction.BLOCK);

        SecurityIncident stored = registry.getIncident(created.getIncidentId());
        assertThat(stored.getEvidence()).doesNotContain("tampered");
        assertThat(stored.getResponseActionsTaken()).isEmpty();
    }

    @Test
    @DisplayName("Should record evidence, actions and assignment")
    void shouldMutateThroughRegistry() {
        String id = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();

        registry.addEvidence(id, "pcap-17");
        registry.recordActionTaken(id, ResponseAction.ISOLATE);
        registry.assign(id, "dave");

        SecurityIncident stored = registry.getIncident(id);
        assertThat(stored.getEvidence()).containsExactly("initial log", "pcap-17");
        assertThat(stored.getResponseActionsTaken()).containsExactly(ResponseAction.ISOLATE);
        assertThat(stored.getAssignedTo()).isEqualTo("dave");
    }

    @Test
    @DisplayName("Unknown ids should raise NotFoundException")
    void shouldRaiseNotFound() {
        assertThatThrownBy(() -> registry.getIncident("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.resolve("nope", null, null)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.addEvidence("nope", "x")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Should filter by status and severity")
    void shouldListWithFilters() {
        String high = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();
        registry.create(request("alice", IncidentSeverity.LOW).build());
        registry.resolve(high, null, null);

        assertThat(registry.listIncidents(null, null)).hasSize(2);
        assertThat(registry.listIncidents(IncidentStatus.RESOLVED, null))
                .extracting(SecurityIncident::getIncidentId).containsExactly(high);
        assertThat(registry.listIncidents(null, IncidentSeverity.LOW)).hasSize(1);
        assertThat(registry.listIncidents(IncidentStatus.RESOLVED, IncidentSeverity.LOW)).isEmpty();
        assertThat(registry.openIncidents()).hasSize(1);
    }

    @Test
    @DisplayName("Summary should aggregate one subject's incidents")
    void shouldSummariseSubject() {
        String first = registry.create(request("alice", IncidentSeverity.HIGH).build()).getIncidentId();
        clock.advance(Duration.ofMinutes(1));
        String second = registry.create(request("alice", IncidentSeverity.LOW)
                .kind(IncidentKind.PHISHING).build()).getIncidentId();
        registry.create(request("bob", IncidentSeverity.CRITICAL).build());
        registry.resolve(first, null, null);
        registry.markEscalated(second);

        IncidentSummary summary = registry.getSummary("alice");

        assertThat(summary.getSubjectId()).isEqualTo("alice");
        assertThat(summary.getTotalIncidents()).isEqualTo(2);
        assertThat(summary.getOpenIncidents()).isEqualTo(1);
        assertThat(summary.getResolvedIncidents()).isEqualTo(1);
        assertThat(summary.getEscalatedIncidents()).isEqualTo(1);
        assertThat(summary.getByKind()).containsEntry("malware", 1L).containsEntry("phishing", 1L);
        assertThat(summary.getBySeverity()).doesNotContainKey("critical");
        assertThat(summary.getRecentIncidents()).extracting(SecurityIncident::getIncidentId)
                .containsExactly(second, first);
    }

    @Test
    @DisplayName("Summary of an unknown subject should be empty")
    void shouldSummariseUnknownSubject() {
        registry.create(request("alice", IncidentSeverity.HIGH).build());

        IncidentSummary summary = registry.getSummary("zed");

        assertThat(summary.getTotalIncidents()).isZero();
        assertThat(summary.getRecentIncidents()).isEmpty();
        assertThat(registry.getSummary(null).getTotalIncidents()).isEqualTo(1);
    }

    @Test
    @DisplayName("Summary should cap recent incidents")
    void shouldCapRecentIncidents() {
        TuningConfig tuning = new TuningConfig();
        tuning.setRecentIncidentCount(2);
        IncidentRegistry small = new IncidentRegistry(tuning, clock);
        for (int i = 0; i < 4; i++) {
            small.create(request("alice", IncidentSeverity.LOW).build());
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(small.getSummary("alice").getRecentIncidents()).hasSize(2);
        assertThat(small.getSummary("alice").getTotalIncidents()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should find the oldest open incident for a source")
    void shouldFindOpenBySource() {
        String first = registry.create(request("alice", IncidentSeverity.HIGH).source("sensor-1").build())
                .getIncidentId();
        registry.create(request("alice", IncidentSeverity.HIGH).source("sensor-1").build());

        assertThat(registry.findOpenBySource("sensor-1")).get()
                .extracting(SecurityIncident::getIncidentId).isEqualTo(first);

        registry.resolve(first, null, null);
        assertThat(registry.findOpenBySource("sensor-1")).get()
                .extracting(SecurityIncident::getIncidentId).isNotEqualTo(first);
        assertThat(registry.findOpenBySource("sensor-2")).isEmpty();
    }

    @Test
    @DisplayName("Request validation should list every missing field")
    void shouldValidateRequest() {
        assertThatThrownBy(() -> IncidentRequest.builder().build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'kind'")
                .hasMessageContaining("'severity'")
                .hasMessageContaining("'title'");
    }

    @Test
    @DisplayName("Imported incidents should replace the registry contents")
    void shouldImport() {
        registry.create(request("alice", IncidentSeverity.HIGH).build());
        List<SecurityIncident> exported = registry.exportIncidents();

        IncidentRegistry restored = new IncidentRegistry(TuningConfig.defaults(), clock);
        restored.importIncidents(exported);

        assertThat(restored.exportIncidents()).isEqualTo(exported);
        assertThat(restored.getSummary("alice")).isEqualTo(registry.getSummary("alice"));
    }

    // ---- Helpers

    private static IncidentRequest.Builder request(String subject, IncidentSeverity severity) {
        return IncidentRequest.builder()
                .kind(IncidentKind.MALWARE)
                .severity(severity)
                .title("Suspicious binary")
                .description("Unsigned binary executed")
                .affectedSubjects(List.of(subject))
                .subjectId(subject)
                .evidence(List.of("initial log"));
    }
}
