package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IncidentCondition}.
 */
class IncidentConditionTest {

    @Test
    @DisplayName("Empty condition should match everything")
    void emptyConditionShouldMatch() {
        assertThat(IncidentCondition.parse(Map.of()).test(incident("Anything", Set.of(), List.of()))).isTrue();
        assertThat(IncidentCondition.parse(null)).isEqualTo(IncidentCondition.always());
    }

    @Test
    @DisplayName("All clauses should hold for a match")
    void shouldRequireAllClauses() {
        IncidentCondition condition = IncidentCondition.parse(Map.of(
                "titleContains", "LINK",
                "minAffectedSubjects", 2,
                "evidence_required", true));

        assertThat(condition.test(incident("Malicious link sent", Set.of("a", "b"), List.of("mail-1")))).isTrue();
        assertThat(condition.test(incident("Malicious link sent", Set.of("a"), List.of("mail-1")))).isFalse();
        assertThat(condition.test(incident("Malicious link sent", Set.of("a", "b"), List.of()))).isFalse();
        assertThat(condition.test(incident("Attachment", Set.of("a", "b"), List.of("mail-1")))).isFalse();
    }

    @Test
    @DisplayName("Should match source and subject clauses exactly")
    void shouldMatchSourceAndSubject() {
        IncidentCondition condition = IncidentCondition.parse(Map.of("source", "edr", "subjectRole", "CHILD"));

        assertThat(condition.test(incident("x", Set.of(), List.of()))).isTrue();
        assertThat(IncidentCondition.parse(Map.of("subjectId", "zed")).test(incident("x", Set.of(), List.of())))
                .isFalse();
    }

    @Test
    @DisplayName("Should reject unknown clauses and ill-typed values")
    void shouldRejectBadClauses() {
        assertThatThrownBy(() -> IncidentCondition.parse(Map.of("colour", "red")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("colour");
        assertThatThrownBy(() -> IncidentCondition.parse(Map.of("minAffectedSubjects", "two")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> IncidentCondition.parse(Map.of("evidenceRequired", "yes")))
                .isInstanceOf(ValidationException.class);
    }

    // ---- Helpers

    private static SecurityIncident incident(String title, Set<String> subjects, List<String> evidence) {
        return SecurityIncident.builder()
                .incidentId("inc-1")
                .kind(IncidentKind.PHISHING)
                .severity(IncidentSeverity.MEDIUM)
                .title(title)
                .detectionTime(Instant.parse("2024-01-01T00:00:00Z"))
                .source("edr")
                .subjectId("alice")
                .subjectRole("child")
                .affectedSubjects(subjects)
                .evidence(evidence)
                .build();
    }
}
