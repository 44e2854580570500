package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ComparisonOperator} and enum name parsing.
 */
class ComparisonOperatorTest {

    @ParameterizedTest(name = "{1} {0} {2} -> {3}")
    @CsvSource({
            ">,  81, 80, true",
            ">,  80, 80, false",
            ">=, 80, 80, true",
            "<,  79, 80, true",
            "<=, 81, 80, false",
            "==, 80.0009, 80, true",
            "==, 80.01, 80, false",
            "!=, 80.0009, 80, false",
            "!=, 80.01, 80, true"
    })
    @DisplayName("Should compare values against thresholds")
    void shouldCompare(String symbol, double value, double threshold, boolean expected) {
        assertThat(ComparisonOperator.fromSymbol(symbol).test(value, threshold)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject unknown comparator symbols")
    void shouldRejectUnknownSymbol() {
        assertThatThrownBy(() -> ComparisonOperator.fromSymbol("=>"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'=>'")
                .hasMessageContaining(">=");
    }

    @Test
    @DisplayName("Enum names should parse from wire form regardless of case")
    void shouldParseWireNames() {
        assertThat(IncidentKind.parse("data-breach")).isEqualTo(IncidentKind.DATA_BREACH);
        assertThat(IncidentKind.parse("Child_Exploitation")).isEqualTo(IncidentKind.CHILD_EXPLOITATION);
        assertThat(ResponseAction.parse(" notify-subject-group ")).isEqualTo(ResponseAction.NOTIFY_SUBJECT_GROUP);
        assertThat(ResponseAction.NOTIFY_EXTERNAL_AUTHORITY.wireName()).isEqualTo("notify-external-authority");
        assertThat(AlertSeverity.parse("CRITICAL")).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Unknown names should list the supported values")
    void shouldRejectUnknownNames() {
        assertThatThrownBy(() -> ResponseAction.parse("teleport"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown response action: 'teleport'")
                .hasMessageContaining("quarantine");
    }

    @Test
    @DisplayName("Incident lifecycle should only move forward")
    void shouldOrderIncidentStatuses() {
        assertThat(IncidentStatus.DETECTED.canMoveTo(IncidentStatus.CONTAINED)).isTrue();
        assertThat(IncidentStatus.CONTAINED.canMoveTo(IncidentStatus.INVESTIGATING)).isFalse();
        assertThat(IncidentStatus.RESOLVED.canMoveTo(IncidentStatus.CLOSED)).isTrue();
        assertThat(IncidentStatus.CLOSED.canMoveTo(IncidentStatus.CLOSED)).isFalse();
    }
}
