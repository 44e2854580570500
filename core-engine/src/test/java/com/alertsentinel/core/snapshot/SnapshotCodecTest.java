package com.alertsentinel.core.snapshot;

import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.config.ResolvedConfig;
import com.alertsentinel.core.config.SentinelConfigLoader;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.support.MutableClock;
import com.alertsentinel.core.support.RecordingDispatcher;
import com.alertsentinel.core.support.RecordingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SnapshotCodec} against a populated {@link SentinelCore}.
 */
class SnapshotCodecTest {

    private static final Instant T0 = Instant.parse("2024-08-15T09:30:00Z");

    private ResolvedConfig config;
    private MutableClock clock;
    private SnapshotCodec codec;

    @BeforeEach
    void setUp() {
        config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");
        clock = new MutableClock(T0);
        codec = new SnapshotCodec();
    }

    @Test
    @DisplayName("Exported state should survive encoding and import into a fresh core")
    void shouldRestoreIntoFreshCore() {
        SentinelCore source = newCore();
        source.recordSample("cpu", 91, T0, Map.of("host", "web-1"));
        source.recordSample("latency", 0.3, T0.plusSeconds(5), Map.of("subject", "alice"));
        source.reportIncident(IncidentKind.MALWARE, IncidentSeverity.HIGH, "Trojan", "dropper", "edr",
                List.of("alice"), "alice", null);
        source.runEscalationScan();

        byte[] json = codec.encode(source.exportState());
        StateSnapshot decoded = codec.decode(json);
        SentinelCore restored = newCore();
        restored.importState(decoded);

        assertThat(restored.getAlertStats()).isEqualTo(source.getAlertStats());
        assertThat(restored.getIncidentSummary("alice")).isEqualTo(source.getIncidentSummary("alice"));
        assertThat(restored.getIncidentSummary(null)).isEqualTo(source.getIncidentSummary(null));
        assertThat(restored.getMetricSummaries()).isEqualTo(source.getMetricSummaries());
        assertThat(restored.getAlerts()).isEqualTo(source.getAlerts());
    }

    @Test
    @DisplayName("Restored cooldown state should keep suppressing")
    void shouldRestoreGateState() {
        SentinelCore source = newCore();
        source.recordSample("cpu", 91, T0);

        SentinelCore restored = newCore();
        restored.importState(codec.decode(codec.encode(source.exportState())));

        assertThat(restored.recordSample("cpu", 95, T0.plusSeconds(10))).isEmpty();
    }

    @Test
    @DisplayName("Encoded snapshot should carry its version and ISO timestamps")
    void shouldEncodeReadableJson() {
        String json = new String(codec.encode(newCore().exportState()), StandardCharsets.UTF_8);

        assertThat(json).contains("\"version\" : 1").contains("2024-08-15T09:30:00Z");
    }

    @Test
    @DisplayName("Should reject malformed input and unknown versions")
    void shouldRejectBadInput() {
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> codec.decode("{\"version\": 99}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("99");
    }

    // ---- Helpers

    private SentinelCore newCore() {
        return new SentinelCore(config, new RecordingDispatcher(), new RecordingGateway(), clock);
    }
}
