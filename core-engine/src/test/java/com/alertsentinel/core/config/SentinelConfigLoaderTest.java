package com.alertsentinel.core.config;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.AlertSeverity;
import com.alertsentinel.core.model.ComparisonOperator;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.ResponseRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SentinelConfigLoader}.
 */
class SentinelConfigLoaderTest {

    @Test
    @DisplayName("Should load and resolve test configuration from classpath")
    void shouldLoadFromClasspath() {
        ResolvedConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getAlertRules()).hasSize(2);
        AlertRule cpu = config.getAlertRules().get(0);
        assertThat(cpu.getRuleId()).isEqualTo("test_cpu");
        assertThat(cpu.getName()).isEqualTo("test_cpu");
        assertThat(cpu.getComparator()).isEqualTo(ComparisonOperator.GREATER_THAN);
        assertThat(cpu.getThreshold()).isEqualTo(80.0);
        assertThat(cpu.getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(cpu.getMaxAlertsPerHour()).isEqualTo(5);
        assertThat(cpu.isAdaptive()).isFalse();

        AlertRule latency = config.getAlertRules().get(1);
        assertThat(latency.getComparator()).isEqualTo(ComparisonOperator.LESS_OR_EQUAL);
        assertThat(latency.isAdaptive()).isTrue();
        assertThat(latency.getIncidentKind()).isEqualTo(IncidentKind.NETWORK_ATTACK);
        assertThat(latency.getCooldownSeconds()).isEqualTo(300);
    }

    @Test
    @DisplayName("Should resolve response rules with mixed-case names and conditions")
    void shouldResolveResponseRules() {
        ResolvedConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        List<ResponseRule> rules = config.getResponseRules();
        assertThat(rules).extracting(ResponseRule::getRuleId).containsExactly("test_malware", "test_phishing");
        assertThat(rules.get(0).getActions())
                .containsExactly(ResponseAction.ISOLATE, ResponseAction.NOTIFY_SUBJECT_GROUP);
        assertThat(rules.get(0).getSeverityFloor()).isEqualTo(IncidentSeverity.MEDIUM);
        assertThat(rules.get(0).isEnabled()).isTrue();

        ResponseRule phishing = rules.get(1);
        assertThat(phishing.getIncidentKind()).isEqualTo(IncidentKind.PHISHING);
        assertThat(phishing.getSubjectRole()).isEqualTo("child");
        assertThat(phishing.isEnabled()).isFalse();
        assertThat(phishing.getCondition().getClauses()).containsKeys("titleContains", "minAffectedSubjects");
    }

    @Test
    @DisplayName("Should apply default escalation policies and tuning overrides")
    void shouldApplyDefaults() {
        ResolvedConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getEscalationPolicies()).hasSize(4);
        assertThat(config.getEscalationPolicies().get(IncidentSeverity.CRITICAL).isEscalateImmediately()).isTrue();
        assertThat(config.getEscalationPolicies().get(IncidentSeverity.HIGH).getEscalationAgeSeconds())
                .isEqualTo(1800);
        assertThat(config.getTuning().getDebounceWindowSeconds()).isEqualTo(120);
        assertThat(config.getTuning().getStaleAlertAgeSeconds()).isEqualTo(600);
        assertThat(config.getTuning().getAlertHistoryCapacity()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadBundledDefaults() {
        ResolvedConfig config = SentinelConfigLoader.load(null);

        assertThat(config.getAlertRules()).extracting(AlertRule::getRuleId)
                .contains("high_cpu_usage", "low_disk_space");
        assertThat(config.getResponseRules()).extracting(ResponseRule::getRuleId)
                .contains("malware_response", "data_breach_response");
    }

    @Test
    @DisplayName("Should report every invalid entry in one exception")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("=>")
                .hasMessageContaining("no_threshold")
                .hasMessageContaining("ransomware")
                .hasMessageContaining("teleport");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("duplicate-keys.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should reject duplicate rule ids")
    void shouldRejectDuplicateRuleIds() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("duplicate-ids.yml"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Duplicate alert rule id: 'same'");
    }

    @Test
    @DisplayName("Should treat an empty file as an empty configuration")
    void shouldAcceptEmptyFile() {
        ResolvedConfig config = SentinelConfigLoader.fromClasspath("empty.yml");

        assertThat(config.getAlertRules()).isEmpty();
        assertThat(config.getResponseRules()).isEmpty();
        assertThat(config.getEscalationPolicies()).hasSize(4);
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sentinel.yml");
        Files.writeString(file, """
                alertRules:
                  - ruleId: disk
                    metricName: disk_usage
                    threshold: 90
                """);

        ResolvedConfig config = SentinelConfigLoader.load(file.toString());

        assertThat(config.getAlertRules()).singleElement()
                .extracting(AlertRule::getMetricName).isEqualTo("disk_usage");
    }

    @Test
    @DisplayName("Should throw when the file or resource does not exist")
    void shouldThrowForMissingSources() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromFile("/no/such/sentinel.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
