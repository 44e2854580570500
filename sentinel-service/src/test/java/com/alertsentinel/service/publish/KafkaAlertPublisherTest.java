package com.alertsentinel.service.publish;

import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.config.SentinelConfigLoader;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KafkaAlertPublisher} registered on a live core.
 */
class KafkaAlertPublisherTest {

    private static final Instant T0 = Instant.parse("2024-07-01T10:00:00Z");

    @Test
    @DisplayName("Should publish each fired alert as JSON keyed by rule id")
    void shouldPublishFiredAlerts() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(),
                new StringSerializer());
        SentinelCore core = SentinelCore.withDefaults(SentinelConfigLoader.fromClasspath("service-test.yml"));
        core.addAlertCallback(new KafkaAlertPublisher(producer, "alerts"));

        core.recordSample("cpu", 50.0, T0);
        core.recordSample("cpu", 93.0, T0.plusSeconds(10));

        assertThat(producer.history()).hasSize(1);
        ProducerRecord<String, String> record = producer.history().get(0);
        assertThat(record.topic()).isEqualTo("alerts");
        assertThat(record.key()).isEqualTo("svc_cpu");
        assertThat(record.value())
                .contains("\"ruleId\":\"svc_cpu\"")
                .contains("\"observedValue\":93.0")
                .contains("\"timestamp\":\"2024-07-01T10:00:10Z\"");
    }

    @Test
    @DisplayName("A failing producer should not break sample ingestion")
    void shouldSurviveSendFailure() {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(),
                new StringSerializer());
        SentinelCore core = SentinelCore.withDefaults(SentinelConfigLoader.fromClasspath("service-test.yml"));
        core.addAlertCallback(new KafkaAlertPublisher(producer, "alerts"));

        core.recordSample("cpu", 93.0, T0);
        producer.errorNext(new IllegalStateException("broker down"));

        assertThat(core.getActiveAlerts()).hasSize(1);
        assertThat(core.getAlertStats().getCallbackErrors()).isZero();
    }
}
