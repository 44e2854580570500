package com.alertsentinel.service.publish;

import com.alertsentinel.core.alerting.AlertCallback;
import com.alertsentinel.core.error.CollaboratorException;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.snapshot.SnapshotCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Alert callback that publishes every fired alert as JSON, keyed by rule id.
 *
 * <p>
 * Sends are asynchronous; a failed send is logged from the producer
 * callback. Instants are written as ISO-8601 strings.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaAlertPublisher implements AlertCallback {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaAlertPublisher.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper mapper = SnapshotCodec.newObjectMapper();

    public KafkaAlertPublisher(Producer<String, String> producer, String topic) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
    }

    /**
     * @throws CollaboratorException if the alert cannot be serialized
     */
    @Override
    public void onAlert(Alert alert) {
        String payload;
        try {
            payload = mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Failed to serialize alert " + alert.getAlertId(), e);
        }
        producer.send(new ProducerRecord<>(topic, alert.getRuleId(), payload), (metadata, error) -> {
            if (error != null) {
                LOG.warn("Failed to publish alert {} to {}: {}", alert.getAlertId(), topic, error.getMessage());
            }
        });
    }
}
