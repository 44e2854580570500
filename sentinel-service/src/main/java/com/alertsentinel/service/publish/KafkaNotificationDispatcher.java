package com.alertsentinel.service.publish;

import com.alertsentinel.core.error.CollaboratorException;
import com.alertsentinel.core.notify.NotificationDispatcher;
import com.alertsentinel.core.notify.NotificationRequest;
import com.alertsentinel.core.snapshot.SnapshotCodec;
import com.alertsentinel.service.SentinelMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link NotificationDispatcher} that hands notification requests to a
 * downstream delivery service through a Kafka topic.
 *
 * <p>
 * Each request is published as JSON keyed by recipient class. The call blocks
 * for at most the configured send timeout waiting for the broker
 * acknowledgement; a missing or failed acknowledgement surfaces as a
 * {@link CollaboratorException}, which the response engine records as a
 * failed action.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaNotificationDispatcher.class);

    private final Producer<String, String> producer;
    private final String topic;
    private final Duration sendTimeout;
    private final SentinelMetrics metrics;
    private final ObjectMapper mapper = SnapshotCodec.newObjectMapper();

    public KafkaNotificationDispatcher(Producer<String, String> producer, String topic, Duration sendTimeout,
            SentinelMetrics metrics) {
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.topic = Objects.requireNonNull(topic, "topic must not be null");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public boolean notify(NotificationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String key = request.getRecipientClass().name().toLowerCase(Locale.ROOT);
        String payload;
        try {
            payload = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            metrics.recordNotification(false);
            throw new CollaboratorException("Failed to serialize notification for " + key, e);
        }

        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, key, payload))
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Notification for {} via {} written to {}-{}@{}", key, request.getChannel(),
                    metadata.topic(), metadata.partition(), metadata.offset());
            metrics.recordNotification(true);
            return true;
        } catch (TimeoutException e) {
            metrics.recordNotification(false);
            throw new CollaboratorException("No broker acknowledgement for notification to " + key
                    + " within " + sendTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            metrics.recordNotification(false);
            throw new CollaboratorException("Broker rejected notification to " + key + ": "
                    + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordNotification(false);
            throw new CollaboratorException("Interrupted while publishing notification to " + key, e);
        }
    }
}
