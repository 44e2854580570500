package com.alertsentinel.service.ingest;

import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.error.SentinelException;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.snapshot.SnapshotCodec;
import com.alertsentinel.service.SentinelMetrics;
import com.alertsentinel.service.ServiceConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds telemetry samples and detection reports from Kafka into the core.
 *
 * <h3>Topics</h3>
 * <ul>
 * <li>sample topic: {@link TelemetryMessage} JSON, recorded through
 * {@link SentinelCore#recordSample}</li>
 * <li>detection topic: {@link DetectionMessage} JSON, reported through
 * {@link SentinelCore#reportIncident}</li>
 * </ul>
 *
 * <p>
 * Malformed or rejected records are logged, counted and skipped so that a
 * single bad record does not stop ingestion. The loop runs on its own thread
 * and owns the consumer, which is not thread-safe; {@link #stop()} wakes the
 * consumer and waits for the thread to finish.
 * </p>
 *
 * @since 1.0.0
 */
public class KafkaIngestLoop implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaIngestLoop.class);
    private static final Duration STOP_WAIT = Duration.ofSeconds(10);

    private final Consumer<String, String> consumer;
    private final String sampleTopic;
    private final String detectionTopic;
    private final Duration pollTimeout;
    private final SentinelCore core;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final ObjectMapper mapper = SnapshotCodec.newObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Thread thread;

    public KafkaIngestLoop(ServiceConfig config, SentinelCore core, SentinelMetrics metrics) {
        this(new KafkaConsumer<>(config.kafkaConsumerProperties()), config.getSampleTopic(),
                config.getDetectionTopic(), config.getPollTimeout(), core, metrics, Clock.systemUTC());
    }

    public KafkaIngestLoop(Consumer<String, String> consumer, String sampleTopic, String detectionTopic,
            Duration pollTimeout, SentinelCore core, SentinelMetrics metrics, Clock clock) {
        this.consumer = Objects.requireNonNull(consumer, "consumer must not be null");
        this.sampleTopic = Objects.requireNonNull(sampleTopic, "sampleTopic must not be null");
        this.detectionTopic = Objects.requireNonNull(detectionTopic, "detectionTopic must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        this.core = Objects.requireNonNull(core, "core must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        thread = new Thread(this, "kafka-ingest");
        thread.start();
        LOG.info("Ingest loop started on topics [{}, {}]", sampleTopic, detectionTopic);
    }

    /**
     * Signal the loop to finish and wait for the consumer to close.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        consumer.wakeup();
        if (thread != null) {
            try {
                thread.join(STOP_WAIT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Ingest loop stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void run() {
        try {
            subscribe();
            while (running.get()) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                throw e;
            }
        } catch (RuntimeException e) {
            LOG.error("Ingest loop terminated unexpectedly: {}", e.getMessage(), e);
            running.set(false);
            throw e;
        } finally {
            consumer.close();
        }
    }

    // ---------------------------------------------------------------
    // Polling
    // ---------------------------------------------------------------

    void subscribe() {
        consumer.subscribe(List.of(sampleTopic, detectionTopic));
    }

    /**
     * Poll once and hand every record to the core.
     *
     * @return number of records handled successfully
     */
    int pollOnce() {
        ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
        int handled = 0;
        for (ConsumerRecord<String, String> record : records) {
            if (handle(record)) {
                handled++;
            }
        }
        return handled;
    }

    private boolean handle(ConsumerRecord<String, String> record) {
        long started = System.nanoTime();
        String topic = record.topic();
        if (record.value() == null || record.value().isBlank()) {
            LOG.warn("Empty record on {} at offset {} – skipping", topic, record.offset());
            metrics.incrementMalformed(topic);
            return false;
        }
        try {
            if (sampleTopic.equals(topic)) {
                TelemetryMessage message = mapper.readValue(record.value(), TelemetryMessage.class);
                core.recordSample(message.toSample(clock.instant()));
                metrics.incrementSamplesIngested();
            } else if (detectionTopic.equals(topic)) {
                DetectionMessage message = mapper.readValue(record.value(), DetectionMessage.class);
                String incidentId = core.reportIncident(message.toRequest());
                metrics.incrementDetectionsIngested();
                LOG.debug("Detection at offset {} became incident {}", record.offset(), incidentId);
            } else {
                LOG.warn("Record from unexpected topic {} – skipping", topic);
                return false;
            }
            return true;
        } catch (JsonProcessingException | ValidationException e) {
            LOG.warn("Rejected record on {} at offset {} – skipping: {}", topic, record.offset(), e.getMessage());
            metrics.incrementMalformed(topic);
            return false;
        } catch (SentinelException e) {
            LOG.error("Core failed to handle record on {} at offset {}: {}", topic, record.offset(),
                    e.getMessage(), e);
            return false;
        } finally {
            metrics.recordLatency((System.nanoTime() - started) / 1_000_000L);
        }
    }
}
