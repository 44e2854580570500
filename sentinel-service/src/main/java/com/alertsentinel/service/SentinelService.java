package com.alertsentinel.service;

import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.config.ResolvedConfig;
import com.alertsentinel.core.config.SentinelConfigLoader;
import com.alertsentinel.core.response.LoggingEnforcementGateway;
import com.alertsentinel.core.snapshot.SnapshotStore;
import com.alertsentinel.core.snapshot.StateSnapshot;
import com.alertsentinel.service.ingest.KafkaIngestLoop;
import com.alertsentinel.service.publish.KafkaAlertPublisher;
import com.alertsentinel.service.publish.KafkaNotificationDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the Alert Sentinel service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (telemetry topic)  → KafkaIngestLoop → SentinelCore.recordSample
 *   Kafka (detection topic)  → KafkaIngestLoop → SentinelCore.reportIncident
 *   fired alerts             → KafkaAlertPublisher → Kafka (alerts topic)
 *   notifications            → KafkaNotificationDispatcher → Kafka (notifications topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Service settings come from environment variables via
 * {@link ServiceConfig}; rules and policies from the sentinel YAML via
 * {@link SentinelConfigLoader}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * When a snapshot path is configured the last snapshot is restored before
 * ingestion starts and a new one is written on shutdown.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelService.class);
    private static final Duration PRODUCER_CLOSE_WAIT = Duration.ofSeconds(5);

    private final ServiceConfig config;
    private final ResolvedConfig sentinelConfig;
    private final MeterRegistry registry;
    private final Producer<String, String> producer;
    private final SentinelMetrics metrics;
    private final SentinelCore core;
    private final KafkaIngestLoop ingestLoop;
    private final HealthServer healthServer;
    private final SnapshotStore snapshotStore;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SentinelService(ServiceConfig config, ResolvedConfig sentinelConfig) {
        this(config, sentinelConfig,
                new KafkaProducer<>(config.kafkaProducerProperties()),
                new KafkaConsumer<>(config.kafkaConsumerProperties()),
                new LoggingMeterRegistry());
    }

    SentinelService(ServiceConfig config, ResolvedConfig sentinelConfig, Producer<String, String> producer,
            Consumer<String, String> consumer, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sentinelConfig = Objects.requireNonNull(sentinelConfig, "sentinelConfig must not be null");
        this.producer = Objects.requireNonNull(producer, "producer must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        this.metrics = new SentinelMetrics(registry);
        KafkaNotificationDispatcher dispatcher = new KafkaNotificationDispatcher(producer,
                config.getNotificationTopic(), config.getSendTimeout(), metrics);
        this.core = new SentinelCore(sentinelConfig, dispatcher, new LoggingEnforcementGateway(),
                Clock.systemUTC());
        core.addAlertCallback(new KafkaAlertPublisher(producer, config.getAlertTopic()));
        core.addAlertCallback(metrics::recordAlert);
        metrics.bindCore(core);

        this.ingestLoop = new KafkaIngestLoop(consumer, config.getSampleTopic(), config.getDetectionTopic(),
                config.getPollTimeout(), core, metrics, Clock.systemUTC());
        this.healthServer = new HealthServer(core);
        this.snapshotStore = config.isSnapshotEnabled()
                ? new FileSnapshotStore(Path.of(config.getSnapshotPath()))
                : null;
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Alert Sentinel with config: {}", config);

        // 2. Load rules, policies and tuning
        ResolvedConfig sentinelConfig = loadSentinelConfig(config);

        // 3. Start and register shutdown
        SentinelService service = new SentinelService(config, sentinelConfig);
        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "sentinel-shutdown"));
        service.start();
    }

    private static ResolvedConfig loadSentinelConfig(ServiceConfig config) {
        String path = config.getSentinelConfigPath();
        if (!path.isBlank()) {
            return SentinelConfigLoader.fromFile(path);
        }
        return SentinelConfigLoader.fromClasspath(SentinelConfigLoader.DEFAULT_RESOURCE);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Restore the last snapshot, then start the core workers, the health
     * server and ingestion.
     *
     * @throws com.alertsentinel.core.error.ValidationException if the stored
     *                                                         snapshot is
     *                                                         unreadable
     */
    public void start() {
        restoreSnapshot();
        core.start();
        healthServer.start(config.getHealthPort());
        ingestLoop.start();
        LOG.info("Alert Sentinel started");
    }

    /**
     * Stop ingestion first so the snapshot captures a quiescent core.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Shutting down Alert Sentinel");
        ingestLoop.stop();
        core.stop();
        if (snapshotStore != null) {
            snapshotStore.save(core.exportState());
        }
        healthServer.stop();
        producer.close(PRODUCER_CLOSE_WAIT);
        registry.close();
    }

    private void restoreSnapshot() {
        if (snapshotStore == null) {
            LOG.info("Snapshot persistence disabled");
            return;
        }
        Optional<StateSnapshot> snapshot = snapshotStore.load();
        if (snapshot.isEmpty()) {
            return;
        }
        core.importState(snapshot.get());
        // Rules come from configuration; only state of rules whose id is unchanged carries over.
        core.setConfig(sentinelConfig);
        LOG.info("Snapshot restored, configured rules re-applied");
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public SentinelCore getCore() {
        return core;
    }

    public SentinelMetrics getMetrics() {
        return metrics;
    }

    HealthServer getHealthServer() {
        return healthServer;
    }

    KafkaIngestLoop getIngestLoop() {
        return ingestLoop;
    }
}
