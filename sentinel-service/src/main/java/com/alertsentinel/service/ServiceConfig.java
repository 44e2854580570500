package com.alertsentinel.service;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed, immutable configuration for the Alert Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String sampleTopic;
    private final String detectionTopic;
    private final String alertTopic;
    private final String notificationTopic;
    private final String kafkaGroupId;
    private final long pollTimeoutMs;
    private final long sendTimeoutMs;

    // ---------------------------------------------------------------
    // Sentinel
    // ---------------------------------------------------------------
    private final String sentinelConfigPath;
    private final String snapshotPath;

    // ---------------------------------------------------------------
    // Health / query endpoint
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.sampleTopic = b.sampleTopic;
        this.detectionTopic = b.detectionTopic;
        this.alertTopic = b.alertTopic;
        this.notificationTopic = b.notificationTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.pollTimeoutMs = b.pollTimeoutMs;
        this.sendTimeoutMs = b.sendTimeoutMs;
        this.sentinelConfigPath = b.sentinelConfigPath;
        this.snapshotPath = b.snapshotPath;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from an explicit variable map.
     */
    static ServiceConfig fromEnvironment(Map<String, String> environment) {
        Function<String, String> lookup = environment::get;
        try {
            return new Builder()
                    .kafkaBootstrapServers(env(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .sampleTopic(env(lookup, "KAFKA_SAMPLE_TOPIC", "telemetry"))
                    .detectionTopic(env(lookup, "KAFKA_DETECTION_TOPIC", "detections"))
                    .alertTopic(env(lookup, "KAFKA_ALERT_TOPIC", "alerts"))
                    .notificationTopic(env(lookup, "KAFKA_NOTIFICATION_TOPIC", "notifications"))
                    .kafkaGroupId(env(lookup, "KAFKA_GROUP_ID", "alert-sentinel"))
                    .pollTimeoutMs(Long.parseLong(env(lookup, "KAFKA_POLL_TIMEOUT_MS", "500")))
                    .sendTimeoutMs(Long.parseLong(env(lookup, "KAFKA_SEND_TIMEOUT_MS", "5000")))
                    .sentinelConfigPath(env(lookup, "SENTINEL_CONFIG_PATH", ""))
                    .snapshotPath(env(lookup, "SNAPSHOT_PATH", ""))
                    .healthPort(Integer.parseInt(env(lookup, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * @return new consumer Properties with String key/value deserializers
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("group.id", kafkaGroupId);
        props.setProperty("auto.offset.reset", "earliest");
        props.setProperty("enable.auto.commit", "true");
        props.setProperty("key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        props.setProperty("value.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
        return props;
    }

    /**
     * @return new producer Properties with String key/value serializers
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("delivery.timeout.ms", String.valueOf(Math.max(sendTimeoutMs, 30_000L)));
        props.setProperty("key.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        props.setProperty("value.serializer", "org.apache.kafka.common.serialization.StringSerializer");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSampleTopic() {
        return sampleTopic;
    }

    public String getDetectionTopic() {
        return detectionTopic;
    }

    public String getAlertTopic() {
        return alertTopic;
    }

    public String getNotificationTopic() {
        return notificationTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public Duration getPollTimeout() {
        return Duration.ofMillis(pollTimeoutMs);
    }

    public Duration getSendTimeout() {
        return Duration.ofMillis(sendTimeoutMs);
    }

    /**
     * @return explicit sentinel YAML path, or an empty string to fall back to
     *         the classpath resource
     */
    public String getSentinelConfigPath() {
        return sentinelConfigPath;
    }

    /**
     * @return snapshot file path, or an empty string when persistence is off
     */
    public String getSnapshotPath() {
        return snapshotPath;
    }

    public boolean isSnapshotEnabled() {
        return !snapshotPath.isBlank();
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} checks that topic names are non-blank and distinct
     * for ingress, timeouts are positive and the port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String sampleTopic = "telemetry";
        private String detectionTopic = "detections";
        private String alertTopic = "alerts";
        private String notificationTopic = "notifications";
        private String kafkaGroupId = "alert-sentinel";
        private long pollTimeoutMs = 500;
        private long sendTimeoutMs = 5_000;
        private String sentinelConfigPath = "";
        private String snapshotPath = "";
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder sampleTopic(String v) {
            this.sampleTopic = v;
            return this;
        }

        public Builder detectionTopic(String v) {
            this.detectionTopic = v;
            return this;
        }

        public Builder alertTopic(String v) {
            this.alertTopic = v;
            return this;
        }

        public Builder notificationTopic(String v) {
            this.notificationTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder pollTimeoutMs(long v) {
            this.pollTimeoutMs = v;
            return this;
        }

        public Builder sendTimeoutMs(long v) {
            this.sendTimeoutMs = v;
            return this;
        }

        public Builder sentinelConfigPath(String v) {
            this.sentinelConfigPath = v;
            return this;
        }

        public Builder snapshotPath(String v) {
            this.snapshotPath = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(sampleTopic, "sampleTopic");
            requireNonBlank(detectionTopic, "detectionTopic");
            requireNonBlank(alertTopic, "alertTopic");
            requireNonBlank(notificationTopic, "notificationTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (sampleTopic.equals(detectionTopic)) {
                throw new IllegalArgumentException(
                        "sampleTopic and detectionTopic must differ, both are: " + sampleTopic);
            }
            if (pollTimeoutMs < 1) {
                throw new IllegalArgumentException("pollTimeoutMs must be >= 1, got: " + pollTimeoutMs);
            }
            if (sendTimeoutMs < 1) {
                throw new IllegalArgumentException("sendTimeoutMs must be >= 1, got: " + sendTimeoutMs);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (sentinelConfigPath == null) {
                sentinelConfigPath = "";
            }
            if (snapshotPath == null) {
                snapshotPath = "";
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", sampleTopic='" + sampleTopic + '\'' +
                ", detectionTopic='" + detectionTopic + '\'' +
                ", alertTopic='" + alertTopic + '\'' +
                ", notificationTopic='" + notificationTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", pollTimeoutMs=" + pollTimeoutMs +
                ", sendTimeoutMs=" + sendTimeoutMs +
                ", sentinelConfigPath='" + sentinelConfigPath + '\'' +
                ", snapshotPath='" + snapshotPath + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
