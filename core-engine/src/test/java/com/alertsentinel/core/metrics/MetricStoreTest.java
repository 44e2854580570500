package com.alertsentinel.core.metrics;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.MetricSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link MetricStore}.
 */
class MetricStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MetricStore store;

    @BeforeEach
    void setUp() {
        store = new MetricStore(10, 5, Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should cut a series back to its newest samples once capacity is exceeded")
    void shouldTrimInBatches() {
        for (int i = 0; i < 10; i++) {
            store.append("cpu", i, T0.plusSeconds(i));
        }
        assertThat(store.size("cpu")).isEqualTo(10);

        store.append("cpu", 10, T0.plusSeconds(10));

        List<MetricSample> kept = store.history("cpu");
        assertThat(kept).hasSize(5);
        assertThat(kept).extracting(MetricSample::getValue).containsExactly(6.0, 7.0, 8.0, 9.0, 10.0);
    }

    @Test
    @DisplayName("Window query should be exclusive at the start and inclusive at the end")
    void shouldQueryHalfOpenWindow() {
        store.append("cpu", 1, T0);
        store.append("cpu", 2, T0.plusSeconds(30));
        store.append("cpu", 3, T0.plusSeconds(60));
        store.append("cpu", 4, T0.plusSeconds(90));

        List<MetricSample> window = store.history("cpu", Duration.ofSeconds(60), T0.plusSeconds(60));

        assertThat(window).extracting(MetricSample::getValue).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Should summarise a series")
    void shouldSummarise() {
        store.append("latency", 2, T0);
        store.append("latency", 4, T0.plusSeconds(1));
        store.append("latency", 9, T0.plusSeconds(2));

        MetricSummary summary = store.summary("latency").orElseThrow();

        assertThat(summary.getCount()).isEqualTo(3);
        assertThat(summary.getMin()).isEqualTo(2.0);
        assertThat(summary.getMax()).isEqualTo(9.0);
        assertThat(summary.getMean()).isEqualTo(5.0);
        assertThat(summary.getMedian()).isEqualTo(4.0);
        assertThat(summary.getLatest()).isEqualTo(9.0);
        assertThat(summary.getStddev()).isCloseTo(Math.sqrt(13.0), within(1e-9));
    }

    @Test
    @DisplayName("Unknown metric should have no summary and empty history")
    void shouldHandleUnknownMetric() {
        assertThat(store.summary("nope")).isEmpty();
        assertThat(store.history("nope")).isEmpty();
        assertThat(store.history("nope", Duration.ofMinutes(1), T0)).isEmpty();
        assertThat(store.size("nope")).isZero();
    }

    @Test
    @DisplayName("Summaries should be sorted by metric name")
    void shouldSortSummaries() {
        store.append("mem", 1, T0);
        store.append("cpu", 1, T0);
        store.append("disk", 1, T0);

        Map<String, MetricSummary> summaries = store.summaries();

        assertThat(summaries.keySet()).containsExactly("cpu", "disk", "mem");
    }

    @Test
    @DisplayName("Should purge old samples and drop empty series")
    void shouldPurge() {
        store.append("cpu", 1, T0);
        store.append("cpu", 2, T0.plusSeconds(100));
        store.append("mem", 1, T0);

        int removed = store.purgeOlderThan(T0.plusSeconds(50));

        assertThat(removed).isEqualTo(2);
        assertThat(store.size("cpu")).isEqualTo(1);
        assertThat(store.summaries()).containsOnlyKeys("cpu");
    }

    @Test
    @DisplayName("Should reject blank names and non-finite values")
    void shouldRejectInvalidSamples() {
        assertThatThrownBy(() -> store.append(" ", 1, T0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.append("cpu", Double.NaN, T0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.append("cpu", Double.POSITIVE_INFINITY, T0))
                .isInstanceOf(ValidationException.class);
        assertThat(store.size("cpu")).isZero();
    }

    @Test
    @DisplayName("Should reject a trim larger than capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new MetricStore(5, 10, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Exported series should import into a fresh store")
    void shouldExportAndImport() {
        store.append("cpu", 1, T0);
        store.append("cpu", 2, T0.plusSeconds(1));

        MetricStore copy = new MetricStore(10, 5, Duration.ofSeconds(1));
        copy.importSeries(store.exportSeries());

        assertThat(copy.history("cpu")).isEqualTo(store.history("cpu"));
    }
}
