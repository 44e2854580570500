package com.alertsentinel.core.metrics;

import com.alertsentinel.core.concurrent.GuardedLock;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Bounded per-name time series of numeric samples.
 *
 * <h3>Capacity</h3>
 * <p>
 * Once a series holds more than {@code capacity} samples it is cut back to
 * its newest {@code trim} samples in one step, so eviction happens in
 * batches rather than on every append.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All access goes through one {@link GuardedLock}; readers receive copies.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricStore.class);

    private final int capacity;
    private final int trim;
    private final GuardedLock lock;
    private final Map<String, Deque<MetricSample>> series = new LinkedHashMap<>();

    public MetricStore(int capacity, int trim, Duration lockTimeout) {
        if (capacity < 1 || trim < 1 || trim > capacity) {
            throw new IllegalArgumentException(
                    "Require 1 <= trim <= capacity, got capacity=" + capacity + ", trim=" + trim);
        }
        this.capacity = capacity;
        this.trim = trim;
        this.lock = new GuardedLock("metric-store", lockTimeout);
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Append one sample.
     *
     * @throws ValidationException if the name is blank, the value is not
     *                             finite, or the timestamp is missing
     */
    public MetricSample append(String name, double value, Instant timestamp) {
        return append(new MetricSample(name, value, timestamp));
    }

    public MetricSample append(MetricSample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        lock.runLocked(() -> {
            Deque<MetricSample> deque = series.computeIfAbsent(sample.getMetricName(), k -> new ArrayDeque<>());
            deque.addLast(sample);
            if (deque.size() > capacity) {
                int evicted = deque.size() - trim;
                for (int i = 0; i < evicted; i++) {
                    deque.pollFirst();
                }
                LOG.debug("Metric '{}' exceeded {} samples, evicted {} oldest",
                        sample.getMetricName(), capacity, evicted);
            }
        });
        return sample;
    }

    /**
     * Drop every sample older than {@code cutoff}; empty series are removed.
     *
     * @return number of samples removed
     */
    public int purgeOlderThan(Instant cutoff) {
        return lock.withLock(() -> {
            int removed = 0;
            Iterator<Map.Entry<String, Deque<MetricSample>>> it = series.entrySet().iterator();
            while (it.hasNext()) {
                Deque<MetricSample> deque = it.next().getValue();
                while (!deque.isEmpty() && deque.peekFirst().getTimestamp().isBefore(cutoff)) {
                    deque.pollFirst();
                    removed++;
                }
                if (deque.isEmpty()) {
                    it.remove();
                }
            }
            return removed;
        });
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    /**
     * Samples of {@code name} with {@code asOf - window < timestamp <= asOf},
     * oldest first.
     */
    public List<MetricSample> history(String name, Duration window, Instant asOf) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        Instant from = asOf.minus(window);
        return lock.withLock(() -> {
            Deque<MetricSample> deque = series.get(name);
            if (deque == null) {
                return List.of();
            }
            List<MetricSample> out = new ArrayList<>();
            for (MetricSample s : deque) {
                Instant ts = s.getTimestamp();
                if (ts.isAfter(from) && !ts.isAfter(asOf)) {
                    out.add(s);
                }
            }
            return out;
        });
    }

    /**
     * @return every retained sample of {@code name}, oldest first
     */
    public List<MetricSample> history(String name) {
        return lock.withLock(() -> {
            Deque<MetricSample> deque = series.get(name);
            return deque == null ? List.<MetricSample>of() : List.copyOf(deque);
        });
    }

    public Optional<MetricSummary> summary(String name) {
        double[] values = lock.withLock(() -> {
            Deque<MetricSample> deque = series.get(name);
            return deque == null
                    ? new double[0]
                    : deque.stream().mapToDouble(MetricSample::getValue).toArray();
        });
        return values.length == 0 ? Optional.empty() : Optional.of(MetricSummary.of(values));
    }

    /**
     * @return summaries for every metric, keyed and sorted by name
     */
    public Map<String, MetricSummary> summaries() {
        Map<String, double[]> values = lock.withLock(() -> {
            Map<String, double[]> copy = new TreeMap<>();
            series.forEach((k, v) -> copy.put(k, v.stream().mapToDouble(MetricSample::getValue).toArray()));
            return copy;
        });
        Map<String, MetricSummary> out = new TreeMap<>();
        values.forEach((k, v) -> out.put(k, MetricSummary.of(v)));
        return out;
    }

    public int size(String name) {
        return lock.withLock(() -> {
            Deque<MetricSample> deque = series.get(name);
            return deque == null ? 0 : deque.size();
        });
    }

    // ---------------------------------------------------------------
    // Snapshot support
    // ---------------------------------------------------------------

    public Map<String, List<MetricSample>> exportSeries() {
        return lock.withLock(() -> {
            Map<String, List<MetricSample>> copy = new LinkedHashMap<>();
            series.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return copy;
        });
    }

    public void importSeries(Map<String, List<MetricSample>> imported) {
        Objects.requireNonNull(imported, "imported series must not be null");
        lock.runLocked(() -> {
            series.clear();
            imported.forEach((k, v) -> series.put(k, new ArrayDeque<>(v)));
        });
    }
}
