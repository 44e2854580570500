package com.alertsentinel.core.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics over the retained samples of one metric.
 *
 * <p>
 * {@code stddev} is the sample standard deviation (n&minus;1 denominator)
 * and is {@code 0} for a single value.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSummary {

    private final int count;
    private final double min;
    private final double max;
    private final double mean;
    private final double median;
    private final double stddev;
    private final double latest;

    @JsonCreator
    public MetricSummary(@JsonProperty("count") int count,
            @JsonProperty("min") double min,
            @JsonProperty("max") double max,
            @JsonProperty("mean") double mean,
            @JsonProperty("median") double median,
            @JsonProperty("stddev") double stddev,
            @JsonProperty("latest") double latest) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.median = median;
        this.stddev = stddev;
        this.latest = latest;
    }

    /**
     * Summarise {@code values} in insertion order.
     *
     * @param values at least one value
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static MetricSummary of(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot summarise an empty series");
        }
        double mean = mean(values);
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double median = n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
        return new MetricSummary(n, sorted[0], sorted[n - 1], mean, median,
                sampleStdDev(values, mean), values[n - 1]);
    }

    public static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double sampleStdDev(double[] values, double mean) {
        if (values.length < 2) {
            return 0.0;
        }
        double sq = 0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    public int getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStddev() {
        return stddev;
    }

    public double getLatest() {
        return latest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSummary that))
            return false;
        return count == that.count
                && Double.compare(min, that.min) == 0
                && Double.compare(max, that.max) == 0
                && Double.compare(mean, that.mean) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(stddev, that.stddev) == 0
                && Double.compare(latest, that.latest) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, min, max, mean, median, stddev, latest);
    }

    @Override
    public String toString() {
        return String.format("MetricSummary{count=%d, min=%.3f, max=%.3f, mean=%.3f, median=%.3f, stddev=%.3f, latest=%.3f}",
                count, min, max, mean, median, stddev, latest);
    }
}
