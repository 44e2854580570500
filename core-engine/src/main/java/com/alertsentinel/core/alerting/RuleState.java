package com.alertsentinel.core.alerting;

import com.alertsentinel.core.model.AlertRule;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable per-rule bookkeeping, only touched under the engine lock.
 */
final class RuleState {

    AlertRule rule;
    Instant lastFired;
    final Deque<Instant> occurrences = new ArrayDeque<>();
    final Deque<Instant> fireHistory = new ArrayDeque<>();
    final Deque<Double> baseline = new ArrayDeque<>();

    RuleState(AlertRule rule) {
        this.rule = rule;
    }

    static long hourBucketOf(Instant at) {
        return Math.floorDiv(at.getEpochSecond(), 3600L);
    }

    /** Alerts fired in the wall-clock hour containing {@code at}, in whatever order samples arrived. */
    int firesInHourOf(Instant at) {
        long bucket = hourBucketOf(at);
        int count = 0;
        for (Instant t : fireHistory) {
            if (hourBucketOf(t) == bucket) {
                count++;
            }
        }
        return count;
    }

    void recordFire(Instant at, int capacity) {
        lastFired = at;
        fireHistory.addLast(at);
        while (fireHistory.size() > capacity) {
            fireHistory.pollFirst();
        }
    }

    /** Records a qualifying observation and returns how many fall in the window ending at {@code now}. */
    int recordOccurrence(Instant now, Duration window) {
        occurrences.addLast(now);
        Instant from = now.minus(window);
        occurrences.removeIf(t -> !t.isAfter(from));
        int count = 0;
        for (Instant t : occurrences) {
            if (!t.isAfter(now)) {
                count++;
            }
        }
        return count;
    }

    void pruneBefore(Instant cutoff) {
        occurrences.removeIf(t -> t.isBefore(cutoff));
        fireHistory.removeIf(t -> t.isBefore(cutoff));
    }
}
