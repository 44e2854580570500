package com.alertsentinel.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * A single cancellable background worker running one action at a fixed
 * delay.
 *
 * <p>
 * {@link #stop()} lets an in-flight iteration finish and then ends the loop.
 * An exception thrown by one iteration is logged and does not cancel later
 * iterations.
 * </p>
 *
 * @since 1.0.0
 */
public final class PeriodicTask implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PeriodicTask.class);

    private final String name;
    private final Duration interval;
    private final Runnable action;
    private ScheduledExecutorService executor;

    public PeriodicTask(String name, Duration interval, Runnable action) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
    }

    /**
     * Start the worker. The first iteration runs after one interval.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Periodic task '" + name + "' is already running");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sentinel-" + name);
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Started periodic task '{}' every {} ms", name, millis);
    }

    /**
     * Signal the worker to stop and wait for the current iteration.
     *
     * @return {@code true} if the worker ended within {@code await}
     */
    public synchronized boolean stop(Duration await) {
        if (executor == null) {
            return true;
        }
        ScheduledExecutorService running = executor;
        executor = null;
        running.shutdown();
        try {
            boolean done = running.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS);
            if (!done) {
                LOG.warn("Periodic task '{}' did not finish within {} ms", name, await.toMillis());
            }
            LOG.info("Stopped periodic task '{}'", name);
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping periodic task '{}'", name);
            return false;
        }
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(5));
    }

    private void runOnce() {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Periodic task '{}' iteration failed", name, e);
        }
    }
}
