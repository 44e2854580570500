package com.alertsentinel.core.concurrent;

import com.alertsentinel.core.error.ConcurrencyTimeoutException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-component mutual exclusion with a bounded wait.
 *
 * <p>
 * Each stateful component owns exactly one instance. Acquisition waits at
 * most {@code timeout} and then fails with
 * {@link ConcurrencyTimeoutException}; it never blocks indefinitely.
 * Reentrant, so a guarded method may call another guarded method of the
 * same component.
 * </p>
 *
 * @since 1.0.0
 */
public final class GuardedLock {

    private final String name;
    private final Duration timeout;
    private final ReentrantLock lock = new ReentrantLock();

    public GuardedLock(String name, Duration timeout) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    /**
     * Run {@code action} while holding the lock.
     *
     * @throws ConcurrencyTimeoutException if the lock is not acquired in time
     *                                     or the wait is interrupted
     */
    public <T> T withLock(Supplier<T> action) {
        acquire();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        acquire();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public String getName() {
        return name;
    }

    private void acquire() {
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new ConcurrencyTimeoutException(name, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyTimeoutException(name, e);
        }
    }
}
