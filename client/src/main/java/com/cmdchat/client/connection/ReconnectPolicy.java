package com.cmdchat.client.connection;

import com.cmdchat.error.ConnectionFailedException;
import com.cmdchat.error.TransportException;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff: up to {@code maxRetries} attempts, pausing
 * {@code baseDelay * 2^attempt} between consecutive attempts (never after the last one).
 * Only {@link TransportException}s are retried; anything else propagates at once.
 */
public class ReconnectPolicy {

    @FunctionalInterface
    public interface Attempt<T> {
        T run();
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /** Told about each failed attempt; {@code nextDelay} is null after the last one. */
    @FunctionalInterface
    public interface FailureListener {
        void onFailure(int attempt, int maxAttempts, TransportException cause, Duration nextDelay);
    }

    private final int maxRetries;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public ReconnectPolicy(int maxRetries, Duration baseDelay) {
        this(maxRetries, baseDelay, duration -> Thread.sleep(duration.toMillis()));
    }

    public ReconnectPolicy(int maxRetries, Duration baseDelay, Sleeper sleeper) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    /**
     * @throws ConnectionFailedException after {@code maxRetries} failed attempts
     * @throws InterruptedException      if interrupted while backing off
     */
    public <T> T execute(Attempt<T> attempt, FailureListener listener) throws InterruptedException {
        TransportException last = null;
        for (int i = 0; i < maxRetries; i++) {
            try {
                return attempt.run();
            } catch (TransportException e) {
                last = e;
                Duration delay = i < maxRetries - 1 ? delayBefore(i + 1) : null;
                listener.onFailure(i + 1, maxRetries, e, delay);
                if (delay != null) {
                    sleeper.sleep(delay);
                }
            }
        }
        throw new ConnectionFailedException(maxRetries, last);
    }

    /** Pause taken after failed attempt number {@code attempt} (1-based). */
    Duration delayBefore(int attempt) {
        return baseDelay.multipliedBy(1L << (attempt - 1));
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Sleeper sleeper() {
        return sleeper;
    }
}
