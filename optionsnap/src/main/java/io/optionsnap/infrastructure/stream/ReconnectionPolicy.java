package io.optionsnap.infrastructure.stream;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy for stream sessions.
 *
 * Supports a fixed delay (multiplier 1.0) or exponential backoff, with either
 * a bounded or an unlimited number of attempts. Exchange streams use
 * {@link #fixedDelay(Duration)}: every disconnect is treated as transient and
 * retried after the same pause, forever.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.fixedDelay(Duration.ofSeconds(60));
 *
 * // on disconnect
 * policy.recordFailure();
 * if (policy.shouldRetry()) {
 *     scheduler.schedule(this::connect, policy.getNextDelay().toMillis(), TimeUnit.MILLISECONDS);
 * }
 *
 * // on successful connect
 * policy.recordSuccess();
 * </pre>
 *
 * One instance per session: the attempt counter is not shared.
 */
public class ReconnectionPolicy {

    /** Marker for no attempt limit. */
    public static final int UNLIMITED = 0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private long totalFailures = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * Check if another attempt should be made.
     *
     * @return true unless a bounded policy has used up its attempts
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return maxAttempts == UNLIMITED || attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed or lost connection.
     * The first failure after a success waits the initial delay; later ones grow by the multiplier.
     */
    public synchronized void recordFailure() {
        if (attemptCount > 0) {
            long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
        }
        attemptCount++;
        totalFailures++;
        lastAttemptTime = Instant.now();

        if (maxAttempts != UNLIMITED && attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a successful connection.
     * Resets the attempt counter and delay; the lifetime failure count is kept.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        circuitOpen = false;
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * Failed attempts since the last success.
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Failed attempts over the policy's lifetime.
     */
    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Same delay before every attempt, no attempt limit.
     */
    public static ReconnectionPolicy fixedDelay(Duration delay) {
        return builder()
            .initialDelay(delay)
            .maxDelay(delay)
            .multiplier(1.0)
            .unlimitedAttempts()
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private int maxAttempts = 10;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder unlimitedAttempts() {
            this.maxAttempts = UNLIMITED;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
