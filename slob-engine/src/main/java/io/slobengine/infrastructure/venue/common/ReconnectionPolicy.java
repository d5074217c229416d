package io.slobengine.infrastructure.venue.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with exponential backoff for the venue link.
 *
 * The delay before attempt n+1 (after n consecutive failures) is
 * {@code min(initialDelay x multiplier^n, maxDelay)}. With 1s, 2.0 and a 60s cap this gives
 * 2, 4, 8, 16, 32, 60 seconds for n = 1..6.
 *
 * Once maxAttempts consecutive failures are recorded the circuit opens and
 * {@link #shouldRetry()} stays false until {@link #reset()}.
 *
 * Usage:
 * <pre>
 * while (policy.shouldRetry()) {
 *     try {
 *         connect();
 *         policy.recordSuccess();
 *         break;
 *     } catch (VenueConnectionException e) {
 *         policy.recordFailure();
 *         if (policy.shouldRetry()) {
 *             sleeper.sleep(policy.getNextDelay());
 *         }
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Check if another attempt should be made.
     *
     * @return true if retry should be attempted, false if circuit is open
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Backoff delay after the given number of consecutive failures.
     */
    public Duration delayFor(int failures) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, failures));
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Delay to wait before the next attempt, based on failures recorded so far.
     */
    public synchronized Duration getNextDelay() {
        return delayFor(attemptCount);
    }

    /**
     * Record a failed connection attempt.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();
        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a successful connection. Resets counters and closes the circuit.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        lastAttemptTime = null;
        circuitOpen = false;
    }

    /**
     * Manual circuit breaker reset.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return Number of failed attempts since last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Startup and operator-triggered connects: 1s base, 60s cap, 5 attempts.
     */
    public static ReconnectionPolicy forVenue() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();
    }

    /**
     * Reconnects after a heartbeat loss use a smaller budget.
     */
    public static ReconnectionPolicy forHeartbeatRecovery() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

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
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
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

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
