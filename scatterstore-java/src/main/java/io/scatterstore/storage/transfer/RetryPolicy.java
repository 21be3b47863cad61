package io.scatterstore.storage.transfer;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for a single provider call.
 * A per-call timeout counts as one failed attempt.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double multiplier,
    Duration maxBackoff,
    Duration callTimeout
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static RetryPolicy noBackoff(int maxAttempts) {
        return builder()
            .maxAttempts(maxAttempts)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .build();
    }

    /**
     * Delay before the given retry.
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(2);
        private Duration callTimeout = Duration.ofSeconds(30);

        public Builder maxAttempts(int attempts) { this.maxAttempts = attempts; return this; }
        public Builder initialBackoff(Duration backoff) { this.initialBackoff = backoff; return this; }
        public Builder multiplier(double multiplier) { this.multiplier = multiplier; return this; }
        public Builder maxBackoff(Duration backoff) { this.maxBackoff = backoff; return this; }
        public Builder callTimeout(Duration timeout) { this.callTimeout = timeout; return this; }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff, callTimeout);
        }
    }
}
