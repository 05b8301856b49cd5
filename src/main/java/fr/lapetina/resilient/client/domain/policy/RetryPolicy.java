package fr.lapetina.resilient.client.domain.policy;

import fr.lapetina.resilient.client.domain.model.Classification;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Pure decision function: given how many attempts were made on the current
 * endpoint and how the last one was classified, decides whether to retry the
 * same endpoint, advance to the next one, or stop.
 *
 * The delay is constant by default. A backoff multiplier and a jitter factor
 * can be configured; both are off unless set.
 *
 * Thread-safe: holds only immutable configuration.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES_PER_ENDPOINT = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final int maxRetriesPerEndpoint;
    private final Duration baseDelay;
    private final double backoffMultiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    private RetryPolicy(Builder builder) {
        if (builder.maxRetriesPerEndpoint < 1) {
            throw new IllegalArgumentException("maxRetriesPerEndpoint must be >= 1, was: " + builder.maxRetriesPerEndpoint);
        }
        if (builder.baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (builder.backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, was: " + builder.backoffMultiplier);
        }
        if (builder.jitterFactor < 0.0 || builder.jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], was: " + builder.jitterFactor);
        }
        this.maxRetriesPerEndpoint = builder.maxRetriesPerEndpoint;
        this.baseDelay = builder.baseDelay;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.maxDelay = builder.maxDelay;
        this.jitterFactor = builder.jitterFactor;
        this.random = builder.random;
    }

    /**
     * Constant-delay policy.
     */
    public static RetryPolicy fixed(int maxRetriesPerEndpoint, Duration baseDelay) {
        return builder()
                .maxRetriesPerEndpoint(maxRetriesPerEndpoint)
                .baseDelay(baseDelay)
                .build();
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * Decides the next step after a failed attempt.
     *
     * @param attemptNumberOnEndpoint 1-based number of the attempt just made on the current endpoint
     * @param classification          classification of that attempt
     * @return the decision
     * @throws IllegalArgumentException if asked about a successful attempt
     */
    public RetryDecision next(int attemptNumberOnEndpoint, Classification classification) {
        Objects.requireNonNull(classification, "classification must not be null");
        if (classification == Classification.SUCCESS) {
            throw new IllegalArgumentException("RetryPolicy is not consulted for successful attempts");
        }
        if (!classification.isRetryable()) {
            return RetryDecision.stop();
        }
        if (attemptNumberOnEndpoint < maxRetriesPerEndpoint) {
            return RetryDecision.retry(delayFor(attemptNumberOnEndpoint));
        }
        return RetryDecision.advance();
    }

    Duration delayFor(int attemptNumberOnEndpoint) {
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attemptNumberOnEndpoint - 1));
        if (maxDelay != null) {
            millis = Math.min(millis, maxDelay.toMillis());
        }
        if (jitterFactor > 0) {
            // spread uniformly within +/- jitterFactor of the nominal delay
            double spread = millis * jitterFactor;
            millis = millis - spread + (2 * spread * random.getAsDouble());
        }
        return Duration.ofMillis(Math.max(0L, Math.round(millis)));
    }

    public int getMaxRetriesPerEndpoint() {
        return maxRetriesPerEndpoint;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetriesPerEndpoint=" + maxRetriesPerEndpoint +
                ", baseDelay=" + baseDelay +
                ", backoffMultiplier=" + backoffMultiplier +
                ", jitterFactor=" + jitterFactor +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxRetriesPerEndpoint = DEFAULT_MAX_RETRIES_PER_ENDPOINT;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private double backoffMultiplier = 1.0;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double jitterFactor = 0.0;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder maxRetriesPerEndpoint(int maxRetriesPerEndpoint) {
            this.maxRetriesPerEndpoint = maxRetriesPerEndpoint;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        /**
         * Source of uniform values in [0, 1) for jitter. Package-private, for tests.
         */
        Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random must not be null");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
