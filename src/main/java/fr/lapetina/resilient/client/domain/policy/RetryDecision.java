package fr.lapetina.resilient.client.domain.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * What to do after a failed attempt.
 */
public interface RetryDecision {

    /**
     * Wait {@code delay}, then try the same endpoint again.
     */
    record RetrySameEndpoint(Duration delay) implements RetryDecision {
        public RetrySameEndpoint {
            Objects.requireNonNull(delay, "Delay is required");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("Delay must not be negative");
            }
        }
    }

    /**
     * This endpoint is exhausted; move to the next one in the chain.
     */
    record AdvanceToNextEndpoint() implements RetryDecision {
    }

    /**
     * Give up on the whole call.
     */
    record Stop() implements RetryDecision {
    }

    static RetryDecision retry(Duration delay) {
        return new RetrySameEndpoint(delay);
    }

    static RetryDecision advance() {
        return new AdvanceToNextEndpoint();
    }

    static RetryDecision stop() {
        return new Stop();
    }
}
