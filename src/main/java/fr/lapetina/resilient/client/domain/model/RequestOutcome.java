package fr.lapetina.resilient.client.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of one logical call. Callers only ever see one of
 * {@link Ok}, {@link Failed} or {@link Cancelled}; never a mid-chain transient error.
 */
public interface RequestOutcome {

    /**
     * Every attempt made during the call, in order.
     */
    List<AttemptRecord> attempts();

    default int attemptCount() {
        return attempts().size();
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * An endpoint answered with a success status.
     */
    record Ok(ServiceResponse response, List<AttemptRecord> attempts) implements RequestOutcome {
        public Ok {
            Objects.requireNonNull(response, "Response is required");
            attempts = List.copyOf(attempts);
        }
    }

    /**
     * The call gave up: a client error, or every endpoint exhausted its retries.
     *
     * @param lastClassification classification of the final attempt
     * @param lastResponse       response of the final attempt, null when it had none
     * @param lastError          transport error of the final attempt, null when it had a response
     */
    record Failed(
            Classification lastClassification,
            ServiceResponse lastResponse,
            Throwable lastError,
            List<AttemptRecord> attempts
    ) implements RequestOutcome {
        public Failed {
            Objects.requireNonNull(lastClassification, "Classification is required");
            attempts = List.copyOf(attempts);
        }

        public Optional<ServiceResponse> response() {
            return Optional.ofNullable(lastResponse);
        }

        public Optional<Throwable> error() {
            return Optional.ofNullable(lastError);
        }

        /**
         * Short human-readable description of the last cause.
         */
        public String describe() {
            if (lastResponse != null) {
                return lastClassification + ": HTTP " + lastResponse.statusCode() + " from " + lastResponse.uri();
            }
            if (lastError != null) {
                return lastClassification + ": " + lastError.getClass().getSimpleName() + " - " + lastError.getMessage();
            }
            return lastClassification.name();
        }
    }

    /**
     * The call was aborted before it resolved.
     */
    record Cancelled(CancellationReason reason, List<AttemptRecord> attempts) implements RequestOutcome {
        public Cancelled {
            Objects.requireNonNull(reason, "Reason is required");
            attempts = List.copyOf(attempts);
        }
    }

    enum CancellationReason {
        /** Explicit cancellation by the caller */
        CALLER,

        /** The overall per-call deadline elapsed */
        DEADLINE,

        /** The thread waiting on the call was interrupted */
        INTERRUPTED
    }
}
