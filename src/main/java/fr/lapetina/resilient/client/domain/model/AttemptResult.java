package fr.lapetina.resilient.client.domain.model;

import java.util.Objects;

/**
 * Raw result of one network attempt, before classification.
 */
public interface AttemptResult {

    /**
     * The endpoint answered, whatever the status code.
     */
    record Responded(ServiceResponse response) implements AttemptResult {
        public Responded {
            Objects.requireNonNull(response, "Response is required");
        }
    }

    /**
     * No response was obtained: connection refused, timeout, DNS or TLS failure.
     */
    record NoResponse(Throwable cause) implements AttemptResult {
        public NoResponse {
            Objects.requireNonNull(cause, "Cause is required");
        }
    }

    static AttemptResult responded(ServiceResponse response) {
        return new Responded(response);
    }

    static AttemptResult noResponse(Throwable cause) {
        return new NoResponse(cause);
    }
}
