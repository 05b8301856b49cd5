package fr.lapetina.resilient.client.domain.model;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Diagnostic record of a single network attempt.
 *
 * @param endpoint           base URL the attempt was sent to
 * @param chainIndex         0-based index of that endpoint in the chain
 * @param attemptOnEndpoint  1-based attempt number on that endpoint
 * @param attemptInCall      1-based attempt number across the whole chain walk
 * @param classification     outcome bucket
 * @param delayBefore        delay waited before this attempt
 * @param elapsed            time spent on the attempt itself
 * @param statusCode         HTTP status, or -1 when no response was obtained
 * @param errorMessage       transport error message, null when a response was obtained
 */
public record AttemptRecord(
        URI endpoint,
        int chainIndex,
        int attemptOnEndpoint,
        int attemptInCall,
        Classification classification,
        Duration delayBefore,
        Duration elapsed,
        int statusCode,
        String errorMessage
) {
    public static final int NO_STATUS = -1;

    public AttemptRecord {
        Objects.requireNonNull(endpoint, "Endpoint is required");
        Objects.requireNonNull(classification, "Classification is required");
        if (chainIndex < 0) {
            throw new IllegalArgumentException("chainIndex must be >= 0");
        }
        if (attemptOnEndpoint < 1 || attemptInCall < 1) {
            throw new IllegalArgumentException("attempt numbers must be >= 1");
        }
        delayBefore = delayBefore != null ? delayBefore : Duration.ZERO;
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public boolean isSuccess() {
        return classification == Classification.SUCCESS;
    }

    public boolean hasResponse() {
        return statusCode != NO_STATUS;
    }
}
