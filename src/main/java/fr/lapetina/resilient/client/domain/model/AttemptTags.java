package fr.lapetina.resilient.client.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Correlation metadata carried by each network attempt.
 *
 * @param source          identifier of the originating component
 * @param callId          identifier shared by every attempt of one logical call
 * @param chainPosition   1-based position of the endpoint in the fallback chain
 * @param attemptNumber   1-based attempt number on that endpoint
 */
public record AttemptTags(
        String source,
        String callId,
        int chainPosition,
        int attemptNumber
) {
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public AttemptTags {
        Objects.requireNonNull(source, "Source is required");
        Objects.requireNonNull(callId, "Call ID is required");
        if (chainPosition < 1) {
            throw new IllegalArgumentException("chainPosition must be >= 1, was: " + chainPosition);
        }
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, was: " + attemptNumber);
        }
    }

    /**
     * Renders the tags as request headers, e.g. {@code X-BGAPP-Fallback-Attempt: 2}.
     */
    public Map<String, String> toHeaders(String headerPrefix) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(headerPrefix + "-Source", source);
        headers.put(headerPrefix + "-Fallback-Attempt", Integer.toString(chainPosition));
        headers.put(headerPrefix + "-Retry-Attempt", Integer.toString(attemptNumber));
        headers.put(REQUEST_ID_HEADER, callId);
        return headers;
    }
}
