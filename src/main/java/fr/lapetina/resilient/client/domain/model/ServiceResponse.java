package fr.lapetina.resilient.client.domain.model;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A response obtained from one endpoint.
 * Immutable and thread-safe. The payload is kept as raw text; its shape
 * belongs to the calling collaborator.
 */
public record ServiceResponse(
        URI uri,
        int statusCode,
        Map<String, List<String>> headers,
        String body
) {
    public ServiceResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : "";
    }

    public Optional<String> firstHeader(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    public static ServiceResponse of(URI uri, int statusCode, String body) {
        return new ServiceResponse(uri, statusCode, null, body);
    }
}
