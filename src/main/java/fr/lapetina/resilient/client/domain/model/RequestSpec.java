package fr.lapetina.resilient.client.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Describes the request to send to whichever endpoint of a chain is being tried.
 * Immutable and thread-safe: the same spec is reused for every attempt of a call.
 *
 * The body is either a {@link String} sent as is, or any other object that the
 * transport serialises to JSON.
 */
public record RequestSpec(
        String method,
        Map<String, String> headers,
        Object body
) {
    public RequestSpec {
        method = method != null ? method.toUpperCase(Locale.ROOT) : "GET";
        headers = headers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
                : Map.of();
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * Creates a body-less GET request.
     */
    public static RequestSpec get() {
        return new RequestSpec("GET", null, null);
    }

    /**
     * Creates a POST request whose body is serialised to JSON.
     */
    public static RequestSpec postJson(Object body) {
        Objects.requireNonNull(body, "Body is required");
        return new RequestSpec("POST", null, body);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public RequestSpec build() {
            return new RequestSpec(method, headers, body);
        }
    }
}
