package fr.lapetina.resilient.client.domain.model;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static declaration of alternate base URLs per logical service, in the order
 * they should be tried after the primary.
 */
public record FallbackTable(Map<ServiceName, List<URI>> alternates) {

    public FallbackTable {
        Map<ServiceName, List<URI>> copy = new LinkedHashMap<>();
        if (alternates != null) {
            alternates.forEach((service, urls) -> copy.put(service, urls != null ? List.copyOf(urls) : List.of()));
        }
        alternates = Collections.unmodifiableMap(copy);
    }

    public static FallbackTable empty() {
        return new FallbackTable(Map.of());
    }

    public List<URI> forService(ServiceName service) {
        return alternates.getOrDefault(service, List.of());
    }

    public boolean declares(ServiceName service) {
        return !forService(service).isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ServiceName, List<URI>> alternates = new LinkedHashMap<>();

        public Builder service(ServiceName service, String... urls) {
            alternates.put(service, Arrays.stream(urls).map(URI::create).toList());
            return this;
        }

        public Builder service(ServiceName service, List<URI> urls) {
            alternates.put(service, urls);
            return this;
        }

        public FallbackTable build() {
            return new FallbackTable(alternates);
        }
    }
}
