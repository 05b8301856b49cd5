package fr.lapetina.resilient.client.domain.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The active deployment profile: development/local or production, with the
 * primary base URL of every logical service.
 * Immutable and thread-safe; created once at process start.
 */
public record EnvironmentProfile(
        boolean development,
        URI baseUrl,
        Map<ServiceName, URI> primaryUrls
) {
    public EnvironmentProfile {
        Objects.requireNonNull(baseUrl, "Base URL is required");
        primaryUrls = primaryUrls != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(primaryUrls))
                : Map.of();
    }

    public boolean production() {
        return !development;
    }

    public Optional<URI> primaryUrl(ServiceName service) {
        return Optional.ofNullable(primaryUrls.get(service));
    }

    public String name() {
        return development ? "development" : "production";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean development;
        private URI baseUrl;
        private final Map<ServiceName, URI> primaryUrls = new LinkedHashMap<>();

        public Builder development(boolean development) {
            this.development = development;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = URI.create(baseUrl);
            return this;
        }

        public Builder baseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder service(ServiceName service, String primaryUrl) {
            this.primaryUrls.put(service, URI.create(primaryUrl));
            return this;
        }

        public Builder service(ServiceName service, URI primaryUrl) {
            this.primaryUrls.put(service, primaryUrl);
            return this;
        }

        public EnvironmentProfile build() {
            return new EnvironmentProfile(development, baseUrl, primaryUrls);
        }
    }
}
