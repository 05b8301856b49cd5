package fr.lapetina.resilient.client.domain.model;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered candidate base URLs for one logical service.
 * Non-empty, duplicate-free and immutable; safe to share across concurrent calls.
 */
public final class FallbackChain {

    private final ServiceName service;
    private final List<URI> endpoints;

    public FallbackChain(ServiceName service, List<URI> endpoints) {
        this.service = Objects.requireNonNull(service, "Service is required");
        Objects.requireNonNull(endpoints, "Endpoints are required");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("Fallback chain for " + service + " must not be empty");
        }
        Set<URI> seen = new HashSet<>();
        for (URI endpoint : endpoints) {
            if (!seen.add(endpoint)) {
                throw new IllegalArgumentException("Duplicate endpoint in chain for " + service + ": " + endpoint);
            }
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public ServiceName getService() {
        return service;
    }

    public List<URI> getEndpoints() {
        return endpoints;
    }

    public URI primary() {
        return endpoints.get(0);
    }

    public URI endpoint(int index) {
        return endpoints.get(index);
    }

    public int size() {
        return endpoints.size();
    }

    public boolean isLast(int index) {
        return index == endpoints.size() - 1;
    }

    /**
     * Joins the endpoint at {@code index} with a request path.
     */
    public URI resolve(int index, String path) {
        return join(endpoints.get(index), path);
    }

    /**
     * Joins a base URL and a path without doubling or dropping the separator.
     */
    public static URI join(URI base, String path) {
        String basePath = base.toString();
        if (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        if (path == null || path.isEmpty()) {
            return URI.create(basePath);
        }
        return URI.create(basePath + (path.startsWith("/") ? path : "/" + path));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FallbackChain that = (FallbackChain) o;
        return service.equals(that.service) && endpoints.equals(that.endpoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, endpoints);
    }

    @Override
    public String toString() {
        return "FallbackChain{" +
                "service=" + service +
                ", endpoints=" + endpoints +
                '}';
    }
}
