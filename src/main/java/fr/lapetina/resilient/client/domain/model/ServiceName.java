package fr.lapetina.resilient.client.domain.model;

import java.util.Objects;

/**
 * Identifies a logical service: a named remote capability that may be served
 * by several physical base URLs.
 */
public record ServiceName(String value) {

    /** Primary admin API. */
    public static final ServiceName API = new ServiceName("api");

    /** STAC catalog browser. */
    public static final ServiceName STAC_BROWSER = new ServiceName("stacBrowser");

    /** OGC geospatial API. */
    public static final ServiceName PYGEOAPI = new ServiceName("pygeoapi");

    public static final ServiceName FLOWER_MONITOR = new ServiceName("flowerMonitor");

    public static final ServiceName MINIO_CONSOLE = new ServiceName("minioConsole");

    public ServiceName {
        Objects.requireNonNull(value, "Service name is required");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Service name must not be blank");
        }
    }

    public static ServiceName of(String value) {
        return new ServiceName(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
