package fr.lapetina.resilient.client.infrastructure.metrics;

import fr.lapetina.resilient.client.domain.event.ExecutionEvent.CallStatus;
import fr.lapetina.resilient.client.domain.model.Classification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters per service, endpoint and classification
 * - Attempt latency timers per service and endpoint
 * - Call counters and latency timers per service and final status
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String DEFAULT_PREFIX = "resilient_client";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> callTimers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this(DEFAULT_PREFIX);
    }

    /**
     * Counts one attempt and records its latency.
     */
    public void recordAttempt(String service, String endpoint, Classification classification, Duration latency) {
        String key = service + ":" + endpoint + ":" + classification.name();
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Total number of endpoint attempts")
                        .tag("service", service)
                        .tag("endpoint", endpoint)
                        .tag("classification", classification.name())
                        .register(registry)
        ).increment();

        attemptTimers.computeIfAbsent(service + ":" + endpoint, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Latency of a single endpoint attempt")
                        .tag("service", service)
                        .tag("endpoint", endpoint)
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts one resolved call and records its total latency.
     */
    public void recordCall(String service, CallStatus status, Duration latency) {
        String key = service + ":" + status.name();
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_calls_total")
                        .description("Total number of resolved calls")
                        .tag("service", service)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();

        callTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_call_latency")
                        .description("End-to-end latency of a call, retries and failover included")
                        .tag("service", service)
                        .tag("status", status.name())
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
