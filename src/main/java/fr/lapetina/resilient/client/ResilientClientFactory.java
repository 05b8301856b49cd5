package fr.lapetina.resilient.client;

import fr.lapetina.resilient.client.domain.event.CompositeEventSink;
import fr.lapetina.resilient.client.domain.event.ExecutionEventSink;
import fr.lapetina.resilient.client.domain.model.EnvironmentProfile;
import fr.lapetina.resilient.client.domain.model.FallbackTable;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.domain.policy.FallbackChainBuilder;
import fr.lapetina.resilient.client.domain.policy.RetryPolicy;
import fr.lapetina.resilient.client.executor.ResilientRequestExecutor;
import fr.lapetina.resilient.client.infrastructure.config.ClientConfig;
import fr.lapetina.resilient.client.infrastructure.config.ConfigLoader;
import fr.lapetina.resilient.client.infrastructure.environment.EnvironmentResolver;
import fr.lapetina.resilient.client.infrastructure.environment.EnvironmentSignals;
import fr.lapetina.resilient.client.infrastructure.http.EndpointTransport;
import fr.lapetina.resilient.client.infrastructure.http.JdkHttpTransport;
import fr.lapetina.resilient.client.infrastructure.metrics.LoggingEventSink;
import fr.lapetina.resilient.client.infrastructure.metrics.MetricsEventSink;
import fr.lapetina.resilient.client.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating a fully-wired executor from configuration.
 * This is the primary entry point for obtaining a configured {@link ResilientRequestExecutor}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ResilientClientFactory factory = ResilientClientFactory.create("resilient-client.yaml")) {
 *     RequestOutcome outcome = factory.getExecutor()
 *             .execute(ServiceName.API, "/health", RequestSpec.get());
 * }
 * }</pre>
 */
public class ResilientClientFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientClientFactory.class);

    public static final String DEFAULT_CONFIG = "resilient-client.yaml";

    private final ClientConfig config;
    private final EnvironmentProfile profile;
    private final FallbackTable fallbackTable;
    private final MetricsRegistry metricsRegistry;
    private final EndpointTransport transport;
    private final ResilientRequestExecutor executor;

    protected ResilientClientFactory(
            String configPath,
            Map<String, String> environment,
            EnvironmentSignals signals,
            EndpointTransport transportOverride
    ) {
        log.info("Initializing ResilientClientFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath, environment).load();

        // Resolve environment once for the process
        EnvironmentResolver resolver = new EnvironmentResolver(signals, config);
        this.profile = resolver.resolve();
        this.fallbackTable = resolver.fallbackTable(profile);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Initialize transport (allow override for testing)
        this.transport = transportOverride != null ? transportOverride : createTransport();

        RetryPolicy retryPolicy = createRetryPolicy();
        log.info("Using retry policy: {}", retryPolicy);

        this.executor = ResilientRequestExecutor.builder()
                .profile(profile)
                .chainBuilder(new FallbackChainBuilder(fallbackTable))
                .transport(transport)
                .retryPolicy(retryPolicy)
                .eventSink(createEventSink())
                .source(config.getTagging().getSource())
                .callTimeout(Duration.ofMillis(config.getTimeouts().getCallTimeoutMs()))
                .build();

        log.info("ResilientClientFactory initialized: profile={}, services={}, fallbackServices={}",
                profile.name(), profile.primaryUrls().size(), fallbackTable.alternates().size());
    }

    protected ResilientClientFactory(String configPath, EndpointTransport transportOverride) {
        this(configPath, System.getenv(), EnvironmentSignals.fromSystem(), transportOverride);
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ResilientClientFactory create(String configPath) {
        return new ResilientClientFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (resilient-client.yaml).
     */
    public static ResilientClientFactory create() {
        return create(DEFAULT_CONFIG);
    }

    public ResilientRequestExecutor getExecutor() {
        return executor;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public EnvironmentProfile getProfile() {
        return profile;
    }

    public FallbackTable getFallbackTable() {
        return fallbackTable;
    }

    public ClientConfig getConfig() {
        return config;
    }

    public EndpointTransport getTransport() {
        return transport;
    }

    /**
     * Primary URL of a service path, for display.
     */
    public URI buildUrl(ServiceName service, String path) {
        return executor.buildUrl(service, path);
    }

    private EndpointTransport createTransport() {
        return new JdkHttpTransport(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getAttemptTimeoutMs()),
                config.getTagging().getHeaderPrefix()
        );
    }

    private RetryPolicy createRetryPolicy() {
        ClientConfig.RetryConfig retry = config.getRetry();
        return RetryPolicy.builder()
                .maxRetriesPerEndpoint(retry.getMaxRetriesPerEndpoint())
                .baseDelay(Duration.ofMillis(retry.getBaseDelayMs()))
                .backoffMultiplier(retry.getBackoffMultiplier())
                .maxDelay(Duration.ofMillis(retry.getMaxDelayMs()))
                .jitterFactor(retry.getJitterFactor())
                .build();
    }

    private ExecutionEventSink createEventSink() {
        List<ExecutionEventSink> sinks = new ArrayList<>();
        sinks.add(new LoggingEventSink());
        if (config.getMetrics().isEnabled()) {
            sinks.add(new MetricsEventSink(metricsRegistry));
        }
        return new CompositeEventSink(sinks);
    }

    @Override
    public void close() {
        log.info("Shutting down ResilientClientFactory...");

        try {
            executor.close();
        } catch (Exception e) {
            log.warn("Error closing executor", e);
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("ResilientClientFactory shut down");
    }
}
