package fr.lapetina.resilient.client.infrastructure.environment;

import fr.lapetina.resilient.client.domain.model.EnvironmentProfile;
import fr.lapetina.resilient.client.domain.model.FallbackTable;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.infrastructure.config.ClientConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the environment profile and its fallback table.
 *
 * Built-in endpoints describe the reference deployment; the
 * {@code profiles} section of {@link ClientConfig} overrides them entry by entry.
 * Resolution never throws: malformed overrides are logged and ignored.
 */
public final class EnvironmentResolver {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentResolver.class);

    private static final Set<String> DEVELOPMENT_MODES = Set.of("development", "dev", "local");
    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1");

    private static final String DEVELOPMENT_BASE_URL = "http://localhost:3000";
    private static final String PRODUCTION_BASE_URL = "https://bgapp-admin.pages.dev";

    private static final Map<ServiceName, String> PRIMARY_URLS = Map.of(
            ServiceName.API, "https://bgapp-admin-api-worker.majearcasa.workers.dev",
            ServiceName.STAC_BROWSER, "https://bgapp-stac.majearcasa.workers.dev",
            ServiceName.PYGEOAPI, "https://bgapp-pygeoapi.majearcasa.workers.dev",
            ServiceName.FLOWER_MONITOR, "https://bgapp-monitor.majearcasa.workers.dev",
            ServiceName.MINIO_CONSOLE, "https://bgapp-storage.majearcasa.workers.dev"
    );

    private static final FallbackTable DEVELOPMENT_FALLBACKS = FallbackTable.builder()
            .service(ServiceName.API,
                    "https://bgapp-admin-api-worker.majearcasa.workers.dev",
                    "https://bgapp-admin.majearcasa.workers.dev",
                    "http://localhost:8000")
            .service(ServiceName.STAC_BROWSER,
                    "https://bgapp-stac.majearcasa.workers.dev",
                    "https://bgapp-stac-worker.majearcasa.workers.dev",
                    "http://localhost:8081")
            .service(ServiceName.PYGEOAPI,
                    "https://bgapp-pygeoapi.majearcasa.workers.dev",
                    "https://bgapp-geo.majearcasa.workers.dev",
                    "http://localhost:5080")
            .build();

    private static final FallbackTable PRODUCTION_FALLBACKS = FallbackTable.builder()
            .service(ServiceName.API,
                    "https://bgapp-admin-api-worker.majearcasa.workers.dev",
                    "https://bgapp-admin.majearcasa.workers.dev",
                    "https://bgapp-api.majearcasa.workers.dev")
            .service(ServiceName.STAC_BROWSER,
                    "https://bgapp-stac.majearcasa.workers.dev",
                    "https://bgapp-stac-worker.majearcasa.workers.dev",
                    "https://bgapp-stac-ocean.majearcasa.workers.dev")
            .service(ServiceName.PYGEOAPI,
                    "https://bgapp-pygeoapi.majearcasa.workers.dev",
                    "https://bgapp-geo.majearcasa.workers.dev",
                    "https://bgapp-geoapi.majearcasa.workers.dev")
            .build();

    private final EnvironmentSignals signals;
    private final ClientConfig config;

    public EnvironmentResolver(EnvironmentSignals signals) {
        this(signals, new ClientConfig());
    }

    public EnvironmentResolver(EnvironmentSignals signals, ClientConfig config) {
        Objects.requireNonNull(signals, "signals must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        ClientConfig.EnvironmentConfig declared = config.getEnvironment();
        this.signals = declared == null ? signals : signals.withOverrides(declared.getMode(), declared.getHostName());
    }

    /**
     * Resolves the active profile. Deterministic for a given signal snapshot.
     */
    public EnvironmentProfile resolve() {
        boolean development = isDevelopment(signals);
        ClientConfig.ProfileConfig overrides = profileOverrides(development);

        EnvironmentProfile.Builder builder = EnvironmentProfile.builder()
                .development(development)
                .baseUrl(development ? DEVELOPMENT_BASE_URL : PRODUCTION_BASE_URL);

        PRIMARY_URLS.forEach(builder::service);

        if (overrides != null) {
            parseUrl(overrides.getBaseUrl(), "baseUrl").ifPresent(builder::baseUrl);
            if (overrides.getServices() != null) {
                // YAML does not enforce the declared generics; entries are checked one by one
                Map<?, ?> services = overrides.getServices();
                for (Map.Entry<?, ?> entry : services.entrySet()) {
                    serviceName(entry.getKey()).ifPresent(service ->
                            parseUrl(entry.getValue(), "services." + service).ifPresent(uri -> builder.service(service, uri)));
                }
            }
        }

        EnvironmentProfile profile = builder.build();
        if (profile.development()) {
            log.info("Resolved environment profile: name={}, baseUrl={}, services={}",
                    profile.name(), profile.baseUrl(), profile.primaryUrls());
        } else {
            log.debug("Resolved environment profile: name={}, baseUrl={}", profile.name(), profile.baseUrl());
        }
        return profile;
    }

    /**
     * Fallback table of the given profile's environment, with configured lists
     * replacing the built-in list of the same service.
     */
    public FallbackTable fallbackTable(EnvironmentProfile profile) {
        boolean development = profile.development();
        FallbackTable builtIn = development ? DEVELOPMENT_FALLBACKS : PRODUCTION_FALLBACKS;
        ClientConfig.ProfileConfig overrides = profileOverrides(development);
        if (overrides == null || overrides.getFallbacks() == null || overrides.getFallbacks().isEmpty()) {
            return builtIn;
        }

        Map<ServiceName, List<URI>> merged = new LinkedHashMap<>(builtIn.alternates());
        Map<?, ?> fallbacks = overrides.getFallbacks();
        for (Map.Entry<?, ?> entry : fallbacks.entrySet()) {
            Optional<ServiceName> service = serviceName(entry.getKey());
            if (service.isEmpty()) {
                continue;
            }
            String setting = "fallbacks." + service.get();
            Object urls = entry.getValue();
            if (urls != null && !(urls instanceof List)) {
                log.warn("Ignoring fallback override that is not a list: setting={}, value={}", setting, urls);
                continue;
            }
            List<URI> parsed = new ArrayList<>();
            if (urls != null) {
                for (Object url : (List<?>) urls) {
                    parseUrl(url, setting).ifPresent(parsed::add);
                }
            }
            merged.put(service.get(), parsed);
        }
        return new FallbackTable(merged);
    }

    public EnvironmentSignals getSignals() {
        return signals;
    }

    /**
     * Development when the mode says so or the host is the local machine.
     * Anything else, absent signals included, is production.
     */
    public static boolean isDevelopment(EnvironmentSignals signals) {
        boolean developmentMode = signals.mode()
                .map(mode -> DEVELOPMENT_MODES.contains(mode.toLowerCase(Locale.ROOT)))
                .orElse(false);
        boolean localHost = signals.host()
                .map(host -> LOCAL_HOSTS.contains(host.toLowerCase(Locale.ROOT)))
                .orElse(false);
        return developmentMode || localHost;
    }

    private ClientConfig.ProfileConfig profileOverrides(boolean development) {
        ClientConfig.ProfilesConfig profiles = config.getProfiles();
        return profiles == null ? null : profiles.forMode(development);
    }

    private static Optional<ServiceName> serviceName(Object key) {
        if (!(key instanceof String)) {
            log.warn("Ignoring configured endpoint with non-text service name: name={}", key);
            return Optional.empty();
        }
        String name = (String) key;
        if (name.isBlank()) {
            log.warn("Ignoring configured endpoint with blank service name");
            return Optional.empty();
        }
        return Optional.of(ServiceName.of(name));
    }

    private static Optional<URI> parseUrl(Object value, String setting) {
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String)) {
            log.warn("Ignoring non-text URL: setting={}, value={}", setting, value);
            return Optional.empty();
        }
        String url = (String) value;
        if (url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                log.warn("Ignoring non-HTTP URL: setting={}, value={}", setting, url);
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed URL: setting={}, value={}, error={}", setting, url, e.getMessage());
            return Optional.empty();
        }
    }
}
