package fr.lapetina.resilient.client.infrastructure.config;

import fr.lapetina.resilient.client.exception.ConfigurationException;
import fr.lapetina.resilient.client.exception.ConfigurationException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Overrides from the hosting environment ({@code RESILIENT_CLIENT_*} variables)
 * - Range validation of every numeric setting
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ENV_MODE = "RESILIENT_CLIENT_ENV";
    public static final String ENV_MAX_RETRIES = "RESILIENT_CLIENT_MAX_RETRIES";
    public static final String ENV_BASE_DELAY_MS = "RESILIENT_CLIENT_BASE_DELAY_MS";
    public static final String ENV_CALL_TIMEOUT_MS = "RESILIENT_CLIENT_CALL_TIMEOUT_MS";
    public static final String ENV_ATTEMPT_TIMEOUT_MS = "RESILIENT_CLIENT_ATTEMPT_TIMEOUT_MS";

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClientConfig.class, loaderOptions));
    }

    /**
     * Loads, overrides and validates the configuration.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or holds invalid values
     */
    public ClientConfig load() {
        ClientConfig config = loadFromPath();
        applyEnvironmentOverrides(config, environment);
        validate(config);
        return config;
    }

    private ClientConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException(Reason.UNREADABLE, classpathResource, e);
        }

        throw new ConfigurationException(Reason.NOT_FOUND, configPath.toString());
    }

    private ClientConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException(Reason.UNREADABLE, path.toString(), e);
        }
    }

    /**
     * Loads configuration from an input stream, with the same overrides and
     * validation as {@link #load()}.
     */
    public ClientConfig loadFromStream(InputStream inputStream) {
        ClientConfig config = parse(inputStream, "stream");
        applyEnvironmentOverrides(config, environment);
        validate(config);
        return config;
    }

    private ClientConfig parse(InputStream inputStream, String origin) {
        try {
            ClientConfig config = yaml.load(inputStream);
            // an empty document yields null
            return config != null ? config : new ClientConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException(Reason.UNREADABLE, origin + " (" + e.getMessage() + ")", e);
        }
    }

    /**
     * Applies {@code RESILIENT_CLIENT_*} overrides on top of the file values.
     *
     * @throws ConfigurationException if a variable holds a non-numeric value
     */
    public static void applyEnvironmentOverrides(ClientConfig config, Map<String, String> env) {
        String mode = env.get(ENV_MODE);
        if (mode != null && !mode.isBlank()) {
            config.getEnvironment().setMode(mode.trim());
        }
        override(env, ENV_MAX_RETRIES, value -> config.getRetry().setMaxRetriesPerEndpoint(Math.toIntExact(value)));
        override(env, ENV_BASE_DELAY_MS, value -> config.getRetry().setBaseDelayMs(value));
        override(env, ENV_CALL_TIMEOUT_MS, value -> config.getTimeouts().setCallTimeoutMs(value));
        override(env, ENV_ATTEMPT_TIMEOUT_MS, value -> config.getTimeouts().setAttemptTimeoutMs(value));
    }

    private static void override(Map<String, String> env, String name, Consumer<Long> setter) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            setter.accept(value);
            log.info("Configuration override from environment: {}={}", name, value);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ConfigurationException(Reason.INVALID_VALUE, name + "=" + raw, e);
        }
    }

    /**
     * Checks every numeric setting is in range.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public static void validate(ClientConfig config) {
        ClientConfig.RetryConfig retry = config.getRetry();
        require(retry.getMaxRetriesPerEndpoint() >= 1,
                "retry.maxRetriesPerEndpoint must be >= 1, was " + retry.getMaxRetriesPerEndpoint());
        require(retry.getBaseDelayMs() >= 0,
                "retry.baseDelayMs must be >= 0, was " + retry.getBaseDelayMs());
        require(retry.getMaxDelayMs() >= 0,
                "retry.maxDelayMs must be >= 0, was " + retry.getMaxDelayMs());
        require(retry.getBackoffMultiplier() >= 1.0,
                "retry.backoffMultiplier must be >= 1, was " + retry.getBackoffMultiplier());
        require(retry.getJitterFactor() >= 0.0 && retry.getJitterFactor() <= 1.0,
                "retry.jitterFactor must be in [0, 1], was " + retry.getJitterFactor());

        ClientConfig.TimeoutsConfig timeouts = config.getTimeouts();
        require(timeouts.getConnectTimeoutMs() > 0,
                "timeouts.connectTimeoutMs must be > 0, was " + timeouts.getConnectTimeoutMs());
        require(timeouts.getAttemptTimeoutMs() > 0,
                "timeouts.attemptTimeoutMs must be > 0, was " + timeouts.getAttemptTimeoutMs());
        require(timeouts.getCallTimeoutMs() >= 0,
                "timeouts.callTimeoutMs must be >= 0, was " + timeouts.getCallTimeoutMs());

        ClientConfig.TaggingConfig tagging = config.getTagging();
        require(tagging.getSource() != null && !tagging.getSource().isBlank(),
                "tagging.source must not be blank");
        require(tagging.getHeaderPrefix() != null && !tagging.getHeaderPrefix().isBlank(),
                "tagging.headerPrefix must not be blank");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(Reason.INVALID_VALUE, message);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static ClientConfig createDefault() {
        return new ClientConfig();
    }
}
