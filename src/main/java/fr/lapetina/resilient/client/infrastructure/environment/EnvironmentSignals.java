package fr.lapetina.resilient.client.infrastructure.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Snapshot of the ambient signals used to pick an environment profile.
 *
 * @param executionMode declared mode ("development", "production", ...), or null
 * @param hostName      host the process runs on, or null
 */
public record EnvironmentSignals(String executionMode, String hostName) {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentSignals.class);

    public static final String MODE_PROPERTY = "resilient.client.env";
    public static final String MODE_VARIABLE = "RESILIENT_CLIENT_ENV";
    public static final String NODE_ENV_VARIABLE = "NODE_ENV";

    public static EnvironmentSignals none() {
        return new EnvironmentSignals(null, null);
    }

    public static EnvironmentSignals of(String executionMode, String hostName) {
        return new EnvironmentSignals(executionMode, hostName);
    }

    /**
     * Reads the signals of the running process: system property, then
     * {@code RESILIENT_CLIENT_ENV}, then {@code NODE_ENV} for the mode, and
     * the local host name.
     */
    public static EnvironmentSignals fromSystem() {
        String mode = firstNonBlank(
                System.getProperty(MODE_PROPERTY),
                System.getenv(MODE_VARIABLE),
                System.getenv(NODE_ENV_VARIABLE));
        return new EnvironmentSignals(mode, localHostName());
    }

    public Optional<String> mode() {
        return Optional.ofNullable(executionMode).map(String::trim).filter(s -> !s.isEmpty());
    }

    public Optional<String> host() {
        return Optional.ofNullable(hostName).map(String::trim).filter(s -> !s.isEmpty());
    }

    /**
     * Replaces the mode and host with the given values when they are not blank.
     */
    public EnvironmentSignals withOverrides(String mode, String host) {
        return new EnvironmentSignals(
                mode != null && !mode.isBlank() ? mode : executionMode,
                host != null && !host.isBlank() ? host : hostName);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Local host name unavailable: {}", e.getMessage());
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
