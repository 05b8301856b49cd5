package fr.lapetina.resilient.client.infrastructure.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the resilient client.
 * Designed to be populated from YAML. Every section has defaults, so an empty
 * document is a valid configuration.
 */
public class ClientConfig {

    private EnvironmentConfig environment = new EnvironmentConfig();
    private ProfilesConfig profiles = new ProfilesConfig();
    private RetryConfig retry = new RetryConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private TaggingConfig tagging = new TaggingConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public EnvironmentConfig getEnvironment() { return environment; }
    public void setEnvironment(EnvironmentConfig environment) { this.environment = environment; }

    public ProfilesConfig getProfiles() { return profiles; }
    public void setProfiles(ProfilesConfig profiles) { this.profiles = profiles; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public TaggingConfig getTagging() { return tagging; }
    public void setTagging(TaggingConfig tagging) { this.tagging = tagging; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Explicit environment selection. Unset fields fall back to ambient signals.
     */
    public static class EnvironmentConfig {
        private String mode;
        private String hostName;

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getHostName() { return hostName; }
        public void setHostName(String hostName) { this.hostName = hostName; }
    }

    public static class ProfilesConfig {
        private ProfileConfig development = new ProfileConfig();
        private ProfileConfig production = new ProfileConfig();

        public ProfileConfig getDevelopment() { return development; }
        public void setDevelopment(ProfileConfig development) { this.development = development; }

        public ProfileConfig getProduction() { return production; }
        public void setProduction(ProfileConfig production) { this.production = production; }

        public ProfileConfig forMode(boolean developmentMode) {
            return developmentMode ? development : production;
        }
    }

    /**
     * Overrides for one environment profile. Entries replace the built-in
     * value for the same service; services not listed keep their defaults.
     */
    public static class ProfileConfig {
        private String baseUrl;
        private Map<String, String> services = new LinkedHashMap<>();
        private Map<String, List<String>> fallbacks = new LinkedHashMap<>();

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Map<String, String> getServices() { return services; }
        public void setServices(Map<String, String> services) { this.services = services; }

        public Map<String, List<String>> getFallbacks() { return fallbacks; }
        public void setFallbacks(Map<String, List<String>> fallbacks) { this.fallbacks = fallbacks; }
    }

    public static class RetryConfig {
        private int maxRetriesPerEndpoint = 3;
        private long baseDelayMs = 1000;
        private double backoffMultiplier = 1.0;
        private long maxDelayMs = 30000;
        private double jitterFactor = 0.0;

        public int getMaxRetriesPerEndpoint() { return maxRetriesPerEndpoint; }
        public void setMaxRetriesPerEndpoint(int maxRetriesPerEndpoint) { this.maxRetriesPerEndpoint = maxRetriesPerEndpoint; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }

    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long attemptTimeoutMs = 30000;
        private long callTimeoutMs = 120000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        /** Zero disables the per-call deadline. */
        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }
    }

    public static class TaggingConfig {
        private String source = "admin-dashboard";
        private String headerPrefix = "X-BGAPP";

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }

        public String getHeaderPrefix() { return headerPrefix; }
        public void setHeaderPrefix(String headerPrefix) { this.headerPrefix = headerPrefix; }
    }

    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "resilient_client";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
