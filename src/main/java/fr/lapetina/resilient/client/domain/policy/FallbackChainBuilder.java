package fr.lapetina.resilient.client.domain.policy;

import fr.lapetina.resilient.client.domain.model.EnvironmentProfile;
import fr.lapetina.resilient.client.domain.model.FallbackChain;
import fr.lapetina.resilient.client.domain.model.FallbackTable;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.exception.ConfigurationException;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the ordered candidate list for a logical service:
 * the profile's primary URL first, then the declared fallbacks in order,
 * with exact duplicates removed (first occurrence kept).
 */
public final class FallbackChainBuilder {

    private final FallbackTable fallbackTable;

    public FallbackChainBuilder(FallbackTable fallbackTable) {
        this.fallbackTable = Objects.requireNonNull(fallbackTable, "fallbackTable must not be null");
    }

    /**
     * @throws ConfigurationException if the service has neither a primary URL nor fallbacks
     */
    public FallbackChain build(EnvironmentProfile profile, ServiceName service) {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(service, "service must not be null");

        Set<URI> ordered = new LinkedHashSet<>();
        profile.primaryUrl(service).ifPresent(ordered::add);
        ordered.addAll(fallbackTable.forService(service));

        if (ordered.isEmpty()) {
            throw new ConfigurationException(
                    ConfigurationException.Reason.UNKNOWN_SERVICE,
                    service + " (profile=" + profile.name() + ")"
            );
        }
        return new FallbackChain(service, new ArrayList<>(ordered));
    }

    public FallbackTable getFallbackTable() {
        return fallbackTable;
    }
}
