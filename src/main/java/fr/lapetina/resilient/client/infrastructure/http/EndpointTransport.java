package fr.lapetina.resilient.client.infrastructure.http;

import fr.lapetina.resilient.client.domain.model.AttemptTags;
import fr.lapetina.resilient.client.domain.model.RequestSpec;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Performs exactly one network attempt against one URI.
 *
 * The returned future completes normally with whatever response the endpoint
 * gave, including 4xx and 5xx statuses, and completes exceptionally only when
 * no response was obtained. Cancelling the future should abort the exchange.
 */
public interface EndpointTransport extends AutoCloseable {

    CompletableFuture<ServiceResponse> send(URI uri, RequestSpec spec, AttemptTags tags);

    @Override
    default void close() {
        // Default no-op
    }
}
