package fr.lapetina.resilient.client.executor;

import fr.lapetina.resilient.client.domain.model.RequestOutcome;
import fr.lapetina.resilient.client.domain.model.ServiceName;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a call that is walking its fallback chain.
 */
public interface PendingCall {

    String callId();

    ServiceName service();

    /**
     * Completes with the terminal outcome. Never completes exceptionally.
     */
    CompletableFuture<RequestOutcome> outcome();

    /**
     * Aborts the call: no further attempts are issued and {@link #outcome()}
     * completes with {@link RequestOutcome.Cancelled}.
     *
     * @return true if this call resolved as cancelled, false if it had already resolved
     */
    boolean cancel();
}
