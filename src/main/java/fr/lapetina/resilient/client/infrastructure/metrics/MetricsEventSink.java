package fr.lapetina.resilient.client.infrastructure.metrics;

import fr.lapetina.resilient.client.domain.event.ExecutionEvent;
import fr.lapetina.resilient.client.domain.event.ExecutionEventSink;
import fr.lapetina.resilient.client.domain.model.AttemptRecord;

import java.util.Objects;

/**
 * Forwards executor events to the {@link MetricsRegistry}.
 */
public final class MetricsEventSink implements ExecutionEventSink {

    private final MetricsRegistry metricsRegistry;

    public MetricsEventSink(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry must not be null");
    }

    @Override
    public void record(ExecutionEvent event) {
        if (event instanceof ExecutionEvent.AttemptEvent) {
            ExecutionEvent.AttemptEvent attempt = (ExecutionEvent.AttemptEvent) event;
            AttemptRecord record = attempt.record();
            metricsRegistry.recordAttempt(
                    attempt.service().value(),
                    record.endpoint().toString(),
                    record.classification(),
                    record.elapsed()
            );
        } else if (event instanceof ExecutionEvent.CallResolvedEvent) {
            ExecutionEvent.CallResolvedEvent resolved = (ExecutionEvent.CallResolvedEvent) event;
            metricsRegistry.recordCall(resolved.service().value(), resolved.status(), resolved.totalElapsed());
        }
    }
}
