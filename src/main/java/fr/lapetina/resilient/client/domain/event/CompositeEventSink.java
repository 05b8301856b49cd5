package fr.lapetina.resilient.client.domain.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fans each event out to several sinks. A failing sink does not prevent the others from receiving the event.
 */
public final class CompositeEventSink implements ExecutionEventSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeEventSink.class);

    private final List<ExecutionEventSink> sinks;

    public CompositeEventSink(List<ExecutionEventSink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks must not be null"));
    }

    public static ExecutionEventSink of(ExecutionEventSink... sinks) {
        return new CompositeEventSink(List.of(sinks));
    }

    @Override
    public void record(ExecutionEvent event) {
        for (ExecutionEventSink sink : sinks) {
            try {
                sink.record(event);
            } catch (Exception e) {
                log.error("Event sink failed: sink={}, callId={}", sink.getClass().getSimpleName(), event.callId(), e);
            }
        }
    }

    public int size() {
        return sinks.size();
    }
}
