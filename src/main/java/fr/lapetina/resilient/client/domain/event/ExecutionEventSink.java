package fr.lapetina.resilient.client.domain.event;

/**
 * Receives executor events for logging or metrics.
 *
 * Implementations must be thread-safe: concurrent calls report to the same sink.
 * They should not throw; when they do, the executor logs the error and carries on.
 */
@FunctionalInterface
public interface ExecutionEventSink {

    void record(ExecutionEvent event);

    static ExecutionEventSink noOp() {
        return event -> { };
    }
}
