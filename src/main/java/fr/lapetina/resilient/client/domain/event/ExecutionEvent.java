package fr.lapetina.resilient.client.domain.event;

import fr.lapetina.resilient.client.domain.model.AttemptRecord;
import fr.lapetina.resilient.client.domain.model.ServiceName;

import java.time.Duration;
import java.util.Objects;

/**
 * Observability events emitted by the executor: one per attempt, one per call resolution.
 */
public interface ExecutionEvent {

    String callId();

    ServiceName service();

    record AttemptEvent(String callId, ServiceName service, AttemptRecord record) implements ExecutionEvent {
        public AttemptEvent {
            Objects.requireNonNull(callId, "callId is required");
            Objects.requireNonNull(service, "service is required");
            Objects.requireNonNull(record, "record is required");
        }
    }

    record CallResolvedEvent(
            String callId,
            ServiceName service,
            CallStatus status,
            int totalAttempts,
            Duration totalElapsed
    ) implements ExecutionEvent {
        public CallResolvedEvent {
            Objects.requireNonNull(callId, "callId is required");
            Objects.requireNonNull(service, "service is required");
            Objects.requireNonNull(status, "status is required");
            totalElapsed = totalElapsed != null ? totalElapsed : Duration.ZERO;
        }
    }

    /**
     * How a call resolved.
     */
    enum CallStatus {
        OK,
        FAILED,
        CANCELLED
    }
}
