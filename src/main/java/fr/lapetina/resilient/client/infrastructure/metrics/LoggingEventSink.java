package fr.lapetina.resilient.client.infrastructure.metrics;

import fr.lapetina.resilient.client.domain.event.ExecutionEvent;
import fr.lapetina.resilient.client.domain.event.ExecutionEventSink;
import fr.lapetina.resilient.client.domain.model.AttemptRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes executor events as structured log lines.
 * Successful attempts log at DEBUG, failed attempts at WARN, call resolutions at INFO.
 */
public final class LoggingEventSink implements ExecutionEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    @Override
    public void record(ExecutionEvent event) {
        if (event instanceof ExecutionEvent.AttemptEvent) {
            logAttempt((ExecutionEvent.AttemptEvent) event);
        } else if (event instanceof ExecutionEvent.CallResolvedEvent) {
            ExecutionEvent.CallResolvedEvent resolved = (ExecutionEvent.CallResolvedEvent) event;
            log.info("Call resolved: callId={}, service={}, status={}, attempts={}, elapsedMs={}",
                    resolved.callId(),
                    resolved.service(),
                    resolved.status(),
                    resolved.totalAttempts(),
                    resolved.totalElapsed().toMillis());
        }
    }

    private void logAttempt(ExecutionEvent.AttemptEvent attempt) {
        AttemptRecord record = attempt.record();
        if (record.isSuccess()) {
            log.debug("Attempt succeeded: callId={}, service={}, endpoint={}, chainPosition={}, attempt={}, status={}, elapsedMs={}",
                    attempt.callId(), attempt.service(), record.endpoint(),
                    record.chainIndex() + 1, record.attemptOnEndpoint(),
                    record.statusCode(), record.elapsed().toMillis());
        } else {
            log.warn("Attempt failed: callId={}, service={}, endpoint={}, chainPosition={}, attempt={}, classification={}, status={}, error={}, elapsedMs={}",
                    attempt.callId(), attempt.service(), record.endpoint(),
                    record.chainIndex() + 1, record.attemptOnEndpoint(),
                    record.classification(), record.statusCode(), record.errorMessage(),
                    record.elapsed().toMillis());
        }
    }
}
