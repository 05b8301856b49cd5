package fr.lapetina.resilient.client.domain.event;

import fr.lapetina.resilient.client.domain.model.ServiceName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeEventSinkTest {

    private final ExecutionEvent event = new ExecutionEvent.CallResolvedEvent(
            "call-1", ServiceName.API, ExecutionEvent.CallStatus.OK, 1, Duration.ofMillis(12));

    @Test
    @DisplayName("should deliver every event to every sink")
    void shouldFanOut() {
        List<ExecutionEvent> first = new ArrayList<>();
        List<ExecutionEvent> second = new ArrayList<>();

        CompositeEventSink.of(first::add, second::add).record(event);

        assertThat(first).containsExactly(event);
        assertThat(second).containsExactly(event);
    }

    @Test
    @DisplayName("should keep delivering when one sink throws")
    void shouldIsolateFailingSink() {
        List<ExecutionEvent> received = new ArrayList<>();
        ExecutionEventSink failing = e -> {
            throw new IllegalStateException("sink down");
        };

        CompositeEventSink.of(failing, received::add).record(event);

        assertThat(received).containsExactly(event);
    }
}
