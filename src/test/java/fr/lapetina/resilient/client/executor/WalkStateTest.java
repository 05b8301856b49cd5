package fr.lapetina.resilient.client.executor;

import fr.lapetina.resilient.client.domain.policy.RetryDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WalkStateTest {

    @Test
    @DisplayName("should start on the first attempt of the first endpoint")
    void shouldStartAtOrigin() {
        assertThat(WalkState.initial()).isEqualTo(new WalkState.Walking(0, 0));
        assertThat(WalkState.initial().isTerminal()).isFalse();
    }

    @Test
    @DisplayName("should stay on the endpoint when retrying")
    void shouldRetrySameEndpoint() {
        WalkState next = WalkState.transition(new WalkState.Walking(1, 0), RetryDecision.retry(Duration.ofSeconds(1)), 3);

        assertThat(next).isEqualTo(new WalkState.Walking(1, 1));
    }

    @Test
    @DisplayName("should move to the next endpoint and reset the attempt index")
    void shouldAdvance() {
        WalkState next = WalkState.transition(new WalkState.Walking(0, 2), RetryDecision.advance(), 3);

        assertThat(next).isEqualTo(new WalkState.Walking(1, 0));
    }

    @Test
    @DisplayName("should stop when advancing past the last endpoint")
    void shouldStopAfterLastEndpoint() {
        WalkState next = WalkState.transition(new WalkState.Walking(2, 2), RetryDecision.advance(), 3);

        assertThat(next).isInstanceOf(WalkState.Stopped.class);
        assertThat(next.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("should stop on a stop decision")
    void shouldStop() {
        assertThat(WalkState.transition(WalkState.initial(), RetryDecision.stop(), 3))
                .isInstanceOf(WalkState.Stopped.class);
    }
}
