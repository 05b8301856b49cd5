package fr.lapetina.resilient.client.executor;

import fr.lapetina.resilient.client.domain.policy.RetryDecision;

/**
 * State of one chain walk.
 *
 * <pre>
 * Walking(0,0) --RetrySameEndpoint--> Walking(c, a+1)
 *              --AdvanceToNextEndpoint--> Walking(c+1, 0) | Stopped (last endpoint)
 *              --Stop--> Stopped
 *              --success--> Succeeded
 * </pre>
 */
public interface WalkState {

    /**
     * @param chainIndex   0-based index of the endpoint being tried
     * @param attemptIndex 0-based index of the attempt on that endpoint
     */
    record Walking(int chainIndex, int attemptIndex) implements WalkState {
        public Walking {
            if (chainIndex < 0 || attemptIndex < 0) {
                throw new IllegalArgumentException("Indexes must be >= 0: chainIndex=" + chainIndex + ", attemptIndex=" + attemptIndex);
            }
        }
    }

    record Succeeded() implements WalkState {
    }

    record Stopped() implements WalkState {
    }

    static Walking initial() {
        return new Walking(0, 0);
    }

    default boolean isTerminal() {
        return !(this instanceof Walking);
    }

    /**
     * Applies a retry decision to the current state.
     *
     * @param current     state the failed attempt was made in
     * @param decision    what the retry policy decided
     * @param chainLength number of endpoints in the chain
     * @return the next state
     */
    static WalkState transition(Walking current, RetryDecision decision, int chainLength) {
        if (decision instanceof RetryDecision.RetrySameEndpoint) {
            return new Walking(current.chainIndex(), current.attemptIndex() + 1);
        }
        if (decision instanceof RetryDecision.AdvanceToNextEndpoint) {
            int next = current.chainIndex() + 1;
            return next < chainLength ? new Walking(next, 0) : new Stopped();
        }
        if (decision instanceof RetryDecision.Stop) {
            return new Stopped();
        }
        throw new IllegalStateException("Unhandled decision: " + decision);
    }
}
