/**
 * Chain-walking executor.
 *
 * <p>{@link fr.lapetina.resilient.client.executor.ResilientRequestExecutor} drives one
 * {@link fr.lapetina.resilient.client.executor.WalkState} per call:
 *
 * <pre>
 *   attempt ──success──────────────────────────────► Ok
 *      │
 *      ├─client error────────────────────────────────► Failed
 *      │
 *      └─server/transport error
 *            ├─attempts left on endpoint ─(delay)──► attempt (same endpoint)
 *            ├─endpoints left ──────────────────────► attempt (next endpoint)
 *            └─chain exhausted ─────────────────────► Failed
 * </pre>
 *
 * <h2>Concurrency</h2>
 * <p>Attempts of one call never overlap. Delays run on a scheduler rather than a sleeping
 * thread, and {@link fr.lapetina.resilient.client.executor.PendingCall#cancel()} stops a call
 * between or during attempts.
 */
package fr.lapetina.resilient.client.executor;
