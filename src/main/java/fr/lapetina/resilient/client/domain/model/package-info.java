/**
 * Domain model for the resilient request layer.
 *
 * <p>Value types describing where a call may go and what happened to it.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilient.client.domain.model.EnvironmentProfile} - Active profile and primary URLs</li>
 *   <li>{@link fr.lapetina.resilient.client.domain.model.FallbackChain} - Ordered candidate endpoints for one service</li>
 *   <li>{@link fr.lapetina.resilient.client.domain.model.RequestSpec} - What to send on every attempt</li>
 *   <li>{@link fr.lapetina.resilient.client.domain.model.AttemptRecord} - Diagnostic trace of one attempt</li>
 *   <li>{@link fr.lapetina.resilient.client.domain.model.RequestOutcome} - Ok, Failed or Cancelled</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All types in this package are immutable and may be shared freely between concurrent calls.
 */
package fr.lapetina.resilient.client.domain.model;
