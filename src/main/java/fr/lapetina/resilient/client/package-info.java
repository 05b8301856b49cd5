/**
 * Resilient Request Client - fallback-chain HTTP client for a small fleet of backend services.
 *
 * <p>Each logical service is reachable through an ordered chain of base URLs. A call walks the
 * chain: transient failures are retried on the same endpoint after a delay, an exhausted endpoint
 * fails over to the next one, and a client error stops the call at once.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilient.client.ResilientClientFactory} - Main entry point for creating
 *       a fully-configured executor from YAML configuration</li>
 *   <li>{@link fr.lapetina.resilient.client.ResilientClientApplication} - Command-line diagnostic
 *       that performs one call and prints every attempt</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ResilientClientFactory factory = ResilientClientFactory.create("resilient-client.yaml")) {
 *     ResilientRequestExecutor executor = factory.getExecutor();
 *
 *     RequestOutcome outcome = executor.execute(ServiceName.API, "/api/dashboard/overview", RequestSpec.get());
 *     if (outcome.isOk()) {
 *         JsonNode payload = JsonCodec.readTree(((RequestOutcome.Ok) outcome).response());
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Development/production profile detection with YAML overrides</li>
 *   <li>Ordered, deduplicated fallback chains per service</li>
 *   <li>Bounded retries with constant (optionally backed-off, jittered) delay</li>
 *   <li>Correlation headers on every attempt</li>
 *   <li>Caller cancellation and per-call deadline</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.resilient.client.ResilientClientFactory
 * @see fr.lapetina.resilient.client.executor.ResilientRequestExecutor
 */
package fr.lapetina.resilient.client;
