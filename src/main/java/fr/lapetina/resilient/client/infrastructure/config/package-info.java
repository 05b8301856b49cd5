/**
 * Configuration loading.
 *
 * <p>This package parses the YAML configuration and applies overrides from the
 * hosting environment.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.resilient.client.infrastructure.config.ClientConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.resilient.client.infrastructure.config.ConfigLoader} - YAML loading, overrides, validation</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code environment} - Explicit mode and host name</li>
 *   <li>{@code profiles} - Per-environment base URL, primaries and fallback lists</li>
 *   <li>{@code retry} - Attempts per endpoint and delay between them</li>
 *   <li>{@code timeouts} - Connect, per-attempt and per-call timeouts</li>
 *   <li>{@code tagging} - Source id and header prefix of the correlation headers</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <h2>Environment Overrides</h2>
 * <table>
 *   <caption>Variables read at load time</caption>
 *   <tr><th>Variable</th><th>Setting</th></tr>
 *   <tr><td>RESILIENT_CLIENT_ENV</td><td>environment.mode</td></tr>
 *   <tr><td>RESILIENT_CLIENT_MAX_RETRIES</td><td>retry.maxRetriesPerEndpoint</td></tr>
 *   <tr><td>RESILIENT_CLIENT_BASE_DELAY_MS</td><td>retry.baseDelayMs</td></tr>
 *   <tr><td>RESILIENT_CLIENT_CALL_TIMEOUT_MS</td><td>timeouts.callTimeoutMs</td></tr>
 *   <tr><td>RESILIENT_CLIENT_ATTEMPT_TIMEOUT_MS</td><td>timeouts.attemptTimeoutMs</td></tr>
 * </table>
 *
 * @see fr.lapetina.resilient.client.infrastructure.config.ClientConfig
 * @see fr.lapetina.resilient.client.infrastructure.config.ConfigLoader
 */
package fr.lapetina.resilient.client.infrastructure.config;
