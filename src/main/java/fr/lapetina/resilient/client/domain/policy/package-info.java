/**
 * Decision logic consulted by the executor: chain construction, failure
 * classification and the retry policy.
 *
 * <p>Everything here is pure and free of networking, so each rule can be tested in isolation.
 *
 * <h2>Classification Table</h2>
 * <table border="1">
 *   <tr><th>Attempt result</th><th>Classification</th><th>Retried</th></tr>
 *   <tr><td>status 200-399</td><td>{@code SUCCESS}</td><td>-</td></tr>
 *   <tr><td>no response</td><td>{@code TRANSPORT_ERROR}</td><td>yes, then failover</td></tr>
 *   <tr><td>status 400-499</td><td>{@code CLIENT_ERROR}</td><td>never</td></tr>
 *   <tr><td>any other status</td><td>{@code SERVER_ERROR}</td><td>yes, then failover</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofSeconds(1));
 * RetryDecision decision = policy.next(1, Classification.SERVER_ERROR);
 * // RetrySameEndpoint[delay=PT1S]
 * }</pre>
 *
 * @see fr.lapetina.resilient.client.domain.policy.RetryPolicy
 * @see fr.lapetina.resilient.client.domain.policy.ErrorClassifier
 */
package fr.lapetina.resilient.client.domain.policy;
