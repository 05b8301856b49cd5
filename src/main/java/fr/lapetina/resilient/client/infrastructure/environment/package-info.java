/**
 * Environment detection.
 *
 * <p>{@link fr.lapetina.resilient.client.infrastructure.environment.EnvironmentResolver} turns
 * {@link fr.lapetina.resilient.client.infrastructure.environment.EnvironmentSignals} and the
 * {@code profiles} configuration section into the immutable profile and fallback table used
 * for the lifetime of the process.
 */
package fr.lapetina.resilient.client.infrastructure.environment;
