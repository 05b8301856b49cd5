package fr.lapetina.resilient.client.exception;

/**
 * Exception thrown when the client is misconfigured.
 *
 * This occurs when:
 * - A logical service has neither a primary URL nor fallbacks
 * - A configuration value is out of range or unparseable
 * - The configuration file cannot be found or read
 *
 * Never retried: it is surfaced to the caller on first occurrence.
 */
public final class ConfigurationException extends RuntimeException {

    private final Reason reason;

    public ConfigurationException(Reason reason, String details) {
        super(reason.getMessage() + ": " + details);
        this.reason = reason;
    }

    public ConfigurationException(Reason reason, String details, Throwable cause) {
        super(reason.getMessage() + ": " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        UNKNOWN_SERVICE("No endpoint configured for service"),
        INVALID_VALUE("Invalid configuration value"),
        NOT_FOUND("Configuration file not found"),
        UNREADABLE("Configuration could not be read");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
