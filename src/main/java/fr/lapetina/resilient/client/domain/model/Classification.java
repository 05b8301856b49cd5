package fr.lapetina.resilient.client.domain.model;

/**
 * Bucket assigned to one attempt's outcome; drives retry and failover decisions.
 */
public enum Classification {
    /** Status 200-399 */
    SUCCESS(false),

    /** Status 400-499: the request itself is wrong, whichever endpoint answers */
    CLIENT_ERROR(false),

    /** Status 500-599 or any other non-success status */
    SERVER_ERROR(true),

    /** No response obtained (refused, timeout, DNS, TLS) */
    TRANSPORT_ERROR(true);

    private final boolean retryable;

    Classification(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
