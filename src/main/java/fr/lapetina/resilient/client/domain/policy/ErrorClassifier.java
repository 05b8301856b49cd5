package fr.lapetina.resilient.client.domain.policy;

import fr.lapetina.resilient.client.domain.model.AttemptResult;
import fr.lapetina.resilient.client.domain.model.Classification;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Assigns each attempt to a {@link Classification}.
 *
 * Rules, in priority order:
 * <ol>
 *   <li>response with status 200-399: SUCCESS</li>
 *   <li>no response at all: TRANSPORT_ERROR</li>
 *   <li>status 400-499: CLIENT_ERROR</li>
 *   <li>anything else: SERVER_ERROR</li>
 * </ol>
 *
 * Stateless and thread-safe.
 */
public final class ErrorClassifier {

    public Classification classify(AttemptResult result) {
        if (result instanceof AttemptResult.Responded) {
            return classifyStatus(((AttemptResult.Responded) result).response().statusCode());
        }
        return Classification.TRANSPORT_ERROR;
    }

    public Classification classifyStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 400) {
            return Classification.SUCCESS;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return Classification.CLIENT_ERROR;
        }
        return Classification.SERVER_ERROR;
    }

    /**
     * Short label for the kind of transport failure, used in logs and metrics.
     */
    public static String transportDetail(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return "timeout";
        }
        if (cause instanceof UnknownHostException) {
            return "dns_error";
        }
        if (cause instanceof ConnectException || cause instanceof NoRouteToHostException) {
            return "connection_refused";
        }
        if (cause instanceof SSLException) {
            return "tls_error";
        }
        return "io_error";
    }

    /**
     * Strips the wrappers added by {@link java.util.concurrent.CompletableFuture} stages.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
