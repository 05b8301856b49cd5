package fr.lapetina.resilient.client.infrastructure.http;

import fr.lapetina.resilient.client.domain.model.AttemptTags;
import fr.lapetina.resilient.client.domain.model.RequestSpec;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Transport backed by {@link java.net.http.HttpClient}.
 *
 * Uses non-blocking I/O; the attempt timeout is applied as the HTTP request
 * timeout so an unresponsive endpoint surfaces as a transport error.
 * Correlation tags are sent as headers and never touch the body.
 */
public class JdkHttpTransport implements EndpointTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    public static final String DEFAULT_HEADER_PREFIX = "X-BGAPP";

    private final HttpClient httpClient;
    private final Duration attemptTimeout;
    private final String headerPrefix;

    public JdkHttpTransport(Duration connectTimeout, Duration attemptTimeout, String headerPrefix) {
        this.attemptTimeout = attemptTimeout;
        this.headerPrefix = headerPrefix != null ? headerPrefix : DEFAULT_HEADER_PREFIX;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public JdkHttpTransport() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30), DEFAULT_HEADER_PREFIX);
    }

    @Override
    public CompletableFuture<ServiceResponse> send(URI uri, RequestSpec spec, AttemptTags tags) {
        HttpRequest httpRequest = buildHttpRequest(uri, spec, tags);

        log.debug("Sending attempt: callId={}, uri={}, method={}, chainPosition={}, attempt={}",
                tags.callId(), uri, spec.method(), tags.chainPosition(), tags.attemptNumber());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new ServiceResponse(
                        uri,
                        response.statusCode(),
                        response.headers().map(),
                        response.body()
                ));
    }

    HttpRequest buildHttpRequest(URI uri, RequestSpec spec, AttemptTags tags) {
        HttpRequest.BodyPublisher publisher = spec.hasBody()
                ? HttpRequest.BodyPublishers.ofString(JsonCodec.encodeBody(spec.body()))
                : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .method(spec.method(), publisher);
        if (attemptTimeout != null && !attemptTimeout.isZero()) {
            builder.timeout(attemptTimeout);
        }

        mergeHeaders(spec, tags).forEach(builder::header);
        return builder.build();
    }

    /**
     * Defaults first, then caller headers, then correlation tags; later entries win.
     */
    Map<String, String> mergeHeaders(RequestSpec spec, AttemptTags tags) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Accept", "application/json");
        if (spec.hasBody()) {
            headers.put("Content-Type", "application/json");
        }
        headers.putAll(spec.headers());
        headers.putAll(tags.toHeaders(headerPrefix));
        return headers;
    }

    public String getHeaderPrefix() {
        return headerPrefix;
    }

    @Override
    public void close() {
        // java.net.http.HttpClient has no close() before JDK 21; its threads are daemons
    }
}
