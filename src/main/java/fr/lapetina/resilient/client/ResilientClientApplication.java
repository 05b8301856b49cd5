package fr.lapetina.resilient.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.resilient.client.domain.model.AttemptRecord;
import fr.lapetina.resilient.client.domain.model.RequestOutcome;
import fr.lapetina.resilient.client.domain.model.RequestSpec;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.exception.ConfigurationException;
import fr.lapetina.resilient.client.infrastructure.http.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;

/**
 * Diagnostic entry point: performs one call through the fallback chain and
 * prints a JSON summary of every attempt.
 *
 * <pre>
 * ResilientClientApplication &lt;config.yaml&gt; &lt;service&gt; &lt;path&gt; [METHOD] [body]
 * </pre>
 *
 * Exit codes: 0 when the call succeeded, 1 when it failed or was cancelled,
 * 2 on usage or configuration errors.
 */
public class ResilientClientApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientClientApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;

    private final ResilientClientFactory factory;

    public ResilientClientApplication(ResilientClientFactory factory) {
        this.factory = factory;
    }

    /**
     * Executes one call and writes its summary to {@code out}.
     *
     * @return the process exit code
     */
    public int call(ServiceName service, String path, String method, String body, PrintStream out) {
        RequestSpec.Builder spec = RequestSpec.builder().method(method);
        if (body != null) {
            spec.body(body);
        }

        log.info("Calling service: service={}, path={}, method={}, primary={}",
                service, path, method, factory.buildUrl(service, path));

        RequestOutcome outcome = factory.getExecutor().execute(service, path, spec.build());
        out.println(render(summarize(service, path, outcome)));
        return outcome.isOk() ? EXIT_OK : EXIT_FAILED;
    }

    public ResilientClientFactory getFactory() {
        return factory;
    }

    static ObjectNode summarize(ServiceName service, String path, RequestOutcome outcome) {
        ObjectNode summary = JsonCodec.mapper().createObjectNode();
        summary.put("service", service.value());
        summary.put("path", path);
        summary.put("attempts", outcome.attemptCount());

        if (outcome instanceof RequestOutcome.Ok) {
            RequestOutcome.Ok ok = (RequestOutcome.Ok) outcome;
            summary.put("status", "OK");
            summary.put("statusCode", ok.response().statusCode());
            summary.put("endpoint", ok.response().uri().toString());
        } else if (outcome instanceof RequestOutcome.Failed) {
            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            summary.put("status", "FAILED");
            summary.put("classification", failed.lastClassification().name());
            summary.put("cause", failed.describe());
        } else if (outcome instanceof RequestOutcome.Cancelled) {
            summary.put("status", "CANCELLED");
            summary.put("reason", ((RequestOutcome.Cancelled) outcome).reason().name());
        }

        ArrayNode attempts = summary.putArray("attemptLog");
        List<AttemptRecord> records = outcome.attempts();
        for (AttemptRecord record : records) {
            ObjectNode node = attempts.addObject();
            node.put("endpoint", record.endpoint().toString());
            node.put("chainPosition", record.chainIndex() + 1);
            node.put("attempt", record.attemptOnEndpoint());
            node.put("classification", record.classification().name());
            if (record.hasResponse()) {
                node.put("statusCode", record.statusCode());
            }
            if (record.errorMessage() != null) {
                node.put("error", record.errorMessage());
            }
            node.put("delayMs", record.delayBefore().toMillis());
            node.put("elapsedMs", record.elapsed().toMillis());
        }
        return summary;
    }

    private static String render(ObjectNode summary) {
        try {
            return JsonCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Summary could not be serialized", e);
        }
    }

    @Override
    public void close() {
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 3) {
            err.println("Usage: ResilientClientApplication <config.yaml> <service> <path> [METHOD] [body]");
            return EXIT_CONFIGURATION;
        }
        String configPath = args[0];
        ServiceName service = ServiceName.of(args[1]);
        String path = args[2];
        String method = args.length > 3 ? args[3] : "GET";
        String body = args.length > 4 ? args[4] : null;

        try (ResilientClientApplication app = new ResilientClientApplication(ResilientClientFactory.create(configPath))) {
            return app.call(service, path, method, body, out);
        } catch (ConfigurationException e) {
            log.error("Configuration error: reason={}", e.getReason(), e);
            err.println(e.getMessage());
            return EXIT_CONFIGURATION;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }
}
