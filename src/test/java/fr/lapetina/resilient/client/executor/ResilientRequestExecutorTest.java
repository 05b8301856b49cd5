package fr.lapetina.resilient.client.executor;

import fr.lapetina.resilient.client.domain.event.ExecutionEvent;
import fr.lapetina.resilient.client.domain.model.AttemptRecord;
import fr.lapetina.resilient.client.domain.model.Classification;
import fr.lapetina.resilient.client.domain.model.EnvironmentProfile;
import fr.lapetina.resilient.client.domain.model.FallbackTable;
import fr.lapetina.resilient.client.domain.model.RequestOutcome;
import fr.lapetina.resilient.client.domain.model.RequestSpec;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;
import fr.lapetina.resilient.client.domain.policy.FallbackChainBuilder;
import fr.lapetina.resilient.client.domain.policy.RetryPolicy;
import fr.lapetina.resilient.client.exception.ConfigurationException;
import fr.lapetina.resilient.client.infrastructure.http.EndpointTransport;
import fr.lapetina.resilient.client.infrastructure.http.StubTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientRequestExecutorTest {

    private static final ServiceName API = ServiceName.API;

    private StubTransport transport;
    private List<ExecutionEvent> events;
    private ResilientRequestExecutor executor;

    @BeforeEach
    void setUp() {
        transport = new StubTransport();
        events = new CopyOnWriteArrayList<>();
        executor = executor(RetryPolicy.fixed(3, Duration.ofMillis(5)), Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private ResilientRequestExecutor executor(RetryPolicy policy, Duration callTimeout) {
        return executor(transport, policy, callTimeout);
    }

    private ResilientRequestExecutor executor(EndpointTransport endpointTransport, RetryPolicy policy, Duration callTimeout) {
        EnvironmentProfile profile = EnvironmentProfile.builder()
                .development(false)
                .baseUrl("https://admin.test")
                .service(API, "https://primary.test")
                .build();
        FallbackTable table = FallbackTable.builder()
                .service(API, "https://primary.test", "https://secondary.test")
                .build();
        return ResilientRequestExecutor.builder()
                .profile(profile)
                .chainBuilder(new FallbackChainBuilder(table))
                .transport(endpointTransport)
                .retryPolicy(policy)
                .eventSink(events::add)
                .source("test-suite")
                .callTimeout(callTimeout)
                .build();
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    @Nested
    @DisplayName("successful calls")
    class Success {

        @Test
        @DisplayName("should return the primary response after one attempt")
        void shouldSucceedOnPrimary() {
            transport.onHost("primary.test", 200, "{\"status\":\"healthy\"}");

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome).isInstanceOf(RequestOutcome.Ok.class);
            RequestOutcome.Ok ok = (RequestOutcome.Ok) outcome;
            assertThat(ok.response().body()).isEqualTo("{\"status\":\"healthy\"}");
            assertThat(ok.attempts()).hasSize(1);
            assertThat(transport.sent().get(0).uri()).isEqualTo(URI.create("https://primary.test/health"));
        }

        @Test
        @DisplayName("should recover on the same endpoint after a transient server error")
        void shouldRecoverOnSameEndpoint() {
            transport.enqueue("primary.test", 503, "busy");
            transport.onHost("primary.test", 200, "ok");

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome.isOk()).isTrue();
            assertThat(outcome.attempts())
                    .extracting(AttemptRecord::classification)
                    .containsExactly(Classification.SERVER_ERROR, Classification.SUCCESS);
            assertThat(outcome.attempts().get(1).delayBefore()).isEqualTo(Duration.ofMillis(5));
        }

        @Test
        @DisplayName("should treat redirects as success")
        void shouldTreatRedirectAsSuccess() {
            transport.onHost("primary.test", 304, "");

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome.isOk()).isTrue();
            assertThat(outcome.attemptCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("client errors")
    class ClientErrors {

        @Test
        @DisplayName("should fail after exactly one attempt on 401")
        void shouldStopOnUnauthorized() {
            transport.always(401, "{\"error\":\"unauthorized\"}");

            RequestOutcome outcome = executor.execute(API, "/api/dashboard/overview", RequestSpec.get());

            assertThat(outcome).isInstanceOf(RequestOutcome.Failed.class);
            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            assertThat(failed.lastClassification()).isEqualTo(Classification.CLIENT_ERROR);
            assertThat(failed.response()).map(ServiceResponse::statusCode).contains(401);
            assertThat(failed.attempts()).hasSize(1);
            assertThat(transport.sentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not fail over on 404")
        void shouldNotFailOverOnNotFound() {
            transport.onHost("primary.test", 404, "missing");
            transport.onHost("secondary.test", 200, "found");

            RequestOutcome outcome = executor.execute(API, "/missing", RequestSpec.get());

            assertThat(outcome.isOk()).isFalse();
            assertThat(transport.sent()).extracting(s -> s.uri().getHost()).containsOnly("primary.test");
        }

        @Test
        @DisplayName("should fail without retry when the request cannot be sent")
        void shouldFailWhenTransportRejectsRequest() {
            transport.always((uri, tags) -> {
                throw new IllegalArgumentException("unsupported method");
            });

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome).isInstanceOf(RequestOutcome.Failed.class);
            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            assertThat(failed.lastClassification()).isEqualTo(Classification.CLIENT_ERROR);
            assertThat(failed.error()).containsInstanceOf(IllegalArgumentException.class);
            assertThat(failed.attempts()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("retry and failover")
    class RetryAndFailover {

        @Test
        @DisplayName("should make max attempts on every endpoint before failing on 503")
        void shouldExhaustWholeChain() {
            transport.always(503, "unavailable");

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome).isInstanceOf(RequestOutcome.Failed.class);
            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            assertThat(failed.lastClassification()).isEqualTo(Classification.SERVER_ERROR);
            assertThat(failed.attempts()).hasSize(6);
            assertThat(failed.attempts())
                    .extracting(AttemptRecord::chainIndex)
                    .containsExactly(0, 0, 0, 1, 1, 1);
            assertThat(failed.attempts())
                    .extracting(AttemptRecord::attemptOnEndpoint)
                    .containsExactly(1, 2, 3, 1, 2, 3);
            assertThat(failed.attempts())
                    .extracting(AttemptRecord::attemptInCall)
                    .containsExactly(1, 2, 3, 4, 5, 6);
        }

        @Test
        @DisplayName("should wait between retries but not before failing over")
        void shouldDelayOnlyBetweenRetries() {
            transport.always(500, "boom");

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome.attempts())
                    .extracting(AttemptRecord::delayBefore)
                    .containsExactly(
                            Duration.ZERO, Duration.ofMillis(5), Duration.ofMillis(5),
                            Duration.ZERO, Duration.ofMillis(5), Duration.ofMillis(5));
        }

        @Test
        @DisplayName("should return the second endpoint payload after transport failures on the first")
        void shouldFailOverOnTransportError() {
            transport.onHostFail("primary.test", new ConnectException("Connection refused"));
            transport.onHost("secondary.test", 200, "payload-2");

            RequestOutcome outcome = executor.execute(API, "/api/dashboard/overview", RequestSpec.get());

            assertThat(outcome).isInstanceOf(RequestOutcome.Ok.class);
            RequestOutcome.Ok ok = (RequestOutcome.Ok) outcome;
            assertThat(ok.response().body()).isEqualTo("payload-2");
            assertThat(ok.response().uri().getHost()).isEqualTo("secondary.test");
            assertThat(ok.attempts()).hasSize(4);
            assertThat(ok.attempts().subList(0, 3))
                    .allSatisfy(record -> {
                        assertThat(record.classification()).isEqualTo(Classification.TRANSPORT_ERROR);
                        assertThat(record.hasResponse()).isFalse();
                        assertThat(record.errorMessage()).startsWith("connection_refused");
                    });
        }

        @Test
        @DisplayName("should attach the last transport error when every endpoint is unreachable")
        void shouldReportLastTransportError() {
            transport.always(StubTransport.failure(new ConnectException("Connection refused")));

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            assertThat(failed.lastClassification()).isEqualTo(Classification.TRANSPORT_ERROR);
            assertThat(failed.response()).isEmpty();
            assertThat(failed.error()).containsInstanceOf(ConnectException.class);
        }
    }

    @Nested
    @DisplayName("correlation tags")
    class Tags {

        @Test
        @DisplayName("should tag attempts with chain position and attempt number")
        void shouldTagEveryAttempt() {
            transport.onHost("primary.test", 503, "down");
            transport.onHost("secondary.test", 200, "up");

            executor.execute(API, "/health", RequestSpec.get());

            List<StubTransport.SentAttempt> sent = transport.sent();
            assertThat(sent).extracting(s -> s.tags().chainPosition()).containsExactly(1, 1, 1, 2);
            assertThat(sent).extracting(s -> s.tags().attemptNumber()).containsExactly(1, 2, 3, 1);
            assertThat(sent).extracting(s -> s.tags().source()).containsOnly("test-suite");
            assertThat(sent).extracting(s -> s.tags().callId()).containsOnly(sent.get(0).tags().callId());
        }

        @Test
        @DisplayName("should reuse a caller supplied request id as call id")
        void shouldReuseCallerRequestId() {
            RequestSpec spec = RequestSpec.builder().header("x-request-id", "req-42").build();

            PendingCall call = executor.executeAsync(API, "/health", spec);

            assertThat(call.callId()).isEqualTo("req-42");
            assertThat(transport.sent().get(0).tags().callId()).isEqualTo("req-42");
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("should stop issuing attempts when cancelled during a retry delay")
        void shouldCancelDuringDelay() throws Exception {
            executor.close();
            executor = executor(RetryPolicy.fixed(3, Duration.ofSeconds(10)), Duration.ZERO);
            transport.always(503, "busy");

            PendingCall call = executor.executeAsync(API, "/health", RequestSpec.get());
            awaitCondition(() -> transport.sentCount() == 1);

            assertThat(call.cancel()).isTrue();

            RequestOutcome outcome = call.outcome().get(1, TimeUnit.SECONDS);
            assertThat(outcome).isInstanceOf(RequestOutcome.Cancelled.class);
            assertThat(((RequestOutcome.Cancelled) outcome).reason())
                    .isEqualTo(RequestOutcome.CancellationReason.CALLER);
            assertThat(outcome.attempts()).hasSize(1);

            Thread.sleep(50);
            assertThat(transport.sentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should cancel the in-flight attempt")
        void shouldCancelInFlightAttempt() throws Exception {
            transport.onHostHang("primary.test");

            PendingCall call = executor.executeAsync(API, "/health", RequestSpec.get());
            assertThat(call.outcome()).isNotDone();

            call.cancel();

            RequestOutcome outcome = call.outcome().get(1, TimeUnit.SECONDS);
            assertThat(outcome).isInstanceOf(RequestOutcome.Cancelled.class);
            assertThat(outcome.attempts()).isEmpty();
            assertThat(transport.hanging()).allMatch(CompletableFuture::isCancelled);
        }

        @Test
        @DisplayName("should not cancel a call that already resolved")
        void shouldIgnoreCancelAfterResolution() throws Exception {
            PendingCall call = executor.executeAsync(API, "/health", RequestSpec.get());
            RequestOutcome outcome = call.outcome().get(1, TimeUnit.SECONDS);

            assertThat(call.cancel()).isFalse();
            assertThat(call.outcome().get()).isSameAs(outcome);
        }

        @Test
        @DisplayName("should resolve as cancelled when the call deadline elapses")
        void shouldCancelOnDeadline() throws Exception {
            executor.close();
            executor = executor(RetryPolicy.fixed(3, Duration.ofMillis(5)), Duration.ofMillis(50));
            transport.onHostHang("primary.test");

            RequestOutcome outcome = executor.executeAsync(API, "/health", RequestSpec.get())
                    .outcome()
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome).isInstanceOf(RequestOutcome.Cancelled.class);
            assertThat(((RequestOutcome.Cancelled) outcome).reason())
                    .isEqualTo(RequestOutcome.CancellationReason.DEADLINE);
        }

        @Test
        @DisplayName("should resolve as cancelled when the waiting thread is interrupted")
        void shouldCancelOnInterrupt() throws Exception {
            transport.onHostHang("primary.test");
            AtomicReference<RequestOutcome> result = new AtomicReference<>();

            Thread caller = new Thread(() -> result.set(executor.execute(API, "/health", RequestSpec.get())));
            caller.start();
            awaitCondition(() -> transport.sentCount() == 1);

            caller.interrupt();
            caller.join(5000);

            assertThat(result.get()).isInstanceOf(RequestOutcome.Cancelled.class);
            assertThat(((RequestOutcome.Cancelled) result.get()).reason())
                    .isEqualTo(RequestOutcome.CancellationReason.INTERRUPTED);
        }
    }

    @Nested
    @DisplayName("configuration errors")
    class ConfigurationErrors {

        @Test
        @DisplayName("should throw immediately for a service without endpoints")
        void shouldRejectUnknownService() {
            assertThatThrownBy(() -> executor.execute(ServiceName.of("unknown"), "/x", RequestSpec.get()))
                    .isInstanceOf(ConfigurationException.class)
                    .extracting(e -> ((ConfigurationException) e).getReason())
                    .isEqualTo(ConfigurationException.Reason.UNKNOWN_SERVICE);

            assertThat(transport.sentCount()).isZero();
        }

        @Test
        @DisplayName("should reject a malformed path before any attempt")
        void shouldRejectMalformedPath() {
            assertThatThrownBy(() -> executor.executeAsync(API, "/has space", RequestSpec.get()))
                    .isInstanceOf(IllegalArgumentException.class);

            assertThat(transport.sentCount()).isZero();
        }
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        @DisplayName("should emit one event per attempt and one on resolution")
        void shouldEmitEvents() {
            transport.always(503, "busy");

            executor.execute(API, "/health", RequestSpec.get());

            assertThat(events).hasSize(7);
            assertThat(events.subList(0, 6)).allMatch(e -> e instanceof ExecutionEvent.AttemptEvent);
            ExecutionEvent.CallResolvedEvent resolved = (ExecutionEvent.CallResolvedEvent) events.get(6);
            assertThat(resolved.status()).isEqualTo(ExecutionEvent.CallStatus.FAILED);
            assertThat(resolved.totalAttempts()).isEqualTo(6);
            assertThat(resolved.service()).isEqualTo(API);
        }

        @Test
        @DisplayName("should complete the call when the sink throws")
        void shouldSurviveFailingSink() {
            executor.close();
            executor = ResilientRequestExecutor.builder()
                    .profile(EnvironmentProfile.builder()
                            .baseUrl("https://admin.test")
                            .service(API, "https://primary.test")
                            .build())
                    .chainBuilder(new FallbackChainBuilder(FallbackTable.empty()))
                    .transport(transport)
                    .eventSink(event -> {
                        throw new IllegalStateException("sink down");
                    })
                    .build();

            RequestOutcome outcome = executor.execute(API, "/health", RequestSpec.get());

            assertThat(outcome.isOk()).isTrue();
        }
    }

    @Nested
    @DisplayName("misbehaving transports")
    class MisbehavingTransports {

        @Test
        @DisplayName("should treat a future completed without a response as a transport failure")
        void shouldFailWhenTransportCompletesWithoutResponse() throws Exception {
            executor.close();
            executor = executor(
                    (uri, spec, tags) -> CompletableFuture.completedFuture(null),
                    RetryPolicy.fixed(3, Duration.ofMillis(1)),
                    Duration.ZERO);

            RequestOutcome outcome = executor.executeAsync(API, "/x", RequestSpec.get())
                    .outcome()
                    .get(5, TimeUnit.SECONDS);

            assertThat(outcome).isInstanceOf(RequestOutcome.Failed.class);
            RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
            assertThat(failed.lastClassification()).isEqualTo(Classification.TRANSPORT_ERROR);
            assertThat(failed.lastError()).isInstanceOf(IllegalStateException.class);
            assertThat(failed.attempts()).hasSize(6);
            assertThat(failed.attempts()).extracting(AttemptRecord::statusCode).containsOnly(AttemptRecord.NO_STATUS);
        }

        @Test
        @DisplayName("should resolve the call when the transport returns no future")
        void shouldFailWhenTransportReturnsNullFuture() throws Exception {
            executor.close();
            executor = executor((uri, spec, tags) -> null, RetryPolicy.fixed(3, Duration.ofMillis(1)), Duration.ZERO);

            PendingCall call = executor.executeAsync(API, "/x", RequestSpec.get());
            RequestOutcome outcome = call.outcome().get(5, TimeUnit.SECONDS);

            assertThat(outcome).isInstanceOf(RequestOutcome.Failed.class);
            assertThat(((RequestOutcome.Failed) outcome).lastError()).isInstanceOf(NullPointerException.class);
            assertThat(call.cancel()).isFalse();
            assertThat(events).last().isInstanceOf(ExecutionEvent.CallResolvedEvent.class);
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("should keep concurrent calls on one chain independent")
        void shouldIsolateConcurrentCalls() throws Exception {
            executor.close();
            executor = executor(RetryPolicy.fixed(2, Duration.ofMillis(1)), Duration.ZERO);
            transport.onHost("primary.test", 503, "busy");
            transport.onHost("secondary.test", (uri, tags) ->
                    CompletableFuture.completedFuture(ServiceResponse.of(uri, 200, tags.callId())));

            List<PendingCall> calls = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                calls.add(executor.executeAsync(API, "/health", RequestSpec.get()));
            }

            for (PendingCall call : calls) {
                RequestOutcome outcome = call.outcome().get(5, TimeUnit.SECONDS);
                assertThat(outcome).isInstanceOf(RequestOutcome.Ok.class);
                assertThat(((RequestOutcome.Ok) outcome).response().body()).isEqualTo(call.callId());
                assertThat(outcome.attempts())
                        .extracting(AttemptRecord::attemptInCall)
                        .containsExactly(1, 2, 3);
            }
            assertThat(transport.sentCount()).isEqualTo(60);
        }
    }

    @Test
    @DisplayName("should build display URLs from the primary endpoint")
    void shouldBuildPrimaryUrl() {
        assertThat(executor.buildUrl(API, "api/services/status"))
                .isEqualTo(URI.create("https://primary.test/api/services/status"));
    }
}
