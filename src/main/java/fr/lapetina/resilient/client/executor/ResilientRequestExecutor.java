package fr.lapetina.resilient.client.executor;

import fr.lapetina.resilient.client.domain.event.ExecutionEvent;
import fr.lapetina.resilient.client.domain.event.ExecutionEventSink;
import fr.lapetina.resilient.client.domain.model.AttemptRecord;
import fr.lapetina.resilient.client.domain.model.AttemptResult;
import fr.lapetina.resilient.client.domain.model.AttemptTags;
import fr.lapetina.resilient.client.domain.model.Classification;
import fr.lapetina.resilient.client.domain.model.EnvironmentProfile;
import fr.lapetina.resilient.client.domain.model.FallbackChain;
import fr.lapetina.resilient.client.domain.model.RequestOutcome;
import fr.lapetina.resilient.client.domain.model.RequestSpec;
import fr.lapetina.resilient.client.domain.model.ServiceName;
import fr.lapetina.resilient.client.domain.model.ServiceResponse;
import fr.lapetina.resilient.client.domain.policy.ErrorClassifier;
import fr.lapetina.resilient.client.domain.policy.FallbackChainBuilder;
import fr.lapetina.resilient.client.domain.policy.RetryDecision;
import fr.lapetina.resilient.client.domain.policy.RetryPolicy;
import fr.lapetina.resilient.client.infrastructure.http.EndpointTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Walks the fallback chain of a logical service until one endpoint succeeds,
 * the retry policy gives up, or the call is cancelled.
 *
 * Attempts within a call are strictly sequential. Retry delays are scheduled
 * on a {@link ScheduledExecutorService}, so no thread is held while waiting.
 * Concurrent calls share only immutable state (profile, chains, policy).
 *
 * <p>Usage:
 * <pre>{@code
 * RequestOutcome outcome = executor.execute(ServiceName.API, "/api/dashboard/overview", RequestSpec.get());
 * if (outcome.isOk()) {
 *     render(((RequestOutcome.Ok) outcome).response().body());
 * }
 * }</pre>
 */
public final class ResilientRequestExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientRequestExecutor.class);

    public static final String DEFAULT_SOURCE = "admin-dashboard";

    private final EnvironmentProfile profile;
    private final FallbackChainBuilder chainBuilder;
    private final EndpointTransport transport;
    private final ErrorClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final ExecutionEventSink eventSink;
    private final String source;
    private final Duration callTimeout;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Map<ServiceName, FallbackChain> chains = new ConcurrentHashMap<>();

    private ResilientRequestExecutor(Builder builder) {
        this.profile = Objects.requireNonNull(builder.profile, "profile must be set");
        this.chainBuilder = Objects.requireNonNull(builder.chainBuilder, "chainBuilder must be set");
        this.transport = Objects.requireNonNull(builder.transport, "transport must be set");
        this.classifier = builder.classifier;
        this.retryPolicy = builder.retryPolicy;
        this.eventSink = builder.eventSink;
        this.source = builder.source;
        this.callTimeout = builder.callTimeout;
        if (builder.scheduler != null) {
            this.scheduler = builder.scheduler;
            this.ownsScheduler = false;
        } else {
            this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "resilient-client-scheduler");
                t.setDaemon(true);
                return t;
            });
            this.ownsScheduler = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes a call and waits for its terminal outcome.
     * If the waiting thread is interrupted the call is cancelled.
     *
     * @throws fr.lapetina.resilient.client.exception.ConfigurationException if the service has no endpoint
     */
    public RequestOutcome execute(ServiceName service, String path, RequestSpec spec) {
        ChainWalk call = startWalk(service, path, spec);
        try {
            return call.outcome().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(RequestOutcome.CancellationReason.INTERRUPTED);
            return call.outcome().join();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Call completed exceptionally: callId=" + call.callId(), e.getCause());
        }
    }

    /**
     * Starts a call without waiting for it.
     *
     * @throws fr.lapetina.resilient.client.exception.ConfigurationException if the service has no endpoint
     */
    public PendingCall executeAsync(ServiceName service, String path, RequestSpec spec) {
        return startWalk(service, path, spec);
    }

    /**
     * Primary URL for a path, for display only. Execution always walks the full chain.
     */
    public URI buildUrl(ServiceName service, String path) {
        return FallbackChain.join(chainFor(service).primary(), path);
    }

    /**
     * Returns the (cached) fallback chain of a service.
     */
    public FallbackChain chainFor(ServiceName service) {
        FallbackChain cached = chains.get(service);
        if (cached != null) {
            return cached;
        }
        return chains.computeIfAbsent(service, s -> chainBuilder.build(profile, s));
    }

    public EnvironmentProfile getProfile() {
        return profile;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private ChainWalk startWalk(ServiceName service, String path, RequestSpec spec) {
        Objects.requireNonNull(service, "service must not be null");
        RequestSpec effectiveSpec = spec != null ? spec : RequestSpec.get();
        FallbackChain chain = chainFor(service);
        // rejects a malformed path before any attempt
        chain.resolve(0, path);
        String callId = effectiveSpec.headers().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(AttemptTags.REQUEST_ID_HEADER))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> UUID.randomUUID().toString());

        ChainWalk walk = new ChainWalk(callId, chain, path, effectiveSpec);
        walk.start();
        return walk;
    }

    private void emit(ExecutionEvent event) {
        try {
            eventSink.record(event);
        } catch (Exception e) {
            log.error("Event sink failed: callId={}, event={}", event.callId(), event.getClass().getSimpleName(), e);
        }
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * One logical call: owns its attempt records and its position in the chain.
     */
    private final class ChainWalk implements PendingCall {

        private final String callId;
        private final FallbackChain chain;
        private final String path;
        private final RequestSpec spec;
        private final long startNanos = System.nanoTime();

        private final List<AttemptRecord> attempts = new CopyOnWriteArrayList<>();
        private final CompletableFuture<RequestOutcome> result = new CompletableFuture<>();

        private volatile WalkState state = WalkState.initial();
        private volatile CompletableFuture<ServiceResponse> inFlight;
        private volatile ScheduledFuture<?> pendingDelay;
        private volatile ScheduledFuture<?> deadline;

        ChainWalk(String callId, FallbackChain chain, String path, RequestSpec spec) {
            this.callId = callId;
            this.chain = chain;
            this.path = path;
            this.spec = spec;
        }

        @Override
        public String callId() {
            return callId;
        }

        @Override
        public ServiceName service() {
            return chain.getService();
        }

        @Override
        public CompletableFuture<RequestOutcome> outcome() {
            return result;
        }

        @Override
        public boolean cancel() {
            return cancel(RequestOutcome.CancellationReason.CALLER);
        }

        void start() {
            withMdc(() -> log.info("Starting call: callId={}, service={}, path={}, method={}, endpoints={}",
                    callId, chain.getService(), path, spec.method(), chain.size()));

            if (callTimeout != null && !callTimeout.isZero() && !callTimeout.isNegative()) {
                try {
                    deadline = scheduler.schedule(
                            () -> cancel(RequestOutcome.CancellationReason.DEADLINE),
                            callTimeout.toMillis(),
                            TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    throw new IllegalStateException("Executor is closed", e);
                }
            }
            guarded(() -> issueAttempt(Duration.ZERO));
        }

        boolean cancel(RequestOutcome.CancellationReason reason) {
            boolean cancelled = resolve(new RequestOutcome.Cancelled(reason, attempts));
            if (cancelled) {
                state = new WalkState.Stopped();
                ScheduledFuture<?> delay = pendingDelay;
                if (delay != null) {
                    delay.cancel(false);
                }
                CompletableFuture<ServiceResponse> current = inFlight;
                if (current != null) {
                    current.cancel(true);
                }
                withMdc(() -> log.warn("Call cancelled: callId={}, service={}, reason={}, attempts={}",
                        callId, chain.getService(), reason, attempts.size()));
            }
            return cancelled;
        }

        private void issueAttempt(Duration delayBefore) {
            WalkState current = state;
            if (result.isDone() || !(current instanceof WalkState.Walking)) {
                return;
            }
            WalkState.Walking walking = (WalkState.Walking) current;

            int chainIndex = walking.chainIndex();
            URI endpoint = chain.endpoint(chainIndex);
            AttemptTags tags = new AttemptTags(source, callId, chainIndex + 1, walking.attemptIndex() + 1);
            long attemptStart = System.nanoTime();

            CompletableFuture<ServiceResponse> future;
            try {
                future = transport.send(chain.resolve(chainIndex, path), spec, tags);
            } catch (RuntimeException e) {
                // the request itself cannot be built; no endpoint would accept it
                withMdc(() -> log.error("Request could not be built: callId={}, endpoint={}, path={}", callId, endpoint, path, e));
                onAttemptComplete(walking, endpoint, delayBefore, attemptStart, null, e, Classification.CLIENT_ERROR);
                return;
            }

            inFlight = future;
            if (result.isDone()) {
                future.cancel(true);
                return;
            }
            future.whenComplete((response, error) -> guarded(() -> {
                Throwable failure = error;
                if (response == null && failure == null) {
                    failure = new IllegalStateException("Transport completed without a response");
                }
                onAttemptComplete(walking, endpoint, delayBefore, attemptStart, response, failure, null);
            }));
        }

        /**
         * Runs one step of the walk. A step that throws resolves the call as failed
         * so that {@link #outcome()} always completes.
         */
        private void guarded(Runnable step) {
            try {
                step.run();
            } catch (RuntimeException e) {
                withMdc(() -> log.error("Call aborted by unexpected error: callId={}, service={}", callId, chain.getService(), e));
                state = new WalkState.Stopped();
                resolve(new RequestOutcome.Failed(Classification.TRANSPORT_ERROR, null, e, attempts));
            }
        }

        private void onAttemptComplete(
                WalkState.Walking walking,
                URI endpoint,
                Duration delayBefore,
                long attemptStart,
                ServiceResponse response,
                Throwable error,
                Classification forced
        ) {
            if (result.isDone()) {
                return;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - attemptStart);
            Throwable cause = error != null ? ErrorClassifier.unwrap(error) : null;
            AttemptResult attemptResult = cause == null
                    ? AttemptResult.responded(response)
                    : AttemptResult.noResponse(cause);
            Classification classification = forced != null ? forced : classifier.classify(attemptResult);

            AttemptRecord record = new AttemptRecord(
                    endpoint,
                    walking.chainIndex(),
                    walking.attemptIndex() + 1,
                    attempts.size() + 1,
                    classification,
                    delayBefore,
                    elapsed,
                    response != null ? response.statusCode() : AttemptRecord.NO_STATUS,
                    cause != null ? describe(cause) : null
            );
            attempts.add(record);
            emit(new ExecutionEvent.AttemptEvent(callId, chain.getService(), record));

            if (classification == Classification.SUCCESS) {
                state = new WalkState.Succeeded();
                resolve(new RequestOutcome.Ok(response, attempts));
                return;
            }

            RetryDecision decision = retryPolicy.next(walking.attemptIndex() + 1, classification);
            WalkState next = WalkState.transition(walking, decision, chain.size());
            state = next;

            if (!(next instanceof WalkState.Walking)) {
                resolve(new RequestOutcome.Failed(classification, response, cause, attempts));
                return;
            }

            if (decision instanceof RetryDecision.RetrySameEndpoint) {
                scheduleAttempt(((RetryDecision.RetrySameEndpoint) decision).delay());
            } else {
                withMdc(() -> log.warn("Endpoint exhausted, failing over: callId={}, service={}, from={}, to={}",
                        callId, chain.getService(), endpoint, chain.endpoint(((WalkState.Walking) next).chainIndex())));
                issueAttempt(Duration.ZERO);
            }
        }

        private void scheduleAttempt(Duration delay) {
            if (delay.isZero()) {
                issueAttempt(delay);
                return;
            }
            try {
                pendingDelay = scheduler.schedule(() -> guarded(() -> issueAttempt(delay)), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                withMdc(() -> log.error("Retry could not be scheduled, executor is closed: callId={}", callId, e));
                cancel(RequestOutcome.CancellationReason.CALLER);
                return;
            }
            if (result.isDone()) {
                pendingDelay.cancel(false);
            }
        }

        private boolean resolve(RequestOutcome outcome) {
            if (!result.complete(outcome)) {
                return false;
            }
            ScheduledFuture<?> timer = deadline;
            if (timer != null) {
                timer.cancel(false);
            }

            Duration total = Duration.ofNanos(System.nanoTime() - startNanos);
            ExecutionEvent.CallStatus status = statusOf(outcome);
            emit(new ExecutionEvent.CallResolvedEvent(callId, chain.getService(), status, outcome.attemptCount(), total));

            if (outcome instanceof RequestOutcome.Failed) {
                RequestOutcome.Failed failed = (RequestOutcome.Failed) outcome;
                withMdc(() -> log.error("Call failed: callId={}, service={}, attempts={}, lastCause={}",
                        callId, chain.getService(), failed.attemptCount(), failed.describe()));
            }
            return true;
        }

        private void withMdc(Runnable logging) {
            MDC.put("callId", callId);
            MDC.put("service", chain.getService().value());
            try {
                logging.run();
            } finally {
                MDC.remove("callId");
                MDC.remove("service");
            }
        }
    }

    private static ExecutionEvent.CallStatus statusOf(RequestOutcome outcome) {
        if (outcome instanceof RequestOutcome.Ok) {
            return ExecutionEvent.CallStatus.OK;
        }
        if (outcome instanceof RequestOutcome.Failed) {
            return ExecutionEvent.CallStatus.FAILED;
        }
        return ExecutionEvent.CallStatus.CANCELLED;
    }

    private static String describe(Throwable cause) {
        String detail = ErrorClassifier.transportDetail(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return detail + ": " + message;
    }

    public static final class Builder {
        private EnvironmentProfile profile;
        private FallbackChainBuilder chainBuilder;
        private EndpointTransport transport;
        private ErrorClassifier classifier = new ErrorClassifier();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private ExecutionEventSink eventSink = ExecutionEventSink.noOp();
        private String source = DEFAULT_SOURCE;
        private Duration callTimeout = Duration.ZERO;
        private ScheduledExecutorService scheduler;

        private Builder() {}

        public Builder profile(EnvironmentProfile profile) {
            this.profile = profile;
            return this;
        }

        public Builder chainBuilder(FallbackChainBuilder chainBuilder) {
            this.chainBuilder = chainBuilder;
            return this;
        }

        public Builder transport(EndpointTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
            return this;
        }

        public Builder eventSink(ExecutionEventSink eventSink) {
            this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
            return this;
        }

        public Builder source(String source) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            return this;
        }

        /**
         * Overall deadline for one call, retries and failover included. Zero disables it.
         */
        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
            return this;
        }

        /**
         * Scheduler for retry delays and deadlines. When not set, the executor
         * creates and owns a single daemon thread.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public ResilientRequestExecutor build() {
            return new ResilientRequestExecutor(this);
        }
    }
}
