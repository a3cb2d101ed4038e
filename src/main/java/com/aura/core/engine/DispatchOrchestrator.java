package com.aura.core.engine;

import com.aura.core.events.AuraEvent;
import com.aura.core.events.EventBus;
import com.aura.core.generator.CodeGenerator;
import com.aura.core.generator.GenerationException;
import com.aura.core.logging.MdcContext;
import com.aura.core.metrics.AuraMetrics;
import com.aura.core.model.AuraObject;
import com.aura.core.model.DispatchOutcome;
import com.aura.core.model.DispatchRequest;
import com.aura.core.model.DispatchState;
import com.aura.core.model.FailureKind;
import com.aura.core.model.ResolvedMethod;
import com.aura.core.model.TransportException;
import com.aura.core.resolver.MethodResolver;
import com.aura.core.security.AuditVerdict;
import com.aura.core.security.SecurityAuditor;
import com.aura.core.store.ObjectPatch;
import com.aura.core.store.ObjectStore;
import com.aura.core.store.PersistenceException;
import com.aura.sandbox.SandboxExecutor;
import com.aura.sandbox.SandboxRequest;
import com.aura.sandbox.SandboxResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Drives one message from receipt to a typed {@link DispatchOutcome}.
 * <p>
 * States: RESOLVING leads to EXECUTING on a hit or MISSED on a miss. EXECUTING
 * ends in DONE, PERSISTING (when the body changed state) or FAILED. A miss runs
 * GENERATING, AUDITING and then INSTALLING (or REJECTED), after which the
 * request re-enters RESOLVING once. Every external call is asynchronous and
 * bounded by its own timeout; nothing is retried except the single
 * re-resolution after an install.
 * <p>
 * Dispatches are not serialized per object. Two concurrent mutating dispatches
 * on the same object may both read the same snapshot, in which case the later
 * write wins.
 * <p>
 * Cancelling the future returned by {@link #dispatch} abandons the request at
 * the next state transition; a sandbox or generator call already in flight
 * runs to completion.
 */
public class DispatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DispatchOrchestrator.class);

    static final String STORE_COMPONENT = "object-store";
    static final String SANDBOX_COMPONENT = "sandbox";
    static final String GENERATOR_COMPONENT = "generator";

    private static final ObjectMapper MANDATE_MAPPER = new ObjectMapper();

    private final ObjectStore store;
    private final MethodResolver resolver;
    private final SandboxExecutor sandbox;
    private final SecurityAuditor auditor;
    private final CodeGenerator generator;
    private final EventBus eventBus;
    private final AuraMetrics metrics;
    private final long storeTimeoutMs;
    private final long sandboxTimeoutMs;
    private final long generatorTimeoutMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dispatchCounter = new AtomicLong();

    public DispatchOrchestrator(ObjectStore store,
                                MethodResolver resolver,
                                SandboxExecutor sandbox,
                                SecurityAuditor auditor,
                                CodeGenerator generator,
                                EventBus eventBus,
                                AuraMetrics metrics,
                                long storeTimeoutMs,
                                long sandboxTimeoutMs,
                                long generatorTimeoutMs) {
        this.store = store;
        this.resolver = resolver;
        this.sandbox = sandbox;
        this.auditor = auditor;
        this.generator = generator;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.storeTimeoutMs = storeTimeoutMs;
        this.sandboxTimeoutMs = sandboxTimeoutMs;
        this.generatorTimeoutMs = generatorTimeoutMs;
    }

    // -- Lifecycle --

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Dispatch orchestrator started (store={}, sandbox={}, generator={})",
                    store.backendName(), sandbox.describe(), generator.describe());
        }
    }

    public void shutdown() {
        if (running.compareAndSet(true, false)) {
            log.info("Dispatch orchestrator shut down after {} dispatches", dispatchCounter.get());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // -- Entry point --

    /**
     * Dispatches a message. The returned future always completes normally with an
     * outcome, unless the caller cancels it.
     *
     * @throws IllegalStateException when the orchestrator is not started
     */
    public CompletableFuture<DispatchOutcome> dispatch(DispatchRequest request) {
        Objects.requireNonNull(request, "request");
        if (!running.get()) {
            throw new IllegalStateException("DispatchOrchestrator is not running");
        }
        var ctx = new DispatchContext(nextDispatchId(), request);
        withMdc(ctx, () -> log.info("Dispatching '{}' to '{}' with {} positional and {} named args",
                request.methodName(), request.targetId(), request.args().size(), request.kwargs().size()));

        resolving(ctx)
                .handle((outcome, error) -> error == null ? outcome : toFailure(ctx, error))
                .thenAccept(outcome -> complete(ctx, outcome));
        return ctx.result();
    }

    // -- States --

    private CompletableFuture<DispatchOutcome> resolving(DispatchContext ctx) {
        return enter(ctx, DispatchState.RESOLVING, () ->
                bounded(store.get(ctx.targetId()), storeTimeoutMs, STORE_COMPONENT)
                        .thenCompose(target -> {
                            if (target.isEmpty()) {
                                return finish(ctx, DispatchState.FAILED, DispatchOutcome.failure(
                                        FailureKind.TARGET_NOT_FOUND,
                                        "object '" + ctx.targetId() + "' does not exist"));
                            }
                            return bounded(resolver.resolve(ctx.targetId(), ctx.methodName()),
                                    storeTimeoutMs, STORE_COMPONENT)
                                    .thenCompose(resolved -> resolved.isPresent()
                                            ? executing(ctx, resolved.get())
                                            : missed(ctx));
                        }));
    }

    private CompletableFuture<DispatchOutcome> executing(DispatchContext ctx, ResolvedMethod resolved) {
        return enter(ctx, DispatchState.EXECUTING, () -> {
            log.debug("Executing '{}' declared on '{}' (depth {})",
                    resolved.methodName(), resolved.declaringObjectId(), resolved.depth());
            metrics.recordResolutionDepth(resolved.depth());
            return bounded(store.get(resolved.declaringObjectId()), storeTimeoutMs, STORE_COMPONENT)
                    .thenCompose(declaring -> {
                        if (declaring.isEmpty()) {
                            return finish(ctx, DispatchState.FAILED, DispatchOutcome.failure(
                                    FailureKind.PERSISTENCE_FAILURE,
                                    "declaring object '" + resolved.declaringObjectId() + "' disappeared"));
                        }
                        var request = new SandboxRequest(resolved.body(), resolved.methodName(),
                                declaring.get().attributes(), ctx.request().args(), ctx.request().kwargs());
                        long start = System.nanoTime();
                        return bounded(sandbox.execute(request), sandboxTimeoutMs, SANDBOX_COMPONENT)
                                .thenCompose(response -> executed(ctx, resolved, response, elapsedMs(start)));
                    });
        });
    }

    private CompletableFuture<DispatchOutcome> executed(DispatchContext ctx, ResolvedMethod resolved,
                                                        SandboxResponse response, long ms) {
        if (response.hasError()) {
            withMdc(ctx, () -> log.warn("Method '{}' on '{}' raised: {}",
                    resolved.methodName(), resolved.declaringObjectId(), response.error()));
            return finish(ctx, DispatchState.FAILED,
                    DispatchOutcome.failure(FailureKind.EXECUTION_FAULT, response.error()));
        }
        metrics.recordExecution(response.stateChanged(), ms);
        if (!response.stateChanged()) {
            return finish(ctx, DispatchState.DONE,
                    DispatchOutcome.success(response.output(), false, resolved.declaringObjectId()));
        }
        if (response.finalState() == null) {
            return CompletableFuture.failedFuture(new TransportException(SANDBOX_COMPONENT,
                    "sandbox reported a state change without the final state"));
        }
        return persisting(ctx, resolved, response);
    }

    private CompletableFuture<DispatchOutcome> persisting(DispatchContext ctx, ResolvedMethod resolved,
                                                          SandboxResponse response) {
        String declaringId = resolved.declaringObjectId();
        return enter(ctx, DispatchState.PERSISTING, () ->
                bounded(store.update(declaringId, ObjectPatch.attributes(response.finalState()), false),
                        storeTimeoutMs, STORE_COMPONENT)
                        .thenCompose(ignored -> {
                            log.debug("Persisted new state of '{}'", declaringId);
                            publishStateChanged(declaringId);
                            return finish(ctx, DispatchState.DONE,
                                    DispatchOutcome.success(response.output(), true, declaringId));
                        }));
    }

    private CompletableFuture<DispatchOutcome> missed(DispatchContext ctx) {
        return enter(ctx, DispatchState.MISSED, () -> {
            if (ctx.hasInstalled()) {
                log.error("Method '{}' was installed on '{}' but resolution still misses",
                        ctx.methodName(), ctx.targetId());
                return finish(ctx, DispatchState.FAILED, DispatchOutcome.failure(
                        FailureKind.PERSISTENCE_FAILURE, "installed method not visible to resolution"));
            }
            log.info("No implementation of '{}' reachable from '{}'; requesting one",
                    ctx.methodName(), ctx.targetId());
            return generating(ctx, mandate(ctx.request()));
        });
    }

    private CompletableFuture<DispatchOutcome> generating(DispatchContext ctx, String mandate) {
        return enter(ctx, DispatchState.GENERATING, () -> {
            long start = System.nanoTime();
            return bounded(generator.generate(mandate, ctx.methodName()), generatorTimeoutMs, GENERATOR_COMPONENT)
                    .whenComplete((code, error) ->
                            metrics.recordGeneration(error == null && code != null && !code.isBlank(), elapsedMs(start)))
                    .thenCompose(code -> {
                        if (code == null || code.isBlank()) {
                            return finish(ctx, DispatchState.FAILED, DispatchOutcome.failure(
                                    FailureKind.GENERATION_FAILURE, "code generation failed: no code returned"));
                        }
                        return auditing(ctx, code);
                    });
        });
    }

    private CompletableFuture<DispatchOutcome> auditing(DispatchContext ctx, String code) {
        return enter(ctx, DispatchState.AUDITING, () -> {
            AuditVerdict verdict = auditor.audit(code, ctx.methodName());
            metrics.recordAudit(verdict.passed());
            if (!verdict.passed()) {
                log.warn("Generated '{}' rejected by audit: {}", ctx.methodName(), verdict.reason());
                return finish(ctx, DispatchState.REJECTED, DispatchOutcome.failure(
                        FailureKind.AUDIT_REJECTION, "audit rejected: " + verdict.reason()));
            }
            return installing(ctx, code);
        });
    }

    private CompletableFuture<DispatchOutcome> installing(DispatchContext ctx, String code) {
        return enter(ctx, DispatchState.INSTALLING, () ->
                bounded(store.update(ctx.targetId(), ObjectPatch.method(ctx.methodName(), code), true),
                        storeTimeoutMs, STORE_COMPONENT)
                        .thenCompose(ignored -> {
                            ctx.markInstalled();
                            metrics.incrementInstalls();
                            withMdc(ctx, () -> log.info("Installed '{}' on '{}'; re-dispatching",
                                    ctx.methodName(), ctx.targetId()));
                            publish(AuraEvent.of(AuraEvent.METHOD_INSTALLED, ctx.targetId(),
                                    Map.of("methodName", ctx.methodName(), "code", code)));
                            return resolving(ctx);
                        }));
    }

    // -- Transitions --

    /**
     * Moves {@code ctx} into {@code state} and runs the state's step with the
     * dispatch MDC set. A cancelled dispatch stops here.
     */
    private CompletableFuture<DispatchOutcome> enter(DispatchContext ctx, DispatchState state,
                                                     Supplier<CompletableFuture<DispatchOutcome>> step) {
        if (ctx.isCancelled()) {
            return CompletableFuture.failedFuture(
                    new CancellationException("dispatch cancelled before " + state));
        }
        ctx.moveTo(state);
        MdcContext.setDispatch(ctx.dispatchId(), ctx.targetId(), ctx.methodName());
        try {
            log.debug("-> {}", state);
            return step.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            MdcContext.clear();
        }
    }

    private CompletableFuture<DispatchOutcome> finish(DispatchContext ctx, DispatchState terminal,
                                                      DispatchOutcome outcome) {
        ctx.moveTo(terminal);
        return CompletableFuture.completedFuture(outcome);
    }

    private void complete(DispatchContext ctx, DispatchOutcome outcome) {
        metrics.recordDispatch(outcome.success() ? "success" : outcome.failureKind().name().toLowerCase(),
                ctx.elapsedMs());
        withMdc(ctx, () -> {
            if (outcome.success()) {
                log.info("Dispatch finished in {}ms (state_changed={}) via {}",
                        ctx.elapsedMs(), outcome.stateChanged(), ctx.path());
            } else {
                log.info("Dispatch failed in {}ms with {}: {} via {}",
                        ctx.elapsedMs(), outcome.failureKind(), outcome.detail(), ctx.path());
            }
        });
        ctx.result().complete(outcome);
    }

    /**
     * Maps an exception that ended the pipeline to a typed failure. Store errors
     * before anything was written are read failures and count as transport
     * failures; store errors while writing are persistence failures.
     */
    DispatchOutcome toFailure(DispatchContext ctx, Throwable error) {
        Throwable cause = unwrap(error);
        DispatchState failedIn = ctx.state();
        ctx.moveTo(DispatchState.FAILED);

        if (cause instanceof CancellationException) {
            return DispatchOutcome.failure(FailureKind.CANCELLED, "dispatch cancelled by caller");
        }
        if (cause instanceof TransportException te) {
            return DispatchOutcome.failure(FailureKind.TRANSPORT_FAILURE, te.getMessage(), te.getComponent());
        }
        if (cause instanceof GenerationException) {
            return DispatchOutcome.failure(FailureKind.GENERATION_FAILURE, cause.getMessage());
        }
        if (cause instanceof PersistenceException) {
            if (failedIn == DispatchState.PERSISTING || failedIn == DispatchState.INSTALLING) {
                return DispatchOutcome.failure(FailureKind.PERSISTENCE_FAILURE, cause.getMessage());
            }
            return DispatchOutcome.failure(FailureKind.TRANSPORT_FAILURE, cause.getMessage(), STORE_COMPONENT);
        }

        withMdc(ctx, () -> log.error("Unexpected error in state {}", failedIn, cause));
        String detail = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        if (failedIn == null) {
            return DispatchOutcome.failure(FailureKind.TRANSPORT_FAILURE, detail, STORE_COMPONENT);
        }
        return switch (failedIn) {
            case PERSISTING, INSTALLING -> DispatchOutcome.failure(FailureKind.PERSISTENCE_FAILURE, detail);
            case GENERATING, MISSED -> DispatchOutcome.failure(FailureKind.GENERATION_FAILURE, detail);
            case AUDITING -> DispatchOutcome.failure(FailureKind.AUDIT_REJECTION, detail);
            case EXECUTING -> DispatchOutcome.failure(FailureKind.TRANSPORT_FAILURE, detail, SANDBOX_COMPONENT);
            default -> DispatchOutcome.failure(FailureKind.TRANSPORT_FAILURE, detail, STORE_COMPONENT);
        };
    }

    // -- Helpers --

    /**
     * Bounds {@code future} by {@code timeoutMs}; a timeout becomes a
     * {@link TransportException} naming {@code component}.
     */
    private <T> CompletableFuture<T> bounded(CompletableFuture<T> future, long timeoutMs, String component) {
        return future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS).handle((value, error) -> {
            if (error == null) {
                return value;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof TimeoutException) {
                throw new TransportException(component, component + " did not answer within " + timeoutMs + "ms", cause);
            }
            throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
        });
    }

    private void publishStateChanged(String objectId) {
        if (eventBus.isClosed()) {
            return;
        }
        store.get(objectId)
                .thenAccept(document -> document.ifPresent(object ->
                        publish(AuraEvent.of(AuraEvent.STATE_CHANGED, object.id(), documentPayload(object)))))
                .exceptionally(e -> {
                    log.warn("Could not read '{}' for state-change event: {}", objectId, unwrap(e).getMessage());
                    return null;
                });
    }

    private void publish(AuraEvent event) {
        if (!eventBus.publish(event)) {
            log.debug("Event {} for '{}' was not accepted", event.eventType(), event.objectId());
        }
    }

    static Map<String, Object> documentPayload(AuraObject object) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("id", object.id());
        payload.put("attributes", object.attributes());
        payload.put("methods", object.methods().keySet());
        return payload;
    }

    static String mandate(DispatchRequest request) {
        return "Implement method '%s' with args %s and kwargs %s"
                .formatted(request.methodName(), toJson(request.args()), toJson(request.kwargs()));
    }

    private static String toJson(Object value) {
        try {
            return MANDATE_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private String nextDispatchId() {
        return "D-%06d".formatted(dispatchCounter.incrementAndGet());
    }

    private static void withMdc(DispatchContext ctx, Runnable action) {
        MdcContext.setDispatch(ctx.dispatchId(), ctx.targetId(), ctx.methodName());
        try {
            action.run();
        } finally {
            MdcContext.clear();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
