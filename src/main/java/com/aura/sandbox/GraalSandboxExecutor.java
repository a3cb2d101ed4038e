package com.aura.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes method bodies in a GraalVM JavaScript guest context.
 * <p>
 * Every call gets a fresh {@link Context} with host access, host class lookup,
 * IO, threads, processes, native access and environment access all denied, so
 * a body sees nothing but the attribute snapshot and arguments it is handed.
 * Values cross the boundary as JSON text. A watchdog cancels the context when
 * the run exceeds the timeout.
 */
public class GraalSandboxExecutor implements SandboxExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraalSandboxExecutor.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Comparator<JsonNode> NUMERIC_VALUE_ORDER = GraalSandboxExecutor::compareNumeric;

    /**
     * Builds the receiver, calls the method and serializes the outcome.
     * Evaluated after the body so top-level body code cannot replace it.
     */
    private static final String INVOKER = """
            (function (fn, stateJson, argsJson, kwargsJson) {
              var committed = false;
              var dirty = false;
              var has = function (name) {
                return Object.prototype.hasOwnProperty.call(self.attributes, name);
              };
              var self = {
                attributes: JSON.parse(stateJson),
                get: function (name) { return has(name) ? self.attributes[name] : null; },
                has: has,
                set: function (name, value) { self.attributes[name] = value; dirty = true; },
                commit: function () { committed = true; }
              };
              var callArgs = [self].concat(JSON.parse(argsJson));
              var kwargs = JSON.parse(kwargsJson);
              if (Object.keys(kwargs).length > 0) {
                callArgs.push(kwargs);
              }
              var output = fn.apply(null, callArgs);
              return JSON.stringify({
                output: output === undefined ? null : output,
                state: self.attributes,
                committed: committed,
                dirty: dirty
              });
            })
            """;

    private final ObjectMapper objectMapper;
    private final long timeoutMs;
    private final Engine engine;
    private final Source invokerSource;
    private final ExecutorService executor;
    private final ScheduledExecutorService watchdog;

    public GraalSandboxExecutor(ObjectMapper objectMapper, long timeoutMs, int threads) {
        this.objectMapper = objectMapper;
        this.timeoutMs = timeoutMs;
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .out(OutputStream.nullOutputStream())
                .err(OutputStream.nullOutputStream())
                .build();
        this.invokerSource = Source.create("js", INVOKER);
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            var t = new Thread(r, "aura-sandbox-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "aura-sandbox-watchdog");
            t.setDaemon(true);
            return t;
        });
        log.info("Local sandbox ready (GraalJS {}, timeout {}ms)", engine.getVersion(), timeoutMs);
    }

    @Override
    public CompletableFuture<SandboxResponse> execute(SandboxRequest request) {
        return CompletableFuture.supplyAsync(() -> run(request), executor);
    }

    @Override
    public String describe() {
        return "local(graaljs " + engine.getVersion() + ")";
    }

    /**
     * Runs one request on the calling thread.
     */
    public SandboxResponse run(SandboxRequest request) {
        String stateJson;
        String argsJson;
        String kwargsJson;
        try {
            stateJson = objectMapper.writeValueAsString(request.objectState());
            argsJson = objectMapper.writeValueAsString(request.args());
            kwargsJson = objectMapper.writeValueAsString(request.kwargs());
        } catch (JsonProcessingException e) {
            return SandboxResponse.failure("TypeError: arguments are not JSON-serializable: " + e.getOriginalMessage());
        }

        var timedOut = new AtomicBoolean(false);
        try (Context context = newContext()) {
            ScheduledFuture<?> guard = watchdog.schedule(() -> {
                timedOut.set(true);
                context.close(true);
            }, timeoutMs, TimeUnit.MILLISECONDS);
            try {
                context.eval(Source.create("js", request.code()));
                Value fn = context.getBindings("js").getMember(request.methodName());
                if (fn == null || !fn.canExecute()) {
                    return SandboxResponse.failure("ReferenceError: method '" + request.methodName()
                            + "' not found or not callable after evaluation");
                }
                Value invoker = context.eval(invokerSource);
                String resultJson = invoker.execute(fn, stateJson, argsJson, kwargsJson).asString();
                return toResponse(request, stateJson, resultJson);
            } catch (PolyglotException e) {
                if (timedOut.get() || e.isCancelled()) {
                    return timeout(request);
                }
                // the guest error object is only readable while the context is open
                String error = describeError(e);
                log.debug("Execution of '{}' raised {}", request.methodName(), error);
                return SandboxResponse.failure(error);
            } finally {
                guard.cancel(false);
            }
        } catch (IllegalStateException e) {
            // context closed by the watchdog between guest calls
            if (timedOut.get()) {
                return timeout(request);
            }
            throw e;
        }
    }

    private SandboxResponse timeout(SandboxRequest request) {
        log.warn("Execution of '{}' exceeded {}ms and was cancelled", request.methodName(), timeoutMs);
        return SandboxResponse.failure("TimeoutError: execution exceeded " + timeoutMs + "ms");
    }

    private Context newContext() {
        return Context.newBuilder("js")
                .engine(engine)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowPolyglotAccess(PolyglotAccess.NONE)
                .allowIO(IOAccess.NONE)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .allowNativeAccess(false)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .out(OutputStream.nullOutputStream())
                .err(OutputStream.nullOutputStream())
                .build();
    }

    private SandboxResponse toResponse(SandboxRequest request, String stateJson, String resultJson) {
        try {
            JsonNode result = objectMapper.readTree(resultJson);
            JsonNode before = objectMapper.readTree(stateJson);
            JsonNode after = result.path("state");
            Object output = objectMapper.convertValue(result.path("output"), Object.class);

            if (sameValue(before, after)) {
                return SandboxResponse.success(output, null);
            }
            if (!result.path("committed").asBoolean(false)) {
                log.debug("Method '{}' changed state without committing", request.methodName());
            }
            Map<String, Object> finalState = objectMapper.convertValue(after, MAP_TYPE);
            // attributes the body left alone keep their original Java values
            before.fields().forEachRemaining(entry -> {
                JsonNode updated = after.get(entry.getKey());
                if (updated != null && sameValue(entry.getValue(), updated)) {
                    finalState.put(entry.getKey(), request.objectState().get(entry.getKey()));
                }
            });
            return SandboxResponse.success(output, finalState);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return SandboxResponse.failure("TypeError: result is not JSON-serializable: " + e.getMessage());
        }
    }

    /**
     * Structural equality where numbers compare by value, so {@code 100.0} written
     * by Jackson equals the {@code 100} that {@code JSON.stringify} writes back.
     */
    static boolean sameValue(JsonNode before, JsonNode after) {
        return before.equals(NUMERIC_VALUE_ORDER, after);
    }

    private static int compareNumeric(JsonNode a, JsonNode b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isNumber() && b.isNumber()) {
            try {
                return a.decimalValue().compareTo(b.decimalValue());
            } catch (NumberFormatException e) {
                // NaN and infinities have no decimal form
                return Double.compare(a.doubleValue(), b.doubleValue());
            }
        }
        return 1;
    }

    static String describeError(PolyglotException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        String type;
        if (e.isSyntaxError()) {
            type = "SyntaxError";
        } else if (e.isResourceExhausted()) {
            type = "ResourceExhausted";
        } else if (e.isGuestException() && e.getGuestObject() != null && e.getGuestObject().hasMember("name")) {
            Value name = e.getGuestObject().getMember("name");
            type = name.isString() ? name.asString() : "Error";
        } else if (e.isInternalError()) {
            type = "InternalError";
        } else {
            type = "Error";
        }
        return message.startsWith(type + ":") ? message : type + ": " + message;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        watchdog.shutdownNow();
        engine.close();
    }
}
