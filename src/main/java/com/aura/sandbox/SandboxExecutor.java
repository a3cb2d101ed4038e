package com.aura.sandbox;

import java.util.concurrent.CompletableFuture;

/**
 * Runs one method body against an attribute snapshot in isolation.
 * <p>
 * Errors raised by the body complete the future normally with
 * {@link SandboxResponse#hasError()} set. The future completes exceptionally
 * only when the sandbox itself could not be reached or failed.
 * Implementations: {@link GraalSandboxExecutor} (in-process, isolated guest
 * context) and {@link HttpSandboxExecutor} (remote sandbox service).
 */
public interface SandboxExecutor {

    CompletableFuture<SandboxResponse> execute(SandboxRequest request);

    /** Short description used by health reporting. */
    String describe();
}
