package com.aura.core.engine;

import com.aura.core.model.DispatchOutcome;
import com.aura.core.model.DispatchRequest;
import com.aura.core.model.DispatchState;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Short-lived working state of one top-level dispatch. Discarded when the
 * dispatch reaches a terminal state.
 */
final class DispatchContext {

    private final String dispatchId;
    private final DispatchRequest request;
    private final CompletableFuture<DispatchOutcome> result = new CompletableFuture<>();
    private final List<DispatchState> path = new CopyOnWriteArrayList<>();
    private final long startNanos = System.nanoTime();
    private volatile DispatchState state;
    private volatile boolean installed;

    DispatchContext(String dispatchId, DispatchRequest request) {
        this.dispatchId = dispatchId;
        this.request = request;
    }

    String dispatchId() {
        return dispatchId;
    }

    DispatchRequest request() {
        return request;
    }

    String targetId() {
        return request.targetId();
    }

    String methodName() {
        return request.methodName();
    }

    /** The future handed to the caller; cancelling it abandons the dispatch. */
    CompletableFuture<DispatchOutcome> result() {
        return result;
    }

    boolean isCancelled() {
        return result.isCancelled();
    }

    DispatchState state() {
        return state;
    }

    void moveTo(DispatchState next) {
        state = next;
        path.add(next);
    }

    List<DispatchState> path() {
        return List.copyOf(path);
    }

    /** Set once a generated method was installed on the target during this dispatch. */
    boolean hasInstalled() {
        return installed;
    }

    void markInstalled() {
        installed = true;
    }

    long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
