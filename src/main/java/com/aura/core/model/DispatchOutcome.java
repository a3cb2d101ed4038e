package com.aura.core.model;

import java.util.Objects;

/**
 * The single typed result a caller receives for a dispatch.
 * <p>
 * Exactly one of the two shapes is populated: a success carries the output and
 * the state-changed flag, a failure carries its {@link FailureKind}, a detail
 * message and, for transport failures, the component that could not be reached.
 *
 * @param success           true for a successful dispatch
 * @param output            method output (success only)
 * @param stateChanged      whether the declaring object's attributes were persisted (success only)
 * @param declaringObjectId the object whose method ran (success only)
 * @param failureKind       failure category (failure only)
 * @param detail            human-readable failure detail (failure only)
 * @param component         failing external component, e.g. "sandbox" (transport failures only)
 */
public record DispatchOutcome(
    boolean success,
    Object output,
    boolean stateChanged,
    String declaringObjectId,
    FailureKind failureKind,
    String detail,
    String component
) {

    public static DispatchOutcome success(Object output, boolean stateChanged, String declaringObjectId) {
        return new DispatchOutcome(true, output, stateChanged, declaringObjectId, null, null, null);
    }

    public static DispatchOutcome failure(FailureKind kind, String detail) {
        return failure(kind, detail, null);
    }

    public static DispatchOutcome failure(FailureKind kind, String detail, String component) {
        Objects.requireNonNull(kind, "kind");
        return new DispatchOutcome(false, null, false, null, kind, detail, component);
    }

    public boolean isFailure(FailureKind kind) {
        return !success && failureKind == kind;
    }
}
