package com.aura.core.model;

/**
 * Terminal failure categories of a dispatch.
 */
public enum FailureKind {
    TARGET_NOT_FOUND,
    EXECUTION_FAULT,
    AUDIT_REJECTION,
    GENERATION_FAILURE,
    PERSISTENCE_FAILURE,
    TRANSPORT_FAILURE,
    CANCELLED
}
