package com.aura.core.model;

/**
 * Thrown when an external collaborator (object store, sandbox, code generator)
 * is unreachable or does not answer within its time bound.
 */
public class TransportException extends RuntimeException {

    private final String component;

    public TransportException(String component, String message) {
        super(message);
        this.component = component;
    }

    public TransportException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }

    /** Name of the component that failed, e.g. {@code "sandbox"}. */
    public String getComponent() {
        return component;
    }
}
