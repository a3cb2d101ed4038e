package com.aura.core.generator;

/**
 * Thrown when the code generator returns nothing usable.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
