package com.aura.core.generator;

import java.util.concurrent.CompletableFuture;

/**
 * Produces a candidate method body for a natural-language mandate.
 * <p>
 * The returned future completes with non-blank source text, or exceptionally
 * with a {@link GenerationException} when nothing usable was produced.
 */
public interface CodeGenerator {

    CompletableFuture<String> generate(String mandate, String methodName);

    /** Short description of the backing model, used by health reporting. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
