package com.aura.core.generator;

/**
 * Structured model output for a generated method.
 *
 * @param code complete JavaScript source defining the method's function
 */
public record GeneratedMethod(String code) {}
