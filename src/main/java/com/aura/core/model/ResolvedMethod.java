package com.aura.core.model;

/**
 * Result of a successful method resolution.
 *
 * @param declaringObjectId the object whose method mapping holds the body (may be an ancestor)
 * @param methodName        the resolved method name
 * @param body              the method source text
 * @param depth             number of prototype edges walked from the start object (0 = self)
 */
public record ResolvedMethod(
    String declaringObjectId,
    String methodName,
    String body,
    int depth
) {}
