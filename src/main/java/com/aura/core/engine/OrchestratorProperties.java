package com.aura.core.engine;

import com.aura.core.resolver.MethodResolver;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aura.dispatch")
public class OrchestratorProperties {

    /** Upper bound for one object store call. */
    private long storeTimeoutMs = 5_000;

    /** Deepest delegation level the resolver inspects. */
    private int maxResolutionDepth = MethodResolver.DEFAULT_MAX_DEPTH;

    /**
     * Added to the sandbox timeout for the dispatch-side bound, so a sandbox that
     * enforces its own timeout can report it before the call is abandoned.
     */
    private long executionGraceMs = 1_000;

    public long getStoreTimeoutMs() { return storeTimeoutMs; }
    public void setStoreTimeoutMs(long storeTimeoutMs) { this.storeTimeoutMs = storeTimeoutMs; }
    public int getMaxResolutionDepth() { return maxResolutionDepth; }
    public void setMaxResolutionDepth(int maxResolutionDepth) { this.maxResolutionDepth = maxResolutionDepth; }
    public long getExecutionGraceMs() { return executionGraceMs; }
    public void setExecutionGraceMs(long executionGraceMs) { this.executionGraceMs = executionGraceMs; }
}
