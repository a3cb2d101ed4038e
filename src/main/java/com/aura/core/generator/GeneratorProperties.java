package com.aura.core.generator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aura.generator")
public class GeneratorProperties {

    /** Upper bound for one generation call. */
    private long timeoutMs = 120_000;

    /** Threads serving generation calls. */
    private int threads = 4;

    /** Name the model is addressed by in the system prompt. */
    private String persona = "ALFRED";

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }

    public String getPersona() { return persona; }
    public void setPersona(String persona) { this.persona = persona; }
}
