package com.aura.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aura.sandbox")
public class SandboxProperties {

    /** {@code local} runs bodies in a guest context, {@code remote} posts them to {@link #url}. */
    private String provider = "local";
    private String url = "http://localhost:8100/execute";
    private long timeoutMs = 10_000;
    private long connectTimeoutMs = 2_000;
    private int threads = 4;

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public long getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
}
