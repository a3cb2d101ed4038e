package com.aura.sandbox;

import com.aura.core.model.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Posts executions to a remote sandbox service ({@code POST /execute}).
 * <p>
 * Unreachable services, timeouts, non-2xx statuses and malformed bodies are
 * reported as {@link TransportException}s naming the {@code sandbox} component.
 */
public class HttpSandboxExecutor implements SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpSandboxExecutor.class);

    static final String COMPONENT = "sandbox";

    private final URI endpoint;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpSandboxExecutor(String url, ObjectMapper objectMapper, long connectTimeoutMs, long requestTimeoutMs) {
        this.endpoint = URI.create(url);
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        log.info("Remote sandbox configured at {}", endpoint);
    }

    @Override
    public CompletableFuture<SandboxResponse> execute(SandboxRequest request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(SandboxResponse.failure(
                    "TypeError: arguments are not JSON-serializable: " + e.getOriginalMessage()));
        }
        var httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("POST {} for method '{}'", endpoint, request.methodName());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw asTransportFailure(error);
                    }
                    return readResponse(response);
                });
    }

    @Override
    public String describe() {
        return "remote(" + endpoint + ")";
    }

    private SandboxResponse readResponse(HttpResponse<String> response) {
        if (response.statusCode() / 100 != 2) {
            throw new TransportException(COMPONENT, "sandbox returned HTTP %d: %s"
                    .formatted(response.statusCode(), response.body()));
        }
        try {
            return objectMapper.readValue(response.body(), SandboxResponse.class);
        } catch (JsonProcessingException e) {
            throw new TransportException(COMPONENT, "malformed sandbox response: " + e.getOriginalMessage(), e);
        }
    }

    private TransportException asTransportFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpTimeoutException) {
            return new TransportException(COMPONENT, "sandbox timed out after " + requestTimeout.toMillis() + "ms", cause);
        }
        log.warn("Sandbox call to {} failed: {}", endpoint, cause.toString());
        return new TransportException(COMPONENT, "sandbox unreachable: " + cause.getMessage(), cause);
    }
}
