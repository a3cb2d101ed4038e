package com.aura.sandbox;

import com.aura.core.model.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the remote sandbox client against a local JDK HTTP server.
 */
class HttpSandboxExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "";
    private volatile long delayMs;

    private static final SandboxRequest REQUEST = new SandboxRequest(
            "function greet(self, name) { return 'Hello, ' + name; }", "greet",
            Map.of("mood", "good"), List.of("Ada"), Map.of());

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/execute", this::handle);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    private HttpSandboxExecutor executor(long timeoutMs) {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/execute";
        return new HttpSandboxExecutor(url, objectMapper, 1000, timeoutMs);
    }

    private static TransportException transportFailure(Runnable call) {
        var ex = assertThrows(CompletionException.class, call::run);
        return assertInstanceOf(TransportException.class, ex.getCause());
    }

    @Test
    @DisplayName("posts the wire request and reads the wire response")
    void success() throws IOException {
        responseBody = """
                {"output": "Hello, Ada", "state_changed": false, "final_state": null, "error": null}
                """;

        SandboxResponse response = executor(2000).execute(REQUEST).join();

        assertEquals("Hello, Ada", response.output());
        assertFalse(response.hasError());

        JsonNode sent = objectMapper.readTree(lastRequestBody.get());
        assertEquals("greet", sent.path("method_name").asText());
        assertEquals("good", sent.path("object_state").path("mood").asText());
        assertEquals("Ada", sent.path("args").get(0).asText());
        assertTrue(sent.path("kwargs").isObject());
        assertTrue(sent.has("code"));
    }

    @Test
    @DisplayName("a body error is passed through as a response, not a transport failure")
    void bodyError() {
        responseBody = """
                {"output": null, "state_changed": false, "final_state": null, "error": "TypeError: bad"}
                """;

        SandboxResponse response = executor(2000).execute(REQUEST).join();
        assertEquals("TypeError: bad", response.error());
    }

    @Test
    @DisplayName("a non-2xx status is a transport failure naming the sandbox")
    void serverError() {
        status = 500;
        responseBody = "boom";

        TransportException te = transportFailure(() -> executor(2000).execute(REQUEST).join());
        assertEquals("sandbox", te.getComponent());
        assertTrue(te.getMessage().contains("HTTP 500"));
    }

    @Test
    @DisplayName("a malformed body is a transport failure")
    void malformedBody() {
        responseBody = "not json";

        TransportException te = transportFailure(() -> executor(2000).execute(REQUEST).join());
        assertTrue(te.getMessage().startsWith("malformed sandbox response"));
    }

    @Test
    @DisplayName("a slow service times out as a transport failure")
    void timeout() {
        delayMs = 1500;
        responseBody = "{}";

        TransportException te = transportFailure(() -> executor(200).execute(REQUEST).join());
        assertEquals("sandbox", te.getComponent());
        assertTrue(te.getMessage().contains("timed out"), te.getMessage());
    }

    @Test
    @DisplayName("an unreachable service is a transport failure")
    void unreachable() throws IOException {
        int closedPort;
        try (var socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        var executor = new HttpSandboxExecutor("http://127.0.0.1:" + closedPort + "/execute",
                objectMapper, 500, 1000);

        TransportException te = transportFailure(() -> executor.execute(REQUEST).join());
        assertEquals("sandbox", te.getComponent());
        assertTrue(te.getMessage().startsWith("sandbox unreachable"), te.getMessage());
    }

    @Test
    @DisplayName("describe names the remote endpoint")
    void describe() {
        assertTrue(executor(1000).describe().startsWith("remote(http://127.0.0.1:"));
    }
}
