package com.aura.core.health;

import com.aura.core.generator.CodeGenerator;
import com.aura.core.model.AuraObject;
import com.aura.core.store.InMemoryObjectStore;
import com.aura.core.store.ObjectStore;
import com.aura.core.store.PersistenceException;
import com.aura.sandbox.SandboxExecutor;
import com.aura.sandbox.SandboxRequest;
import com.aura.sandbox.SandboxResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static SandboxExecutor sandboxReturning(SandboxResponse response) {
        SandboxExecutor sandbox = mock(SandboxExecutor.class);
        when(sandbox.execute(any())).thenReturn(CompletableFuture.completedFuture(response));
        when(sandbox.describe()).thenReturn("stub");
        return sandbox;
    }

    private static CodeGenerator generator() {
        return (mandate, methodName) -> CompletableFuture.completedFuture("");
    }

    @Test
    @DisplayName("checkAll reports store, sandbox and generator in order")
    void checkAllOrder() {
        var store = new InMemoryObjectStore();
        store.initialize();
        var service = new HealthCheckService(store, sandboxReturning(SandboxResponse.success("pong", null)),
                generator(), "sk-test");

        var results = service.checkAll();

        assertEquals(3, results.size());
        assertEquals("object-store", results.get(0).component());
        assertEquals("sandbox", results.get(1).component());
        assertEquals("generator", results.get(2).component());
        assertTrue(results.stream().allMatch(r -> r.status() == HealthStatus.Status.UP));
    }

    @Nested
    @DisplayName("object store")
    class StoreTests {

        @Test
        @DisplayName("is DEGRADED when the root object is missing")
        void missingRoot() {
            var service = new HealthCheckService(new InMemoryObjectStore(), null, null, "");
            assertEquals(HealthStatus.Status.DEGRADED, service.checkStore().status());
        }

        @Test
        @DisplayName("is DOWN when the store fails")
        void storeFails() {
            ObjectStore store = mock(ObjectStore.class);
            when(store.get(AuraObject.NIL_ID)).thenReturn(
                    CompletableFuture.failedFuture(new PersistenceException("connection refused")));
            when(store.backendName()).thenReturn("jdbc");

            HealthStatus status = new HealthCheckService(store, null, null, "").checkStore();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertEquals("jdbc", status.metadata().get("backend"));
        }

        @Test
        @DisplayName("is DOWN when no store is configured")
        void noStore() {
            assertEquals(HealthStatus.Status.DOWN, new HealthCheckService(null, null, null, "").checkStore().status());
        }

        @Test
        @DisplayName("is UP when the root object is present")
        void rootPresent() {
            ObjectStore store = mock(ObjectStore.class);
            when(store.get(AuraObject.NIL_ID)).thenReturn(
                    CompletableFuture.completedFuture(Optional.of(AuraObject.empty(AuraObject.NIL_ID))));
            when(store.backendName()).thenReturn("memory");

            assertEquals(HealthStatus.Status.UP, new HealthCheckService(store, null, null, "").checkStore().status());
        }
    }

    @Nested
    @DisplayName("sandbox")
    class SandboxTests {

        @Test
        @DisplayName("runs the probe body and is UP on 'pong'")
        void probe() {
            SandboxExecutor sandbox = sandboxReturning(SandboxResponse.success("pong", null));

            HealthStatus status = new HealthCheckService(null, sandbox, null, "").checkSandbox();

            assertEquals(HealthStatus.Status.UP, status.status());
            ArgumentCaptor<SandboxRequest> request = ArgumentCaptor.forClass(SandboxRequest.class);
            verify(sandbox).execute(request.capture());
            assertEquals(HealthCheckService.PROBE_BODY, request.getValue().code());
            assertEquals("ping", request.getValue().methodName());
        }

        @Test
        @DisplayName("is DEGRADED when the probe raises")
        void probeError() {
            SandboxExecutor sandbox = sandboxReturning(SandboxResponse.failure("Error: nope"));
            assertEquals(HealthStatus.Status.DEGRADED,
                    new HealthCheckService(null, sandbox, null, "").checkSandbox().status());
        }

        @Test
        @DisplayName("is DOWN when the sandbox is unreachable")
        void unreachable() {
            SandboxExecutor sandbox = mock(SandboxExecutor.class);
            when(sandbox.execute(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
            when(sandbox.describe()).thenReturn("remote(http://nowhere)");

            assertEquals(HealthStatus.Status.DOWN,
                    new HealthCheckService(null, sandbox, null, "").checkSandbox().status());
        }
    }

    @Nested
    @DisplayName("generator")
    class GeneratorTests {

        @Test
        @DisplayName("is DEGRADED without an API key")
        void noKey() {
            assertEquals(HealthStatus.Status.DEGRADED,
                    new HealthCheckService(null, null, generator(), "not-set").checkGenerator().status());
            assertEquals(HealthStatus.Status.DEGRADED,
                    new HealthCheckService(null, null, generator(), "").checkGenerator().status());
        }

        @Test
        @DisplayName("is UP with a key and never calls the model")
        void withKey() {
            CodeGenerator generator = mock(CodeGenerator.class);
            when(generator.describe()).thenReturn("llm(http://model)");

            HealthStatus status = new HealthCheckService(null, null, generator, "sk-test").checkGenerator();

            assertEquals(HealthStatus.Status.UP, status.status());
            verify(generator, never()).generate(any(), any());
        }

        @Test
        @DisplayName("is DOWN when no generator is configured")
        void noGenerator() {
            assertEquals(HealthStatus.Status.DOWN,
                    new HealthCheckService(null, null, null, "sk").checkGenerator().status());
        }
    }

    @Nested
    @DisplayName("Overall status")
    class OverallTests {

        @Test
        @DisplayName("the worst component status wins")
        void worstWins() {
            var up = HealthStatus.up("sandbox", "ok", Map.of());
            var degraded = HealthStatus.degraded("generator", "no key", Map.of());
            var down = HealthStatus.down("object-store", "refused");

            assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(degraded, down, up)));
            assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
        }

        @Test
        @DisplayName("exit codes rise with severity")
        void exitCodes() {
            assertEquals(0, HealthStatus.Status.UP.exitCode());
            assertEquals(1, HealthStatus.Status.DEGRADED.exitCode());
            assertEquals(2, HealthStatus.Status.DOWN.exitCode());
        }

        @Test
        @DisplayName("missing metadata becomes an empty map")
        void nullMetadata() {
            assertEquals(Map.of(), new HealthStatus("sandbox", HealthStatus.Status.UP, "ok", null).metadata());
        }
    }
}
