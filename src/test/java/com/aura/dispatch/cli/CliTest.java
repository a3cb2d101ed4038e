package com.aura.dispatch.cli;

import com.aura.core.health.HealthCheckService;
import com.aura.core.health.HealthStatus;
import com.aura.core.model.AuraObject;
import com.aura.core.model.TransportException;
import com.aura.core.resolver.MethodResolver;
import com.aura.core.security.SecurityAuditor;
import com.aura.core.security.SecurityProperties;
import com.aura.core.store.InMemoryObjectStore;
import com.aura.core.store.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Aura CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private InMemoryObjectStore store;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
        store.initialize();
        store.create(new AuraObject("system", Map.of("owner", "ops"),
                Map.of("greet", "function greet(self, name) { return 'Hello, ' + name; }"))).join();
        store.link("system", AuraObject.NIL_ID).join();

        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                HealthStatus.up("object-store", "Store reachable, root object present", Map.of()),
                HealthStatus.up("sandbox", "Sandbox executed probe", Map.of()),
                HealthStatus.up("generator", "Generator configured", Map.of())
        ));
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == InspectCommand.class) {
                    return (K) new InspectCommand(store, new MethodResolver(store), new ObjectMapper());
                }
                if (cls == AuditCommand.class) {
                    return (K) new AuditCommand(new SecurityAuditor(new SecurityProperties()));
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CliRunner(new AuraCommand(), createFactory()).commandLine();
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String subcommand : List.of("health", "inspect", "audit", "serve", "help")) {
                assertTrue(output.contains(subcommand), "Help should list '" + subcommand + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Aura 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AURA v0.1.0"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("audit --help shows the --method option")
        void auditHelp() {
            CliResult result = execute("audit", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--method"));
        }
    }

    // =====================================================================
    //  Command execution tests
    // =====================================================================

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("prints one line per component and the overall verdict")
        void allUp() {
            CliResult result = execute("health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("object-store: Store reachable"));
            assertTrue(result.output().contains("sandbox: Sandbox executed probe"));
            assertTrue(result.output().contains("Overall: all components operational"));
        }

        @Test
        @DisplayName("reports a degraded component")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    HealthStatus.degraded("generator", "No model API key configured (OPENAI_API_KEY)", Map.of())));

            CliResult result = execute("health");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("OPENAI_API_KEY"));
            assertTrue(result.output().contains("Overall: one or more components degraded"));
        }

        @Test
        @DisplayName("a component down exits with 2")
        void down() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    HealthStatus.up("sandbox", "Sandbox executed probe", Map.of()),
                    HealthStatus.down("object-store", "Store error: connection refused")));

            CliResult result = execute("health");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Overall: one or more components down"));
        }
    }

    @Nested
    @DisplayName("inspect")
    class InspectTests {

        @Test
        @DisplayName("shows attributes, methods and the delegation chain")
        void inspectSystem() {
            CliResult result = execute("inspect", "system");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("OBJECT system"));
            assertTrue(output.contains("{\"owner\":\"ops\"}"));
            assertTrue(output.contains("Methods:    greet"));
            assertTrue(output.contains("[0] system (1 method)"));
            assertTrue(output.contains("[1] nil (0 methods)"));
        }

        @Test
        @DisplayName("an unreachable store exits with 3")
        void storeUnavailable() {
            store = new InMemoryObjectStore() {
                @Override
                public CompletableFuture<Optional<AuraObject>> get(String objectId) {
                    return CompletableFuture.failedFuture(new PersistenceException("connection refused"));
                }
            };

            CliResult result = execute("inspect", "system");
            assertEquals(CliRunner.EXIT_COMPONENT_UNAVAILABLE, result.exitCode());
            assertTrue(result.output().contains("Object store unavailable: connection refused"));
        }

        @Test
        @DisplayName("an unknown object exits with 1")
        void unknownObject() {
            CliResult result = execute("inspect", "ghost");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Object not found: ghost"));
        }
    }

    @Nested
    @DisplayName("audit")
    class AuditTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("a clean body passes with exit code 0")
        void cleanBody() throws IOException {
            Path file = tempDir.resolve("greet.js");
            Files.writeString(file, "function greet(self, name) { return 'Hello, ' + name; }");

            CliResult result = execute("audit", file.toString(), "--method", "greet");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Audit passed"));
        }

        @Test
        @DisplayName("a forbidden body is rejected with exit code 1")
        void forbiddenBody() throws IOException {
            Path file = tempDir.resolve("leak.js");
            Files.writeString(file, "function leak(self) { return open('/etc/passwd'); }");

            CliResult result = execute("audit", file.toString());
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Audit rejected: forbidden identifier 'open'"));
        }

        @Test
        @DisplayName("commit marker warnings are printed")
        void warningsPrinted() throws IOException {
            Path file = tempDir.resolve("rename.js");
            Files.writeString(file, "function rename(self, n) { self.set('name', n); }");

            CliResult result = execute("audit", file.toString(), "-m", "rename");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("does not end with self.commit()"));
        }

        @Test
        @DisplayName("an unreadable file exits with 2")
        void missingFile() {
            CliResult result = execute("audit", tempDir.resolve("nope.js").toString());
            assertEquals(2, result.exitCode());
        }
    }

    @Nested
    @DisplayName("CliRunner")
    class RunnerTests {

        @Test
        @DisplayName("leaves serve mode to the web server")
        void runnerSkipsServe() {
            var runner = new CliRunner(new AuraCommand(), createFactory());
            runner.run("serve");
            assertEquals(0, runner.getExitCode());
        }

        @Test
        @DisplayName("serve mode is decided by the subcommand, not by any argument")
        void serveModeDetection() {
            assertTrue(CliRunner.isServeMode("serve"));
            assertTrue(CliRunner.isServeMode("--debug", "serve"));
            assertFalse(CliRunner.isServeMode("inspect", "serve"));
            assertFalse(CliRunner.isServeMode("audit", "serve", "-m", "serve"));
            assertFalse(CliRunner.isServeMode());
        }

        @Test
        @DisplayName("maps component failures to the unavailable exit code")
        void exitCodeMapping() {
            assertEquals(CliRunner.EXIT_COMPONENT_UNAVAILABLE,
                    CliRunner.exitCodeFor(new CompletionException(new TransportException("sandbox", "down"))));
            assertEquals(CliRunner.EXIT_COMPONENT_UNAVAILABLE,
                    CliRunner.exitCodeFor(new PersistenceException("gone")));
            assertEquals(CommandLine.ExitCode.SOFTWARE,
                    CliRunner.exitCodeFor(new IllegalStateException("bug")));
        }

        @Test
        @DisplayName("records the exit code of the command it ran")
        void recordsExitCode() {
            var runner = new CliRunner(new AuraCommand(), createFactory());
            runner.run("inspect", "ghost");
            assertEquals(1, runner.getExitCode());
        }
    }
}
