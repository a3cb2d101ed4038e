package com.aura.core.health;

import com.aura.core.generator.CodeGenerator;
import com.aura.core.model.AuraObject;
import com.aura.core.store.ObjectStore;
import com.aura.sandbox.SandboxExecutor;
import com.aura.sandbox.SandboxRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Non-destructive checks of the runtime's collaborators: the object store,
 * the sandbox executor and the code generator.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String PROBE_BODY = "function ping(self) { return 'pong'; }";
    private static final long PROBE_TIMEOUT_SECONDS = 5;

    private final ObjectStore objectStore;
    private final SandboxExecutor sandboxExecutor;
    private final CodeGenerator codeGenerator;
    private final String modelApiKey;

    public HealthCheckService(
            @Autowired(required = false) ObjectStore objectStore,
            @Autowired(required = false) SandboxExecutor sandboxExecutor,
            @Autowired(required = false) CodeGenerator codeGenerator,
            @Value("${spring.ai.openai.api-key:}") String modelApiKey) {
        this.objectStore = objectStore;
        this.sandboxExecutor = sandboxExecutor;
        this.codeGenerator = codeGenerator;
        this.modelApiKey = modelApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkSandbox());
        results.add(checkGenerator());
        return results;
    }

    HealthStatus checkStore() {
        if (objectStore == null) {
            return HealthStatus.down("object-store", "No ObjectStore configured");
        }
        try {
            boolean rootPresent = objectStore.get(AuraObject.NIL_ID)
                    .get(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .isPresent();
            if (rootPresent) {
                return HealthStatus.up("object-store",
                        "Store reachable, root object present", Map.of("backend", objectStore.backendName()));
            }
            return HealthStatus.degraded("object-store",
                    "Store reachable but root object '" + AuraObject.NIL_ID + "' is missing",
                    Map.of("backend", objectStore.backendName()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down("object-store", "Interrupted");
        } catch (Exception e) {
            log.warn("Object store health check failed: {}", e.getMessage());
            return HealthStatus.down("object-store",
                    "Store error: " + e.getMessage(), Map.of("backend", objectStore.backendName()));
        }
    }

    HealthStatus checkSandbox() {
        if (sandboxExecutor == null) {
            return HealthStatus.down("sandbox", "No SandboxExecutor configured");
        }
        var probe = new SandboxRequest(PROBE_BODY, "ping", Map.of(), List.of(), Map.of());
        try {
            var response = sandboxExecutor.execute(probe).get(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!response.hasError() && "pong".equals(response.output())) {
                return HealthStatus.up("sandbox",
                        "Sandbox executed probe", Map.of("provider", sandboxExecutor.describe()));
            }
            return HealthStatus.degraded("sandbox",
                    "Unexpected probe result: " + (response.hasError() ? response.error() : response.output()),
                    Map.of("provider", sandboxExecutor.describe()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down("sandbox", "Interrupted");
        } catch (Exception e) {
            log.warn("Sandbox health check failed: {}", e.getMessage());
            return HealthStatus.down("sandbox",
                    "Sandbox error: " + e.getMessage(), Map.of("provider", sandboxExecutor.describe()));
        }
    }

    HealthStatus checkGenerator() {
        if (codeGenerator == null) {
            return HealthStatus.down("generator", "No CodeGenerator configured");
        }
        if (modelApiKey == null || modelApiKey.isBlank() || "not-set".equals(modelApiKey)) {
            return HealthStatus.degraded("generator",
                    "No model API key configured (OPENAI_API_KEY)", Map.of("generator", codeGenerator.describe()));
        }
        return HealthStatus.up("generator",
                "Generator configured", Map.of("generator", codeGenerator.describe()));
    }
}
