package com.aura.dispatch.api;

import com.aura.sandbox.SandboxExecutor;
import com.aura.sandbox.SandboxRequest;
import com.aura.sandbox.SandboxResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoint of the sandbox service mode ({@code aura serve}).
 * <p>
 * Runs one method body in the local GraalJS sandbox and answers with the wire
 * response. Errors raised by the body are part of a 200 response; only a
 * malformed request is rejected with 400.
 */
@RestController
@ConditionalOnProperty(name = "aura.sandbox.provider", havingValue = "local", matchIfMissing = true)
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxExecutor sandboxExecutor;

    public SandboxController(SandboxExecutor sandboxExecutor) {
        this.sandboxExecutor = sandboxExecutor;
    }

    /**
     * POST /execute
     */
    @PostMapping("/execute")
    public ResponseEntity<?> execute(@RequestBody SandboxRequest request) {
        if (request.code() == null || request.code().isBlank()
                || request.methodName() == null || request.methodName().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "'code' and 'method_name' are required"));
        }
        log.debug("Executing '{}' for remote caller", request.methodName());
        SandboxResponse response = sandboxExecutor.execute(request).join();
        return ResponseEntity.ok(response);
    }
}
