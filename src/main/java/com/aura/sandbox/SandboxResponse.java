package com.aura.sandbox;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Result of one sandboxed execution.
 *
 * @param output       value returned by the method, {@code null} on error
 * @param stateChanged whether the attributes differ by value after the run
 * @param finalState   the post-execution attributes when changed, otherwise {@code null}
 * @param error        {@code "<ErrorType>: message"} when the body raised, otherwise {@code null}
 */
public record SandboxResponse(
    @JsonProperty("output") Object output,
    @JsonProperty("state_changed") boolean stateChanged,
    @JsonProperty("final_state") Map<String, Object> finalState,
    @JsonProperty("error") String error
) {

    public static SandboxResponse success(Object output, Map<String, Object> finalStateIfChanged) {
        return new SandboxResponse(output, finalStateIfChanged != null, finalStateIfChanged, null);
    }

    public static SandboxResponse failure(String error) {
        return new SandboxResponse(null, false, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
