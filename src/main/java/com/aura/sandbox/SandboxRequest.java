package com.aura.sandbox;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One method execution as sent to a sandbox.
 *
 * @param code        the method body source text
 * @param methodName  name of the function the body defines
 * @param objectState snapshot of the executing object's attributes
 * @param args        positional arguments
 * @param kwargs      named arguments
 */
public record SandboxRequest(
    @JsonProperty("code") String code,
    @JsonProperty("method_name") String methodName,
    @JsonProperty("object_state") Map<String, Object> objectState,
    @JsonProperty("args") List<Object> args,
    @JsonProperty("kwargs") Map<String, Object> kwargs
) {

    public SandboxRequest {
        objectState = objectState != null ? Collections.unmodifiableMap(new LinkedHashMap<>(objectState)) : Map.of();
        args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        kwargs = kwargs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)) : Map.of();
    }
}
