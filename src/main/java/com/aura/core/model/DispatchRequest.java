package com.aura.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A message sent to an object. Lives only for the duration of one dispatch.
 *
 * @param targetId   id of the receiving object
 * @param methodName name of the message
 * @param args       ordered positional arguments
 * @param kwargs     named arguments
 */
public record DispatchRequest(
    String targetId,
    String methodName,
    List<Object> args,
    Map<String, Object> kwargs
) {

    public DispatchRequest {
        Objects.requireNonNull(targetId, "targetId");
        Objects.requireNonNull(methodName, "methodName");
        // JSON nulls are legal argument values, so List.copyOf/Map.copyOf are not usable here
        args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        kwargs = kwargs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(kwargs)) : Map.of();
    }

    public static DispatchRequest of(String targetId, String methodName, Object... args) {
        return new DispatchRequest(targetId, methodName, Arrays.asList(args), Map.of());
    }
}
