package com.aura.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A prototype object as held by the object store: a stable id, an attribute
 * mapping and the method bodies it declares itself.
 * <p>
 * Attribute access is explicit rather than intercepted: {@link #getAttribute}
 * signals absence with an empty {@link Optional}, and {@link #setAttribute}
 * inserts the value and raises the dirty flag. Delegation to ancestors is not
 * modelled here; it is a separate call to the method resolver.
 * <p>
 * Instances are not thread-safe. Stores hand out copies, so a caller owns the
 * instance it receives.
 */
public final class AuraObject implements Serializable {

    /** Id of the root object that terminates every delegation chain. */
    public static final String NIL_ID = "nil";

    private final String id;
    private final Map<String, Object> attributes;
    private final Map<String, String> methods;
    private boolean dirty;

    public AuraObject(String id, Map<String, Object> attributes, Map<String, String> methods) {
        this.id = Objects.requireNonNull(id, "id");
        this.attributes = new LinkedHashMap<>(attributes != null ? attributes : Map.of());
        this.methods = new LinkedHashMap<>(methods != null ? methods : Map.of());
    }

    public static AuraObject empty(String id) {
        return new AuraObject(id, Map.of(), Map.of());
    }

    public String id() {
        return id;
    }

    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public void setAttribute(String name, Object value) {
        attributes.put(name, value);
        dirty = true;
    }

    /** True once {@link #setAttribute} has been called on this instance. */
    public boolean isDirty() {
        return dirty;
    }

    public boolean declaresMethod(String methodName) {
        return methods.containsKey(methodName);
    }

    public Optional<String> methodBody(String methodName) {
        return Optional.ofNullable(methods.get(methodName));
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Map<String, String> methods() {
        return Collections.unmodifiableMap(methods);
    }

    public AuraObject copy() {
        return new AuraObject(id, JsonValues.deepCopy(attributes), methods);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuraObject other)) return false;
        return id.equals(other.id)
                && attributes.equals(other.attributes)
                && methods.equals(other.methods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, attributes, methods);
    }

    @Override
    public String toString() {
        return "AuraObject{id=" + id + ", attributes=" + attributes.keySet()
                + ", methods=" + methods.keySet() + "}";
    }
}
