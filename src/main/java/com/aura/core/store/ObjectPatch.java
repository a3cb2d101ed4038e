package com.aura.core.store;

import com.aura.core.model.AuraObject;
import com.aura.core.model.JsonValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial document update. A {@code null} mapping leaves the stored one untouched.
 *
 * @param attributes attribute entries to merge or the full replacement mapping
 * @param methods    method entries to merge or the full replacement mapping
 */
public record ObjectPatch(
    Map<String, Object> attributes,
    Map<String, String> methods
) {

    public static ObjectPatch attributes(Map<String, Object> attributes) {
        return new ObjectPatch(attributes, null);
    }

    public static ObjectPatch method(String methodName, String body) {
        return new ObjectPatch(null, Map.of(methodName, body));
    }

    /**
     * Applies this patch to {@code existing} and returns the resulting document.
     * {@code existing} is not modified.
     */
    public AuraObject applyTo(AuraObject existing, boolean merge) {
        Map<String, Object> newAttributes;
        if (attributes == null) {
            newAttributes = new LinkedHashMap<>(existing.attributes());
        } else if (merge) {
            newAttributes = new LinkedHashMap<>(existing.attributes());
            newAttributes.putAll(JsonValues.deepCopy(attributes));
        } else {
            newAttributes = JsonValues.deepCopy(attributes);
        }

        Map<String, String> newMethods;
        if (methods == null) {
            newMethods = new LinkedHashMap<>(existing.methods());
        } else if (merge) {
            newMethods = new LinkedHashMap<>(existing.methods());
            newMethods.putAll(methods);
        } else {
            newMethods = new LinkedHashMap<>(methods);
        }
        return new AuraObject(existing.id(), newAttributes, newMethods);
    }
}
