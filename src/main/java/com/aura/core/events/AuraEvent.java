package com.aura.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the runtime for live-state subscribers.
 *
 * @param eventType event type, e.g. {@code "object.state_changed"} or {@code "method.installed"}
 * @param objectId  the object this event is about
 * @param payload   arbitrary key-value data; for state changes the full post-mutation document
 * @param timestamp when the event occurred
 */
public record AuraEvent(
    String eventType,
    String objectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STATE_CHANGED = "object.state_changed";
    public static final String METHOD_INSTALLED = "method.installed";

    public static AuraEvent of(String eventType, String objectId, Map<String, Object> payload) {
        return new AuraEvent(eventType, objectId, payload, Instant.now());
    }
}
