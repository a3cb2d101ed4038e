package com.aura.core.store;

/**
 * Thrown when an operation names an object the store does not hold.
 */
public class ObjectNotFoundException extends PersistenceException {

    private final String objectId;

    public ObjectNotFoundException(String objectId) {
        super("Object not found: " + objectId);
        this.objectId = objectId;
    }

    public String getObjectId() {
        return objectId;
    }
}
