package com.aura.core.store;

/**
 * Thrown when an atomic update or insert loses against a concurrent writer,
 * or when an object id is already taken.
 */
public class StoreConflictException extends PersistenceException {

    public StoreConflictException(String message) {
        super(message);
    }
}
