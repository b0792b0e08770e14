package com.world.registry.store;

/**
 * Thrown when an attribute value cannot be applied to an entity.
 * Always recovered from by skipping the offending value.
 */
public class MalformedAttributeException extends RuntimeException {

    public MalformedAttributeException(String message) {
        super(message);
    }
}
