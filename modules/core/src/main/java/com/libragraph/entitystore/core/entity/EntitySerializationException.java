package com.libragraph.entitystore.core.entity;

/**
 * Thrown when an entity cannot be converted to or from its stored JSON form.
 */
public class EntitySerializationException extends RuntimeException {

    public EntitySerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
