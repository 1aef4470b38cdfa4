package com.libragraph.entitystore.types;

import java.util.Optional;

/**
 * Instance-level contract of a persistable entity.
 *
 * <p>Type-level facts (table name, key name, deserialization) live on {@link EntityType}.
 */
public interface Entity<ID> {

    /**
     * Returns the primary key, empty before the entity has one.
     */
    Optional<ID> primaryKey();

    /**
     * Returns the canonical text form read back by {@link EntityType#deserialize}.
     */
    String serialize();
}
