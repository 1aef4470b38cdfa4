/**
 * Entity contracts shared across all entity store modules.
 *
 * <p>{@link com.libragraph.entitystore.types.Entity} is implemented by domain values,
 * {@link com.libragraph.entitystore.types.EntityType} describes them to a repository and
 * {@link com.libragraph.entitystore.types.IdCodec} maps primary keys to index tokens.
 * No framework dependencies.
 */
package com.libragraph.entitystore.types;
