package com.libragraph.entitystore.types;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Type-level capability a repository needs to persist entities of type {@code E}.
 *
 * <p>Table and key names are stable constants of the entity type; they form part of every
 * blob name, so changing them orphans previously stored data.
 */
public interface EntityType<E, ID> {

    String tableName();

    String primaryKeyName();

    IdCodec<ID> idCodec();

    Optional<ID> primaryKey(E entity);

    String serialize(E entity);

    E deserialize(String content);

    /**
     * Builds an entity type for entities implementing {@link Entity}.
     */
    static <E extends Entity<ID>, ID> EntityType<E, ID> of(String tableName, String primaryKeyName,
                                                            IdCodec<ID> idCodec,
                                                            Function<String, E> deserializer) {
        return new SimpleEntityType<>(tableName, primaryKeyName, idCodec, deserializer);
    }

    record SimpleEntityType<E extends Entity<ID>, ID>(
            String tableName,
            String primaryKeyName,
            IdCodec<ID> idCodec,
            Function<String, E> deserializer
    ) implements EntityType<E, ID> {

        public SimpleEntityType {
            Objects.requireNonNull(tableName, "tableName cannot be null");
            Objects.requireNonNull(primaryKeyName, "primaryKeyName cannot be null");
            Objects.requireNonNull(idCodec, "idCodec cannot be null");
            Objects.requireNonNull(deserializer, "deserializer cannot be null");
            if (tableName.isBlank() || primaryKeyName.isBlank()) {
                throw new IllegalArgumentException("tableName and primaryKeyName cannot be blank");
            }
        }

        @Override
        public Optional<ID> primaryKey(E entity) {
            return entity.primaryKey();
        }

        @Override
        public String serialize(E entity) {
            return entity.serialize();
        }

        @Override
        public E deserialize(String content) {
            return deserializer.apply(content);
        }
    }
}
