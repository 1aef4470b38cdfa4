package com.libragraph.entitystore.core.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.entitystore.types.EntityType;
import com.libragraph.entitystore.types.IdCodec;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * EntityType derived from annotations on a plain class or record, stored as JSON.
 *
 * <p>The single field annotated {@link Id} supplies the primary key and its name.
 * The table name comes from {@link Table} or defaults to the simple class name.
 * Serialization uses Jackson, so the class must be readable by the given
 * {@link ObjectMapper} (records work out of the box).
 */
public final class AnnotatedEntityType<E, ID> implements EntityType<E, ID> {

    private final Class<E> entityClass;
    private final Field idField;
    private final String tableName;
    private final IdCodec<ID> idCodec;
    private final ObjectMapper objectMapper;

    private AnnotatedEntityType(Class<E> entityClass, Field idField, IdCodec<ID> idCodec,
                                ObjectMapper objectMapper) {
        this.entityClass = entityClass;
        this.idField = idField;
        this.idCodec = idCodec;
        this.objectMapper = objectMapper;
        Table table = entityClass.getAnnotation(Table.class);
        this.tableName = table != null ? table.value() : entityClass.getSimpleName();
        if (tableName.isBlank()) {
            throw new IllegalArgumentException("@Table value cannot be blank on " + entityClass.getName());
        }
    }

    /**
     * Creates an entity type using the built-in codec for {@code idType}.
     */
    public static <E, ID> AnnotatedEntityType<E, ID> of(Class<E> entityClass, Class<ID> idType,
                                                       ObjectMapper objectMapper) {
        return of(entityClass, IdCodec.forType(idType), objectMapper);
    }

    /**
     * @throws IllegalArgumentException if the class has no or several {@link Id} fields,
     *                                  the field is primitive (it could never be absent),
     *                                  or the field type does not match the codec
     */
    public static <E, ID> AnnotatedEntityType<E, ID> of(Class<E> entityClass, IdCodec<ID> idCodec,
                                                       ObjectMapper objectMapper) {
        Objects.requireNonNull(entityClass, "entityClass cannot be null");
        Objects.requireNonNull(idCodec, "idCodec cannot be null");
        Objects.requireNonNull(objectMapper, "objectMapper cannot be null");

        Field idField = findIdField(entityClass);
        if (idField.getType().isPrimitive()) {
            throw new IllegalArgumentException("@Id field " + entityClass.getSimpleName() + "." + idField.getName()
                    + " is primitive " + idField.getType().getName() + "; use the boxed type so unsaved entities have no key");
        }
        if (!idField.getType().equals(idCodec.idType())) {
            throw new IllegalArgumentException("@Id field " + entityClass.getSimpleName() + "." + idField.getName()
                    + " is " + idField.getType().getName() + ", codec expects " + idCodec.idType().getName());
        }
        idField.setAccessible(true);
        return new AnnotatedEntityType<>(entityClass, idField, idCodec, objectMapper);
    }

    public Class<E> entityClass() {
        return entityClass;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public String primaryKeyName() {
        return idField.getName();
    }

    @Override
    public IdCodec<ID> idCodec() {
        return idCodec;
    }

    @Override
    public Optional<ID> primaryKey(E entity) {
        Objects.requireNonNull(entity, "entity cannot be null");
        try {
            @SuppressWarnings("unchecked")
            ID value = (ID) idField.get(entity);
            return Optional.ofNullable(value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read @Id field " + idField, e);
        }
    }

    @Override
    public String serialize(E entity) {
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new EntitySerializationException("Failed to serialize " + tableName + " entity", e);
        }
    }

    @Override
    public E deserialize(String content) {
        try {
            return objectMapper.readValue(content, entityClass);
        } catch (JsonProcessingException e) {
            throw new EntitySerializationException("Failed to deserialize " + tableName + " entity", e);
        }
    }

    private static Field findIdField(Class<?> entityClass) {
        List<Field> candidates = new ArrayList<>();
        for (Class<?> c = entityClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (field.isAnnotationPresent(Id.class)) {
                    candidates.add(field);
                }
            }
        }
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No @Id field on " + entityClass.getName());
        }
        if (candidates.size() > 1) {
            throw new IllegalArgumentException("Multiple @Id fields on " + entityClass.getName());
        }
        return candidates.get(0);
    }
}
