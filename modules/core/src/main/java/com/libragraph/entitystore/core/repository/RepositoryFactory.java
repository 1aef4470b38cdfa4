package com.libragraph.entitystore.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.entitystore.core.entity.AnnotatedEntityType;
import com.libragraph.entitystore.core.storage.BlobStore;
import com.libragraph.entitystore.types.EntityType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Objects;

/**
 * Creates repositories sharing one injected {@link BlobStore}.
 *
 * <p>Annotated entity classes are serialized with the injected {@link ObjectMapper},
 * so Jackson customizers registered in the application apply to stored blobs.
 */
@ApplicationScoped
public class RepositoryFactory {

    private final BlobStore store;
    private final ObjectMapper objectMapper;

    @Inject
    public RepositoryFactory(BlobStore store, ObjectMapper objectMapper) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public <E, ID> CrudRepository<E, ID> create(EntityType<E, ID> type) {
        return new IndexedBlobRepository<>(store, type);
    }

    /**
     * Creates a repository for a class carrying an {@link com.libragraph.entitystore.core.entity.Id} field.
     */
    public <E, ID> CrudRepository<E, ID> create(Class<E> entityClass, Class<ID> idType) {
        return create(AnnotatedEntityType.of(entityClass, idType, objectMapper));
    }

    public BlobStore store() {
        return store;
    }
}
