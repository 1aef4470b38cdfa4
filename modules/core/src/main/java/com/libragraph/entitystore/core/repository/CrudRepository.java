package com.libragraph.entitystore.core.repository;

import java.util.List;
import java.util.Optional;

/**
 * Primary-key CRUD over one entity table.
 *
 * <p>Entities without a primary key are never written: {@link #save}, {@link #update} and
 * {@link #delete} return without touching storage. Keys are not generated.
 *
 * <p>Not thread-safe across instances sharing a table: index maintenance is a plain
 * read-modify-write.
 */
public interface CrudRepository<E, ID> {

    /**
     * Writes the entity and adds its ID to the table index if missing.
     *
     * @return the same entity instance
     * @throws RepositoryException if the blob store rejects a write
     */
    E save(E entity);

    List<E> saveAll(Iterable<? extends E> entities);

    Optional<E> findById(ID id);

    /**
     * Returns every indexed entity in index order. IDs whose blob is missing are skipped.
     */
    List<E> findAll();

    /**
     * Returns the entities found for the given IDs, in argument order. Missing IDs are skipped.
     */
    List<E> findAllById(Iterable<? extends ID> ids);

    /**
     * Overwrites the entity's blob and indexes its ID if missing.
     *
     * @return the same entity instance
     * @throws RepositoryException if the blob store rejects a write
     */
    E update(E entity);

    /**
     * Removes the entity blob and its index entry.
     *
     * @return true if an entity blob was removed
     */
    boolean deleteById(ID id);

    /**
     * @return true if an entity blob was removed; false also when the entity has no key
     */
    boolean delete(E entity);

    /**
     * Removes every indexed entity and the index itself.
     *
     * @return number of entity blobs removed
     */
    int deleteAll();

    /**
     * True if the entity blob exists and is non-empty. The index is not consulted.
     */
    boolean existsById(ID id);

    /**
     * Number of IDs in the table index.
     */
    long count();
}
