package com.libragraph.entitystore.core.repository;

import com.libragraph.entitystore.core.storage.BlobStore;
import com.libragraph.entitystore.types.EntityType;
import com.libragraph.entitystore.types.IdCodec;
import com.libragraph.entitystore.util.BlobNames;
import com.libragraph.entitystore.util.IdIndex;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * CrudRepository storing each entity as its own blob plus a per-table ID index blob.
 *
 * <p>Blob layout: {@code {table}_{key}_{id}} holds the serialized entity,
 * {@code {table}_IDs} lists every persisted ID, one per line. The index lets
 * {@link #findAll()} enumerate a table without listing the store.
 *
 * <p>The store is shared and not owned: this class never closes it.
 */
public class IndexedBlobRepository<E, ID> implements CrudRepository<E, ID> {

    private static final Logger log = Logger.getLogger(IndexedBlobRepository.class);

    private final BlobStore store;
    private final EntityType<E, ID> type;
    private final IdCodec<ID> idCodec;
    private final String indexName;

    public IndexedBlobRepository(BlobStore store, EntityType<E, ID> type) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.idCodec = Objects.requireNonNull(type.idCodec(), "type.idCodec() cannot be null");
        this.indexName = BlobNames.index(type.tableName());
    }

    @Override
    public E save(E entity) {
        return write(entity, "create", store::create);
    }

    @Override
    public List<E> saveAll(Iterable<? extends E> entities) {
        Objects.requireNonNull(entities, "entities cannot be null");
        List<E> saved = new ArrayList<>();
        for (E entity : entities) {
            saved.add(save(entity));
        }
        return saved;
    }

    @Override
    public Optional<E> findById(ID id) {
        String content = store.read(blobName(id));
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(type.deserialize(content));
    }

    @Override
    public List<E> findAll() {
        List<E> entities = new ArrayList<>();
        for (ID id : readIndex()) {
            String content = store.read(blobName(id));
            if (content.isEmpty()) {
                log.debugf("Indexed %s %s=%s has no blob, skipping", type.tableName(), type.primaryKeyName(), id);
                continue;
            }
            entities.add(type.deserialize(content));
        }
        return entities;
    }

    @Override
    public List<E> findAllById(Iterable<? extends ID> ids) {
        Objects.requireNonNull(ids, "ids cannot be null");
        List<E> found = new ArrayList<>();
        for (ID id : ids) {
            findById(id).ifPresent(found::add);
        }
        return found;
    }

    @Override
    public E update(E entity) {
        return write(entity, "update", store::update);
    }

    @Override
    public boolean deleteById(ID id) {
        String name = blobName(id);
        boolean removed = store.delete(name);
        if (!removed) {
            log.debugf("No blob %s to delete", name);
        }

        List<ID> ids = readIndex();
        List<ID> kept = new ArrayList<>(ids.size());
        for (ID indexed : ids) {
            if (!indexed.equals(id)) {
                kept.add(indexed);
            }
        }
        if (kept.size() != ids.size()) {
            writeIndex(kept);
        }
        return removed;
    }

    @Override
    public boolean delete(E entity) {
        Objects.requireNonNull(entity, "entity cannot be null");
        Optional<ID> id = type.primaryKey(entity);
        if (id.isEmpty()) {
            log.debugf("Ignoring delete of %s without %s", type.tableName(), type.primaryKeyName());
            return false;
        }
        return deleteById(id.get());
    }

    @Override
    public int deleteAll() {
        int removed = 0;
        for (ID id : readIndex()) {
            if (store.delete(blobName(id))) {
                removed++;
            }
        }
        store.delete(indexName);
        log.debugf("Deleted %d %s blobs", removed, type.tableName());
        return removed;
    }

    @Override
    public boolean existsById(ID id) {
        return !store.read(blobName(id)).isEmpty();
    }

    @Override
    public long count() {
        return readIndex().size();
    }

    private E write(E entity, String operation, BiPredicate<String, String> writer) {
        Objects.requireNonNull(entity, "entity cannot be null");
        Optional<ID> id = type.primaryKey(entity);
        if (id.isEmpty()) {
            log.debugf("Ignoring %s of %s without %s", operation, type.tableName(), type.primaryKeyName());
            return entity;
        }

        String name = blobName(id.get());
        require(writer.test(name, type.serialize(entity)), operation, name);

        indexIfAbsent(id.get());
        return entity;
    }

    private void indexIfAbsent(ID id) {
        String content = store.read(indexName);
        if (parseIndex(content).contains(id)) {
            return;
        }
        String token = IdIndex.requireValidToken(idCodec.format(id));
        require(store.append(indexName, IdIndex.appendSuffix(content, token)), "append", indexName);
    }

    private List<ID> readIndex() {
        return parseIndex(store.read(indexName));
    }

    private List<ID> parseIndex(String content) {
        List<String> tokens = IdIndex.parse(content);
        List<ID> ids = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            ID id;
            try {
                id = idCodec.parse(token);
            } catch (IllegalArgumentException e) {
                log.warnf("Skipping malformed entry '%s' in %s: %s", token, indexName, e.getMessage());
                continue;
            }
            if (!ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    private void writeIndex(List<ID> ids) {
        List<String> tokens = new ArrayList<>(ids.size());
        for (ID id : ids) {
            tokens.add(idCodec.format(id));
        }
        require(store.update(indexName, IdIndex.format(tokens)), "update", indexName);
    }

    private String blobName(ID id) {
        Objects.requireNonNull(id, "id cannot be null");
        String token = IdIndex.requireValidToken(idCodec.format(id));
        return BlobNames.record(type.tableName(), type.primaryKeyName(), token);
    }

    private void require(boolean succeeded, String operation, String name) {
        if (!succeeded) {
            throw new RepositoryException(type.tableName(), operation, name);
        }
    }
}
