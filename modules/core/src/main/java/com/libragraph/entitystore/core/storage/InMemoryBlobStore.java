package com.libragraph.entitystore.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed BlobStore for development and testing. Content is lost on shutdown.
 */
@ApplicationScoped
@IfBuildProperty(name = "entitystore.blob-store.type", stringValue = "memory")
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public boolean create(String name, String content) {
        blobs.put(requireName(name), Objects.requireNonNull(content, "content cannot be null"));
        return true;
    }

    @Override
    public String read(String name) {
        return blobs.getOrDefault(requireName(name), "");
    }

    @Override
    public boolean delete(String name) {
        return blobs.remove(requireName(name)) != null;
    }

    @Override
    public boolean append(String name, String content) {
        Objects.requireNonNull(content, "content cannot be null");
        blobs.merge(requireName(name), content, String::concat);
        return true;
    }

    /** Returns the names of all stored blobs, sorted. */
    public Set<String> names() {
        return new TreeSet<>(blobs.keySet());
    }

    public int size() {
        return blobs.size();
    }

    public void clear() {
        blobs.clear();
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Blob name cannot be empty");
        }
        return name;
    }
}
