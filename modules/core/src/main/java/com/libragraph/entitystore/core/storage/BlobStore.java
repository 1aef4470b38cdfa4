package com.libragraph.entitystore.core.storage;

/**
 * Named text-blob storage used as the only I/O primitive of the entity repositories.
 *
 * <p>Blob names are opaque to implementations. A blob that does not exist reads as empty
 * content, so callers cannot tell "absent" from "present but empty".
 *
 * <p>Failures never throw: write operations report them as a {@code false} flag and
 * reads return empty content.
 */
public interface BlobStore {

    /**
     * Writes a blob, overwriting any existing content.
     *
     * @return true if the content was stored
     */
    boolean create(String name, String content);

    /**
     * Reads a blob.
     *
     * @return the content, or an empty string if the blob does not exist or cannot be read
     */
    String read(String name);

    /**
     * Overwrites a blob. Same semantics as {@link #create}.
     */
    default boolean update(String name, String content) {
        return create(name, content);
    }

    /**
     * Removes a blob.
     *
     * @return true if a blob was removed, false if none existed or removal failed
     */
    boolean delete(String name);

    /**
     * Appends to a blob, creating it if absent.
     * The default is a read followed by a create and is not atomic.
     */
    default boolean append(String name, String content) {
        return create(name, read(name) + content);
    }
}
