package com.libragraph.entitystore.core.repository;

/**
 * Thrown when the blob store reports a failed write during a repository operation.
 */
public class RepositoryException extends RuntimeException {

    private final String table;
    private final String blobName;

    public RepositoryException(String table, String operation, String blobName) {
        super("Blob store rejected " + operation + " of " + blobName + " (table=" + table + ")");
        this.table = table;
        this.blobName = blobName;
    }

    public String table() {
        return table;
    }

    public String blobName() {
        return blobName;
    }
}
