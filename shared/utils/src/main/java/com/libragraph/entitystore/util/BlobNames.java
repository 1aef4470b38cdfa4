package com.libragraph.entitystore.util;

import java.util.Objects;

/**
 * Derives blob names for entity records and table indexes.
 *
 * <p>Record blobs: {@code {table}_{primaryKeyName}_{id}}. Index blobs: {@code {table}_IDs}.
 */
public final class BlobNames {

    public static final String INDEX_SUFFIX = "_IDs";

    private BlobNames() {
    }

    public static String record(String table, String primaryKeyName, String idToken) {
        requireName(table, "table");
        requireName(primaryKeyName, "primaryKeyName");
        Objects.requireNonNull(idToken, "idToken cannot be null");
        if (idToken.isEmpty()) {
            throw new IllegalArgumentException("idToken cannot be empty");
        }
        return table + "_" + primaryKeyName + "_" + idToken;
    }

    public static String index(String table) {
        requireName(table, "table");
        return table + INDEX_SUFFIX;
    }

    private static void requireName(String value, String what) {
        Objects.requireNonNull(value, what + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be blank");
        }
    }
}
