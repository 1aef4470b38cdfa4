/**
 * Shared utilities for all entity store modules.
 *
 * <p>Contains {@link com.libragraph.entitystore.util.IdIndex} (the line-oriented ID index
 * format) and {@link com.libragraph.entitystore.util.BlobNames} (blob naming scheme).
 * No framework dependencies, pure Java.
 */
package com.libragraph.entitystore.util;
