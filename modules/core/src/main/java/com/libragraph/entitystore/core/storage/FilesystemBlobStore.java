package com.libragraph.entitystore.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Filesystem-backed BlobStore.
 *
 * <p>Layout: {@code {root}/{name}}, one UTF-8 text file per blob. The root directory is
 * created on first write. Names containing path separators or {@code ..} are rejected.
 *
 * <p>I/O failures are logged. Writes then report {@code false}, reads return empty
 * content, so an unreadable blob looks the same as a missing one.
 */
@ApplicationScoped
@IfBuildProperty(name = "entitystore.blob-store.type", stringValue = "filesystem", enableIfMissing = true)
public class FilesystemBlobStore implements BlobStore {

    private static final Logger log = Logger.getLogger(FilesystemBlobStore.class);

    @ConfigProperty(name = "entitystore.blob-store.filesystem.root")
    String root;

    public FilesystemBlobStore() {
    }

    public FilesystemBlobStore(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null").toString();
    }

    @Override
    public boolean create(String name, String content) {
        Objects.requireNonNull(content, "content cannot be null");
        Path path = resolvePath(name);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            return true;
        } catch (IOException e) {
            log.errorf(e, "Failed to write blob %s", name);
            return false;
        }
    }

    @Override
    public String read(String name) {
        Path path = resolvePath(name);
        if (!Files.exists(path)) {
            return "";
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            // Deleted between the existence check and the read
            return "";
        } catch (IOException e) {
            log.errorf(e, "Failed to read blob %s", name);
            return "";
        }
    }

    @Override
    public boolean delete(String name) {
        Path path = resolvePath(name);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.errorf(e, "Failed to delete blob %s", name);
            return false;
        }
    }

    @Override
    public boolean append(String name, String content) {
        Objects.requireNonNull(content, "content cannot be null");
        Path path = resolvePath(name);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE);
            return true;
        } catch (IOException e) {
            log.errorf(e, "Failed to append to blob %s", name);
            return false;
        }
    }

    private Path resolvePath(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (root == null || root.isBlank()) {
            throw new IllegalStateException("entitystore.blob-store.filesystem.root is not configured");
        }
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("Invalid blob name: " + name);
        }
        return Path.of(root, name);
    }
}
