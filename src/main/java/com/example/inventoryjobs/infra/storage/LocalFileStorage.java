package com.example.inventoryjobs.infra.storage;

import com.example.inventoryjobs.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * {@link Storage} on the local file system.
 * Paths are {@code <workspaceId>/<itemId>/<filename>} relative to {@code storage.base-path}.
 */
@Slf4j
@Component
public class LocalFileStorage implements Storage {

    private final Path basePath;

    public LocalFileStorage(StorageProperties properties) {
        this.basePath = Path.of(properties.getBasePath()).toAbsolutePath().normalize();
    }

    @Override
    public String save(UUID workspaceId, UUID itemId, String filename, InputStream content) throws IOException {
        var relative = workspaceId + "/" + itemId + "/" + filename;
        var target = resolve(relative);
        Files.createDirectories(target.getParent());
        Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Stored {}", relative);
        return relative;
    }

    @Override
    public InputStream get(String path) throws IOException {
        return Files.newInputStream(resolve(path));
    }

    @Override
    public void delete(String path) throws IOException {
        Files.deleteIfExists(resolve(path));
    }

    Path resolve(String path) throws IOException {
        if (path == null || path.isBlank()) {
            throw new IOException("Empty storage path");
        }
        var resolved = basePath.resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IOException("Storage path escapes base directory: " + path);
        }
        return resolved;
    }
}
