package com.example.inventoryjobs.infra.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.UUID;

/**
 * Blob storage for item photos and their thumbnails.
 */
public interface Storage {

    /**
     * Store {@code content} under the workspace/item namespace.
     *
     * @return storage path to persist and later pass to {@link #get(String)}
     */
    String save(UUID workspaceId, UUID itemId, String filename, InputStream content) throws IOException;

    /**
     * Open a stored object. The caller closes the stream.
     */
    InputStream get(String path) throws IOException;

    void delete(String path) throws IOException;
}
