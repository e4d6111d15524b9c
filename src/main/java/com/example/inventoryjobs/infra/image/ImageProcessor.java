package com.example.inventoryjobs.infra.image;

import com.example.inventoryjobs.domain.enums.ThumbnailSize;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Produces thumbnails of a source image.
 */
public interface ImageProcessor {

    /**
     * Generate one file per {@link ThumbnailSize} next to {@code baseDestPath}.
     *
     * @param sourcePath   local copy of the original
     * @param baseDestPath destination prefix; each size appends {@code _<size>.<ext>}
     * @return generated local files by size
     */
    Map<ThumbnailSize, Path> generateAllThumbnails(Path sourcePath, Path baseDestPath) throws IOException;
}
