package com.example.inventoryjobs.infra.image;

import com.example.inventoryjobs.domain.enums.ThumbnailSize;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * Thumbnail generation with the JDK's ImageIO.
 * Output is JPEG scaled to fit the size's bounding box; images are never upscaled.
 */
@Slf4j
@Component
public class ImageIoThumbnailProcessor implements ImageProcessor {

    static final String FORMAT = "jpg";

    @Override
    public Map<ThumbnailSize, Path> generateAllThumbnails(Path sourcePath, Path baseDestPath) throws IOException {
        var source = ImageIO.read(sourcePath.toFile());
        if (source == null) {
            throw new IOException("Unsupported or corrupt image: " + sourcePath.getFileName());
        }

        var generated = new EnumMap<ThumbnailSize, Path>(ThumbnailSize.class);
        try {
            for (var size : ThumbnailSize.values()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Thumbnail generation interrupted");
                }
                var target = baseDestPath.resolveSibling(baseDestPath.getFileName() + "_" + size.getCode() + "." + FORMAT);
                var scaled = scale(source, size.getMaxEdge());
                if (!ImageIO.write(scaled, FORMAT, target.toFile())) {
                    throw new IOException("No ImageIO writer for " + FORMAT);
                }
                generated.put(size, target);
            }
        } catch (IOException | RuntimeException e) {
            for (var path : generated.values()) {
                Files.deleteIfExists(path);
            }
            throw e;
        }

        log.debug("Generated {} thumbnails for {}", generated.size(), sourcePath.getFileName());
        return generated;
    }

    static BufferedImage scale(BufferedImage source, int maxEdge) {
        var width = source.getWidth();
        var height = source.getHeight();
        var ratio = Math.min(1.0, (double) maxEdge / Math.max(width, height));
        var targetWidth = Math.max(1, (int) Math.round(width * ratio));
        var targetHeight = Math.max(1, (int) Math.round(height * ratio));

        // JPEG has no alpha channel
        var scaled = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        var graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(source, 0, 0, targetWidth, targetHeight, Color.WHITE, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }
}
