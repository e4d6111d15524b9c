package com.example.inventoryjobs.infra.image;

import com.example.inventoryjobs.domain.enums.ThumbnailSize;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ImageIoThumbnailProcessor Tests")
class ImageIoThumbnailProcessorTest {

    @TempDir
    Path dir;

    private final ImageIoThumbnailProcessor processor = new ImageIoThumbnailProcessor();

    @Test
    @DisplayName("Should scale each size to fit its bounding box")
    void shouldGenerateAllSizes() throws IOException {
        // Given
        var source = dir.resolve("source.png");
        ImageIO.write(new BufferedImage(600, 900, BufferedImage.TYPE_INT_ARGB), "png", source.toFile());

        // When
        var generated = processor.generateAllThumbnails(source, dir.resolve("thumb-1"));

        // Then
        assertThat(generated).containsOnlyKeys(ThumbnailSize.values());
        assertThat(generated.get(ThumbnailSize.SMALL).getFileName().toString()).isEqualTo("thumb-1_small.jpg");

        var small = ImageIO.read(generated.get(ThumbnailSize.SMALL).toFile());
        assertThat(small.getHeight()).isEqualTo(150);
        assertThat(small.getWidth()).isEqualTo(100);

        var large = ImageIO.read(generated.get(ThumbnailSize.LARGE).toFile());
        assertThat(large.getHeight()).isEqualTo(800);
        var medium = ImageIO.read(generated.get(ThumbnailSize.MEDIUM).toFile());
        assertThat(medium.getHeight()).isEqualTo(400);
    }

    @Test
    @DisplayName("Should keep small originals at their own size")
    void shouldNotUpscale() {
        var scaled = ImageIoThumbnailProcessor.scale(new BufferedImage(120, 80, BufferedImage.TYPE_INT_RGB), 800);

        assertThat(scaled.getWidth()).isEqualTo(120);
        assertThat(scaled.getHeight()).isEqualTo(80);
    }

    @Test
    @DisplayName("Should reject a file that is not an image")
    void shouldRejectCorruptSource() throws IOException {
        var source = dir.resolve("source.bin");
        Files.writeString(source, "definitely not a png");

        assertThatThrownBy(() -> processor.generateAllThumbnails(source, dir.resolve("thumb-2")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unsupported or corrupt image");
    }
}
