package com.example.inventoryjobs.service.thumbnail;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Payload of a {@code photo:generate_thumbnails} task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ThumbnailPayload {

    @NotNull
    private UUID photoId;

    @NotNull
    private UUID workspaceId;

    @NotNull
    private UUID itemId;

    /**
     * Storage path of the original upload
     */
    @NotBlank
    private String storagePath;
}
