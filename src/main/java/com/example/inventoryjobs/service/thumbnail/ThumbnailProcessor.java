package com.example.inventoryjobs.service.thumbnail;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.enums.ThumbnailSize;
import com.example.inventoryjobs.domain.model.ThumbnailPaths;
import com.example.inventoryjobs.exception.InvalidPayloadException;
import com.example.inventoryjobs.infra.events.Event;
import com.example.inventoryjobs.infra.events.EventBroadcaster;
import com.example.inventoryjobs.infra.image.ImageProcessor;
import com.example.inventoryjobs.infra.storage.Storage;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.store.PhotoStore;
import com.example.inventoryjobs.tx.TxManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for {@code photo:generate_thumbnails} tasks.
 * <p>
 * Pipeline: mark processing, fetch the original, generate all sizes, upload them, then store
 * the paths and mark the photo ready in one transaction and publish
 * {@code photo.thumbnail_ready}.
 * <p>
 * Every step failure goes through {@link #handleFailure}. Only the final attempt marks the
 * photo failed and publishes {@code photo.thumbnail_failed}; earlier attempts keep it
 * processing with the diagnostic recorded. Local files are always removed.
 * <p>
 * A task dead-lettered by another path (expired lease, crashed worker) marks the photo
 * failed through {@link #onDeadLetter}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThumbnailProcessor implements TaskHandler {

    static final String ENTITY_TYPE = "item_photo";

    private final PayloadCodec payloadCodec;
    private final PhotoStore photoStore;
    private final Storage storage;
    private final ImageProcessor imageProcessor;
    private final EventBroadcaster eventBroadcaster;
    private final TxManager txManager;
    private final JobsProperties properties;

    @Override
    public TaskType getTaskType() {
        return TaskType.GENERATE_THUMBNAILS;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        ThumbnailPayload payload;
        try {
            payload = payloadCodec.decode(task, ThumbnailPayload.class);
        } catch (InvalidPayloadException e) {
            log.error("Task {}: {}", task.getId(), e.getMessage());
            return TaskExecutionResult.failure(e, TaskExecutionResult.ERROR_INVALID_PAYLOAD);
        }

        var photoId = payload.getPhotoId();
        log.info("Processing thumbnails for photo {} (attempt {})", photoId, context.getAttempt());

        try {
            if (!photoStore.markProcessing(photoId)) {
                // ready, failed or deleted: a duplicate delivery has nothing left to do
                log.info("Photo {} is no longer awaiting thumbnails, skipping", photoId);
                return TaskExecutionResult.success(Map.of("skipped", true));
            }
        } catch (Exception e) {
            return handleFailure(context, payload, new StepException("mark processing", e));
        }

        ThumbnailPaths paths;
        try {
            paths = generateAndUpload(context, payload);
        } catch (StepException e) {
            return handleFailure(context, payload, e);
        } catch (Error e) {
            // an OutOfMemoryError decoding a huge original still settles the photo state first
            handleFailure(context, payload, new StepException("process thumbnails", e));
            throw e;
        }

        boolean marked;
        try {
            marked = txManager.withTransaction(tx -> photoStore.markReady(photoId, paths));
        } catch (Exception e) {
            return handleFailure(context, payload, new StepException("update paths", e));
        }
        if (!marked) {
            log.warn("Photo {} left processing while its thumbnails were generated, not marking ready", photoId);
            return TaskExecutionResult.success(Map.of("skipped", true));
        }

        var data = new HashMap<String, Object>();
        data.put("photo_id", photoId.toString());
        data.put("item_id", payload.getItemId().toString());
        data.put("small_thumbnail_url", paths.getSmall());
        data.put("medium_thumbnail_url", paths.getMedium());
        data.put("large_thumbnail_url", paths.getLarge());
        publish(payload, Event.THUMBNAIL_READY, data);

        log.info("Thumbnails ready for photo {}", photoId);
        return TaskExecutionResult.success(Map.of("photoId", photoId.toString()));
    }

    private ThumbnailPaths generateAndUpload(TaskContext context, ThumbnailPayload payload) throws StepException {
        var photoId = payload.getPhotoId();
        var workDir = Path.of(properties.getThumbnails().getWorkDir());
        var sourcePath = workDir.resolve("thumb-src-" + photoId);
        var baseDest = workDir.resolve("thumb-" + photoId);
        List<Path> localFiles = new ArrayList<>();
        localFiles.add(sourcePath);

        try {
            try {
                Files.createDirectories(workDir);
                try (var in = storage.get(payload.getStoragePath())) {
                    Files.copy(in, sourcePath, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                throw new StepException("get original", e);
            }

            context.throwIfCancelled();
            Map<ThumbnailSize, Path> generated;
            try {
                generated = imageProcessor.generateAllThumbnails(sourcePath, baseDest);
            } catch (Exception e) {
                throw new StepException("generate thumbnails", e);
            }
            localFiles.addAll(generated.values());

            var stored = new EnumMap<ThumbnailSize, String>(ThumbnailSize.class);
            for (var entry : generated.entrySet()) {
                context.throwIfCancelled();
                var size = entry.getKey();
                var localPath = entry.getValue();
                var filename = "thumb_" + size.getCode() + "_" + photoId + extensionOf(localPath);
                try (var in = Files.newInputStream(localPath)) {
                    stored.put(size, storage.save(payload.getWorkspaceId(), payload.getItemId(), filename, in));
                } catch (IOException e) {
                    throw new StepException("save " + size.getCode() + " thumbnail", e);
                }
            }
            return ThumbnailPaths.of(stored);
        } catch (RuntimeException e) {
            throw new StepException("process thumbnails", e);
        } finally {
            deleteQuietly(localFiles);
        }
    }

    private TaskExecutionResult handleFailure(TaskContext context, ThumbnailPayload payload, StepException error) {
        var photoId = payload.getPhotoId();
        var message = error.getMessage();
        var result = TaskExecutionResult.failure(error, "THUMBNAIL_FAILED");

        if (!context.isFinalAttempt()) {
            log.warn("Thumbnail attempt {} for photo {} failed, will retry: {}", context.getAttempt(), photoId, message);
            try {
                photoStore.recordAttemptError(photoId, message);
            } catch (Exception e) {
                log.warn("Failed to record thumbnail error for photo {}: {}", photoId, e.getMessage());
                result.withAuxiliaryFailure("photo", e.getMessage());
            }
            return result;
        }

        log.error("Thumbnail generation for photo {} failed permanently: {}", photoId, message);
        try {
            markPhotoFailed(payload, message);
        } catch (Exception e) {
            log.error("Failed to mark photo {} as failed: {}", photoId, e.getMessage());
            return result.withAuxiliaryFailure("photo", e.getMessage());
        }
        return result;
    }

    /**
     * Settles the photo when the task gave up without the final attempt reaching
     * {@link #handleFailure}, e.g. after a worker crash. A photo already marked failed
     * is left alone, so the failed event is published once.
     */
    @Override
    public void onDeadLetter(QueuedTask task, TaskExecutionResult result) {
        ThumbnailPayload payload;
        try {
            payload = payloadCodec.decode(task, ThumbnailPayload.class);
        } catch (InvalidPayloadException e) {
            log.warn("Dead-lettered task {} has no usable photo reference: {}", task.getId(), e.getMessage());
            return;
        }
        var message = result.getErrorMessage() != null ? result.getErrorMessage() : "thumbnail task dead-lettered";
        if (markPhotoFailed(payload, message)) {
            log.warn("Photo {} marked failed after task {} was dead-lettered", payload.getPhotoId(), task.getId());
        }
    }

    private boolean markPhotoFailed(ThumbnailPayload payload, String message) {
        var photoId = payload.getPhotoId();
        if (!photoStore.markFailed(photoId, message)) {
            return false;
        }
        var data = new HashMap<String, Object>();
        data.put("photo_id", photoId.toString());
        data.put("item_id", payload.getItemId().toString());
        data.put("error", message);
        publish(payload, Event.THUMBNAIL_FAILED, data);
        return true;
    }

    private void publish(ThumbnailPayload payload, String type, Map<String, Object> data) {
        var event = Event.builder()
                .type(type)
                .entityId(payload.getPhotoId().toString())
                .entityType(ENTITY_TYPE)
                .data(data)
                .build();
        eventBroadcaster.publish(payload.getWorkspaceId(), event);
    }

    private static String extensionOf(Path path) {
        var name = path.getFileName().toString();
        var dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }

    private static void deleteQuietly(List<Path> paths) {
        for (var path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
            }
        }
    }

    /**
     * A pipeline step failure, its message prefixed with the step name
     */
    static class StepException extends Exception {

        StepException(String step, Throwable cause) {
            super(step + ": " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        }
    }
}
