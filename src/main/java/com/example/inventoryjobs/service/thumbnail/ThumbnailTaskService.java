package com.example.inventoryjobs.service.thumbnail;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskQueue;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.service.queue.TaskOptions;
import com.example.inventoryjobs.service.queue.TaskQueueClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Entry point for photo uploads: requests thumbnail generation for a stored original.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThumbnailTaskService {

    static final TaskOptions TASK_OPTIONS = TaskOptions.builder()
            .queue(TaskQueue.DEFAULT.getCode())
            .maxRetry(5)
            .timeout(Duration.ofMinutes(5))
            .build();

    private final TaskQueueClient taskQueueClient;
    private final PayloadCodec payloadCodec;

    public QueuedTask requestThumbnails(ThumbnailPayload payload) {
        var queued = taskQueueClient.enqueue(payloadCodec.encode(TaskType.GENERATE_THUMBNAILS, payload), TASK_OPTIONS);
        log.info("Requested thumbnails for photo {} (task {})", payload.getPhotoId(), queued.getId());
        return queued;
    }
}
