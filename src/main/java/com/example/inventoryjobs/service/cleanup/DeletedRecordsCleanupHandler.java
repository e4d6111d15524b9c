package com.example.inventoryjobs.service.cleanup;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Handler for {@code cleanup:deleted_records} tasks. No payload.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeletedRecordsCleanupHandler implements TaskHandler {

    private final CleanupProcessor cleanupProcessor;

    @Override
    public TaskType getTaskType() {
        return TaskType.CLEANUP_DELETED_RECORDS;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        try {
            var deleted = cleanupProcessor.purgeDeletedRecords();
            return TaskExecutionResult.success(Map.of("deleted", deleted));
        } catch (Exception e) {
            log.error("Deleted records cleanup failed: {}", e.getMessage(), e);
            return TaskExecutionResult.failure(e);
        }
    }
}
