package com.example.inventoryjobs.service.executor;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.service.queue.QueueSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WorkerServer Tests")
class WorkerServerTest {

    @Mock
    private TaskExecutorService taskExecutorService;

    @Mock
    private ExecutorService workerExecutor;

    private JobsProperties properties;
    private WorkerServer workerServer;

    @BeforeEach
    void setUp() {
        properties = new JobsProperties();
        properties.getWorker().setConcurrency(2);
        var selector = new QueueSelector(Map.of("default", 3), new Random(7));
        workerServer = new WorkerServer(taskExecutorService, properties, workerExecutor, selector);
    }

    private QueuedTask task() {
        return QueuedTask.builder()
                .id(UUID.randomUUID())
                .taskType(TaskType.LOAN_REMINDER.getCode())
                .queue("default")
                .status(TaskStatus.PROCESSING)
                .retryCount(0)
                .maxRetry(3)
                .timeoutSeconds(30L)
                .build();
    }

    private void runSubmittedTasksInline() {
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(workerExecutor).execute(any(Runnable.class));
    }

    @Nested
    @DisplayName("Polling Tests")
    class PollingTests {

        @Test
        @DisplayName("Should claim up to the free capacity and execute each task")
        void shouldClaimUpToCapacity() {
            // Given
            var first = task();
            var second = task();
            when(taskExecutorService.claimDueTasks("default", 2)).thenReturn(List.of(first, second));
            runSubmittedTasksInline();

            // When
            var dispatched = workerServer.pollOnce();

            // Then
            assertThat(dispatched).isEqualTo(2);
            verify(taskExecutorService).executeTask(first);
            verify(taskExecutorService).executeTask(second);
            assertThat(workerServer.getInFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should stop claiming while all workers are busy")
        void shouldNotClaimWhenSaturated() {
            // Given
            var pending = new ArrayList<Runnable>();
            doAnswer(inv -> {
                pending.add(inv.getArgument(0));
                return null;
            }).when(workerExecutor).execute(any(Runnable.class));
            when(taskExecutorService.claimDueTasks("default", 2)).thenReturn(List.of(task(), task()));

            // When
            workerServer.pollOnce();
            var secondCycle = workerServer.pollOnce();

            // Then
            assertThat(secondCycle).isZero();
            assertThat(workerServer.getInFlightCount()).isEqualTo(2);
            verify(taskExecutorService, times(1)).claimDueTasks(anyString(), anyInt());

            // When the workers finish
            pending.forEach(Runnable::run);

            // Then capacity is back
            assertThat(workerServer.getInFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should release the permit when a task throws")
        void shouldReleasePermitOnException() {
            // Given
            var failing = task();
            when(taskExecutorService.claimDueTasks("default", 2)).thenReturn(List.of(failing));
            when(taskExecutorService.executeTask(failing)).thenThrow(new IllegalStateException("boom"));
            runSubmittedTasksInline();

            // When
            workerServer.pollOnce();

            // Then
            assertThat(workerServer.getInFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should hand back the claim when the pool rejects the task")
        void shouldReleaseClaimOnRejection() {
            // Given
            var rejected = task();
            when(taskExecutorService.claimDueTasks("default", 2)).thenReturn(List.of(rejected));
            doThrow(new RejectedExecutionException("shutting down")).when(workerExecutor).execute(any(Runnable.class));

            // When
            workerServer.pollOnce();

            // Then
            verify(taskExecutorService).releaseClaim(rejected);
            assertThat(workerServer.getInFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should not poll when the worker is disabled")
        void shouldSkipWhenDisabled() {
            // Given
            properties.getWorker().setEnabled(false);

            // When
            workerServer.pollAndDispatch();

            // Then
            verify(taskExecutorService, never()).claimDueTasks(anyString(), anyInt());
        }

        @Test
        @DisplayName("Should keep polling after a claim failure")
        void shouldSurviveClaimFailure() {
            // Given
            when(taskExecutorService.claimDueTasks("default", 2)).thenThrow(new IllegalStateException("db down"));

            // When
            workerServer.pollAndDispatch();
            workerServer.pollAndDispatch();

            // Then
            verify(taskExecutorService, times(2)).claimDueTasks("default", 2);
        }
    }

    @Nested
    @DisplayName("Shutdown Tests")
    class ShutdownTests {

        @Test
        @DisplayName("Should wait for in-flight tasks")
        void shouldWaitForInFlightTasks() throws Exception {
            // Given
            when(workerExecutor.awaitTermination(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(true);

            // When
            workerServer.shutdown();

            // Then
            verify(workerExecutor).shutdown();
            verify(workerExecutor, never()).shutdownNow();
        }

        @Test
        @DisplayName("Should interrupt tasks still running after the shutdown timeout")
        void shouldInterruptAfterTimeout() throws Exception {
            // Given
            when(workerExecutor.awaitTermination(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(false);

            // When
            workerServer.shutdown();

            // Then
            verify(workerExecutor).shutdownNow();
        }

        @Test
        @DisplayName("Should stop claiming once shutdown started")
        void shouldStopPollingAfterShutdown() throws Exception {
            // Given
            when(workerExecutor.awaitTermination(anyLong(), any())).thenReturn(true);
            workerServer.shutdown();

            // When
            workerServer.pollAndDispatch();

            // Then
            verify(taskExecutorService, never()).claimDueTasks(anyString(), anyInt());
        }
    }
}
