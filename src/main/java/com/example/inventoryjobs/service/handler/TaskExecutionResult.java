package com.example.inventoryjobs.service.handler;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the result of a task execution.
 * <p>
 * Success or failure refers to the primary effect of the task only. Failures of
 * best-effort side channels (push, in-app notifications) are carried as auxiliary
 * failures and never change the outcome.
 */
@Data
@Builder
public class TaskExecutionResult {

    public static final String ERROR_TIMEOUT = "TIMEOUT";
    public static final String ERROR_INVALID_PAYLOAD = "INVALID_PAYLOAD";
    public static final String ERROR_UNKNOWN_TYPE = "UNKNOWN_TASK_TYPE";

    /**
     * Whether the primary effect happened
     */
    private boolean success;

    private String errorMessage;

    /**
     * Error type/classification for analysis
     */
    private String errorType;

    private String stackTrace;

    /**
     * Counters and identifiers worth logging, e.g. number of tasks enqueued
     */
    @Builder.Default
    private Map<String, Object> responseData = new HashMap<>();

    /**
     * Whether this failure may be retried. Non-retryable failures dead-letter immediately.
     */
    @Builder.Default
    private boolean retryable = true;

    /**
     * Best-effort channel failures, in the order they happened
     */
    @Builder.Default
    private List<String> auxiliaryFailures = new ArrayList<>();

    public static TaskExecutionResult success() {
        return TaskExecutionResult.builder().success(true).build();
    }

    public static TaskExecutionResult success(Map<String, Object> responseData) {
        return TaskExecutionResult.builder()
                .success(true)
                .responseData(responseData != null ? new HashMap<>(responseData) : new HashMap<>())
                .build();
    }

    public static TaskExecutionResult failure(String errorMessage, String errorType) {
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(true)
                .build();
    }

    /**
     * Create a failure result from a throwable
     */
    public static TaskExecutionResult failure(Throwable e) {
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getName())
                .errorType(e.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(e))
                .retryable(true)
                .build();
    }

    public static TaskExecutionResult failure(Throwable e, String errorType) {
        var result = failure(e);
        result.setErrorType(errorType);
        return result;
    }

    /**
     * Create a non-retryable failure (permanent failure)
     */
    public static TaskExecutionResult permanentFailure(String errorMessage, String errorType) {
        return TaskExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(false)
                .build();
    }

    public static TaskExecutionResult timeout(String errorMessage) {
        return failure(errorMessage, ERROR_TIMEOUT);
    }

    /**
     * Truncate stack trace to prevent database overflow
     */
    static String truncateStackTrace(Throwable e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }

    public TaskExecutionResult withResponseData(String key, Object value) {
        if (this.responseData == null) {
            this.responseData = new HashMap<>();
        }
        this.responseData.put(key, value);
        return this;
    }

    /**
     * Record a best-effort channel failure
     */
    public TaskExecutionResult withAuxiliaryFailure(String channel, String message) {
        if (this.auxiliaryFailures == null) {
            this.auxiliaryFailures = new ArrayList<>();
        }
        this.auxiliaryFailures.add(channel + ": " + message);
        return this;
    }

    public TaskExecutionResult withAuxiliaryFailures(List<String> failures) {
        failures.forEach(f -> {
            if (this.auxiliaryFailures == null) {
                this.auxiliaryFailures = new ArrayList<>();
            }
            this.auxiliaryFailures.add(f);
        });
        return this;
    }

    public boolean hasAuxiliaryFailures() {
        return auxiliaryFailures != null && !auxiliaryFailures.isEmpty();
    }
}
