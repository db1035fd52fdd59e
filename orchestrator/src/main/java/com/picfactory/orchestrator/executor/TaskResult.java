package com.picfactory.orchestrator.executor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one attempt, as interpreted by the JobScheduler:
 * <ul>
 *   <li>{@code ok}                       → task done with {@code outputPaths}</li>
 *   <li>{@code rateLimitSeconds} present → cool down, then re-queue (no retry consumed)</li>
 *   <li>{@code retryable}                → re-queue with exponential backoff until retries run out</li>
 *   <li>otherwise                        → task error</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        boolean      ok,
        List<String> outputPaths,
        String       reason,
        Boolean      retryable,
        Long         rateLimitSeconds
) {
    public TaskResult {
        outputPaths = outputPaths == null ? List.of() : List.copyOf(outputPaths);
    }

    public static TaskResult success(List<String> outputPaths) {
        return new TaskResult(true, outputPaths, null, null, null);
    }

    public static TaskResult rateLimited(long waitSeconds, String reason) {
        return new TaskResult(false, List.of(), reason, true, waitSeconds);
    }

    public static TaskResult retryable(String reason) {
        return new TaskResult(false, List.of(), reason, true, null);
    }

    public static TaskResult nonRetryable(String reason) {
        return new TaskResult(false, List.of(), reason, false, null);
    }

    @JsonIgnore
    public boolean isRateLimited() {
        return !ok && rateLimitSeconds != null && rateLimitSeconds > 0;
    }

    public boolean canRetry() {
        return Boolean.TRUE.equals(retryable);
    }
}
