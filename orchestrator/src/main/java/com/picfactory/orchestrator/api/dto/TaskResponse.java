package com.picfactory.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.picfactory.orchestrator.model.GenerationTask;
import com.picfactory.orchestrator.model.TaskStatus;

import java.util.List;

/**
 * Wire view of one task, used in job responses and "task-updated" events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        String       id,
        String       refImageId,
        String       promptId,
        TaskStatus   status,
        int          retryCount,
        List<String> outputPaths,
        String       errorMessage
) {
    public static TaskResponse from(GenerationTask t) {
        return new TaskResponse(
                t.getId(),
                t.getRefImageId(),
                t.getPromptId(),
                t.getStatus(),
                t.getRetryCount(),
                t.getOutputPaths(),
                t.getErrorMessage()
        );
    }
}
