package com.picfactory.orchestrator.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.picfactory.orchestrator.model.TaskStatus;

/**
 * Progress snapshot of one job: how many tasks are done out of the total,
 * tagged with the status that triggered the snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobProgressEvent(
        String     jobId,
        int        completed,
        int        total,
        TaskStatus status,
        String     currentTaskId,
        String     message
) {}
