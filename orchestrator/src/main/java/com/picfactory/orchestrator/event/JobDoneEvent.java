package com.picfactory.orchestrator.event;

import com.picfactory.orchestrator.model.TaskStatus;

/** Final status of a job loop: DONE, ERROR or CANCELLED. */
public record JobDoneEvent(String jobId, TaskStatus finalStatus) {}
