package com.picfactory.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution state of a single GenerationTask.
 *
 * Transitions:
 *   QUEUED             → RUNNING            (picked by the job loop)
 *   QUEUED             → PAUSED             (job paused)
 *   PAUSED             → QUEUED             (job resumed)
 *   RUNNING            → DONE | ERROR       (executor result)
 *   RUNNING            → QUEUED | PAUSED    (retryable failure, retries left)
 *   RUNNING            → WAITING_RATE_LIMIT (remote surface asked us to back off)
 *   WAITING_RATE_LIMIT → QUEUED | PAUSED    (cooldown elapsed)
 *   any non-terminal   → CANCELLED          (job cancelled)
 *
 * DONE, ERROR and CANCELLED are terminal.
 */
public enum TaskStatus {
    QUEUED("queued"),
    RUNNING("running"),
    WAITING_RATE_LIMIT("waiting_rate_limit"),
    PAUSED("paused"),
    DONE("done"),
    ERROR("error"),
    CANCELLED("cancelled");

    // Statuses that keep a job alive.
    private static final Set<TaskStatus> ACTIVE =
            EnumSet.of(QUEUED, RUNNING, WAITING_RATE_LIMIT, PAUSED);

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isActive() { return ACTIVE.contains(this); }
}
