package com.picfactory.orchestrator.repository;

import com.picfactory.orchestrator.model.JobBundle;

/**
 * A stored job: its bundle plus the scheduling signals of its loop.
 */
public record JobRuntime(JobBundle bundle, RuntimeControl control) {

    public static JobRuntime idle(JobBundle bundle) {
        return new JobRuntime(bundle, new RuntimeControl());
    }

    public String jobId() {
        return bundle.getId();
    }
}
