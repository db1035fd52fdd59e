package com.picfactory.orchestrator.event;

/** Job-level failure of the execution loop itself (not of a single task). */
public record JobErrorEvent(String jobId, String message) {}
