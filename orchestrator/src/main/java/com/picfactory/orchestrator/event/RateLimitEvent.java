package com.picfactory.orchestrator.event;

/**
 * Emitted once per rate-limited attempt. {@code resumeAtIso} is the instant
 * the cooldown ends if the job is not paused in the meantime.
 */
public record RateLimitEvent(String jobId, long waitSeconds, String resumeAtIso) {}
