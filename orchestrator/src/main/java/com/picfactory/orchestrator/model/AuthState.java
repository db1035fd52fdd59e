package com.picfactory.orchestrator.model;

import java.time.Instant;

/**
 * Snapshot of the remote login state, pushed as the {@code auth-state} event.
 */
public record AuthState(AuthStage stage, Instant checkedAt, String message) {}
