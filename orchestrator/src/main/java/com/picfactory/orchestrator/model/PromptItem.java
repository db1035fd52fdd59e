package com.picfactory.orchestrator.model;

/**
 * One prompt of a job. {@code text} is already trimmed and never blank.
 */
public record PromptItem(String id, String text) {}
