package com.picfactory.orchestrator.model;

/**
 * One input image of a job. Immutable once created.
 */
public record ReferenceImage(String id, String filePath, String fileName) {}
