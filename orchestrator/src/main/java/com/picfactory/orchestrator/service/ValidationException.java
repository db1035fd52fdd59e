package com.picfactory.orchestrator.service;

/**
 * Thrown when a job submission is unusable (no references or no prompts,
 * unwritable output directory). Nothing is stored when this is thrown.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
