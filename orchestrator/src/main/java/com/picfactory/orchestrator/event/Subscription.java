package com.picfactory.orchestrator.event;

/**
 * Handle returned by every {@code onXxx} registration method.
 * Calling {@link #unsubscribe()} more than once is harmless.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
