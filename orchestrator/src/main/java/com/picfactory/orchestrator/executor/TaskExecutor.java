package com.picfactory.orchestrator.executor;

/**
 * Performs exactly one attempt of one task against the remote surface.
 *
 * <p>Contract:
 * <ul>
 *   <li>Return {@link TaskResult#success} only with positive evidence that new
 *       output was produced for this task.</li>
 *   <li>A detected rate limit is reported as {@link TaskResult#rateLimited}
 *       and takes precedence over any other classification.</li>
 *   <li>Authentication failures are non-retryable and their reason says
 *       "not logged in".</li>
 *   <li>Everything else is retryable.</li>
 *   <li>Expected failures are returned, never thrown. Anything that escapes
 *       is treated by the scheduler as a fault of the whole job loop.</li>
 * </ul>
 */
public interface TaskExecutor {

    TaskResult execute(TaskInput input);
}
