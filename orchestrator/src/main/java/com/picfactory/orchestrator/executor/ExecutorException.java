package com.picfactory.orchestrator.executor;

/**
 * Classified failure raised inside an executor attempt.
 *
 * Never crosses the executor boundary: {@link #toResult()} turns it into the
 * TaskResult the scheduler understands.
 */
public class ExecutorException extends RuntimeException {

    public enum Kind { RATE_LIMITED, NON_RETRYABLE, RETRYABLE }

    private final Kind kind;
    private final long waitSeconds;

    private ExecutorException(Kind kind, String message, long waitSeconds, Throwable cause) {
        super(message, cause);
        this.kind        = kind;
        this.waitSeconds = waitSeconds;
    }

    public static ExecutorException rateLimited(long waitSeconds, String message) {
        return new ExecutorException(Kind.RATE_LIMITED, message, waitSeconds, null);
    }

    public static ExecutorException nonRetryable(String message) {
        return new ExecutorException(Kind.NON_RETRYABLE, message, 0, null);
    }

    public static ExecutorException retryable(String message) {
        return new ExecutorException(Kind.RETRYABLE, message, 0, null);
    }

    public static ExecutorException retryable(String message, Throwable cause) {
        return new ExecutorException(Kind.RETRYABLE, message, 0, cause);
    }

    public Kind getKind() { return kind; }

    public TaskResult toResult() {
        return switch (kind) {
            case RATE_LIMITED  -> TaskResult.rateLimited(waitSeconds, getMessage());
            case NON_RETRYABLE -> TaskResult.nonRetryable(getMessage());
            case RETRYABLE     -> TaskResult.retryable(getMessage());
        };
    }
}
