package com.picfactory.orchestrator.executor;

/**
 * Selected when neither the offline nor the live executor is enabled.
 * Fails every attempt without retrying so the operator sees the cause at once.
 */
public class DisabledTaskExecutor implements TaskExecutor {

    static final String REASON =
            "live executor is not enabled; set PICFACTORY_ENABLE_REAL_RUNNER=1 "
            + "(or PICFACTORY_MOCK_RUNNER=1 for offline runs) and retry";

    @Override
    public TaskResult execute(TaskInput input) {
        return TaskResult.nonRetryable(REASON);
    }
}
