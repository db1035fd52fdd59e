package com.picfactory.orchestrator.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskResultTest {

    @Test
    void rateLimited_isRetryableAndCarriesWait() {
        TaskResult r = TaskResult.rateLimited(600, "slow down");

        assertThat(r.ok()).isFalse();
        assertThat(r.isRateLimited()).isTrue();
        assertThat(r.canRetry()).isTrue();
        assertThat(r.rateLimitSeconds()).isEqualTo(600);
    }

    @Test
    void success_isNeverRateLimited() {
        TaskResult r = new TaskResult(true, List.of("/out/a.png"), null, null, 30L);

        assertThat(r.isRateLimited()).isFalse();
    }

    @Test
    void nullOutputPaths_becomeEmptyList() {
        assertThat(new TaskResult(false, null, null, true, null).outputPaths()).isEmpty();
    }

    @Test
    void executorException_mapsEachKindToItsResult() {
        assertThat(ExecutorException.rateLimited(60, "wait").toResult().rateLimitSeconds()).isEqualTo(60);
        assertThat(ExecutorException.nonRetryable("not logged in").toResult().canRetry()).isFalse();
        assertThat(ExecutorException.retryable("timeout").toResult().canRetry()).isTrue();
    }

    @Test
    void disabledExecutor_failsWithoutRetry() {
        TaskResult r = new DisabledTaskExecutor().execute(null);

        assertThat(r.ok()).isFalse();
        assertThat(r.canRetry()).isFalse();
        assertThat(r.reason()).contains("not enabled");
    }

    @Test
    void json_omitsAbsentOptionalFields() throws Exception {
        String json = new ObjectMapper().writeValueAsString(TaskResult.nonRetryable("nope"));

        assertThat(json).contains("\"retryable\":false").doesNotContain("rateLimitSeconds").doesNotContain("rateLimited");
    }
}
