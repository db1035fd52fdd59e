package com.picfactory.orchestrator.executor;

import com.picfactory.orchestrator.service.FileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Degraded executor used when no live remote surface is configured.
 *
 * Every attempt succeeds after a fixed latency and produces a copy of the
 * reference image as its output, so the scheduler's state machine can be
 * exercised end to end without a browser.
 */
public class OfflineTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(OfflineTaskExecutor.class);

    private final FileService files;
    private final Duration    latency;

    public OfflineTaskExecutor(FileService files, Duration latency) {
        this.files   = files;
        this.latency = latency;
    }

    @Override
    public TaskResult execute(TaskInput input) {
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskResult.retryable("offline executor interrupted");
        }

        try {
            Path output = files.saveOfflineOutput(
                    Path.of(input.refImage().filePath()),
                    input.outputDir(),
                    input.refImage().fileName(),
                    input.prompt().text());
            log.debug("Offline output for task {} written to {}", input.task().getId(), output);
            return TaskResult.success(List.of(output.toString()));
        } catch (UncheckedIOException e) {
            return TaskResult.retryable("could not write placeholder output: " + e.getMessage());
        }
    }
}
