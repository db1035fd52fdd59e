package com.picfactory.orchestrator.service;

import com.picfactory.orchestrator.config.PicFactoryProperties;
import com.picfactory.orchestrator.event.JobDoneEvent;
import com.picfactory.orchestrator.event.JobErrorEvent;
import com.picfactory.orchestrator.event.JobProgressEvent;
import com.picfactory.orchestrator.event.ListenerRegistry;
import com.picfactory.orchestrator.event.RateLimitEvent;
import com.picfactory.orchestrator.event.Subscription;
import com.picfactory.orchestrator.executor.RateLimitDetector;
import com.picfactory.orchestrator.executor.TaskExecutor;
import com.picfactory.orchestrator.executor.TaskInput;
import com.picfactory.orchestrator.executor.TaskResult;
import com.picfactory.orchestrator.model.GenerationTask;
import com.picfactory.orchestrator.model.JobBundle;
import com.picfactory.orchestrator.model.PromptItem;
import com.picfactory.orchestrator.model.ReferenceImage;
import com.picfactory.orchestrator.model.ReferenceInput;
import com.picfactory.orchestrator.model.TaskStatus;
import com.picfactory.orchestrator.repository.JobRuntime;
import com.picfactory.orchestrator.repository.JobStore;
import com.picfactory.orchestrator.repository.RuntimeControl;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Owns every job's task state and runs one sequential loop per started job.
 *
 * Loop iteration:
 *  1. cancelled → final "cancelled" snapshot + done event, exit
 *  2. paused    → block until resumed or cancelled
 *  3. claim the first QUEUED task; none left → idle-wait or finish
 *  4. run it through the TaskExecutor (the only long blocking call)
 *  5. apply the result: done / rate-limit cooldown / retry with backoff / error
 *
 * Task state is mutated only while holding the job's RuntimeControl lock, by
 * the loop and by the control commands alike. Events are published after the
 * lock is released, on the thread that caused them.
 */
@Service
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    static final String DEFAULT_FAILURE_REASON = "task execution failed";
    static final String MISSING_DEPENDENCY     = "missing dependency";

    private final JobStore                         store;
    private final TaskExecutor                     executor;
    private final FileService                      files;
    private final Executor                         loopExecutor;
    private final PicFactoryProperties.Scheduler   config;
    private final PicFactoryProperties.Output      output;
    private final Clock                            clock;
    private final MeterRegistry                    meterRegistry;
    private final Timer                            attemptTimer;

    private final ListenerRegistry<JobProgressEvent> progressListeners = new ListenerRegistry<>("progress");
    private final ListenerRegistry<GenerationTask>   taskListeners     = new ListenerRegistry<>("task-updated");
    private final ListenerRegistry<RateLimitEvent>   rateLimitListeners = new ListenerRegistry<>("rate-limit");
    private final ListenerRegistry<JobDoneEvent>     doneListeners     = new ListenerRegistry<>("done");
    private final ListenerRegistry<JobErrorEvent>    errorListeners    = new ListenerRegistry<>("error");

    public JobScheduler(JobStore store,
                        TaskExecutor executor,
                        FileService files,
                        @Qualifier("jobLoopExecutor") Executor loopExecutor,
                        PicFactoryProperties properties,
                        Clock clock,
                        MeterRegistry meterRegistry) {
        this.store         = store;
        this.executor      = executor;
        this.files         = files;
        this.loopExecutor  = loopExecutor;
        this.config        = properties.getScheduler();
        this.output        = properties.getOutput();
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.attemptTimer  = Timer.builder("picfactory.task.duration")
                .description("Wall time of one executor attempt")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Observer registration
    // ------------------------------------------------------------------

    public Subscription onProgress(Consumer<? super JobProgressEvent> listener) {
        return progressListeners.subscribe(listener);
    }

    public Subscription onTaskUpdated(Consumer<? super GenerationTask> listener) {
        return taskListeners.subscribe(listener);
    }

    public Subscription onRateLimit(Consumer<? super RateLimitEvent> listener) {
        return rateLimitListeners.subscribe(listener);
    }

    public Subscription onDone(Consumer<? super JobDoneEvent> listener) {
        return doneListeners.subscribe(listener);
    }

    public Subscription onErrorEvent(Consumer<? super JobErrorEvent> listener) {
        return errorListeners.subscribe(listener);
    }

    // ------------------------------------------------------------------
    // Job submission and lookup
    // ------------------------------------------------------------------

    /**
     * Create a job holding every reference × prompt combination, all QUEUED.
     *
     * References are de-duplicated by file path (first one wins); prompts are
     * trimmed and blank ones dropped. Nothing is stored when validation fails.
     *
     * @throws ValidationException no usable reference, no usable prompt, or
     *                             an output directory that cannot be created
     */
    public JobBundle createJob(List<ReferenceInput> refs, List<String> prompts, String outputDir) {
        List<ReferenceImage> refImages   = toReferenceImages(refs);
        List<PromptItem>     promptItems = toPromptItems(prompts);
        if (refImages.isEmpty()) {
            throw new ValidationException("at least one reference image is required");
        }
        if (promptItems.isEmpty()) {
            throw new ValidationException("at least one non-empty prompt is required");
        }

        Path dir = resolveOutputDir(outputDir);
        try {
            files.ensureDir(dir);
        } catch (UncheckedIOException e) {
            throw new ValidationException("output directory cannot be created: " + dir, e);
        }

        List<GenerationTask> tasks = new ArrayList<>(refImages.size() * promptItems.size());
        for (ReferenceImage ref : refImages) {
            for (PromptItem prompt : promptItems) {
                tasks.add(new GenerationTask(newId("task"), ref.id(), prompt.id()));
            }
        }

        JobBundle bundle = new JobBundle(newId("job"), clock.instant(), dir.toString(),
                refImages, promptItems, tasks);
        JobRuntime runtime = JobRuntime.idle(bundle);
        store.save(runtime);
        log.info("Job {} created: {} reference(s) × {} prompt(s) = {} task(s), output={}",
                bundle.getId(), refImages.size(), promptItems.size(), tasks.size(), dir);

        progressListeners.publish(snapshot(runtime, TaskStatus.QUEUED, null, null));
        return getJob(bundle.getId());
    }

    /** Detached snapshot of the job and its tasks. */
    public JobBundle getJob(String jobId) {
        JobRuntime runtime = require(jobId);
        RuntimeControl control = runtime.control();
        control.lock();
        try {
            return runtime.bundle().copy();
        } finally {
            control.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Control commands
    // ------------------------------------------------------------------

    /**
     * Launch the job's loop. No-op while a loop is already running.
     * Starting a paused job re-queues its paused tasks first.
     */
    public void start(String jobId) {
        JobRuntime runtime = require(jobId);
        RuntimeControl control = runtime.control();
        List<GenerationTask> requeued;

        control.lock();
        try {
            if (control.isRunning()) {
                log.debug("Job {} is already running; start ignored", jobId);
                return;
            }
            control.setPaused(false);
            control.setCancelled(false);
            requeued = moveTasks(runtime.bundle(), TaskStatus.PAUSED, TaskStatus.QUEUED);
            control.setRunning(true);
        } finally {
            control.unlock();
        }
        requeued.forEach(taskListeners::publish);

        try {
            loopExecutor.execute(() -> runLoop(runtime));
        } catch (RejectedExecutionException e) {
            control.setRunning(false);
            throw e;
        }
        log.info("Job {} started", jobId);
    }

    /** Stop picking new tasks; queued tasks become PAUSED. In-flight work finishes its step. */
    public void pause(String jobId) {
        JobRuntime runtime = require(jobId);
        RuntimeControl control = runtime.control();
        List<GenerationTask> paused;

        control.lock();
        try {
            control.setPaused(true);
            paused = moveTasks(runtime.bundle(), TaskStatus.QUEUED, TaskStatus.PAUSED);
        } finally {
            control.unlock();
        }
        control.signalChange();

        paused.forEach(taskListeners::publish);
        progressListeners.publish(snapshot(runtime, TaskStatus.PAUSED, null, null));
        log.info("Job {} paused ({} task(s) held)", jobId, paused.size());
    }

    /** Paused tasks go back to QUEUED, then the job behaves as {@link #start}. */
    public void resume(String jobId) {
        JobRuntime runtime = require(jobId);
        RuntimeControl control = runtime.control();
        List<GenerationTask> requeued;

        control.lock();
        try {
            control.setPaused(false);
            requeued = moveTasks(runtime.bundle(), TaskStatus.PAUSED, TaskStatus.QUEUED);
        } finally {
            control.unlock();
        }
        control.signalChange();

        requeued.forEach(taskListeners::publish);
        log.info("Job {} resumed ({} task(s) re-queued)", jobId, requeued.size());
        start(jobId);
    }

    /**
     * Cancel every unfinished task right away. A result that arrives for an
     * in-flight attempt afterwards is discarded.
     */
    public void cancel(String jobId) {
        JobRuntime runtime = require(jobId);
        RuntimeControl control = runtime.control();
        List<GenerationTask> cancelled = new ArrayList<>();

        control.lock();
        try {
            control.setCancelled(true);
            for (GenerationTask task : runtime.bundle().getTasks()) {
                if (task.getStatus().isActive()) {
                    task.setStatus(TaskStatus.CANCELLED);
                    cancelled.add(task.copy());
                }
            }
        } finally {
            control.unlock();
        }
        control.signalChange();

        cancelled.forEach(taskListeners::publish);
        progressListeners.publish(snapshot(runtime, TaskStatus.CANCELLED, null, null));
        log.info("Job {} cancelled ({} task(s) stopped)", jobId, cancelled.size());
    }

    /**
     * Delete a task's output files and clear its output list.
     *
     * @throws NotFoundException no job owns {@code taskId}
     */
    public void deleteOutput(String taskId) {
        JobRuntime runtime = store.findAll().stream()
                .filter(r -> r.bundle().findTask(taskId).isPresent())
                .findFirst()
                .orElseThrow(() -> new NotFoundException("task", taskId));
        RuntimeControl control = runtime.control();
        List<String> paths;
        GenerationTask updated;

        control.lock();
        try {
            GenerationTask task = runtime.bundle().findTask(taskId).orElseThrow();
            paths = task.getOutputPaths();
            task.clearOutputPaths();
            updated = task.copy();
        } finally {
            control.unlock();
        }

        files.deleteFiles(paths);
        taskListeners.publish(updated);
        log.info("Deleted {} output file(s) of task {}", paths.size(), taskId);
    }

    // ------------------------------------------------------------------
    // Execution loop
    // ------------------------------------------------------------------

    private void runLoop(JobRuntime runtime) {
        String jobId = runtime.jobId();
        RuntimeControl control = runtime.control();
        log.info("Job {} loop running on {}", jobId, Thread.currentThread().getName());
        String inFlight = null;

        try {
            while (true) {
                if (control.isCancelled()) {
                    emitDone(runtime, TaskStatus.CANCELLED);
                    return;
                }
                if (control.isPaused()) {
                    control.awaitUnless(() -> !control.isPaused() || control.isCancelled(),
                            config.getPausePoll());
                    continue;
                }

                Optional<GenerationTask> claimed = claimNextQueued(runtime);
                if (claimed.isEmpty()) {
                    Optional<TaskStatus> finalStatus = completionStatus(runtime);
                    if (finalStatus.isPresent() && !control.isCancelled()) {
                        emitDone(runtime, finalStatus.get());
                        return;
                    }
                    if (finalStatus.isEmpty()) {
                        control.awaitUnless(
                                () -> control.isCancelled() || control.isPaused() || hasQueued(runtime),
                                config.getIdlePoll());
                    }
                    continue;
                }

                GenerationTask task = claimed.get();
                inFlight = task.getId();
                taskListeners.publish(task);
                progressListeners.publish(snapshot(runtime, TaskStatus.RUNNING, task.getId(), null));

                JobBundle bundle = runtime.bundle();
                Optional<ReferenceImage> ref    = bundle.findRef(task.getRefImageId());
                Optional<PromptItem>     prompt = bundle.findPrompt(task.getPromptId());
                if (ref.isEmpty() || prompt.isEmpty()) {
                    failMissingDependency(runtime, task.getId());
                    inFlight = null;
                    continue;
                }

                TaskResult result = attempt(runtime, task, ref.get(), prompt.get());
                applyResult(runtime, task.getId(), result);
                inFlight = null;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} loop interrupted; stopping", jobId);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Job {} loop failed: {}", jobId, message, e);
            if (inFlight != null) {
                releaseAfterFault(runtime, inFlight, message);
            }
            errorListeners.publish(new JobErrorEvent(jobId, message));
            progressListeners.publish(snapshot(runtime, TaskStatus.ERROR, null, message));
        } finally {
            control.setRunning(false);
        }
    }

    /**
     * Put the task that was in flight when the loop failed back in the queue,
     * so a later start picks it up again instead of idling on it forever.
     */
    private void releaseAfterFault(JobRuntime runtime, String taskId, String message) {
        RuntimeControl control = runtime.control();
        GenerationTask updated;
        control.lock();
        try {
            GenerationTask task = runtime.bundle().findTask(taskId).orElseThrow();
            TaskStatus status = task.getStatus();
            if (status != TaskStatus.RUNNING && status != TaskStatus.WAITING_RATE_LIMIT) {
                return;
            }
            task.setStatus(control.isPaused() ? TaskStatus.PAUSED : TaskStatus.QUEUED);
            task.setErrorMessage(message);
            updated = task.copy();
        } finally {
            control.unlock();
        }
        log.warn("Job {} task {} released to {} after loop failure", runtime.jobId(), taskId,
                updated.getStatus().wireName());
        taskListeners.publish(updated);
    }

    private Optional<GenerationTask> claimNextQueued(JobRuntime runtime) {
        RuntimeControl control = runtime.control();
        control.lock();
        try {
            if (control.isCancelled() || control.isPaused()) {
                return Optional.empty();
            }
            return runtime.bundle().getTasks().stream()
                    .filter(t -> t.getStatus() == TaskStatus.QUEUED)
                    .findFirst()
                    .map(t -> {
                        t.setStatus(TaskStatus.RUNNING);
                        return t.copy();
                    });
        } finally {
            control.unlock();
        }
    }

    /** Final job status once no task is active; empty while work remains. */
    private Optional<TaskStatus> completionStatus(JobRuntime runtime) {
        RuntimeControl control = runtime.control();
        control.lock();
        try {
            List<GenerationTask> tasks = runtime.bundle().getTasks();
            if (tasks.stream().anyMatch(t -> t.getStatus().isActive())) {
                return Optional.empty();
            }
            boolean anyError = tasks.stream().anyMatch(t -> t.getStatus() == TaskStatus.ERROR);
            return Optional.of(anyError ? TaskStatus.ERROR : TaskStatus.DONE);
        } finally {
            control.unlock();
        }
    }

    private boolean hasQueued(JobRuntime runtime) {
        return runtime.bundle().countByStatus(TaskStatus.QUEUED) > 0;
    }

    private void failMissingDependency(JobRuntime runtime, String taskId) {
        RuntimeControl control = runtime.control();
        GenerationTask updated;
        control.lock();
        try {
            GenerationTask task = runtime.bundle().findTask(taskId).orElseThrow();
            if (task.getStatus() == TaskStatus.CANCELLED) {
                return;
            }
            task.setStatus(TaskStatus.ERROR);
            task.setErrorMessage(MISSING_DEPENDENCY);
            updated = task.copy();
        } finally {
            control.unlock();
        }
        log.warn("Job {} task {}: reference or prompt is missing", runtime.jobId(), taskId);
        taskListeners.publish(updated);
        progressListeners.publish(snapshot(runtime, TaskStatus.ERROR, taskId,
                "Task " + taskId + " failed: " + MISSING_DEPENDENCY));
    }

    /** One executor call, with per-task MDC and timing. */
    private TaskResult attempt(JobRuntime runtime, GenerationTask task, ReferenceImage ref, PromptItem prompt) {
        MDC.put("jobId", runtime.jobId());
        MDC.put("taskId", task.getId());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.info("Attempt {} for task {} (ref={}, prompt=\"{}\")",
                    task.getRetryCount() + 1, task.getId(), ref.fileName(), abbreviate(prompt.text()));
            TaskResult result = executor.execute(
                    new TaskInput(runtime.jobId(), task, ref, prompt, runtime.bundle().getOutputDir()));
            if (result == null) {
                throw new IllegalStateException("executor returned no result for task " + task.getId());
            }
            return result;
        } finally {
            sample.stop(attemptTimer);
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Result interpretation
    // ------------------------------------------------------------------

    private void applyResult(JobRuntime runtime, String taskId, TaskResult result) throws InterruptedException {
        RuntimeControl control = runtime.control();
        GenerationTask task = runtime.bundle().findTask(taskId).orElseThrow();

        GenerationTask   updated;
        JobProgressEvent progress  = null;
        RateLimitEvent   rateLimit = null;
        long             backoffMs = 0;
        String           outcome;

        control.lock();
        try {
            if (control.isCancelled() || task.getStatus() == TaskStatus.CANCELLED) {
                log.info("Job {} task {}: result discarded after cancellation", runtime.jobId(), taskId);
                countAttempt("discarded");
                return;
            }

            if (result.ok()) {
                task.setStatus(TaskStatus.DONE);
                task.setOutputPaths(result.outputPaths());
                task.setErrorMessage(null);
                outcome  = "success";
                progress = snapshot(runtime, TaskStatus.RUNNING, taskId, null);

            } else if (result.isRateLimited()) {
                long seconds = RateLimitDetector.clampWaitSeconds(result.rateLimitSeconds());
                task.setStatus(TaskStatus.WAITING_RATE_LIMIT);
                task.setErrorMessage(reasonOf(result));
                outcome   = "rate_limited";
                rateLimit = new RateLimitEvent(runtime.jobId(), seconds,
                        clock.instant().plusSeconds(seconds).toString());

            } else {
                task.incrementRetryCount();
                task.setErrorMessage(reasonOf(result));
                if (result.canRetry() && task.getRetryCount() <= config.getMaxRetry()) {
                    task.setStatus(control.isPaused() ? TaskStatus.PAUSED : TaskStatus.QUEUED);
                    outcome   = "retryable";
                    backoffMs = config.getBackoffBase().toMillis() * (1L << (task.getRetryCount() - 1));
                } else {
                    task.setStatus(TaskStatus.ERROR);
                    outcome  = result.canRetry() ? "retryable" : "non_retryable";
                    progress = snapshot(runtime, TaskStatus.ERROR, taskId,
                            "Task " + taskId + " failed: " + task.getErrorMessage());
                }
            }
            updated = task.copy();
        } finally {
            control.unlock();
        }

        countAttempt(outcome);
        log.info("Job {} task {} → {} (retries={}{})", runtime.jobId(), taskId,
                updated.getStatus().wireName(), updated.getRetryCount(),
                updated.getErrorMessage() != null ? ", reason=" + updated.getErrorMessage() : "");

        taskListeners.publish(updated);
        if (progress != null) {
            progressListeners.publish(progress);
        }
        if (rateLimit != null) {
            rateLimitListeners.publish(rateLimit);
            waitForRateLimit(runtime, rateLimit.waitSeconds());
            requeueAfterCooldown(runtime, task);
        } else if (backoffMs > 0) {
            // Plain sleep: control signals do not shorten the backoff.
            Thread.sleep(backoffMs);
        }
    }

    /**
     * Count down {@code seconds} of cooldown. Paused time does not count and
     * cancellation ends the wait. A progress update is published each time the
     * remaining time crosses a multiple of five seconds, down to zero.
     */
    private void waitForRateLimit(JobRuntime runtime, long seconds) throws InterruptedException {
        RuntimeControl control = runtime.control();
        Duration remaining    = Duration.ofSeconds(seconds);
        long     lastReported = seconds;
        Instant  last         = clock.instant();

        while (!control.isCancelled() && remaining.compareTo(Duration.ZERO) > 0) {
            control.awaitUnless(control::isCancelled, config.getRateLimitTick());
            if (control.isCancelled()) {
                break;
            }
            Instant now = clock.instant();
            if (control.isPaused()) {
                last = now;
                continue;
            }
            remaining = remaining.minus(Duration.between(last, now));
            last = now;

            long remainingSeconds = ceilSeconds(remaining);
            if (lastReported > 0 && remainingSeconds <= ((lastReported - 1) / 5) * 5) {
                lastReported = remainingSeconds;
                progressListeners.publish(snapshot(runtime, TaskStatus.WAITING_RATE_LIMIT, null,
                        "Rate-limit cooldown: " + remainingSeconds + "s remaining"));
            }
        }
    }

    private void requeueAfterCooldown(JobRuntime runtime, GenerationTask task) {
        RuntimeControl control = runtime.control();
        GenerationTask updated;
        control.lock();
        try {
            if (control.isCancelled() || task.getStatus() != TaskStatus.WAITING_RATE_LIMIT) {
                return;
            }
            task.setStatus(control.isPaused() ? TaskStatus.PAUSED : TaskStatus.QUEUED);
            updated = task.copy();
        } finally {
            control.unlock();
        }
        log.info("Job {} task {}: cooldown over, back to {}", runtime.jobId(), task.getId(),
                updated.getStatus().wireName());
        taskListeners.publish(updated);
    }

    private void emitDone(JobRuntime runtime, TaskStatus finalStatus) {
        progressListeners.publish(snapshot(runtime, finalStatus, null, null));
        doneListeners.publish(new JobDoneEvent(runtime.jobId(), finalStatus));
        log.info("Job {} finished: {}", runtime.jobId(), finalStatus.wireName());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobRuntime require(String jobId) {
        return store.findById(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    private JobProgressEvent snapshot(JobRuntime runtime, TaskStatus status, String currentTaskId, String message) {
        RuntimeControl control = runtime.control();
        control.lock();
        try {
            JobBundle bundle = runtime.bundle();
            return new JobProgressEvent(runtime.jobId(),
                    (int) bundle.countByStatus(TaskStatus.DONE),
                    bundle.getTasks().size(),
                    status, currentTaskId, message);
        } finally {
            control.unlock();
        }
    }

    /** Caller holds the job lock. */
    private static List<GenerationTask> moveTasks(JobBundle bundle, TaskStatus from, TaskStatus to) {
        List<GenerationTask> moved = new ArrayList<>();
        for (GenerationTask task : bundle.getTasks()) {
            if (task.getStatus() == from) {
                task.setStatus(to);
                moved.add(task.copy());
            }
        }
        return moved;
    }

    private void countAttempt(String outcome) {
        Counter.builder("picfactory.task.attempts")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private Path resolveOutputDir(String outputDir) {
        if (outputDir != null && !outputDir.isBlank()) {
            try {
                return Path.of(outputDir.trim());
            } catch (InvalidPathException e) {
                throw new ValidationException("invalid output directory: " + outputDir, e);
            }
        }
        Path configured = output.getDefaultDir();
        Path root = configured != null && !configured.toString().isBlank()
                ? configured
                : Path.of(System.getProperty("user.home"), "Downloads", "PicFactory");
        return root.resolve("job-" + LocalDate.now(clock));
    }

    private static List<ReferenceImage> toReferenceImages(List<ReferenceInput> refs) {
        Map<String, ReferenceImage> byPath = new LinkedHashMap<>();
        if (refs != null) {
            for (ReferenceInput ref : refs) {
                if (ref == null || ref.filePath() == null || ref.filePath().isBlank()) {
                    continue;
                }
                String path = ref.filePath().trim();
                byPath.putIfAbsent(path, new ReferenceImage(newId("ref"), path, ref.resolvedFileName()));
            }
        }
        return List.copyOf(byPath.values());
    }

    private static List<PromptItem> toPromptItems(List<String> prompts) {
        if (prompts == null) {
            return List.of();
        }
        return prompts.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> new PromptItem(newId("prompt"), p.trim()))
                .toList();
    }

    private static String reasonOf(TaskResult result) {
        return result.reason() != null && !result.reason().isBlank() ? result.reason() : DEFAULT_FAILURE_REASON;
    }

    private static long ceilSeconds(Duration d) {
        long millis = d.toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }
}
