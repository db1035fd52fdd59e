package com.picfactory.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One submitted batch: every reference image paired with every prompt.
 *
 * The task list is the cross-product refs × prompts in reference-major
 * order and is fixed at creation; only the tasks themselves mutate.
 */
public class JobBundle {

    private final String               id;
    private final Instant              createdAt;
    private final String               outputDir;
    private final List<ReferenceImage> refs;
    private final List<PromptItem>     prompts;
    private final List<GenerationTask> tasks;

    public JobBundle(String id,
                     Instant createdAt,
                     String outputDir,
                     List<ReferenceImage> refs,
                     List<PromptItem> prompts,
                     List<GenerationTask> tasks) {
        this.id        = id;
        this.createdAt = createdAt;
        this.outputDir = outputDir;
        this.refs      = List.copyOf(refs);
        this.prompts   = List.copyOf(prompts);
        this.tasks     = List.copyOf(tasks);
    }

    public String               getId()        { return id; }
    public Instant              getCreatedAt() { return createdAt; }
    public String               getOutputDir() { return outputDir; }
    public List<ReferenceImage> getRefs()      { return refs; }
    public List<PromptItem>     getPrompts()   { return prompts; }
    public List<GenerationTask> getTasks()     { return tasks; }

    public Optional<GenerationTask> findTask(String taskId) {
        return tasks.stream().filter(t -> t.getId().equals(taskId)).findFirst();
    }

    public Optional<ReferenceImage> findRef(String refImageId) {
        return refs.stream().filter(r -> r.id().equals(refImageId)).findFirst();
    }

    public Optional<PromptItem> findPrompt(String promptId) {
        return prompts.stream().filter(p -> p.id().equals(promptId)).findFirst();
    }

    public long countByStatus(TaskStatus status) {
        return tasks.stream().filter(t -> t.getStatus() == status).count();
    }

    /** Snapshot with detached task copies. */
    public JobBundle copy() {
        return new JobBundle(id, createdAt, outputDir, refs, prompts,
                tasks.stream().map(GenerationTask::copy).toList());
    }
}
