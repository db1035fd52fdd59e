package com.picfactory.orchestrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One (reference image, prompt) unit of work within a JobBundle.
 *
 * Created once when the job is submitted and never removed. Only the
 * JobScheduler mutates it, always while holding the owning job's lock;
 * observers receive {@link #copy()} snapshots.
 */
public class GenerationTask {

    private final String id;
    private final String refImageId;
    private final String promptId;

    private TaskStatus status = TaskStatus.QUEUED;

    // Only ever increases.
    private int retryCount = 0;

    private List<String> outputPaths = new ArrayList<>();

    // Last failure reason; cleared on success.
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public GenerationTask(String id, String refImageId, String promptId) {
        this.id         = id;
        this.refImageId = refImageId;
        this.promptId   = promptId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()           { return id; }
    public String       getRefImageId()   { return refImageId; }
    public String       getPromptId()     { return promptId; }
    public TaskStatus   getStatus()       { return status; }
    public int          getRetryCount()   { return retryCount; }
    public List<String> getOutputPaths()  { return List.copyOf(outputPaths); }
    public String       getErrorMessage() { return errorMessage; }

    public void setStatus(TaskStatus status)          { this.status = status; }
    public void setErrorMessage(String errorMessage)  { this.errorMessage = errorMessage; }
    public void setOutputPaths(List<String> paths)    { this.outputPaths = new ArrayList<>(paths); }
    public void clearOutputPaths()                    { this.outputPaths = new ArrayList<>(); }
    public void incrementRetryCount()                 { this.retryCount++; }

    /** Detached copy handed to observers and executors. */
    public GenerationTask copy() {
        GenerationTask c = new GenerationTask(id, refImageId, promptId);
        c.status       = status;
        c.retryCount   = retryCount;
        c.outputPaths  = new ArrayList<>(outputPaths);
        c.errorMessage = errorMessage;
        return c;
    }
}
