package com.picfactory.orchestrator.executor;

import com.picfactory.orchestrator.model.GenerationTask;
import com.picfactory.orchestrator.model.PromptItem;
import com.picfactory.orchestrator.model.ReferenceImage;

/**
 * Everything an executor needs for one attempt. {@code task} is a detached
 * copy; executors never mutate scheduler state.
 */
public record TaskInput(
        String         jobId,
        GenerationTask task,
        ReferenceImage refImage,
        PromptItem     prompt,
        String         outputDir
) {}
