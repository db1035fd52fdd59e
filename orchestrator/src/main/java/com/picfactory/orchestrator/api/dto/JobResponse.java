package com.picfactory.orchestrator.api.dto;

import com.picfactory.orchestrator.model.JobBundle;
import com.picfactory.orchestrator.model.PromptItem;
import com.picfactory.orchestrator.model.ReferenceImage;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /jobs and GET /jobs/{id}.
 */
public record JobResponse(
        String               id,
        Instant              createdAt,
        String               outputDir,
        List<ReferenceImage> refs,
        List<PromptItem>     prompts,
        List<TaskResponse>   tasks
) {
    public static JobResponse from(JobBundle job) {
        return new JobResponse(
                job.getId(),
                job.getCreatedAt(),
                job.getOutputDir(),
                job.getRefs(),
                job.getPrompts(),
                job.getTasks().stream().map(TaskResponse::from).toList()
        );
    }
}
