package com.picfactory.orchestrator.api;

import com.picfactory.orchestrator.api.dto.CreateJobRequest;
import com.picfactory.orchestrator.api.dto.JobResponse;
import com.picfactory.orchestrator.model.JobBundle;
import com.picfactory.orchestrator.service.JobScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for job lifecycle.
 *
 * POST /jobs                create a job (every ref × every prompt, all queued)
 * GET  /jobs/{id}           current snapshot of a job and its tasks
 * POST /jobs/{id}/start     launch the job loop (no-op if already running)
 * POST /jobs/{id}/pause     hold queued tasks
 * POST /jobs/{id}/resume    release held tasks and continue
 * POST /jobs/{id}/cancel    cancel every unfinished task
 *
 * Progress is pushed over GET /events rather than polled.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobScheduler scheduler;

    public JobController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Create a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"refs":[{"filePath":"/tmp/cat.png"}],"prompts":["watercolor","pixel art"]}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody CreateJobRequest req) {
        JobBundle job = scheduler.createJob(req.referenceInputs(), req.prompts(), req.outputDir());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable String id) {
        return JobResponse.from(scheduler.getJob(id));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<Void> start(@PathVariable String id) {
        scheduler.start(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@PathVariable String id) {
        scheduler.pause(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@PathVariable String id) {
        scheduler.resume(id);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String id) {
        scheduler.cancel(id);
        return ResponseEntity.accepted().build();
    }
}
