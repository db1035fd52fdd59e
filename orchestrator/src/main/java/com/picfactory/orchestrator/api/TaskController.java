package com.picfactory.orchestrator.api;

import com.picfactory.orchestrator.service.JobScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * DELETE /tasks/{taskId}/output: remove a task's output files from disk.
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final JobScheduler scheduler;

    public TaskController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @DeleteMapping("/{taskId}/output")
    public ResponseEntity<Void> deleteOutput(@PathVariable String taskId) {
        scheduler.deleteOutput(taskId);
        return ResponseEntity.noContent().build();
    }
}
