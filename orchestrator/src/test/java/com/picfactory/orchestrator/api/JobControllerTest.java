package com.picfactory.orchestrator.api;

import com.picfactory.orchestrator.model.*;
import com.picfactory.orchestrator.service.JobScheduler;
import com.picfactory.orchestrator.service.NotFoundException;
import com.picfactory.orchestrator.service.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController and the shared exception mapping.
 * JobScheduler is mocked; no job loop runs.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc        mockMvc;
    @MockitoBean JobScheduler scheduler;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void createJob_validRequest_returns201WithQueuedTasks() throws Exception {
        when(scheduler.createJob(any(), any(), isNull())).thenReturn(fakeJob());

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refs":[{"filePath":"/tmp/cat.png"}],"prompts":["watercolor"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("job_1"))
                .andExpect(jsonPath("$.refs[0].fileName").value("cat.png"))
                .andExpect(jsonPath("$.tasks[0].status").value("queued"))
                .andExpect(jsonPath("$.tasks[0].retryCount").value(0))
                .andExpect(jsonPath("$.tasks[0].errorMessage").doesNotExist());
    }

    @Test
    void createJob_noPrompts_returns400WithMessage() throws Exception {
        when(scheduler.createJob(any(), any(), any()))
                .thenThrow(new ValidationException("at least one prompt is required"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refs":[{"filePath":"/tmp/cat.png"}],"prompts":[]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("at least one prompt is required"));
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_existingId_returns200() throws Exception {
        when(scheduler.getJob("job_1")).thenReturn(fakeJob());

        mockMvc.perform(get("/jobs/{id}", "job_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputDir").value("/tmp/out"))
                .andExpect(jsonPath("$.prompts[0].text").value("watercolor"));
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        when(scheduler.getJob(anyString())).thenThrow(new NotFoundException("job", "nope"));

        mockMvc.perform(get("/jobs/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("job not found: nope"));
    }

    // ------------------------------------------------------------------
    // Control commands
    // ------------------------------------------------------------------

    @Test
    void controlCommands_return202() throws Exception {
        mockMvc.perform(post("/jobs/{id}/start", "job_1")).andExpect(status().isAccepted());
        mockMvc.perform(post("/jobs/{id}/pause", "job_1")).andExpect(status().isAccepted());
        mockMvc.perform(post("/jobs/{id}/resume", "job_1")).andExpect(status().isAccepted());
        mockMvc.perform(post("/jobs/{id}/cancel", "job_1")).andExpect(status().isAccepted());

        verify(scheduler).start("job_1");
        verify(scheduler).pause("job_1");
        verify(scheduler).resume("job_1");
        verify(scheduler).cancel("job_1");
    }

    @Test
    void start_unknownJob_returns404() throws Exception {
        doThrow(new NotFoundException("job", "nope")).when(scheduler).start("nope");

        mockMvc.perform(post("/jobs/{id}/start", "nope"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobBundle fakeJob() {
        ReferenceImage ref    = new ReferenceImage("ref_1", "/tmp/cat.png", "cat.png");
        PromptItem     prompt = new PromptItem("prompt_1", "watercolor");
        GenerationTask task   = new GenerationTask("task_1", ref.id(), prompt.id());
        return new JobBundle("job_1", Instant.parse("2026-01-01T00:00:00Z"), "/tmp/out",
                List.of(ref), List.of(prompt), List.of(task));
    }
}
