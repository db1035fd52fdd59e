package com.picfactory.orchestrator.repository;

import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of job id → job runtime.
 *
 * Inserts and lookups are safe from any thread; the entries themselves are
 * mutated only by the JobScheduler under each job's own lock. Jobs live for
 * the lifetime of the process.
 */
@Repository
public class JobStore {

    private final Map<String, JobRuntime> jobs = new ConcurrentHashMap<>();

    public void save(JobRuntime runtime) {
        jobs.put(runtime.jobId(), runtime);
    }

    public Optional<JobRuntime> findById(String jobId) {
        return Optional.ofNullable(jobId).map(jobs::get);
    }

    public Collection<JobRuntime> findAll() {
        return List.copyOf(jobs.values());
    }

    public int count() {
        return jobs.size();
    }
}
