package com.aistudio.orchestrator.repository;

import com.aistudio.orchestrator.model.Job;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local job store. Contents are lost on restart. */
@Repository
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void put(Job job) {
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Collection<Job> all() {
        return List.copyOf(jobs.values());
    }

    @Override
    public boolean remove(String id) {
        return jobs.remove(id) != null;
    }
}
