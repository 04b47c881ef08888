package com.aistudio.orchestrator.repository;

import com.aistudio.orchestrator.model.Job;

import java.util.Collection;
import java.util.Optional;

/**
 * Storage for job snapshots.
 *
 * Implementations only need to be safe for concurrent single-key access;
 * {@code JobQueueManager} serializes every read-modify-write itself.
 */
public interface JobStore {

    void put(Job job);

    Optional<Job> get(String id);

    Collection<Job> all();

    boolean remove(String id);
}
