package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.Job;

/**
 * Receives the new snapshot after every job state change.
 *
 * Called on the thread that made the change, after the registry lock is
 * released. Implementations must not block.
 */
@FunctionalInterface
public interface JobUpdateListener {

    void onJobUpdated(Job job);
}
