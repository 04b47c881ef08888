package com.aistudio.orchestrator.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool that runs job bodies.
 *
 * Every worker may hold an open provider call; the pool size caps concurrent
 * text and image requests.
 */
@Configuration
public class JobWorkerConfig {

    @Bean(name = "jobWorkers", destroyMethod = "shutdown")
    public ExecutorService jobWorkers(@Value("${ai-studio.jobs.worker-threads:4}") int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workerThreads, factory);
    }
}
