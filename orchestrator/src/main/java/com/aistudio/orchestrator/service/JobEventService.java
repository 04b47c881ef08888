package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes job snapshots to Server-Sent-Event subscribers.
 *
 * Each subscriber gets a {@code connected} event, then one {@code job} event
 * per state change, optionally filtered to a single job. Emitters that fail
 * to send are dropped.
 */
@Service
public class JobEventService implements JobUpdateListener {

    private static final Logger log = LoggerFactory.getLogger(JobEventService.class);

    private record Subscriber(SseEmitter emitter, String jobId) {
        boolean wants(Job job) {
            return jobId == null || jobId.equals(job.id());
        }
    }

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    /**
     * @param jobId only stream this job, or null for every job
     */
    public SseEmitter subscribe(String jobId) {
        SseEmitter emitter = new SseEmitter(0L);
        Subscriber subscriber = new Subscriber(emitter, jobId);
        subscribers.add(subscriber);

        emitter.onCompletion(() -> subscribers.remove(subscriber));
        emitter.onTimeout(() -> subscribers.remove(subscriber));
        emitter.onError(ex -> subscribers.remove(subscriber));

        try {
            emitter.send(SseEmitter.event().name("connected").data(Map.of("subscribers", subscribers.size())));
        } catch (IOException e) {
            log.debug("SSE subscriber gone before first event: {}", e.getMessage());
            subscribers.remove(subscriber);
            emitter.completeWithError(e);
        }
        return emitter;
    }

    @Override
    public void onJobUpdated(Job job) {
        for (Subscriber subscriber : subscribers) {
            if (!subscriber.wants(job)) continue;
            try {
                subscriber.emitter().send(SseEmitter.event().name("job").id(job.id()).data(job));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                subscribers.remove(subscriber);
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
