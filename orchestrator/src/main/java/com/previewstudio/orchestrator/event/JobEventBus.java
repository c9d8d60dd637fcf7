package com.previewstudio.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process pub/sub for job events.
 *
 * Delivery is synchronous on the emitting thread: subscribers of the job
 * first, then global subscribers, each in registration order. A subscriber
 * that throws is logged and skipped; it never reaches the emitter.
 */
@Component
public class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final Map<String, List<JobEventHandler>> byJob  = new ConcurrentHashMap<>();
    private final List<JobEventHandler>              global = new CopyOnWriteArrayList<>();

    public void emit(String jobId, JobEvent event) {
        List<JobEventHandler> handlers = byJob.get(jobId);
        if (handlers != null) {
            for (JobEventHandler handler : handlers) deliver(handler, jobId, event);
        }
        for (JobEventHandler handler : global) deliver(handler, jobId, event);
    }

    public Subscription subscribe(String jobId, JobEventHandler handler) {
        byJob.compute(jobId, (id, handlers) -> {
            List<JobEventHandler> list = handlers != null ? handlers : new CopyOnWriteArrayList<>();
            list.add(handler);
            return list;
        });
        return () -> unsubscribe(jobId, handler);
    }

    public boolean unsubscribe(String jobId, JobEventHandler handler) {
        boolean[] removed = {false};
        byJob.computeIfPresent(jobId, (id, handlers) -> {
            removed[0] = handlers.remove(handler);
            return handlers.isEmpty() ? null : handlers;
        });
        return removed[0];
    }

    public Subscription subscribeAll(JobEventHandler handler) {
        global.add(handler);
        return () -> global.remove(handler);
    }

    public int subscriberCount(String jobId) {
        List<JobEventHandler> handlers = byJob.get(jobId);
        return handlers == null ? 0 : handlers.size();
    }

    private void deliver(JobEventHandler handler, String jobId, JobEvent event) {
        try {
            handler.onEvent(jobId, event);
        } catch (RuntimeException e) {
            log.warn("Event handler failed for job {} ({} event): {}", jobId, event.type().value(), e.getMessage(), e);
        }
    }
}
