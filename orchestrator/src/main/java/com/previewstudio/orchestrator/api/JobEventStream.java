package com.previewstudio.orchestrator.api;

import com.previewstudio.orchestrator.config.PreviewProperties;
import com.previewstudio.orchestrator.event.JobEvent;
import com.previewstudio.orchestrator.event.Subscription;
import com.previewstudio.orchestrator.model.Job;
import com.previewstudio.orchestrator.model.JobStatus;
import com.previewstudio.orchestrator.service.JobOrchestrator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-sent event stream of one job's events.
 *
 * Wire format:
 *   event: connected   data: {"jobId": ...}
 *   event: {type}      data: {"type", "timestamp", "message", ...event data}
 *   : heartbeat        (comment, every preview.sse.heartbeat-interval)
 *   event: close       data: {}   (preview.sse.close-delay after a terminal event)
 *
 * A stream opened on a job that has already finished gets "connected"
 * followed by "close".
 */
@Component
public class JobEventStream {

    private static final Logger log = LoggerFactory.getLogger(JobEventStream.class);

    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-timers");
        t.setDaemon(true);
        return t;
    });

    private final JobOrchestrator orchestrator;
    private final Duration        heartbeatInterval;
    private final Duration        closeDelay;

    public JobEventStream(JobOrchestrator orchestrator, PreviewProperties properties) {
        this.orchestrator      = orchestrator;
        this.heartbeatInterval = properties.getSse().getHeartbeatInterval();
        this.closeDelay        = properties.getSse().getCloseDelay();
    }

    /**
     * Open a stream for the job.
     *
     * @throws com.previewstudio.orchestrator.service.JobNotFoundException before the stream starts
     */
    public SseEmitter open(String jobId) {
        Job job = orchestrator.getJobMeta(jobId);

        SseEmitter emitter = new SseEmitter(0L);
        Connection connection = new Connection(jobId, emitter);
        emitter.onCompletion(connection::release);
        emitter.onTimeout(connection::release);
        emitter.onError(e -> connection.release());

        connection.send(SseEmitter.event().name("connected").data(Map.of("jobId", jobId), MediaType.APPLICATION_JSON));
        if (job.getStatus().isTerminal()) {
            connection.scheduleClose();
            return emitter;
        }

        connection.subscription = orchestrator.subscribe(jobId, (id, event) -> connection.forward(event));
        long every = heartbeatInterval.toMillis();
        connection.heartbeat = timers.scheduleAtFixedRate(connection::heartbeat, every, every, TimeUnit.MILLISECONDS);
        if (connection.released.get()) {
            // Client left while we were subscribing.
            connection.subscription.close();
            connection.heartbeat.cancel(false);
            return emitter;
        }

        // Finished between the first read and the subscription: its last event was missed.
        if (orchestrator.getJobMeta(jobId).getStatus().isTerminal()) connection.scheduleClose();
        return emitter;
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
    }

    static Map<String, Object> payload(JobEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type",      event.type().value());
        data.put("timestamp", event.timestamp().toString());
        data.put("message",   event.message());
        data.putAll(event.data());
        return data;
    }

    static boolean endsStream(JobEvent event) {
        return event.type().isTerminal() || JobStatus.CANCELLED.value().equals(event.status());
    }

    // ------------------------------------------------------------------
    // One open stream
    // ------------------------------------------------------------------

    private final class Connection {

        private final String     jobId;
        private final SseEmitter emitter;
        private final AtomicBoolean closing  = new AtomicBoolean(false);
        private final AtomicBoolean released = new AtomicBoolean(false);

        private volatile Subscription       subscription;
        private volatile ScheduledFuture<?> heartbeat;

        Connection(String jobId, SseEmitter emitter) {
            this.jobId   = jobId;
            this.emitter = emitter;
        }

        void forward(JobEvent event) {
            send(SseEmitter.event()
                    .name(event.type().value())
                    .data(payload(event), MediaType.APPLICATION_JSON));
            if (endsStream(event)) scheduleClose();
        }

        void heartbeat() {
            send(SseEmitter.event().comment("heartbeat"));
        }

        void scheduleClose() {
            if (!closing.compareAndSet(false, true)) return;
            timers.schedule(() -> {
                if (send(SseEmitter.event().name("close").data(Map.of(), MediaType.APPLICATION_JSON))) {
                    emitter.complete();
                }
                release();
            }, closeDelay.toMillis(), TimeUnit.MILLISECONDS);
        }

        /** Returns false once the client is gone; the connection is released then. */
        synchronized boolean send(SseEmitter.SseEventBuilder event) {
            if (released.get()) return false;
            try {
                emitter.send(event);
                return true;
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE client of job {} went away: {}", jobId, e.getMessage());
                release();
                return false;
            }
        }

        void release() {
            if (!released.compareAndSet(false, true)) return;
            Subscription s = subscription;
            if (s != null) s.close();
            ScheduledFuture<?> h = heartbeat;
            if (h != null) h.cancel(false);
        }
    }
}
