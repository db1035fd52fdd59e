package com.picfactory.orchestrator.api;

import com.picfactory.orchestrator.api.dto.TaskResponse;
import com.picfactory.orchestrator.event.Subscription;
import com.picfactory.orchestrator.service.JobScheduler;
import com.picfactory.orchestrator.session.RemoteSessionManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans scheduler and session events out to every connected SSE client.
 *
 * Event names: progress, task-updated, rate-limit, done, error, auth-state.
 * A client whose connection fails is dropped on the next send.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final List<SseEmitter>   emitters      = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions;

    public EventBroadcaster(JobScheduler scheduler, RemoteSessionManager sessions) {
        this.subscriptions = List.of(
                scheduler.onProgress(e -> send("progress", e)),
                scheduler.onTaskUpdated(t -> send("task-updated", TaskResponse.from(t))),
                scheduler.onRateLimit(e -> send("rate-limit", e)),
                scheduler.onDone(e -> send("done", e)),
                scheduler.onErrorEvent(e -> send("error", e)),
                sessions.onAuthState(s -> send("auth-state", s)));
    }

    /** Register a new client; it receives every event published from now on. */
    public SseEmitter connect() {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        log.debug("SSE client connected ({} open)", emitters.size());
        return emitter;
    }

    int clientCount() {
        return emitters.size();
    }

    void send(String name, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(name).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping SSE client after failed '{}' send: {}", name, e.getMessage());
                emitters.remove(emitter);
                emitter.completeWithError(e);
            }
        }
    }

    @PreDestroy
    public void close() {
        subscriptions.forEach(Subscription::unsubscribe);
        emitters.forEach(SseEmitter::complete);
        emitters.clear();
    }
}
