package com.cascade.flowqueue.service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.cascade.flowqueue.config.FlowQueueProperties;
import com.cascade.flowqueue.event.FlowQueueEvent;

/**
 * Pushes queue events to connected dashboards over Server-Sent Events.
 * <p>
 * Events are handed to a single sender thread so the store is never held up by slow clients,
 * and clients still see them in emission order. Clients only receive events emitted after
 * they connect.
 */
@Slf4j
@Service
public class FlowQueueStreamService {

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final ExecutorService sender = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "flow-queue-sse");
        t.setDaemon(true);
        return t;
    });
    private final long emitterTimeoutMs;

    public FlowQueueStreamService(FlowQueueProperties properties) {
        this.emitterTimeoutMs = properties.getStream().getEmitterTimeout().toMillis();
    }

    public SseEmitter subscribe() {
        return register(new SseEmitter(emitterTimeoutMs));
    }

    SseEmitter register(SseEmitter emitter) {
        emitter.onCompletion(() -> unsubscribe(emitter));
        emitter.onTimeout(() -> {
            emitter.complete();
            unsubscribe(emitter);
        });
        emitter.onError(e -> unsubscribe(emitter));
        emitters.add(emitter);
        log.info("Flow queue stream client connected ({} active)", emitters.size());
        return emitter;
    }

    @EventListener
    public void onFlowQueueEvent(FlowQueueEvent event) {
        if (emitters.isEmpty()) {
            return;
        }
        try {
            sender.execute(() -> broadcast(event));
        } catch (RejectedExecutionException e) {
            log.debug("Stream sender stopped, dropping {} for {}", event.getType().getEventName(),
                    event.getQueuedFlowId());
        }
    }

    public int getConnectedClients() {
        return emitters.size();
    }

    void broadcast(FlowQueueEvent event) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(event.getType().getEventName())
                        .data(event.getPayload(), MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping flow queue stream client: {}", e.getMessage());
                emitter.completeWithError(e);
                unsubscribe(emitter);
            }
        }
    }

    private void unsubscribe(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("Flow queue stream client disconnected ({} active)", emitters.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        for (SseEmitter emitter : emitters) {
            emitter.complete();
        }
        emitters.clear();
        sender.shutdown();
        try {
            sender.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
