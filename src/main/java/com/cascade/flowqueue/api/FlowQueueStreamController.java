package com.cascade.flowqueue.api;

import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import com.cascade.flowqueue.service.FlowQueueStreamService;

@Slf4j
@RestController
@RequestMapping("/api/flow-queue")
@RequiredArgsConstructor
public class FlowQueueStreamController {

    private final FlowQueueStreamService streamService;

    /**
     * Live queue events: flow-added, flow-updated, flow-removed, flow-expired
     * GET /api/flow-queue/events
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        log.debug("Flow queue stream subscription requested");
        return streamService.subscribe();
    }

    @GetMapping("/events/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(Map.of("connectedClients", streamService.getConnectedClients()));
    }
}
