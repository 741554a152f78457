package com.cascade.flowqueue.api;

import java.util.Map;

import jakarta.validation.Valid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.cascade.flowqueue.model.FlowQueueStatus;
import com.cascade.flowqueue.model.FlowStatus;
import com.cascade.flowqueue.model.QueuedFlow;
import com.cascade.flowqueue.service.FlowQueueStore;

@RestController
@RequestMapping("/api/flow-queue")
public class FlowQueueController {

    private static final Logger logger = LoggerFactory.getLogger(FlowQueueController.class);

    private final FlowQueueStore store;

    public FlowQueueController(FlowQueueStore store) {
        this.store = store;
    }

    /**
     * Current queue status for the dashboard
     * GET /api/flow-queue/status
     */
    @GetMapping("/status")
    public ResponseEntity<FlowQueueStatus> getStatus() {
        return ResponseEntity.ok(store.snapshot());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getFlow(@PathVariable String id) {
        return store.findById(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(id));
    }

    /**
     * Admit (or merge) a delivery reported by a dispatch worker
     * POST /api/flow-queue
     */
    @PostMapping
    public ResponseEntity<QueuedFlow> admit(@Valid @RequestBody FlowAdmissionRequest req) {
        QueuedFlow flow = store.admit(req.toAdmission());
        return ResponseEntity.ok(flow);
    }

    /**
     * PUT /api/flow-queue/{id}/status
     */
    @PutMapping("/{id}/status")
    public ResponseEntity<?> updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest req) {
        FlowStatus status = FlowStatus.fromWireName(req.getStatus());
        return store.setStatus(id, status, req.getMessageIndex())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> remove(@PathVariable String id) {
        if (store.remove(id)) {
            return ResponseEntity.noContent().build();
        }
        return notFound(id);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        logger.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
            "error", ex.getMessage()
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null
                ? fieldError.getField() + " " + fieldError.getDefaultMessage()
                : "Invalid request";
        logger.warn("Invalid request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
            "error", message
        ));
    }

    private ResponseEntity<Map<String, Object>> notFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
            "error", "Queued flow not found",
            "id", id
        ));
    }
}
