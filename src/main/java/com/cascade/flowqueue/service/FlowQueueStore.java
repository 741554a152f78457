package com.cascade.flowqueue.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.cascade.flowqueue.event.FlowQueueEventNotifier;
import com.cascade.flowqueue.model.FlowAdmission;
import com.cascade.flowqueue.model.FlowQueueStatus;
import com.cascade.flowqueue.model.FlowStatus;
import com.cascade.flowqueue.model.QueuedFlow;

/**
 * In-memory registry of flow deliveries currently tracked for the dashboard.
 * <p>
 * All reads and writes go through a single lock; events are published while it is held so
 * listeners observe them in mutation order. Entries never leave the store: callers and
 * listeners always receive copies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowQueueStore {

    private static final Comparator<QueuedFlow> DISPLAY_ORDER = Comparator
            .comparing((QueuedFlow flow) -> flow.isActive() ? 0 : 1)
            .thenComparing(QueuedFlow::getLastUpdated, Comparator.reverseOrder());

    private final FlowQueueEventNotifier notifier;
    private final ThroughputTracker throughputTracker;
    private final Clock clock;

    // insertion order is the estimator's processing order
    private final Map<String, QueuedFlow> flows = new LinkedHashMap<>();
    private final Object lock = new Object();

    /**
     * Registers a delivery, or merges into the active delivery of the same flow to the same recipient.
     */
    public QueuedFlow admit(FlowAdmission admission) {
        synchronized (lock) {
            Instant now = clock.instant();
            QueuedFlow existing = findActiveLocked(admission.getFlowId(), admission.getRecipientNumber());

            if (existing != null) {
                merge(existing, admission);
                existing.setLastUpdated(now);
                QueuedFlow merged = existing.copy();
                log.debug("Merged admission into {} (flow={}, recipient={}, index={}/{})",
                        merged.getId(), merged.getFlowId(), merged.getRecipientNumber(),
                        merged.getMessageIndex(), merged.getTotalMessages());
                notifier.flowUpdated(merged);
                return merged;
            }

            QueuedFlow created = QueuedFlow.builder()
                    .id(newId(now))
                    .flowId(admission.getFlowId())
                    .flowName(admission.getFlowName())
                    .instanceId(admission.getInstanceId())
                    .instanceName(admission.getInstanceName())
                    .recipientNumber(admission.getRecipientNumber())
                    .recipientName(admission.getRecipientName())
                    .status(admission.getStatus() != null ? admission.getStatus() : FlowStatus.PENDING)
                    .scheduledTime(admission.getScheduledTime() != null ? admission.getScheduledTime() : now)
                    .messageIndex(admission.getMessageIndex() != null ? admission.getMessageIndex() : 0)
                    .totalMessages(admission.getTotalMessages() != null ? admission.getTotalMessages() : 0)
                    .triggerKeyword(admission.getTriggerKeyword())
                    .triggerMessage(admission.getTriggerMessage())
                    .createdAt(now)
                    .lastUpdated(now)
                    .build();
            clampProgress(created);

            flows.put(created.getId(), created);
            log.info("Queued flow {} ({}) for {} via instance {}: {} message(s)",
                    created.getId(), created.getFlowName(), created.getRecipientNumber(),
                    created.getInstanceId(), created.getTotalMessages());

            QueuedFlow snapshot = created.copy();
            notifier.flowAdded(snapshot);
            return snapshot;
        }
    }

    /**
     * Updates the status (and optionally the progress cursor) of a tracked delivery.
     * <p>
     * Returns empty when the id is unknown; the entry may already have been swept, so callers
     * treat that as a no-op. Entries already sent or failed are left as they are.
     */
    public Optional<QueuedFlow> setStatus(String id, FlowStatus status, Integer messageIndex) {
        Objects.requireNonNull(status, "status");
        synchronized (lock) {
            QueuedFlow flow = flows.get(id);
            if (flow == null) {
                log.debug("Status update {} for unknown queued flow {} ignored", status, id);
                return Optional.empty();
            }
            if (flow.getStatus().isTerminal()) {
                log.debug("Queued flow {} already {}, ignoring update to {}", id, flow.getStatus(), status);
                return Optional.of(flow.copy());
            }

            flow.setStatus(status);
            if (messageIndex != null) {
                flow.setMessageIndex(messageIndex);
                clampProgress(flow);
            }
            flow.setLastUpdated(clock.instant());

            if (status.isTerminal()) {
                throughputTracker.recordCompletion();
                log.info("Queued flow {} finished as {} ({}/{})", id, status,
                        flow.getMessageIndex(), flow.getTotalMessages());
            }

            QueuedFlow updated = flow.copy();
            notifier.flowUpdated(updated);
            return Optional.of(updated);
        }
    }

    public Optional<QueuedFlow> setStatus(String id, FlowStatus status) {
        return setStatus(id, status, null);
    }

    public boolean remove(String id) {
        synchronized (lock) {
            QueuedFlow removed = flows.remove(id);
            if (removed == null) {
                return false;
            }
            log.info("Removed queued flow {}", id);
            notifier.flowRemoved(id);
            return true;
        }
    }

    public Optional<QueuedFlow> findById(String id) {
        synchronized (lock) {
            QueuedFlow flow = flows.get(id);
            return flow != null ? Optional.of(flow.copy()) : Optional.empty();
        }
    }

    /**
     * The pending or sending delivery of {@code flowId} to {@code recipientNumber}, if any.
     */
    public Optional<QueuedFlow> findActive(String flowId, String recipientNumber) {
        synchronized (lock) {
            QueuedFlow flow = findActiveLocked(flowId, recipientNumber);
            return flow != null ? Optional.of(flow.copy()) : Optional.empty();
        }
    }

    public int size() {
        synchronized (lock) {
            return flows.size();
        }
    }

    public FlowQueueStatus snapshot() {
        List<QueuedFlow> all;
        double processingSpeed;
        synchronized (lock) {
            all = new ArrayList<>(flows.size());
            for (QueuedFlow flow : flows.values()) {
                all.add(flow.copy());
            }
            processingSpeed = throughputTracker.averageSpeed();
        }

        int activeQueues = 0;
        long totalMessagesQueued = 0;
        Set<String> instancesInUse = new HashSet<>();
        for (QueuedFlow flow : all) {
            if (!flow.isActive()) {
                continue;
            }
            activeQueues++;
            totalMessagesQueued += flow.getRemainingMessages();
            instancesInUse.add(flow.getInstanceId());
        }

        all.sort(DISPLAY_ORDER);
        return new FlowQueueStatus(activeQueues, totalMessagesQueued, processingSpeed,
                instancesInUse.size(), all);
    }

    /**
     * Drops terminal entries last updated before {@code cutoff}, publishing an expiry for each.
     * @return ids of the dropped entries
     */
    List<String> expireTerminalBefore(Instant cutoff) {
        List<String> expired = new ArrayList<>();
        synchronized (lock) {
            Iterator<QueuedFlow> it = flows.values().iterator();
            while (it.hasNext()) {
                QueuedFlow flow = it.next();
                if (flow.getStatus().isTerminal() && flow.getLastUpdated().isBefore(cutoff)) {
                    it.remove();
                    expired.add(flow.getId());
                }
            }
            // listeners may call back into the store, so publish only once iteration is done
            for (String id : expired) {
                notifier.flowExpired(id);
            }
        }
        return expired;
    }

    /**
     * Hands the active entries, in insertion order, to {@code estimator} and writes the returned
     * seconds-remaining back onto them.
     * @return number of entries updated
     */
    int applyEstimates(Function<List<QueuedFlow>, Map<String, Double>> estimator) {
        synchronized (lock) {
            List<QueuedFlow> active = new ArrayList<>();
            for (QueuedFlow flow : flows.values()) {
                if (flow.isActive()) {
                    active.add(flow.copy());
                }
            }
            if (active.isEmpty()) {
                return 0;
            }

            Map<String, Double> estimates = estimator.apply(active);
            Instant now = clock.instant();
            int updated = 0;
            for (Map.Entry<String, Double> estimate : estimates.entrySet()) {
                QueuedFlow flow = flows.get(estimate.getKey());
                if (flow == null) {
                    continue;
                }
                flow.setEstimatedTimeRemaining(estimate.getValue());
                flow.setLastUpdated(now);
                updated++;
            }
            return updated;
        }
    }

    private QueuedFlow findActiveLocked(String flowId, String recipientNumber) {
        for (QueuedFlow flow : flows.values()) {
            if (flow.isActive()
                    && Objects.equals(flow.getFlowId(), flowId)
                    && Objects.equals(flow.getRecipientNumber(), recipientNumber)) {
                return flow;
            }
        }
        return null;
    }

    private String newId(Instant now) {
        String id;
        do {
            id = "flow-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
        } while (flows.containsKey(id));
        return id;
    }

    private static void merge(QueuedFlow target, FlowAdmission admission) {
        if (admission.getFlowName() != null) target.setFlowName(admission.getFlowName());
        if (admission.getInstanceId() != null) target.setInstanceId(admission.getInstanceId());
        if (admission.getInstanceName() != null) target.setInstanceName(admission.getInstanceName());
        if (admission.getRecipientName() != null) target.setRecipientName(admission.getRecipientName());
        if (admission.getStatus() != null) target.setStatus(admission.getStatus());
        if (admission.getScheduledTime() != null) target.setScheduledTime(admission.getScheduledTime());
        if (admission.getTotalMessages() != null) target.setTotalMessages(admission.getTotalMessages());
        if (admission.getMessageIndex() != null) target.setMessageIndex(admission.getMessageIndex());
        if (admission.getTriggerKeyword() != null) target.setTriggerKeyword(admission.getTriggerKeyword());
        if (admission.getTriggerMessage() != null) target.setTriggerMessage(admission.getTriggerMessage());
        clampProgress(target);
    }

    private static void clampProgress(QueuedFlow flow) {
        int total = Math.max(0, flow.getTotalMessages());
        flow.setTotalMessages(total);
        flow.setMessageIndex(Math.max(0, Math.min(flow.getMessageIndex(), total)));
    }
}
