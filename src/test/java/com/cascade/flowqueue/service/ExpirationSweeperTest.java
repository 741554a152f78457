package com.cascade.flowqueue.service;

import com.cascade.flowqueue.config.FlowQueueProperties;
import com.cascade.flowqueue.event.FlowExpiredEvent;
import com.cascade.flowqueue.event.FlowQueueEvent;
import com.cascade.flowqueue.event.FlowQueueEventNotifier;
import com.cascade.flowqueue.model.FlowAdmission;
import com.cascade.flowqueue.model.FlowStatus;
import com.cascade.flowqueue.model.QueuedFlow;
import com.cascade.flowqueue.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExpirationSweeperTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private FlowQueueStore store;
    private ExpirationSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-05T10:00:00Z"));
        FlowQueueProperties properties = new FlowQueueProperties();
        store = new FlowQueueStore(new FlowQueueEventNotifier(eventPublisher),
                new ThroughputTracker(properties, clock), clock);
        sweeper = new ExpirationSweeper(store, properties, clock);
    }

    private QueuedFlow admit(String flowId) {
        return store.admit(FlowAdmission.builder()
                .flowId(flowId)
                .recipientNumber("5511999999999")
                .instanceId("i1")
                .totalMessages(3)
                .build());
    }

    @Test
    void testSentEntryExpiresAfterRetention() {
        // Given: sent at T
        QueuedFlow flow = admit("f1");
        store.setStatus(flow.getId(), FlowStatus.SENT, 3);
        clearInvocations(eventPublisher);

        // When: one tick at T + 61 minutes
        clock.advance(Duration.ofMinutes(61));
        List<String> expired = sweeper.sweep();

        // Then
        assertEquals(List.of(flow.getId()), expired);
        assertTrue(store.findById(flow.getId()).isEmpty());

        ArgumentCaptor<FlowQueueEvent> captor = ArgumentCaptor.forClass(FlowQueueEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertInstanceOf(FlowExpiredEvent.class, captor.getValue());
        assertEquals(flow.getId(), captor.getValue().getQueuedFlowId());
    }

    @Test
    void testTerminalEntryKeptUntilRetentionExceeded() {
        QueuedFlow flow = admit("f1");
        store.setStatus(flow.getId(), FlowStatus.FAILED);

        clock.advance(Duration.ofMinutes(59));
        assertTrue(sweeper.sweep().isEmpty());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(sweeper.sweep().isEmpty(), "exactly one hour is not yet expired");
        assertTrue(store.findById(flow.getId()).isPresent());

        clock.advance(Duration.ofMillis(1));
        assertEquals(List.of(flow.getId()), sweeper.sweep());
    }

    @Test
    void testActiveEntriesNeverSwept() {
        QueuedFlow pending = admit("f1");
        QueuedFlow sending = admit("f2");
        store.setStatus(sending.getId(), FlowStatus.SENDING, 1);

        clock.advance(Duration.ofDays(2));

        assertTrue(sweeper.sweep().isEmpty());
        assertEquals(2, store.snapshot().activeQueues());
        assertTrue(store.findById(pending.getId()).isPresent());
    }

    @Test
    void testSweepOnlyDropsStaleTerminalEntries() {
        // Given
        QueuedFlow old = admit("f1");
        store.setStatus(old.getId(), FlowStatus.SENT, 3);
        clock.advance(Duration.ofMinutes(30));
        QueuedFlow recent = admit("f2");
        store.setStatus(recent.getId(), FlowStatus.SENT, 3);

        // When
        clock.advance(Duration.ofMinutes(31));
        List<String> expired = sweeper.sweep();

        // Then
        assertEquals(List.of(old.getId()), expired);
        assertEquals(1, store.size());
        assertTrue(store.findById(recent.getId()).isPresent());
    }

    @Test
    void testExpiredListenerCanReadmitDuringSweep() {
        // Given: three sent entries, and a listener that re-admits each recipient on expiry
        List<String> stale = new ArrayList<>();
        for (String flowId : List.of("f1", "f2", "f3")) {
            QueuedFlow flow = admit(flowId);
            store.setStatus(flow.getId(), FlowStatus.SENT, 3);
            stale.add(flow.getId());
        }
        List<String> readmitted = new ArrayList<>();
        doAnswer(invocation -> {
            Object event = invocation.getArgument(0);
            if (event instanceof FlowExpiredEvent) {
                readmitted.add(admit("retry-" + ((FlowExpiredEvent) event).getQueuedFlowId()).getId());
            }
            return null;
        }).when(eventPublisher).publishEvent(any(ApplicationEvent.class));

        // When
        clock.advance(Duration.ofMinutes(61));
        List<String> expired = sweeper.sweep();

        // Then: every stale entry is dropped in one pass
        assertEquals(stale, expired);
        for (String id : stale) {
            assertTrue(store.findById(id).isEmpty());
        }
        assertEquals(3, readmitted.size());
        assertEquals(3, store.size());
        assertEquals(3, store.snapshot().activeQueues());
    }
}
