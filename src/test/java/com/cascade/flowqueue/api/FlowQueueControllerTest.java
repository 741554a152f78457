package com.cascade.flowqueue.api;

import com.cascade.flowqueue.model.FlowAdmission;
import com.cascade.flowqueue.model.FlowQueueStatus;
import com.cascade.flowqueue.model.FlowStatus;
import com.cascade.flowqueue.model.QueuedFlow;
import com.cascade.flowqueue.service.FlowQueueStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FlowQueueController.class)
class FlowQueueControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FlowQueueStore store;

    private static QueuedFlow flow(String id, FlowStatus status, int index) {
        Instant now = Instant.parse("2026-01-05T10:00:00Z");
        return QueuedFlow.builder()
                .id(id)
                .flowId("f1")
                .flowName("Welcome")
                .instanceId("i1")
                .recipientNumber("5511999999999")
                .status(status)
                .messageIndex(index)
                .totalMessages(3)
                .scheduledTime(now)
                .createdAt(now)
                .lastUpdated(now)
                .build();
    }

    @Test
    void testGetStatus() throws Exception {
        when(store.snapshot()).thenReturn(new FlowQueueStatus(1, 3, 15.0, 1,
                List.of(flow("flow-1", FlowStatus.PENDING, 0))));

        mockMvc.perform(get("/api/flow-queue/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeQueues").value(1))
                .andExpect(jsonPath("$.totalMessagesQueued").value(3))
                .andExpect(jsonPath("$.processingSpeed").value(15.0))
                .andExpect(jsonPath("$.instancesInUse").value(1))
                .andExpect(jsonPath("$.queuedFlows[0].id").value("flow-1"))
                .andExpect(jsonPath("$.queuedFlows[0].status").value("pending"))
                .andExpect(jsonPath("$.queuedFlows[0].lastUpdated").value("2026-01-05T10:00:00Z"))
                .andExpect(jsonPath("$.queuedFlows[0].estimatedTimeRemaining").doesNotExist());
    }

    @Test
    void testGetFlowNotFound() throws Exception {
        when(store.findById("flow-x")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/flow-queue/flow-x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.id").value("flow-x"));
    }

    @Test
    void testAdmit() throws Exception {
        when(store.admit(any(FlowAdmission.class))).thenReturn(flow("flow-1", FlowStatus.PENDING, 0));

        mockMvc.perform(post("/api/flow-queue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"flowId":"f1","recipientNumber":"5511999999999","instanceId":"i1",
                                 "totalMessages":3,"messageIndex":0,"status":"pending","triggerKeyword":"oi"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("flow-1"));

        ArgumentCaptor<FlowAdmission> captor = ArgumentCaptor.forClass(FlowAdmission.class);
        verify(store).admit(captor.capture());
        FlowAdmission admission = captor.getValue();
        assertEquals("f1", admission.getFlowId());
        assertEquals(FlowStatus.PENDING, admission.getStatus());
        assertEquals(3, admission.getTotalMessages());
        assertEquals("oi", admission.getTriggerKeyword());
        assertNull(admission.getFlowName());
    }

    @Test
    void testAdmitRejectsMissingRecipient() throws Exception {
        mockMvc.perform(post("/api/flow-queue")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flowId\":\"f1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verify(store, never()).admit(any());
    }

    @Test
    void testUpdateStatus() throws Exception {
        when(store.setStatus("flow-1", FlowStatus.SENT, 3)).thenReturn(Optional.of(flow("flow-1", FlowStatus.SENT, 3)));

        mockMvc.perform(put("/api/flow-queue/flow-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"sent\",\"messageIndex\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("sent"))
                .andExpect(jsonPath("$.messageIndex").value(3));
    }

    @Test
    void testUpdateStatusUnknownIdReturns404() throws Exception {
        when(store.setStatus(eq("flow-gone"), any(FlowStatus.class), any())).thenReturn(Optional.empty());

        mockMvc.perform(put("/api/flow-queue/flow-gone/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"failed\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUpdateStatusRejectsUnknownStatus() throws Exception {
        mockMvc.perform(put("/api/flow-queue/flow-1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"done\"}"))
                .andExpect(status().isBadRequest());

        verify(store, never()).setStatus(anyString(), any(FlowStatus.class), any());
    }

    @Test
    void testRemove() throws Exception {
        when(store.remove("flow-1")).thenReturn(true);
        when(store.remove("flow-2")).thenReturn(false);

        mockMvc.perform(delete("/api/flow-queue/flow-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/flow-queue/flow-2"))
                .andExpect(status().isNotFound());
    }
}
