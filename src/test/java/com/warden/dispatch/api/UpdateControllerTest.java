package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.applier.ApplierException;
import com.warden.core.engine.InvalidTransitionException;
import com.warden.core.engine.UpdateStateMachine;
import com.warden.core.events.Event;
import com.warden.core.events.EventLog;
import com.warden.core.model.UpdateOutcome;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import com.warden.core.persistence.StorageException;
import com.warden.core.persistence.UpdateConflictException;
import com.warden.core.persistence.UpdateNotFoundException;
import com.warden.core.persistence.UpdateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(UpdateController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class UpdateControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private UpdateStateMachine stateMachine;

    @MockitoBean
    private Ledger ledger;

    private UpdateStore updateStore;
    private EventLog eventLog;

    @BeforeEach
    void setUp() {
        updateStore = mock(UpdateStore.class);
        eventLog = mock(EventLog.class);
        when(ledger.updates()).thenReturn(updateStore);
        when(ledger.events()).thenReturn(eventLog);
    }

    private static UpdateRecord record(long id, UpdateState state, Map<String, Object> meta) {
        return new UpdateRecord(id, "kernel", "6.1", state, meta, CREATED);
    }

    // ── GET ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /updates lists recent updates")
    void listUpdates() throws Exception {
        when(updateStore.listAll(50)).thenReturn(List.of(record(2, UpdateState.APPLIED, null),
                record(1, UpdateState.FAILED, Map.of("error", "disk full"))));

        mockMvc.perform(get("/api/v1/updates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].state").value("applied"))
                .andExpect(jsonPath("$[1].meta.error").value("disk full"))
                .andExpect(jsonPath("$[0].created_at").value("2026-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("GET /updates?state=pending filters by state")
    void listByState() throws Exception {
        when(updateStore.listRecentByState(UpdateState.PENDING, 50))
                .thenReturn(List.of(record(3, UpdateState.PENDING, null)));

        mockMvc.perform(get("/api/v1/updates").param("state", "pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(3));
    }

    @Test
    @DisplayName("GET /updates?state=failed&limit=1 honours the limit")
    void listByStateWithLimit() throws Exception {
        when(updateStore.listRecentByState(UpdateState.FAILED, 1))
                .thenReturn(List.of(record(7, UpdateState.FAILED, null)));

        mockMvc.perform(get("/api/v1/updates").param("state", "failed").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(7));

        verify(updateStore, never()).listByState(any());
    }

    @Test
    @DisplayName("GET /updates?state=bogus is 400")
    void listBadState() throws Exception {
        mockMvc.perform(get("/api/v1/updates").param("state", "bogus"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /updates/{id} returns the record, 404 when unknown")
    void getUpdate() throws Exception {
        when(updateStore.get(1L)).thenReturn(record(1, UpdateState.APPLIED, null));
        when(updateStore.get(2L)).thenThrow(new UpdateNotFoundException(2L));

        mockMvc.perform(get("/api/v1/updates/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("kernel"))
                .andExpect(jsonPath("$.error").doesNotExist());
        mockMvc.perform(get("/api/v1/updates/2"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("GET /updates/{id}/events returns the history in order")
    void getUpdateEvents() throws Exception {
        when(updateStore.get(1L)).thenReturn(record(1, UpdateState.APPLIED, null));
        when(eventLog.readByReference(1L)).thenReturn(List.of(
                new Event(10, "update.started", Map.of("updateId", 1), CREATED),
                new Event(11, "update.applied", Map.of("updateId", 1), CREATED)));

        mockMvc.perform(get("/api/v1/updates/1/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].kind", contains("update.started", "update.applied")));
    }

    @Test
    @DisplayName("GET /events pages the log")
    void listEvents() throws Exception {
        when(eventLog.readAfter(10L, 2)).thenReturn(List.of(new Event(11, "update.applied", null, CREATED)));

        mockMvc.perform(get("/api/v1/events").param("after", "10").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(11));
    }

    // ── POST ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /updates returns 201 with the applied record")
    void applyUpdate() throws Exception {
        when(stateMachine.apply("kernel", "6.1"))
                .thenReturn(UpdateOutcome.succeeded(record(1, UpdateState.APPLIED, Map.of("attempt", 1))));

        mockMvc.perform(post("/api/v1/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ApplyRequest("kernel", "6.1"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("applied"))
                .andExpect(jsonPath("$.meta.attempt").value(1));
    }

    @Test
    @DisplayName("POST /updates reports an applier failure in the body")
    void applyUpdateFailure() throws Exception {
        when(stateMachine.apply("kernel", "6.1")).thenReturn(UpdateOutcome.failed(
                record(1, UpdateState.FAILED, Map.of("error", "disk full")), new ApplierException("disk full")));

        mockMvc.perform(post("/api/v1/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"kernel\",\"version\":\"6.1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.state").value("failed"))
                .andExpect(jsonPath("$.error").value("disk full"));
    }

    @Test
    @DisplayName("POST /updates with a pending attempt is 409")
    void applyConflict() throws Exception {
        when(stateMachine.apply("kernel", "6.1")).thenThrow(new UpdateConflictException("kernel", "6.1"));

        mockMvc.perform(post("/api/v1/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"kernel\",\"version\":\"6.1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", containsString("already pending")));
    }

    @Test
    @DisplayName("POST /updates without a name is 400")
    void applyWithoutName() throws Exception {
        mockMvc.perform(post("/api/v1/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"6.1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /updates with malformed JSON is 400")
    void applyMalformed() throws Exception {
        mockMvc.perform(post("/api/v1/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed JSON body"));
    }

    @Test
    @DisplayName("POST /updates/{id}/rollback returns the rolled back record, 422 when illegal")
    void rollback() throws Exception {
        when(stateMachine.rollback(1L)).thenReturn(UpdateOutcome.succeeded(
                record(1, UpdateState.ROLLED_BACK, Map.of("rollbackOutcome", "succeeded"))));
        when(stateMachine.rollback(2L)).thenThrow(
                new InvalidTransitionException(2L, UpdateState.ROLLED_BACK, UpdateState.ROLLED_BACK));

        mockMvc.perform(post("/api/v1/updates/1/rollback"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("rolled_back"));
        mockMvc.perform(post("/api/v1/updates/2/rollback"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    @DisplayName("storage failures are 503")
    void storageFailure() throws Exception {
        when(updateStore.listAll(50)).thenThrow(new StorageException("database is locked"));

        mockMvc.perform(get("/api/v1/updates"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }
}
