package com.warden.core.engine;

import com.warden.core.events.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessOwnerTest {

    @Test
    @DisplayName("this process is alive")
    void currentIsAlive() {
        assertEquals(ProcessHandle.current().pid(), ProcessOwner.current().pid());
        assertTrue(ProcessOwner.current().isAlive());
    }

    @Test
    @DisplayName("a live pid with another start time is a reused pid")
    void reusedPidIsNotAlive() {
        ProcessOwner current = ProcessOwner.current();
        assumeTrue(current.startedAt() != null, "platform does not report process start times");

        assertFalse(new ProcessOwner(current.pid(), current.startedAt() + 1).isAlive());
    }

    @Test
    @DisplayName("owner without a start time falls back to pid liveness")
    void pidOnly() {
        assertTrue(new ProcessOwner(ProcessHandle.current().pid(), null).isAlive());
    }

    @Test
    @DisplayName("owner survives a payload round trip through an event")
    void payload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(Event.UPDATE_ID, 4L);
        new ProcessOwner(1234L, 1_700_000_000_000L).writeTo(payload);
        // JSON numbers that fit come back as Integer
        payload.put(ProcessOwner.PID, 1234);

        Event event = new Event(1, "update.started", payload, Instant.now());

        assertEquals(new ProcessOwner(1234L, 1_700_000_000_000L), ProcessOwner.readFrom(event).orElseThrow());
    }

    @Test
    @DisplayName("events written without an owner have none")
    void noOwner() {
        assertTrue(ProcessOwner.readFrom(new Event(1, "update.started", Map.of(Event.UPDATE_ID, 4L), Instant.now())).isEmpty());
        assertTrue(ProcessOwner.readFrom(new Event(2, "update.started", null, Instant.now())).isEmpty());
    }
}
