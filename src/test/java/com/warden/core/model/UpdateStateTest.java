package com.warden.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UpdateStateTest {

    @Test
    @DisplayName("pending resolves to applied or failed, both of which roll back")
    void transitionTable() {
        assertTrue(UpdateState.PENDING.canTransitionTo(UpdateState.APPLIED));
        assertTrue(UpdateState.PENDING.canTransitionTo(UpdateState.FAILED));
        assertTrue(UpdateState.APPLIED.canTransitionTo(UpdateState.ROLLED_BACK));
        assertTrue(UpdateState.FAILED.canTransitionTo(UpdateState.ROLLED_BACK));

        assertFalse(UpdateState.PENDING.canTransitionTo(UpdateState.ROLLED_BACK));
        assertFalse(UpdateState.APPLIED.canTransitionTo(UpdateState.FAILED));
        assertFalse(UpdateState.FAILED.canTransitionTo(UpdateState.APPLIED));
        assertFalse(UpdateState.ROLLED_BACK.canTransitionTo(UpdateState.PENDING));
    }

    @Test
    @DisplayName("nothing leaves rolled_back")
    void rolledBackIsTerminal() {
        assertTrue(UpdateState.ROLLED_BACK.allowedTargets().isEmpty());
        assertFalse(UpdateState.ROLLED_BACK.isRollbackable());
        assertEquals(EnumSet.of(UpdateState.APPLIED, UpdateState.FAILED), UpdateState.PENDING.allowedTargets());
    }

    @Test
    @DisplayName("fromWireName accepts wire and constant names")
    void parsesNames() {
        assertEquals(UpdateState.ROLLED_BACK, UpdateState.fromWireName("rolled_back"));
        assertEquals(UpdateState.ROLLED_BACK, UpdateState.fromWireName("ROLLED_BACK"));
        assertEquals(UpdateState.PENDING, UpdateState.fromWireName("Pending"));
        assertThrows(IllegalArgumentException.class, () -> UpdateState.fromWireName("done"));
        assertThrows(IllegalArgumentException.class, () -> UpdateState.fromWireName(null));
    }

    @Test
    @DisplayName("UpdateRecord copies meta and formats its identity")
    void recordBasics() {
        var meta = new HashMap<String, Object>(Map.of("attempt", 1));
        var record = new UpdateRecord(3, "kernel", "6.1", UpdateState.PENDING, meta, Instant.EPOCH);
        meta.put("attempt", 2);

        assertEquals(1, record.meta().get("attempt"));
        assertThrows(UnsupportedOperationException.class, () -> record.meta().put("x", 1));
        assertEquals("kernel@6.1", record.identity());
        assertEquals("kernel", new UpdateRecord(4, "kernel", null, UpdateState.PENDING, null, null).identity());
        assertTrue(new UpdateRecord(4, "kernel", null, UpdateState.PENDING, null, null).meta().isEmpty());
    }
}
