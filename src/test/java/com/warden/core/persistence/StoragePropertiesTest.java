package com.warden.core.persistence;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoragePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new StorageProperties();
        assertEquals("./data/db.sqlite", props.getSqlitePath());
        assertEquals(5000, props.getBusyTimeoutMs());
        assertEquals(500, props.getPageSize());
        assertDoesNotThrow(props::validate);
    }

    @Test
    void rejectsInvalidValues() {
        var blankPath = new StorageProperties();
        blankPath.setSqlitePath(" ");
        assertThrows(IllegalStateException.class, blankPath::validate);

        var badPage = new StorageProperties();
        badPage.setPageSize(0);
        assertThrows(IllegalStateException.class, badPage::validate);

        var badTimeout = new StorageProperties();
        badTimeout.setBusyTimeoutMs(-1);
        assertThrows(IllegalStateException.class, badTimeout::validate);
    }
}
